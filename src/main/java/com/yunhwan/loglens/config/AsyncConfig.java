package com.yunhwan.loglens.config;

import com.yunhwan.loglens.config.slack.SlackProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * 슬래시 커맨드 2단계(파이프라인 + 콜백 전달) 실행용
     */
    @Bean
    public ThreadPoolTaskExecutor triageTaskExecutor(SlackProperties props) {
        SlackProperties.Executor cfg = props.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(cfg.getMaxPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity()); // 초과분은 TaskRejectedException
        executor.setThreadNamePrefix("triage-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
