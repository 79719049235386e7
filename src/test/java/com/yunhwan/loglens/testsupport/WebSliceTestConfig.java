package com.yunhwan.loglens.testsupport;

import com.yunhwan.loglens.config.web.AuthProperties;
import com.yunhwan.loglens.config.web.WebProperties;
import com.yunhwan.loglens.infra.logging.TriageEventLogger;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Clock;

/**
 * @WebMvcTest 슬라이스에 빠지는 설정/메트릭 빈, 요청 로깅 필터가 쓰는 로거/시계.
 */
@TestConfiguration
@EnableConfigurationProperties({AuthProperties.class, WebProperties.class})
@Import(TriageEventLogger.class)
public class WebSliceTestConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
