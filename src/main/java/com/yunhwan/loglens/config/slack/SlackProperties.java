package com.yunhwan.loglens.config.slack;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "loglens.slack")
public class SlackProperties {

    // 환경변수로만 주입. 비어 있으면 모든 커맨드를 거절한다
    private String signingSecret;

    /**
     * 요청 타임스탬프 허용 오차(초). 리플레이 방지
     */
    private long toleranceSeconds = 300;

    /**
     * response_url 허용 prefix
     */
    private List<String> allowedCallbackPrefixes = new ArrayList<>(List.of("https://hooks.slack.com/"));

    /**
     * 결과 전달 목표 시간. 초과 시 경고 로그만 남긴다
     */
    private Duration latencyCeiling = Duration.ofSeconds(30);

    // 결과 메시지에 붙일 이벤트 링크 최대 개수
    private int maxLinks = 5;

    private Delivery delivery = new Delivery();
    private Executor executor = new Executor();

    @Getter @Setter
    public static class Delivery {
        // 첫 시도 포함. 2 = 1회 재시도
        private int maxAttempts = 2;
        private Duration backoff = Duration.ofSeconds(1);
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(5);
    }

    @Getter @Setter
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 50;
    }
}
