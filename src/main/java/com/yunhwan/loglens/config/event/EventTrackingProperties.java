package com.yunhwan.loglens.config.event;

import com.yunhwan.loglens.common.retry.RetryProperties;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "loglens.event-tracking")
public class EventTrackingProperties {

    // 이벤트 트래킹 API 루트 (self-hosted 면 교체)
    private String baseUrl = "https://sentry.io";

    private String org;
    private String project;

    // 환경변수로만 주입
    private String authToken;

    /**
     * 문의 시각 기준 ± 조회 구간(분)
     */
    private int windowMinutes = 5;

    /**
     * 이벤트 상세 링크. {org}/{project} 는 기동 시, {eventId} 는 이벤트마다 치환된다.
     */
    private String linkTemplate = "https://sentry.io/organizations/{org}/issues/?project={project}&query={eventId}";

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(10);

    private RetryProperties retry = new RetryProperties(3, Duration.ofSeconds(2), Duration.ofSeconds(10));
    private Cache cache = new Cache();

    @Getter @Setter
    public static class Cache {
        private int capacity = 100;
    }
}
