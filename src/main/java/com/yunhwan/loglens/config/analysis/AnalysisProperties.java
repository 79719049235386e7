package com.yunhwan.loglens.config.analysis;

import com.yunhwan.loglens.common.retry.RetryProperties;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "loglens.analysis")
public class AnalysisProperties {

    private String baseUrl = "https://generativelanguage.googleapis.com";
    private String model = "gemini-2.5-flash";

    // 환경변수로만 주입
    private String apiKey;

    private double temperature = 0.7;
    private int maxOutputTokens = 8000;

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(25);

    private RetryProperties retry = new RetryProperties(3, Duration.ofSeconds(1), Duration.ofSeconds(4));
}
