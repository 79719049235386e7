package com.yunhwan.loglens.common.retry;

import io.github.resilience4j.retry.Retry;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * 외부 호출별 재시도 설정 (yml 바인딩용).
 */
@Getter
@Setter
public class RetryProperties {

    private int maxAttempts = 3;
    private Duration initialBackoff = Duration.ofSeconds(2);
    private Duration maxBackoff = Duration.ofSeconds(10);

    public RetryProperties() {
    }

    public RetryProperties(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public Retry toRetry(String name, Predicate<Throwable> retryable) {
        return Retries.exponential(name, maxAttempts, initialBackoff, maxBackoff, retryable);
    }
}
