package com.yunhwan.loglens.common.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Resilience4j {@link Retry} 생성.
 * <p>
 * 이벤트 조회 / 모델 호출 / 콜백 전달이 같은 지수 백오프 규칙(initial * 2^(n-1), 상한 max)을 쓰고,
 * 재시도 대상 예외만 호출처마다 다르게 준다. 소진되거나 대상이 아닌 예외는 감싸지 않고 그대로 던진다.
 */
@Slf4j
public final class Retries {

    static final double MULTIPLIER = 2.0;

    private Retries() {
    }

    public static Retry exponential(String name,
                                    int maxAttempts,
                                    Duration initialBackoff,
                                    Duration maxBackoff,
                                    Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1. maxAttempts=" + maxAttempts);
        }
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff(initialBackoff, maxBackoff))
                .retryOnException(retryable)
                .build();
        return withLogging(Retry.of(name, config));
    }

    /**
     * 실패한 시도 번호(1부터) → 다음 시도 전 대기(ms).
     */
    public static IntervalFunction backoff(Duration initialBackoff, Duration maxBackoff) {
        return IntervalFunction.ofExponentialBackoff(initialBackoff, MULTIPLIER, maxBackoff);
    }

    private static Retry withLogging(Retry retry) {
        retry.getEventPublisher()
                .onRetry(e -> log.warn("[Retry] operation={}, attempt={}, nextDelayMs={}, err={}",
                        e.getName(), e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(),
                        compact(e.getLastThrowable())))
                .onError(e -> log.warn("[Retry] give up operation={}, attempts={}, err={}",
                        e.getName(), e.getNumberOfRetryAttempts(), compact(e.getLastThrowable())));
        return retry;
    }

    private static String compact(Throwable e) {
        if (e == null) return "";
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) msg = e.getClass().getSimpleName();
        // 너무 길면 로그 폭발 방지
        return (msg.length() > 300) ? msg.substring(0, 300) : msg;
    }
}
