package com.yunhwan.loglens.usecase.event;

import java.time.Duration;
import java.time.Instant;

/**
 * 보고 시각 기준 대칭 조회 구간 [occurredAt - w, occurredAt + w] (양 끝 포함).
 */
public record EventWindow(Instant start, Instant end) {

    public static EventWindow around(Instant occurredAt, int windowMinutes) {
        if (windowMinutes < 0) {
            throw new IllegalArgumentException("windowMinutes must be >= 0. windowMinutes=" + windowMinutes);
        }
        Duration w = Duration.ofMinutes(windowMinutes);
        return new EventWindow(occurredAt.minus(w), occurredAt.plus(w));
    }

    public boolean contains(Instant t) {
        return !t.isBefore(start) && !t.isAfter(end);
    }
}
