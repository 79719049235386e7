package com.yunhwan.loglens.usecase.event;

import com.yunhwan.loglens.common.exception.TransientEventSourceException;
import com.yunhwan.loglens.domain.event.RawEvent;
import com.yunhwan.loglens.infra.logging.TriageEventLogger;
import com.yunhwan.loglens.usecase.event.cache.CorrelationCache;
import com.yunhwan.loglens.usecase.event.cache.CorrelationKey;
import com.yunhwan.loglens.usecase.event.port.EventTrackingClient;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 고객 식별자 + 시간 구간으로 에러 이벤트를 가져온다.
 * <p>
 * 캐시 확인 → (미스) 업스트림 조회(일시 장애만 재시도) → 성공 결과 캐시 적재.
 * 0건은 정상 종료 상태이며 그대로 캐시된다.
 * <p>
 * 캐시 확인과 업스트림 조회는 원자적이지 않다. 같은 키로 동시에 미스가 나면 둘 다 업스트림을 호출하고,
 * 먼저 들어간 결과가 남으며 두 호출 모두 그 결과를 돌려받는다.
 */
@Slf4j
public class EventFetcher {

    public static final int DEFAULT_WINDOW_MINUTES = 5;

    private final EventTrackingClient client;
    private final CorrelationCache cache;
    private final Retry retry;
    private final TriageEventLogger eventLogger;

    public EventFetcher(EventTrackingClient client,
                        CorrelationCache cache,
                        Retry retry,
                        TriageEventLogger eventLogger) {
        this.client = client;
        this.cache = cache;
        this.retry = retry;
        this.eventLogger = eventLogger;
    }

    public List<RawEvent> fetch(String subjectId, Instant occurredAt) {
        return fetch(subjectId, occurredAt, DEFAULT_WINDOW_MINUTES);
    }

    public List<RawEvent> fetch(String subjectId, Instant occurredAt, int windowMinutes) {
        EventWindow window = EventWindow.around(occurredAt, windowMinutes);
        CorrelationKey key = new CorrelationKey(subjectId, window.start(), window.end(), client.endpoint());

        Optional<CorrelationCache.Entry> cached = cache.get(key);
        if (cached.isPresent()) {
            List<RawEvent> events = cached.get().events();
            log.info("[EventFetcher] cache hit key={}, events={}", key.shortDigest(), events.size());
            eventLogger.eventsFetched(subjectId, window, events.size(), true);
            return events;
        }

        log.info("[EventFetcher] fetching events subjectId={}, start={}, end={}", subjectId, window.start(), window.end());

        List<RawEvent> events = Retry.decorateSupplier(retry, () -> client.query(subjectId, window)).get();

        CorrelationCache.Entry stored = cache.putIfAbsent(key, events);
        log.info("[EventFetcher] cached key={}, events={}", key.shortDigest(), stored.events().size());
        eventLogger.eventsFetched(subjectId, window, stored.events().size(), false);
        return stored.events();
    }

    /**
     * 이벤트 조회 재시도 대상: 일시 장애만.
     */
    public static boolean isRetryable(Throwable e) {
        return e instanceof TransientEventSourceException;
    }
}
