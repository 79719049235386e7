package com.yunhwan.loglens.usecase.event.cache;

import com.yunhwan.loglens.domain.event.RawEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * CorrelationCache
 * <p>
 * 역할:
 * - 동일한 (subject, window, endpoint) 조회를 업스트림에 반복해서 보내지 않도록 결과를 보관합니다.
 * - 고정 용량 ring(슬롯 배열) + digest→entry 맵 구조이며, 가득 차면 가장 먼저 들어온 항목을 밀어냅니다(FIFO).
 * - TTL 은 없습니다. 프로세스 재시작 시 비워져도 정확성에는 영향이 없습니다.
 * <p>
 * 동시성:
 * - entry 는 한 번 넣으면 바뀌지 않으므로 조회는 락 없이 맵에서 읽습니다.
 * - 삽입만 ring 상태를 바꾸므로 단일 락으로 직렬화합니다.
 */
@Slf4j
public class CorrelationCache {

    public static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final Clock clock;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final String[] slots;
    private int next;
    private final Object insertLock = new Object();

    public CorrelationCache(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1. capacity=" + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
        this.slots = new String[capacity];
    }

    public Optional<Entry> get(CorrelationKey key) {
        return Optional.ofNullable(entries.get(key.digest()));
    }

    /**
     * 한 번 들어간 키는 덮어쓰지 않는다. 이미 있으면 기존 entry 를 돌려준다.
     */
    public Entry putIfAbsent(CorrelationKey key, List<RawEvent> events) {
        String digest = key.digest();
        synchronized (insertLock) {
            Entry existing = entries.get(digest);
            if (existing != null) {
                return existing;
            }

            String evicted = slots[next];
            if (evicted != null) {
                entries.remove(evicted);
                log.debug("[CorrelationCache] evicted key={}", evicted.substring(0, 16));
            }

            Entry entry = new Entry(List.copyOf(events), clock.instant());
            slots[next] = digest;
            entries.put(digest, entry);
            next = (next + 1) % capacity;
            return entry;
        }
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        synchronized (insertLock) {
            entries.clear();
            Arrays.fill(slots, null);
            next = 0;
        }
    }

    public record Entry(List<RawEvent> events, Instant storedAt) {}
}
