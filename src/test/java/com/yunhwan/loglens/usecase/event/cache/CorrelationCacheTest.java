package com.yunhwan.loglens.usecase.event.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.loglens.domain.event.RawEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationCacheTest {

    private static final Instant NOW = Instant.parse("2025-01-19T14:30:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final ObjectMapper om = new ObjectMapper();

    private CorrelationKey key(String subject) {
        return new CorrelationKey(subject, NOW.minusSeconds(300), NOW.plusSeconds(300), "https://example.test/events/");
    }

    private RawEvent event(String id) {
        return RawEvent.of(om.createObjectNode().put("id", id));
    }

    @Test
    @DisplayName("용량이 차면 가장 먼저 들어온 키부터 밀려난다 (FIFO)")
    void FIFO_축출() {
        CorrelationCache cache = new CorrelationCache(2, clock);

        cache.putIfAbsent(key("a"), List.of());
        cache.putIfAbsent(key("b"), List.of());
        cache.putIfAbsent(key("c"), List.of());

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(key("a"))).isEmpty();
        assertThat(cache.get(key("b"))).isPresent();
        assertThat(cache.get(key("c"))).isPresent();
    }

    @Test
    @DisplayName("한 번 저장된 키는 덮어쓰지 않고 기존 entry 를 돌려준다")
    void 한번만_저장() {
        CorrelationCache cache = new CorrelationCache(10, clock);

        CorrelationCache.Entry first = cache.putIfAbsent(key("a"), List.of(event("e1")));
        CorrelationCache.Entry second = cache.putIfAbsent(key("a"), List.of(event("e2"), event("e3")));

        assertThat(second).isSameAs(first);
        assertThat(cache.get(key("a")).orElseThrow().events()).hasSize(1);
        assertThat(first.storedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("0건 결과도 캐시된다")
    void 빈_결과_캐시() {
        CorrelationCache cache = new CorrelationCache(10, clock);

        cache.putIfAbsent(key("a"), List.of());

        assertThat(cache.get(key("a"))).hasValueSatisfying(e -> assertThat(e.events()).isEmpty());
    }

    @Test
    @DisplayName("구간이나 엔드포인트가 다르면 다른 키다")
    void 키_구분() {
        CorrelationKey base = key("a");
        CorrelationKey otherWindow = new CorrelationKey("a", NOW.minusSeconds(600), NOW.plusSeconds(600), base.endpoint());
        CorrelationKey otherEndpoint = new CorrelationKey("a", base.windowStart(), base.windowEnd(), "https://other.test/");

        assertThat(base.digest()).isEqualTo(key("a").digest());
        assertThat(base.digest()).isNotEqualTo(otherWindow.digest());
        assertThat(base.digest()).isNotEqualTo(otherEndpoint.digest());
        assertThat(base.shortDigest()).hasSize(16);
    }
}
