package com.yunhwan.loglens.infra.sentry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.loglens.common.exception.EventSourceAuthException;
import com.yunhwan.loglens.common.exception.EventSourceException;
import com.yunhwan.loglens.common.exception.EventSourceRateLimitException;
import com.yunhwan.loglens.common.exception.TransientEventSourceException;
import com.yunhwan.loglens.config.event.EventTrackingProperties;
import com.yunhwan.loglens.domain.event.RawEvent;
import com.yunhwan.loglens.infra.metrics.MetricsConfig;
import com.yunhwan.loglens.usecase.event.EventWindow;
import com.yunhwan.loglens.usecase.event.port.EventTrackingClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sentry 프로젝트 이벤트 API 어댑터.
 * <p>
 * GET /api/0/projects/{org}/{project}/events/?query=user.id:{subjectId}&start=..&end=..&full=true
 * 상태 코드를 예외 분류로만 바꾸고, 재시도는 하지 않는다(EventFetcher 담당).
 */
@Slf4j
public class SentryEventTrackingClient implements EventTrackingClient {

    static final String EVENTS_PATH = "/api/0/projects/{org}/{project}/events/";
    static final String DEFAULT_RETRY_AFTER = "60";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final EventTrackingProperties props;
    private final MeterRegistry meterRegistry;

    public SentryEventTrackingClient(RestTemplate restTemplate,
                                     ObjectMapper objectMapper,
                                     EventTrackingProperties props,
                                     MeterRegistry meterRegistry) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.props = props;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public List<RawEvent> query(String subjectId, EventWindow window) {
        URI uri = buildEventsUri(subjectId, window);
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(props.getAuthToken() == null ? "" : props.getAuthToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> res;
        try {
            res = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == 404) {
                // 프로젝트/이벤트 없음 → 0건으로 본다
                log.warn("[SentryClient] 404 from events endpoint. treating as zero events");
                fetchCounter(MetricsConfig.RESULT_SUCCESS, "not_found").increment();
                return List.of();
            }
            throw translate(e);
        } catch (ResourceAccessException e) {
            // timeout, connection reset 등
            fetchCounter(MetricsConfig.RESULT_ERROR, "transient").increment();
            throw new TransientEventSourceException("Event tracking request failed: " + e.getMessage(), e);
        }

        List<RawEvent> events = parseEvents(res.getBody());
        fetchCounter(MetricsConfig.RESULT_SUCCESS, MetricsConfig.KIND_NONE).increment();
        return events;
    }

    @Override
    public String endpoint() {
        return normalizedBase() + EVENTS_PATH
                .replace("{org}", String.valueOf(props.getOrg()))
                .replace("{project}", String.valueOf(props.getProject()));
    }

    private EventSourceException translate(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();

        if (status == 401 || status == 403) {
            log.error("[SentryClient] authentication failed. status={}", status);
            fetchCounter(MetricsConfig.RESULT_ERROR, "auth").increment();
            return new EventSourceAuthException(status);
        }
        if (status == 429) {
            String retryAfter = e.getResponseHeaders() == null ? null : e.getResponseHeaders().getFirst("Retry-After");
            if (retryAfter == null || retryAfter.isBlank()) retryAfter = DEFAULT_RETRY_AFTER;
            log.warn("[SentryClient] rate limited. retryAfter={}", retryAfter);
            fetchCounter(MetricsConfig.RESULT_ERROR, "rate_limited").increment();
            return new EventSourceRateLimitException(retryAfter.trim());
        }
        if (status >= 500) {
            log.warn("[SentryClient] server error status={}", status);
            fetchCounter(MetricsConfig.RESULT_ERROR, "transient").increment();
            return new TransientEventSourceException("Event tracking server error: " + status, e);
        }
        log.error("[SentryClient] unexpected status={}", status);
        fetchCounter(MetricsConfig.RESULT_ERROR, "failed").increment();
        return new EventSourceException("Event tracking API error: " + status, e);
    }

    private List<RawEvent> parseEvents(String body) {
        if (body == null || body.isBlank()) return List.of();
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EventSourceException("Event tracking returned non-JSON body", e);
        }
        if (root == null || !root.isArray()) {
            log.warn("[SentryClient] response is not a JSON array. treating as zero events");
            return List.of();
        }
        List<RawEvent> events = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            events.add(RawEvent.of(node));
        }
        return List.copyOf(events);
    }

    URI buildEventsUri(String subjectId, EventWindow window) {
        return UriComponentsBuilder.fromUriString(normalizedBase() + EVENTS_PATH)
                .queryParam("query", "{query}")
                .queryParam("start", "{start}")
                .queryParam("end", "{end}")
                .queryParam("full", "true")
                .encode()
                .buildAndExpand(Map.of(
                        "org", String.valueOf(props.getOrg()),
                        "project", String.valueOf(props.getProject()),
                        "query", "user.id:" + subjectId,
                        "start", window.start().toString(),
                        "end", window.end().toString()
                ))
                .toUri();
    }

    private String normalizedBase() {
        String base = props.getBaseUrl();
        return base != null && base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private Counter fetchCounter(String result, String kind) {
        return Counter.builder(MetricsConfig.METRIC_EVENT_FETCH)
                .tag(MetricsConfig.TAG_RESULT, result)
                .tag(MetricsConfig.TAG_KIND, kind)
                .register(meterRegistry);
    }
}
