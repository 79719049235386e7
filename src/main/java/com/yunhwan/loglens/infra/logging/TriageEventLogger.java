package com.yunhwan.loglens.infra.logging;

import com.yunhwan.loglens.common.exception.ErrorKind;
import com.yunhwan.loglens.domain.analysis.AnalysisResult;
import com.yunhwan.loglens.domain.analysis.ProbableCause;
import com.yunhwan.loglens.domain.incident.IncidentReport;
import com.yunhwan.loglens.usecase.event.EventWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static net.logstash.logback.argument.StructuredArguments.entries;

/**
 * 파이프라인 단계별 구조화 이벤트 로그.
 * <p>
 * 설명문/모델 응답 원문/서명/토큰은 넣지 않는다. 길이와 분류값만 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TriageEventLogger {

    private final Clock clock;

    public void eventsFetched(String subjectId, EventWindow window, int eventCount, boolean cacheHit) {
        Map<String, Object> evt = createBaseEvent("triage.events_fetched");
        evt.put("subject_id", subjectId);
        evt.put("window", mapOfNonNull(
                "start", window.start().toString(),
                "end", window.end().toString()
        ));
        evt.put("event_count", eventCount);
        evt.put("cache_hit", cacheHit);

        log.info("triage_event {}", entries(evt));
    }

    public void analysisCompleted(IncidentReport report, AnalysisResult result, long durationMs) {
        Map<String, Object> evt = createBaseEvent("triage.analysis_completed");
        evt.put("subject_id", report.subjectId());
        evt.put("occurred_at", report.occurredAt().toString());
        evt.put("duration_ms", durationMs);

        Map<String, Object> analysis = new LinkedHashMap<>();
        analysis.put("events_found", result.eventsFound());
        analysis.put("confidences", confidences(result.causes()));
        analysis.put("placeholder_causes", result.causes().stream().filter(ProbableCause::isPlaceholder).count());
        analysis.put("evidence_links", result.evidenceLinks().size());
        evt.put("analysis", analysis);

        log.info("triage_event {}", entries(evt));
    }

    public void analysisFailed(IncidentReport report, ErrorKind kind, long durationMs) {
        Map<String, Object> evt = createBaseEvent("triage.analysis_failed");
        evt.put("subject_id", report.subjectId());
        evt.put("kind", kind.code());
        evt.put("duration_ms", durationMs);

        log.warn("triage_event {}", entries(evt));
    }

    public void commandAccepted(String subjectId, String occurredAt) {
        Map<String, Object> evt = createBaseEvent("triage.command_accepted");
        evt.put("subject_id", subjectId);
        evt.put("occurred_at", occurredAt);

        log.info("triage_event {}", entries(evt));
    }

    public void commandDelivered(String subjectId, String outcome, long durationMs) {
        Map<String, Object> evt = createBaseEvent("triage.command_delivered");
        evt.put("subject_id", subjectId);
        evt.put("outcome", outcome);
        evt.put("duration_ms", durationMs);

        log.info("triage_event {}", entries(evt));
    }

    public void httpRequestCompleted(String requestId, String method, String path, int status, long durationMs) {
        Map<String, Object> evt = createBaseEvent("http.request_completed");
        evt.put("request_id", requestId);
        evt.put("method", method);
        evt.put("path", path);
        evt.put("status", status);
        evt.put("duration_ms", durationMs);

        log.info("http_event {}", entries(evt));
    }

    public void httpRequestFailed(String requestId, String method, String path, Throwable error, long durationMs) {
        Map<String, Object> evt = createBaseEvent("http.request_failed");
        evt.put("request_id", requestId);
        evt.put("method", method);
        evt.put("path", path);
        evt.put("error_type", error.getClass().getSimpleName());
        evt.put("duration_ms", durationMs);

        log.error("http_event {}", entries(evt));
    }

    private Map<String, Object> createBaseEvent(String eventType) {
        Map<String, Object> evt = new LinkedHashMap<>();
        evt.put("event_type", eventType);
        evt.put("event_id", UUID.randomUUID().toString());
        evt.put("logged_at", OffsetDateTime.now(clock).toString());
        return evt;
    }

    private static List<String> confidences(List<ProbableCause> causes) {
        return causes.stream().map(c -> String.valueOf(c.confidence())).toList();
    }

    /**
     * Null-safe map builder (skips null values).
     */
    private Map<String, Object> mapOfNonNull(Object... kv) {
        if (kv.length % 2 != 0) {
            throw new IllegalArgumentException("kv length must be even. length=" + kv.length);
        }
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            Object k = kv[i];
            Object v = kv[i + 1];
            if (k == null) {
                throw new IllegalArgumentException("key must not be null");
            }
            if (v != null) {
                m.put(String.valueOf(k), v);
            }
        }
        return m;
    }
}
