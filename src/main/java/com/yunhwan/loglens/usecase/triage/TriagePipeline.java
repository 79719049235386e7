package com.yunhwan.loglens.usecase.triage;

import com.yunhwan.loglens.common.exception.TriageException;
import com.yunhwan.loglens.domain.analysis.AnalysisResult;
import com.yunhwan.loglens.domain.event.RawEvent;
import com.yunhwan.loglens.domain.evidence.FormattedEvidence;
import com.yunhwan.loglens.domain.incident.IncidentReport;
import com.yunhwan.loglens.infra.logging.TriageEventLogger;
import com.yunhwan.loglens.usecase.analysis.AnalysisOrchestrator;
import com.yunhwan.loglens.usecase.analysis.KnowledgeDocuments;
import com.yunhwan.loglens.usecase.analysis.port.KnowledgeBase;
import com.yunhwan.loglens.usecase.event.EventFetcher;
import com.yunhwan.loglens.usecase.evidence.EventFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * 두 진입점(/api/analyze, 슬래시 커맨드)이 공유하는 Fetch → Format → Analyze 흐름.
 * <p>
 * 이벤트 0건은 실패가 아니다. 모델은 그대로 호출되고 eventsFound=0 으로 끝난다.
 */
@Slf4j
@RequiredArgsConstructor
public class TriagePipeline {

    private final EventFetcher eventFetcher;
    private final EventFormatter eventFormatter;
    private final KnowledgeBase knowledgeBase;
    private final AnalysisOrchestrator orchestrator;
    private final TriageEventLogger eventLogger;
    private final Clock clock;
    private final int windowMinutes;

    public AnalysisResult run(IncidentReport report) {
        long startedAt = clock.millis();
        try {
            List<RawEvent> events = eventFetcher.fetch(report.subjectId(), report.occurredAt(), windowMinutes);
            if (events.isEmpty()) {
                log.info("[TriagePipeline] no events for subjectId={} within ±{}m. analyzing without evidence",
                        report.subjectId(), windowMinutes);
            }

            FormattedEvidence evidence = eventFormatter.format(events);
            KnowledgeDocuments docs = knowledgeBase.load();

            AnalysisResult result = orchestrator.analyze(report, evidence, docs, events.size());
            eventLogger.analysisCompleted(report, result, clock.millis() - startedAt);
            return result;
        } catch (TriageException e) {
            eventLogger.analysisFailed(report, e.kind(), clock.millis() - startedAt);
            throw e;
        }
    }

    public int windowMinutes() {
        return windowMinutes;
    }
}
