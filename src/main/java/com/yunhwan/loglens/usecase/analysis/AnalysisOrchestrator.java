package com.yunhwan.loglens.usecase.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.yunhwan.loglens.common.exception.AnalysisProviderException;
import com.yunhwan.loglens.common.exception.TriageException;
import com.yunhwan.loglens.domain.analysis.AnalysisResult;
import com.yunhwan.loglens.domain.analysis.ProbableCause;
import com.yunhwan.loglens.domain.evidence.FormattedEvidence;
import com.yunhwan.loglens.domain.incident.IncidentReport;
import com.yunhwan.loglens.usecase.analysis.port.TextGenerationClient;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 프롬프트 구성 → 모델 호출 → 응답 검증/보정 → 최종 결과.
 * <p>
 * 모델 호출은 일시 장애/레이트리밋일 때만 재시도한다.
 * 응답 형식 오류는 재시도하지 않는다.
 */
@Slf4j
public class AnalysisOrchestrator {

    private final TextGenerationClient textGenerationClient;
    private final PromptBuilder promptBuilder;
    private final AnalysisResponseParser responseParser;
    private final Retry retry;

    public AnalysisOrchestrator(TextGenerationClient textGenerationClient,
                                PromptBuilder promptBuilder,
                                AnalysisResponseParser responseParser,
                                Retry retry) {
        this.textGenerationClient = textGenerationClient;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.retry = retry;
    }

    public AnalysisResult analyze(IncidentReport report,
                                  FormattedEvidence evidence,
                                  KnowledgeDocuments docs,
                                  int eventsFound) {
        AnalysisStage stage = AnalysisStage.INVOKE;
        try {
            String system = promptBuilder.systemInstruction();
            String user = promptBuilder.userContent(report, evidence.text(), docs);

            log.info("[AnalysisOrchestrator] invoking model={} subjectId={}, promptChars={}",
                    textGenerationClient.modelName(), report.subjectId(), system.length() + user.length());
            String content = Retry.decorateSupplier(retry, () -> textGenerationClient.generate(system, user)).get();

            stage = AnalysisStage.PARSE;
            JsonNode root = responseParser.parse(content);

            stage = AnalysisStage.VALIDATE;
            ModelAnalysis validated = responseParser.validate(root);

            stage = AnalysisStage.REPAIR;
            List<ProbableCause> causes = responseParser.repair(validated.causes());

            stage = AnalysisStage.FINALIZE;
            return new AnalysisResult(
                    causes,
                    validated.suggestedResponse(),
                    evidence.links(),
                    validated.logsSummary(),
                    eventsFound
            );
        } catch (TriageException e) {
            log.error("[AnalysisOrchestrator] failed stage={}, kind={}, err={}", stage, e.kind().code(), e.getMessage());
            throw e;
        }
    }

    /**
     * 모델 호출 재시도 대상: retryable 로 표시된 provider 오류만.
     */
    public static boolean isRetryable(Throwable e) {
        return e instanceof AnalysisProviderException ape && ape.isRetryable();
    }
}
