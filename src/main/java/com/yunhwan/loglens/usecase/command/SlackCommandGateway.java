package com.yunhwan.loglens.usecase.command;

import com.yunhwan.loglens.common.exception.CommandUsageException;
import com.yunhwan.loglens.common.exception.ErrorKind;
import com.yunhwan.loglens.common.exception.InvalidIncidentReportException;
import com.yunhwan.loglens.common.exception.TriageException;
import com.yunhwan.loglens.domain.analysis.AnalysisResult;
import com.yunhwan.loglens.domain.incident.IncidentReport;
import com.yunhwan.loglens.infra.logging.TriageEventLogger;
import com.yunhwan.loglens.usecase.command.port.CallbackDeliverer;
import com.yunhwan.loglens.usecase.triage.TriagePipeline;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 슬래시 커맨드 2단계 처리.
 * <p>
 * 1단계 {@link #receive}: 서명 검증 → 바디 디코딩 + 파싱만 하고 즉시 응답(ack 또는 사용법 안내)을 만든다.
 * 2단계 {@link #dispatch}: ack 가 전송된 뒤 파이프라인을 백그라운드에서 돌리고 결과를 콜백 URL 로 보낸다.
 * 파이프라인은 반드시 ack 이후에 시작한다.
 */
@Slf4j
public class SlackCommandGateway {

    public static final String OUTCOME_DELIVERED = "delivered";
    public static final String OUTCOME_ERROR_DELIVERED = "error_delivered";
    public static final String OUTCOME_DELIVERY_FAILED = "delivery_failed";

    private final SignatureVerifier signatureVerifier;
    private final CommandParser commandParser;
    private final SlackMessageRenderer renderer;
    private final TriagePipeline pipeline;
    private final CallbackDeliverer deliverer;
    private final Executor executor;
    private final Retry deliveryRetry;
    private final TriageEventLogger eventLogger;
    private final Clock clock;
    private final List<String> allowedCallbackPrefixes;
    private final Duration latencyCeiling;

    public SlackCommandGateway(SignatureVerifier signatureVerifier,
                               CommandParser commandParser,
                               SlackMessageRenderer renderer,
                               TriagePipeline pipeline,
                               CallbackDeliverer deliverer,
                               Executor executor,
                               Retry deliveryRetry,
                               TriageEventLogger eventLogger,
                               Clock clock,
                               List<String> allowedCallbackPrefixes,
                               Duration latencyCeiling) {
        this.signatureVerifier = signatureVerifier;
        this.commandParser = commandParser;
        this.renderer = renderer;
        this.pipeline = pipeline;
        this.deliverer = deliverer;
        this.executor = executor;
        this.deliveryRetry = deliveryRetry;
        this.eventLogger = eventLogger;
        this.clock = clock;
        this.allowedCallbackPrefixes = List.copyOf(allowedCallbackPrefixes);
        this.latencyCeiling = latencyCeiling;
    }

    /**
     * 서명 실패는 예외로 던진다(401). 그 외 사용자 입력 문제는 ephemeral 안내로 돌려준다.
     */
    public CommandReceipt receive(CommandEnvelope envelope) {
        signatureVerifier.verify(envelope);

        CommandForm form;
        ParsedCommand command;
        IncidentReport report;
        try {
            form = CommandForm.decode(envelope.rawBody());
            command = commandParser.parse(form.text());
            report = IncidentReport.of(command.description(), command.timestamp(), command.subjectId());
        } catch (CommandUsageException e) {
            log.info("[SlackCommandGateway] usage error: {}", e.getMessage());
            return CommandReceipt.immediate(renderer.usage(e.safeMessage()));
        } catch (InvalidIncidentReportException e) {
            log.info("[SlackCommandGateway] invalid report: {}", e.getMessage());
            return CommandReceipt.immediate(renderer.error(e.safeMessage(), e.suggestion()));
        }

        String callbackUrl = form.responseUrl();
        if (!isAllowedCallback(callbackUrl)) {
            log.warn("[SlackCommandGateway] rejecting callback url outside allowed prefixes");
            return CommandReceipt.immediate(renderer.error("Missing or unsupported response_url", null));
        }

        eventLogger.commandAccepted(report.subjectId(), report.occurredAt().toString());
        PendingTriage pending = new PendingTriage(report, callbackUrl, clock.instant());
        return CommandReceipt.accepted(renderer.acknowledgement(command), pending);
    }

    /**
     * ack 응답이 flush 된 뒤 호출한다.
     */
    public void dispatch(PendingTriage pending) {
        try {
            executor.execute(() -> runAndDeliver(pending));
        } catch (RejectedExecutionException e) {
            // Spring TaskRejectedException 포함
            log.error("[SlackCommandGateway] executor rejected task. subjectId={}", pending.report().subjectId());
            deliverQuietly(pending, renderer.error("LogLens is busy right now", "Please try again in a minute"));
        }
    }

    void runAndDeliver(PendingTriage pending) {
        IncidentReport report = pending.report();
        ChannelMessage message;
        String outcome;
        try {
            AnalysisResult result = pipeline.run(report);
            message = renderer.render(result);
            outcome = OUTCOME_DELIVERED;
        } catch (TriageException e) {
            message = renderer.error(e.safeMessage(), e.suggestion());
            outcome = OUTCOME_ERROR_DELIVERED;
        } catch (RuntimeException e) {
            log.error("[SlackCommandGateway] unexpected pipeline failure. subjectId={}", report.subjectId(), e);
            message = renderer.error(ErrorKind.INTERNAL.getMessage(), ErrorKind.INTERNAL.getSuggestion());
            outcome = OUTCOME_ERROR_DELIVERED;
        }

        if (!deliverQuietly(pending, message)) {
            outcome = OUTCOME_DELIVERY_FAILED;
        }

        Duration elapsed = Duration.between(pending.acceptedAt(), clock.instant());
        if (elapsed.compareTo(latencyCeiling) > 0) {
            log.warn("[SlackCommandGateway] exceeded latency ceiling. subjectId={}, elapsedMs={}, ceilingMs={}",
                    report.subjectId(), elapsed.toMillis(), latencyCeiling.toMillis());
        }
        eventLogger.commandDelivered(report.subjectId(), outcome, elapsed.toMillis());
    }

    /**
     * 콜백 전송. 정책만큼 재시도하고, 끝내 실패하면 로그만 남긴다(더 보낼 곳이 없다).
     */
    private boolean deliverQuietly(PendingTriage pending, ChannelMessage message) {
        try {
            Retry.decorateRunnable(deliveryRetry, () -> deliverer.deliver(pending.callbackUrl(), message)).run();
            return true;
        } catch (RuntimeException e) {
            log.error("[SlackCommandGateway] callback delivery failed. subjectId={}, err={}",
                    pending.report().subjectId(), e.getMessage());
            return false;
        }
    }

    boolean isAllowedCallback(String callbackUrl) {
        if (callbackUrl == null || callbackUrl.isBlank()) return false;
        return allowedCallbackPrefixes.stream().anyMatch(callbackUrl::startsWith);
    }
}
