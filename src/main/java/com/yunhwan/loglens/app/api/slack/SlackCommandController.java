package com.yunhwan.loglens.app.api.slack;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.loglens.common.exception.TriageException;
import com.yunhwan.loglens.infra.metrics.MetricsConfig;
import com.yunhwan.loglens.usecase.command.CommandEnvelope;
import com.yunhwan.loglens.usecase.command.CommandReceipt;
import com.yunhwan.loglens.usecase.command.SlackCommandGateway;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 슬래시 커맨드 웹훅.
 * <p>
 * 서명은 수신한 바이트 그대로 계산해야 하므로 @RequestParam 대신 원문 body 를 직접 읽는다.
 * 디코딩은 서명 검증 뒤 게이트웨이에서 한다.
 * 즉시 응답을 flush 한 뒤에 파이프라인 작업을 넘긴다.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class SlackCommandController {

    static final String TIMESTAMP_HEADER = "X-Slack-Request-Timestamp";
    static final String SIGNATURE_HEADER = "X-Slack-Signature";

    private final SlackCommandGateway gateway;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @PostMapping(value = "/slack/commands", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public void command(@RequestHeader(value = TIMESTAMP_HEADER, required = false) String timestamp,
                        @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
                        HttpServletRequest request,
                        HttpServletResponse response) throws IOException {
        String rawBody = new String(request.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        CommandReceipt receipt;
        try {
            receipt = gateway.receive(new CommandEnvelope(rawBody, signature, timestamp));
        } catch (TriageException e) {
            commandCounter(MetricsConfig.RESULT_REJECTED, e.kind().code()).increment();
            throw e;
        }

        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), receipt.response());
        response.flushBuffer();

        receipt.pendingTriage().ifPresentOrElse(
                pending -> {
                    commandCounter(MetricsConfig.RESULT_ACCEPTED, MetricsConfig.KIND_NONE).increment();
                    gateway.dispatch(pending);
                },
                () -> commandCounter(MetricsConfig.RESULT_REJECTED, "usage").increment()
        );
    }

    private Counter commandCounter(String result, String kind) {
        return Counter.builder(MetricsConfig.METRIC_SLACK_COMMAND)
                .tag(MetricsConfig.TAG_RESULT, result)
                .tag(MetricsConfig.TAG_KIND, kind)
                .register(meterRegistry);
    }
}
