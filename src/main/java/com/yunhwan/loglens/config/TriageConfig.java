package com.yunhwan.loglens.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yunhwan.loglens.common.exception.CallbackDeliveryException;
import com.yunhwan.loglens.common.retry.Retries;
import com.yunhwan.loglens.config.analysis.AnalysisProperties;
import com.yunhwan.loglens.config.event.EventTrackingProperties;
import com.yunhwan.loglens.config.slack.SlackProperties;
import com.yunhwan.loglens.infra.llm.GeminiTextGenerationClient;
import com.yunhwan.loglens.infra.logging.TriageEventLogger;
import com.yunhwan.loglens.infra.sentry.SentryEventTrackingClient;
import com.yunhwan.loglens.infra.slack.SlackCallbackDeliverer;
import com.yunhwan.loglens.usecase.analysis.AnalysisOrchestrator;
import com.yunhwan.loglens.usecase.analysis.AnalysisResponseParser;
import com.yunhwan.loglens.usecase.analysis.PromptBuilder;
import com.yunhwan.loglens.usecase.analysis.port.KnowledgeBase;
import com.yunhwan.loglens.usecase.analysis.port.TextGenerationClient;
import com.yunhwan.loglens.usecase.command.CommandParser;
import com.yunhwan.loglens.usecase.command.SignatureVerifier;
import com.yunhwan.loglens.usecase.command.SlackCommandGateway;
import com.yunhwan.loglens.usecase.command.SlackMessageRenderer;
import com.yunhwan.loglens.usecase.command.port.CallbackDeliverer;
import com.yunhwan.loglens.usecase.event.EventFetcher;
import com.yunhwan.loglens.usecase.event.cache.CorrelationCache;
import com.yunhwan.loglens.usecase.event.port.EventTrackingClient;
import com.yunhwan.loglens.usecase.evidence.EventFormatter;
import com.yunhwan.loglens.usecase.triage.TriagePipeline;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * 유스케이스 객체 조립. usecase 패키지는 스프링에 의존하지 않도록 여기서 생성한다.
 */
@Configuration
public class TriageConfig {

    static final String RETRY_EVENT_FETCH = "event_fetch";
    static final String RETRY_MODEL_GENERATE = "model_generate";
    static final String RETRY_CALLBACK_DELIVERY = "callback_delivery";

    // ---- event ----

    @Bean
    public EventTrackingClient eventTrackingClient(@Qualifier("eventTrackingRestTemplate") RestTemplate restTemplate,
                                                   ObjectMapper objectMapper,
                                                   EventTrackingProperties props,
                                                   MeterRegistry meterRegistry) {
        return new SentryEventTrackingClient(restTemplate, objectMapper, props, meterRegistry);
    }

    @Bean
    public CorrelationCache correlationCache(EventTrackingProperties props, Clock clock) {
        return new CorrelationCache(props.getCache().getCapacity(), clock);
    }

    @Bean
    public EventFetcher eventFetcher(EventTrackingClient client,
                                     CorrelationCache cache,
                                     EventTrackingProperties props,
                                     TriageEventLogger eventLogger) {
        Retry retry = props.getRetry().toRetry(RETRY_EVENT_FETCH, EventFetcher::isRetryable);
        return new EventFetcher(client, cache, retry, eventLogger);
    }

    @Bean
    public EventFormatter eventFormatter(EventTrackingProperties props) {
        String template = props.getLinkTemplate()
                .replace("{org}", String.valueOf(props.getOrg()))
                .replace("{project}", String.valueOf(props.getProject()));
        return new EventFormatter(template);
    }

    // ---- analysis ----

    @Bean
    @Profile("!stub")
    public TextGenerationClient geminiTextGenerationClient(@Qualifier("analysisRestTemplate") RestTemplate restTemplate,
                                                           ObjectMapper objectMapper,
                                                           AnalysisProperties props) {
        return new GeminiTextGenerationClient(restTemplate, objectMapper, props);
    }

    @Bean
    public PromptBuilder promptBuilder() {
        return new PromptBuilder();
    }

    @Bean
    public AnalysisResponseParser analysisResponseParser(ObjectMapper objectMapper) {
        return new AnalysisResponseParser(objectMapper);
    }

    @Bean
    public AnalysisOrchestrator analysisOrchestrator(TextGenerationClient textGenerationClient,
                                                     PromptBuilder promptBuilder,
                                                     AnalysisResponseParser parser,
                                                     AnalysisProperties props) {
        Retry retry = props.getRetry().toRetry(RETRY_MODEL_GENERATE, AnalysisOrchestrator::isRetryable);
        return new AnalysisOrchestrator(textGenerationClient, promptBuilder, parser, retry);
    }

    @Bean
    public TriagePipeline triagePipeline(EventFetcher eventFetcher,
                                         EventFormatter eventFormatter,
                                         KnowledgeBase knowledgeBase,
                                         AnalysisOrchestrator orchestrator,
                                         TriageEventLogger eventLogger,
                                         Clock clock,
                                         EventTrackingProperties props) {
        return new TriagePipeline(eventFetcher, eventFormatter, knowledgeBase, orchestrator, eventLogger,
                clock, props.getWindowMinutes());
    }

    // ---- slack ----

    @Bean
    public CallbackDeliverer callbackDeliverer(@Qualifier("slackRestTemplate") RestTemplate restTemplate,
                                               MeterRegistry meterRegistry) {
        return new SlackCallbackDeliverer(restTemplate, meterRegistry);
    }

    @Bean
    public SlackCommandGateway slackCommandGateway(SlackProperties props,
                                                   Clock clock,
                                                   TriagePipeline pipeline,
                                                   CallbackDeliverer deliverer,
                                                   @Qualifier("triageTaskExecutor") ThreadPoolTaskExecutor executor,
                                                   TriageEventLogger eventLogger) {
        SlackProperties.Delivery delivery = props.getDelivery();
        // 전달 실패만 재시도. 고정 간격(backoff == max)
        Retry deliveryRetry = Retries.exponential(RETRY_CALLBACK_DELIVERY, delivery.getMaxAttempts(),
                delivery.getBackoff(), delivery.getBackoff(), CallbackDeliveryException.class::isInstance);
        return new SlackCommandGateway(
                new SignatureVerifier(props.getSigningSecret(), clock, Duration.ofSeconds(props.getToleranceSeconds())),
                new CommandParser(),
                new SlackMessageRenderer(props.getMaxLinks(), pipeline.windowMinutes()),
                pipeline,
                deliverer,
                executor,
                deliveryRetry,
                eventLogger,
                clock,
                props.getAllowedCallbackPrefixes(),
                props.getLatencyCeiling()
        );
    }
}
