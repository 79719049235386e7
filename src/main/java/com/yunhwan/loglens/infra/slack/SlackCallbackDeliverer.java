package com.yunhwan.loglens.infra.slack;

import com.yunhwan.loglens.common.exception.CallbackDeliveryException;
import com.yunhwan.loglens.infra.metrics.MetricsConfig;
import com.yunhwan.loglens.usecase.command.ChannelMessage;
import com.yunhwan.loglens.usecase.command.port.CallbackDeliverer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * response_url 로 결과 메시지를 POST 한다.
 * <p>
 * response_url 은 그 자체가 자격 증명이므로 로그에는 host 만 남긴다.
 */
@Slf4j
public class SlackCallbackDeliverer implements CallbackDeliverer {

    private final RestTemplate restTemplate;
    private final MeterRegistry meterRegistry;

    public SlackCallbackDeliverer(RestTemplate restTemplate, MeterRegistry meterRegistry) {
        this.restTemplate = restTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void deliver(String callbackUrl, ChannelMessage message) {
        URI uri = URI.create(callbackUrl);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            restTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(message, headers), String.class);
            deliveryCounter(MetricsConfig.RESULT_SUCCESS).increment();
            log.info("[SlackDeliverer] delivered response. host={}, type={}", uri.getHost(), message.responseType());
        } catch (RestClientException e) {
            deliveryCounter(MetricsConfig.RESULT_ERROR).increment();
            log.warn("[SlackDeliverer] delivery failed. host={}, err={}", uri.getHost(), e.getClass().getSimpleName());
            throw new CallbackDeliveryException("Callback delivery failed. host=" + uri.getHost(), e);
        }
    }

    private Counter deliveryCounter(String result) {
        return Counter.builder(MetricsConfig.METRIC_SLACK_DELIVERY)
                .tag(MetricsConfig.TAG_RESULT, result)
                .register(meterRegistry);
    }
}
