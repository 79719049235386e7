package com.yunhwan.loglens.config;

import com.yunhwan.loglens.config.analysis.AnalysisProperties;
import com.yunhwan.loglens.config.event.EventTrackingProperties;
import com.yunhwan.loglens.config.slack.SlackProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 외부 호출별 RestTemplate. 타임아웃이 서로 달라서 분리한다.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate eventTrackingRestTemplate(EventTrackingProperties props) {
        return restTemplate(props.getConnectTimeout(), props.getReadTimeout());
    }

    @Bean
    public RestTemplate analysisRestTemplate(AnalysisProperties props) {
        return restTemplate(props.getConnectTimeout(), props.getReadTimeout());
    }

    @Bean
    public RestTemplate slackRestTemplate(SlackProperties props) {
        SlackProperties.Delivery delivery = props.getDelivery();
        return restTemplate(delivery.getConnectTimeout(), delivery.getReadTimeout());
    }

    private static RestTemplate restTemplate(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connectTimeout.toMillis());
        factory.setReadTimeout((int) readTimeout.toMillis());
        return new RestTemplate(factory);
    }
}
