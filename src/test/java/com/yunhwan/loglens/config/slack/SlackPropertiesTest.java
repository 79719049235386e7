package com.yunhwan.loglens.config.slack;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * loglens.slack.* 바인딩 확인.
 */
class SlackPropertiesTest {

    private final ApplicationContextRunner contextRunner =
            new ApplicationContextRunner().withUserConfiguration(TestConfig.class);

    @Test
    @DisplayName("설정이 없으면 기본값(300초 허용 오차, 2회 전달 시도, 30초 목표 시간)을 쓴다")
    void 기본값() {
        contextRunner.run(ctx -> {
            SlackProperties props = ctx.getBean(SlackProperties.class);

            assertThat(props.getToleranceSeconds()).isEqualTo(300);
            assertThat(props.getAllowedCallbackPrefixes()).containsExactly("https://hooks.slack.com/");
            assertThat(props.getLatencyCeiling()).isEqualTo(Duration.ofSeconds(30));
            assertThat(props.getMaxLinks()).isEqualTo(5);
            assertThat(props.getDelivery().getMaxAttempts()).isEqualTo(2);
            assertThat(props.getExecutor().getQueueCapacity()).isEqualTo(50);
        });
    }

    @Test
    @DisplayName("kebab-case 키와 Duration 문자열을 바인딩한다")
    void 바인딩() {
        contextRunner
                .withPropertyValues(
                        "loglens.slack.signing-secret=s3cret",
                        "loglens.slack.tolerance-seconds=60",
                        "loglens.slack.allowed-callback-prefixes[0]=https://hooks.example.com/",
                        "loglens.slack.latency-ceiling=10s",
                        "loglens.slack.delivery.backoff=250ms",
                        "loglens.slack.executor.core-pool-size=2"
                )
                .run(ctx -> {
                    SlackProperties props = ctx.getBean(SlackProperties.class);

                    assertThat(props.getSigningSecret()).isEqualTo("s3cret");
                    assertThat(props.getToleranceSeconds()).isEqualTo(60);
                    assertThat(props.getAllowedCallbackPrefixes()).containsExactly("https://hooks.example.com/");
                    assertThat(props.getLatencyCeiling()).isEqualTo(Duration.ofSeconds(10));
                    assertThat(props.getDelivery().getBackoff()).isEqualTo(Duration.ofMillis(250));
                    assertThat(props.getExecutor().getCorePoolSize()).isEqualTo(2);
                });
    }

    @Configuration
    @EnableConfigurationProperties(SlackProperties.class)
    static class TestConfig {
    }
}
