package com.yunhwan.loglens.usecase.command;

import com.yunhwan.loglens.common.exception.ErrorKind;
import com.yunhwan.loglens.common.exception.SignatureVerificationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignatureVerifierTest {

    private static final String SECRET = "8f742231b10e8888abcd99yyyzzz85a5";
    private static final long NOW = 1_737_297_000L;
    private static final String BODY = "token=x&command=%2Floglens&text=A+%7C+B+%7C+C&response_url=https%3A%2F%2Fhooks.slack.com%2Fx";

    private final SignatureVerifier verifier = new SignatureVerifier(
            SECRET, Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC), Duration.ofSeconds(300));

    /**
     * 검증기 구현과 독립적으로 계산한 기대 서명.
     */
    private static String slackSignature(String secret, String timestamp, String body) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        byte[] digest = mac.doFinal(("v0:" + timestamp + ":" + body).getBytes(StandardCharsets.UTF_8));
        return "v0=" + HexFormat.of().formatHex(digest);
    }

    private static CommandEnvelope envelope(String signature, String timestamp, String body) {
        return new CommandEnvelope(body, signature, timestamp);
    }

    @Test
    @DisplayName("올바른 서명과 허용 구간 안의 타임스탬프는 통과한다")
    void 정상_서명() throws Exception {
        String ts = String.valueOf(NOW);

        assertThat(verifier.sign(ts, BODY)).isEqualTo(slackSignature(SECRET, ts, BODY));
        assertThatCode(() -> verifier.verify(envelope(slackSignature(SECRET, ts, BODY), ts, BODY)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("바디가 한 글자라도 바뀌면 거절한다")
    void 서명_불일치() throws Exception {
        String ts = String.valueOf(NOW);
        String signature = slackSignature(SECRET, ts, BODY);

        assertThatThrownBy(() -> verifier.verify(envelope(signature, ts, BODY + "x")))
                .isInstanceOfSatisfying(SignatureVerificationException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.SIGNATURE_INVALID));
    }

    @Test
    @DisplayName("301초 지난 요청은 서명이 맞아도 거절한다")
    void 오래된_요청() throws Exception {
        String ts = String.valueOf(NOW - 301);

        assertThatThrownBy(() -> verifier.verify(envelope(slackSignature(SECRET, ts, BODY), ts, BODY)))
                .isInstanceOf(SignatureVerificationException.class)
                .hasMessageContaining("too old");
    }

    @Test
    @DisplayName("경계값 300초는 허용한다")
    void 경계값_허용() throws Exception {
        String ts = String.valueOf(NOW - 300);

        assertThatCode(() -> verifier.verify(envelope(slackSignature(SECRET, ts, BODY), ts, BODY)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("미래로 301초 이상 앞선 요청도 거절한다")
    void 미래_요청() throws Exception {
        String ts = String.valueOf(NOW + 301);

        assertThatThrownBy(() -> verifier.verify(envelope(slackSignature(SECRET, ts, BODY), ts, BODY)))
                .isInstanceOf(SignatureVerificationException.class);
    }

    @Test
    @DisplayName("헤더 누락, 숫자가 아닌 타임스탬프, 미설정 시크릿은 모두 거절한다")
    void 입력_누락() {
        String ts = String.valueOf(NOW);

        assertThatThrownBy(() -> verifier.verify(envelope(null, ts, BODY)))
                .isInstanceOf(SignatureVerificationException.class);
        assertThatThrownBy(() -> verifier.verify(envelope("v0=abc", "yesterday", BODY)))
                .isInstanceOf(SignatureVerificationException.class);

        SignatureVerifier unconfigured = new SignatureVerifier("", Clock.systemUTC(), Duration.ofSeconds(300));
        assertThatThrownBy(() -> unconfigured.verify(envelope("v0=abc", ts, BODY)))
                .isInstanceOf(SignatureVerificationException.class);
    }
}
