package com.yunhwan.loglens.usecase.command;

import com.yunhwan.loglens.common.exception.SignatureVerificationException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;

/**
 * 슬랙 요청 서명 검증.
 * <p>
 * basestring = "v0:{timestamp}:{body}", 서명 = "v0=" + hex(HMAC-SHA256(secret, basestring)).
 * 타임스탬프가 허용 구간(기본 300초)을 벗어나면 서명이 맞아도 거절한다(리플레이 방지).
 */
@Slf4j
public class SignatureVerifier {

    static final String VERSION = "v0";
    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final byte[] signingSecret;
    private final Clock clock;
    private final Duration tolerance;

    public SignatureVerifier(String signingSecret, Clock clock, Duration tolerance) {
        this.signingSecret = signingSecret == null ? new byte[0] : signingSecret.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
        this.tolerance = tolerance;
    }

    public void verify(CommandEnvelope envelope) {
        if (signingSecret.length == 0) {
            log.error("[SignatureVerifier] signing secret is not configured. rejecting request");
            throw new SignatureVerificationException("Signing secret not configured");
        }
        if (envelope.signature() == null || envelope.timestamp() == null) {
            log.warn("[SignatureVerifier] missing signature headers");
            throw new SignatureVerificationException("Missing signature headers");
        }

        long requestEpoch;
        try {
            requestEpoch = Long.parseLong(envelope.timestamp().trim());
        } catch (NumberFormatException e) {
            log.warn("[SignatureVerifier] non-numeric timestamp header");
            throw new SignatureVerificationException("Invalid timestamp header");
        }

        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - requestEpoch) > tolerance.getSeconds()) {
            log.warn("[SignatureVerifier] request timestamp outside window. requestEpoch={}, now={}", requestEpoch, now);
            throw new SignatureVerificationException("Request timestamp too old");
        }

        String expected = sign(envelope.timestamp().trim(), envelope.rawBody() == null ? "" : envelope.rawBody());
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                envelope.signature().trim().getBytes(StandardCharsets.UTF_8)
        );
        if (!matches) {
            log.warn("[SignatureVerifier] signature mismatch");
            throw new SignatureVerificationException("Invalid signature");
        }
        log.debug("[SignatureVerifier] signature verified");
    }

    String sign(String timestamp, String body) {
        String basestring = VERSION + ":" + timestamp + ":" + body;
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(signingSecret, HMAC_ALGORITHM));
            byte[] digest = mac.doFinal(basestring.getBytes(StandardCharsets.UTF_8));
            return VERSION + "=" + HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(HMAC_ALGORITHM + " not available", e);
        }
    }
}
