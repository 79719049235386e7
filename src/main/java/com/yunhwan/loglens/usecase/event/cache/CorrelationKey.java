package com.yunhwan.loglens.usecase.event.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * (subject, window, endpoint) 조합의 캐시 키.
 * digest 는 SHA-256 hex 이며 로그에는 앞 16자리만 남긴다.
 */
public record CorrelationKey(String subjectId, Instant windowStart, Instant windowEnd, String endpoint) {

    public String digest() {
        String canonical = String.join("\n",
                "endpoint=" + endpoint,
                "subject=" + subjectId,
                "start=" + windowStart,
                "end=" + windowEnd);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // JDK 표준 알고리즘이라 발생하지 않음
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public String shortDigest() {
        return digest().substring(0, 16);
    }
}
