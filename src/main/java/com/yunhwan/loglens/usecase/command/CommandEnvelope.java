package com.yunhwan.loglens.usecase.command;

/**
 * 웹훅 1회 호출분. 검증 후 버리며 저장하지 않는다.
 * <p>
 * 바디는 서명 검증이 끝나기 전까지 디코딩하지 않는다. 폼 필드는 {@link CommandForm#decode} 로 꺼낸다.
 *
 * @param rawBody   서명 대상 원문 바디 (application/x-www-form-urlencoded)
 * @param signature X-Slack-Signature
 * @param timestamp X-Slack-Request-Timestamp (epoch seconds)
 */
public record CommandEnvelope(
        String rawBody,
        String signature,
        String timestamp
) {
    @Override
    public String toString() {
        // 서명/바디(콜백 URL 포함)는 로그에 남기지 않는다
        return "CommandEnvelope{timestamp=" + timestamp + ", bodyLength=" + (rawBody == null ? 0 : rawBody.length()) + "}";
    }
}
