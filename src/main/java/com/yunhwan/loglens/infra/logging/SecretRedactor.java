package com.yunhwan.loglens.infra.logging;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 로그 문자열에서 자격 증명으로 보이는 값을 가린다.
 * <p>
 * JSON 로그는 {@link SecretValueMasker}, 콘솔 패턴 로그는 {@link RedactingMessageConverter} 가 이 규칙을 쓴다.
 */
public final class SecretRedactor {

    public static final String REDACTED = "***REDACTED***";

    private record Rule(Pattern pattern, String replacement) {}

    // 순서 중요: Bearer 를 먼저 가려야 "Authorization: Bearer xyz" 가 한 번에 처리된다
    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("(?i)Bearer\\s+[^\\s,\"'}]+"), "Bearer " + REDACTED),
            new Rule(Pattern.compile("(?i)(?<![a-z])(token|password|secret|api[_-]?key|authorization)[\"']?\\s*[:=]\\s*[\"']?[^\\s,\"'}]+"),
                    "$1=" + REDACTED),
            new Rule(Pattern.compile("sk-[a-zA-Z0-9]{20,}"), "sk-" + REDACTED),
            new Rule(Pattern.compile("xoxb-[a-zA-Z0-9-]+"), "xoxb-" + REDACTED),
            new Rule(Pattern.compile("sntrys_[a-zA-Z0-9]+"), "sntrys_" + REDACTED),
            new Rule(Pattern.compile("v0=[0-9a-f]{64}"), "v0=" + REDACTED),
            // response_url 은 URL 자체가 자격 증명
            new Rule(Pattern.compile("(https://hooks\\.slack\\.com/)[^\\s\"'<>|]+"), "$1" + REDACTED)
    );

    private SecretRedactor() {
    }

    public static String redact(String value) {
        if (value == null || value.isEmpty()) return value;
        String out = value;
        for (Rule rule : RULES) {
            out = rule.pattern().matcher(out).replaceAll(rule.replacement());
        }
        return out;
    }
}
