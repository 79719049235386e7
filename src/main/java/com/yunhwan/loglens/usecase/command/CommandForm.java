package com.yunhwan.loglens.usecase.command;

import com.yunhwan.loglens.common.exception.CommandUsageException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * 슬래시 커맨드 폼 바디에서 쓰는 필드.
 * 같은 키가 여러 번 오면 첫 값만 쓴다.
 *
 * @param text        커맨드 인자
 * @param responseUrl 결과 전달용 콜백 URL
 */
public record CommandForm(String text, String responseUrl) {

    static final String TEXT = "text";
    static final String RESPONSE_URL = "response_url";

    /**
     * 잘못된 퍼센트 인코딩은 {@link CommandUsageException} 으로 바꾼다.
     */
    public static CommandForm decode(String rawBody) {
        Map<String, String> fields = new HashMap<>();
        if (rawBody != null && !rawBody.isEmpty()) {
            try {
                for (String pair : rawBody.split("&")) {
                    if (pair.isEmpty()) continue;
                    int idx = pair.indexOf('=');
                    String key = idx < 0 ? pair : pair.substring(0, idx);
                    String value = idx < 0 ? "" : pair.substring(idx + 1);
                    fields.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                            URLDecoder.decode(value, StandardCharsets.UTF_8));
                }
            } catch (IllegalArgumentException e) {
                throw new CommandUsageException("Malformed command body");
            }
        }
        return new CommandForm(fields.get(TEXT), fields.get(RESPONSE_URL));
    }
}
