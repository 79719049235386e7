package com.yunhwan.loglens.infra.logging;

import com.fasterxml.jackson.core.JsonStreamContext;
import net.logstash.logback.mask.ValueMasker;

/**
 * LogstashEncoder 의 MaskingJsonGeneratorDecorator 에 등록하는 값 마스커 (logback-spring.xml).
 * 바뀐 값이 없으면 null 을 돌려 원래 값을 그대로 쓰게 한다.
 */
public class SecretValueMasker implements ValueMasker {

    @Override
    public Object mask(JsonStreamContext context, Object value) {
        if (!(value instanceof String s)) return null;
        String redacted = SecretRedactor.redact(s);
        return redacted.equals(s) ? null : redacted;
    }
}
