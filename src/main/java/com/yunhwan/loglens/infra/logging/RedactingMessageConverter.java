package com.yunhwan.loglens.infra.logging;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;

/**
 * 콘솔 패턴의 %m / %msg / %message 를 대체한다 (logback-spring.xml conversionRule).
 */
public class RedactingMessageConverter extends ClassicConverter {

    @Override
    public String convert(ILoggingEvent event) {
        return SecretRedactor.redact(event.getFormattedMessage());
    }
}
