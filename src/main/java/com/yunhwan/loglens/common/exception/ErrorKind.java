package com.yunhwan.loglens.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 호출자에게 노출되는 오류 분류.
 * <p>
 * message/suggestion 은 외부에 그대로 나가는 문구이므로 토큰, 내부 URL, 스택 등은 절대 넣지 않는다.
 * 상세 원인은 서버 로그에만 남긴다.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    EVENT_SOURCE_AUTH(HttpStatus.SERVICE_UNAVAILABLE,
            "Event tracking service is unavailable",
            "Please verify the event tracking credentials are configured correctly"),
    EVENT_SOURCE_RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS,
            "Event tracking rate limit exceeded",
            "Please try again in a few minutes"),
    EVENT_SOURCE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE,
            "Event tracking service did not respond",
            "Please try again in a few moments"),
    EVENT_SOURCE_FAILED(HttpStatus.BAD_GATEWAY,
            "Failed to fetch events from the event tracking service",
            "Please check the event tracking integration"),
    ANALYSIS_PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE,
            "Analysis failed: AI service unavailable",
            "Please try again in a few moments"),
    ANALYSIS_RESPONSE_MALFORMED(HttpStatus.INTERNAL_SERVER_ERROR,
            "Analysis failed: Invalid response from AI",
            "Please try again or contact support"),
    INVALID_INPUT(HttpStatus.UNPROCESSABLE_ENTITY,
            "Invalid input",
            "Please check your input and try again"),
    SIGNATURE_INVALID(HttpStatus.UNAUTHORIZED,
            "Invalid signature",
            ""),
    COMMAND_USAGE(HttpStatus.OK,
            "Invalid command format",
            "Use format: /loglens [description] | [timestamp] | [customer_id]"),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED,
            "Authentication failed",
            "Please check your authentication token"),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR,
            "An internal error occurred",
            "Please try again later or contact support if the issue persists");

    private final HttpStatus status;
    private final String message;
    private final String suggestion;

    /**
     * 로그/메트릭 태그용 소문자 코드.
     */
    public String code() {
        return name().toLowerCase();
    }
}
