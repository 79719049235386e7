package com.yunhwan.loglens.app.api.support;

import com.yunhwan.loglens.infra.logging.TriageEventLogger;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.UUID;

/**
 * 요청마다 request id 를 MDC 에 넣고, 끝나면 method/path/status/소요시간을 한 줄로 남긴다.
 * <p>
 * 쿼리스트링과 바디는 남기지 않는다 (Slack 폼 바디에 response_url 이 들어 있다).
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@RequiredArgsConstructor
public class RequestLoggingFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String MDC_KEY = "request_id";

    private static final int MAX_REQUEST_ID_LENGTH = 64;

    private final TriageEventLogger eventLogger;
    private final Clock clock;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = resolveRequestId(request.getHeader(HEADER));
        long startedAt = clock.millis();

        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
            eventLogger.httpRequestCompleted(requestId, request.getMethod(), request.getRequestURI(),
                    response.getStatus(), clock.millis() - startedAt);
        } catch (IOException | ServletException | RuntimeException e) {
            eventLogger.httpRequestFailed(requestId, request.getMethod(), request.getRequestURI(),
                    e, clock.millis() - startedAt);
            throw e;
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    // 헤더 값은 그대로 로그에 들어가므로 길이와 문자를 제한한다
    static String resolveRequestId(String header) {
        if (StringUtils.hasText(header)
                && header.length() <= MAX_REQUEST_ID_LENGTH
                && header.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-' || c == '_')) {
            return header;
        }
        return UUID.randomUUID().toString();
    }
}
