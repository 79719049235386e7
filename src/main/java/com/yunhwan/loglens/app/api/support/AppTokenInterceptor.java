package com.yunhwan.loglens.app.api.support;

import com.yunhwan.loglens.common.exception.UnauthorizedException;
import com.yunhwan.loglens.config.web.AuthProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * /api/** 공유 토큰 검사 (X-Auth-Token).
 */
@RequiredArgsConstructor
public class AppTokenInterceptor implements HandlerInterceptor {

    public static final String HEADER = "X-Auth-Token";

    private final AuthProperties props;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // CORS preflight 는 통과
        if (HttpMethod.OPTIONS.matches(request.getMethod())) return true;

        String expected = props.getAppPassword();
        if (expected == null || expected.isBlank()) {
            throw new UnauthorizedException("App password is not configured");
        }
        String provided = request.getHeader(HEADER);
        if (provided == null || !MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedException("Invalid or missing " + HEADER);
        }
        return true;
    }
}
