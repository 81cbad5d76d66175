package com.wildvision.observations.config;

import com.wildvision.observations.exception.UnauthorizedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Rejects requests whose {@value #API_KEY_HEADER} header does not match the configured secret.
 * With no secret configured every request is rejected.
 */
@Component
public class ApiKeyInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyInterceptor.class);

    public static final String API_KEY_HEADER = "x-api-key";

    private final byte[] expectedKey;

    public ApiKeyInterceptor(@Value("${wildvision.api-key:}") String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("wildvision.api-key is not set; all /api requests will be refused");
            this.expectedKey = null;
        } else {
            this.expectedKey = apiKey.getBytes(StandardCharsets.UTF_8);
        }
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        // Browsers never send custom headers on a preflight.
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }
        String provided = request.getHeader(API_KEY_HEADER);
        if (!matches(provided)) {
            log.warn("Unauthorized {} {} from {}", request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
            throw new UnauthorizedException("Unauthorized");
        }
        return true;
    }

    private boolean matches(String provided) {
        if (expectedKey == null || provided == null || provided.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(expectedKey, provided.getBytes(StandardCharsets.UTF_8));
    }
}
