package com.ai.leasing.auth;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Requires the configured API key on operator endpoints. With no key configured every
 * request passes, which is only meant for local runs.
 */
@Component
public class ApiKeyInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyInterceptor.class);

    public static final String API_KEY_HEADER = "X-Api-Key";

    private final String apiKey;

    public ApiKeyInterceptor(@Value("${leasing.api-key:}") String apiKey) {
        this.apiKey = StringUtils.trimToEmpty(apiKey);
        if (this.apiKey.isEmpty()) {
            log.warn("leasing.api-key is not set; /api endpoints are open");
        }
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws IOException {
        if (apiKey.isEmpty()) {
            return true;
        }
        String presented = request.getHeader(API_KEY_HEADER);
        if (presented != null && MessageDigest.isEqual(
                apiKey.getBytes(StandardCharsets.UTF_8), presented.trim().getBytes(StandardCharsets.UTF_8))) {
            return true;
        }
        log.warn("Rejected {} {} from {}: missing or wrong API key",
                request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"status\":401,\"error\":\"Unauthorized\",\"message\":\"Missing or invalid API key\"}");
        return false;
    }
}
