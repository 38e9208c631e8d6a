package com.vulnscan.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every API request with request/correlation ids and the calling organization and user, so scan
 * creation, audit rows and the work queued from a request can be traced back to it.
 */
@Component
@Slf4j
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String ORGANIZATION_HEADER = "X-Organization-Id";
    public static final String USER_HEADER = "X-User-Id";

    static final String MDC_REQUEST_ID = "requestId";
    static final String MDC_CORRELATION_ID = "correlationId";
    static final String MDC_ORG_ID = "orgId";
    static final String MDC_USER_ID = "userId";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = headerOrNew(request.getHeader(REQUEST_ID_HEADER));
        String correlationId = headerOrNew(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_CORRELATION_ID, correlationId);
        putIdentifier(MDC_ORG_ID, request.getHeader(ORGANIZATION_HEADER));
        putIdentifier(MDC_USER_ID, request.getHeader(USER_HEADER));
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        long started = System.currentTimeMillis();
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("{} {} -> {} in {}ms", request.getMethod(), request.getRequestURI(), response.getStatus(),
                    System.currentTimeMillis() - started);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_CORRELATION_ID);
            MDC.remove(MDC_ORG_ID);
            MDC.remove(MDC_USER_ID);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    // Only numeric ids reach the MDC; malformed headers are rejected later by the controllers.
    private void putIdentifier(String key, String header) {
        if (header == null || header.isBlank()) {
            return;
        }
        String value = header.trim();
        if (value.chars().allMatch(Character::isDigit) && value.length() <= 19) {
            MDC.put(key, value);
        }
    }

    private String headerOrNew(String value) {
        return (value == null || value.isBlank()) ? UUID.randomUUID().toString() : value.trim();
    }
}
