package com.secretsync.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Opens a {@link SyncLogContext} for every request. A manual sync runs on the request thread, so
 * the engine picks up the caller's correlation id and the cycle's logs can be matched to the
 * {@code X-Correlation-Id} the caller sent or received.
 */
@Component
public class RequestCorrelationFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = SyncLogContext.orNewId(request.getHeader(REQUEST_ID_HEADER));
        String correlationId = SyncLogContext.orNewId(request.getHeader(CORRELATION_ID_HEADER));
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try (SyncLogContext.Scope ignored = SyncLogContext.forRequest(requestId, correlationId)) {
            filterChain.doFilter(request, response);
        }
    }
}
