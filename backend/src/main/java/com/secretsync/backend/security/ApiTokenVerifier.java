package com.secretsync.backend.security;

import com.secretsync.backend.config.SecretSyncProperties;
import com.secretsync.backend.exception.UnauthorizedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Guards the sync trigger with the configured static API token. Accepts {@code Bearer <token>} or
 * the bare token. When no token is configured every caller is allowed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiTokenVerifier {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SecretSyncProperties properties;

    public void verify(String authorizationHeader) {
        SecretSyncProperties.Api api = properties.getApi();
        if (!api.isTokenRequired()) {
            return;
        }
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new UnauthorizedException("Authorization header is required");
        }
        String presented = authorizationHeader.startsWith(BEARER_PREFIX)
                ? authorizationHeader.substring(BEARER_PREFIX.length()).strip()
                : authorizationHeader.strip();
        if (!constantTimeEquals(api.getToken(), presented)) {
            log.warn("Invalid token attempt for /api/sync");
            throw new UnauthorizedException("Invalid token");
        }
    }

    private boolean constantTimeEquals(String expected, String presented) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8));
    }
}
