package com.secretsync.backend.controller;

import com.secretsync.backend.dto.SyncResponse;
import com.secretsync.backend.model.SyncResult;
import com.secretsync.backend.security.ApiTokenVerifier;
import com.secretsync.backend.sync.SecretSyncEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
@Tag(name = "Sync")
public class SyncController {

    private final SecretSyncEngine syncEngine;
    private final ApiTokenVerifier tokenVerifier;

    /**
     * A failed sync is still a 200: the call reached the engine, the body carries the outcome.
     */
    @PostMapping
    @Operation(summary = "Trigger a sync now")
    public ResponseEntity<SyncResponse> sync(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        tokenVerifier.verify(authorization);
        log.info("Manual sync triggered via API");
        SyncResult result = syncEngine.runOnce();
        return ResponseEntity.ok(SyncResponse.builder()
                .status(result.isSuccess() ? "success" : "failure")
                .message(result.message())
                .timestamp(result.timestamp())
                .build());
    }
}
