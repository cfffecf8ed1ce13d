package com.secretsync.backend.controller;

import com.secretsync.backend.dto.HealthResponse;
import com.secretsync.backend.model.ClientHealth;
import com.secretsync.backend.model.HealthSnapshot;
import com.secretsync.backend.service.SyncHealthTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Tag(name = "Health")
public class HealthController {

    private final SyncHealthTracker healthTracker;

    /**
     * Reports the last known client readiness and sync outcome. Makes no calls to GCP or the
     * Kubernetes API; connectivity is exercised by the sync cycles.
     */
    @GetMapping
    @Operation(summary = "Get client readiness and last sync outcome")
    public ResponseEntity<HealthResponse> health() {
        HealthSnapshot snapshot = healthTracker.report();
        Map<String, ClientHealth> checks = new LinkedHashMap<>();
        checks.put("gcp", snapshot.source());
        checks.put("kubernetes", snapshot.sink());
        return ResponseEntity.ok(HealthResponse.builder()
                .status(snapshot.isHealthy() ? "healthy" : "degraded")
                .timestamp(Instant.now())
                .checks(checks)
                .lastSync(snapshot.lastSync())
                .build());
    }
}
