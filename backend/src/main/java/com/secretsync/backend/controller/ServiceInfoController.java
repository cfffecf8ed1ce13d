package com.secretsync.backend.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "Service")
public class ServiceInfoController {

    @GetMapping("/")
    @Operation(summary = "Describe the service and its endpoints")
    public ResponseEntity<ServiceInfoResponse> root() {
        return ResponseEntity.ok(new ServiceInfoResponse(
                "GCP Secret Sync to Kubernetes",
                "running",
                Map.of("health", "/api/health", "sync", "/api/sync")));
    }

    public record ServiceInfoResponse(String service, String status, Map<String, String> endpoints) {}
}
