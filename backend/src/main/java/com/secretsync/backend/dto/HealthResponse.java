package com.secretsync.backend.dto;

import com.secretsync.backend.model.ClientHealth;
import com.secretsync.backend.model.SyncResult;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class HealthResponse {
    private String status;
    private Instant timestamp;
    private Map<String, ClientHealth> checks;
    private SyncResult lastSync;
}
