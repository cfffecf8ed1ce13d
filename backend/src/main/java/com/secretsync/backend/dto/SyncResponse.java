package com.secretsync.backend.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class SyncResponse {
    private String status;
    private String message;
    private Instant timestamp;
}
