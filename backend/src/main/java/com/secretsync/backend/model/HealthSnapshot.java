package com.secretsync.backend.model;

/**
 * Point-in-time copy of adapter readiness and the last cycle. {@code lastSync} is null until the
 * first cycle completes.
 */
public record HealthSnapshot(ClientHealth source, ClientHealth sink, SyncResult lastSync) {

    public boolean isHealthy() {
        return source.ready() && sink.ready() && (lastSync == null || lastSync.isSuccess());
    }
}
