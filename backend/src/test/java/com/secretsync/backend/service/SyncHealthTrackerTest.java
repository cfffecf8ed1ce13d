package com.secretsync.backend.service;

import com.secretsync.backend.exception.SyncErrorType;
import com.secretsync.backend.model.ClientHealth;
import com.secretsync.backend.model.HealthSnapshot;
import com.secretsync.backend.model.SyncResult;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SyncHealthTrackerTest {

    private final SyncHealthTracker tracker = new SyncHealthTracker();

    @Test
    void defaultsToNotInitialized() {
        HealthSnapshot snapshot = tracker.report();

        assertThat(snapshot.source()).isEqualTo(ClientHealth.NOT_INITIALIZED);
        assertThat(snapshot.sink()).isEqualTo(ClientHealth.NOT_INITIALIZED);
        assertThat(snapshot.lastSync()).isNull();
        assertThat(snapshot.isHealthy()).isFalse();
    }

    @Test
    void lastSyncIsOverwritten() {
        tracker.recordSourceHealth(ClientHealth.ready("ok"));
        tracker.recordSinkHealth(ClientHealth.ready("ok"));
        tracker.recordSync(SyncResult.failure(Instant.now(), SyncErrorType.PARSE_ERROR, "bad json"));
        assertThat(tracker.report().isHealthy()).isFalse();

        SyncResult success = SyncResult.success(Instant.now(), 2);
        tracker.recordSync(success);

        assertThat(tracker.report().lastSync()).isEqualTo(success);
        assertThat(tracker.report().isHealthy()).isTrue();
    }

    @Test
    void readyClientsWithoutSyncAreHealthy() {
        tracker.recordSourceHealth(ClientHealth.ready("ok"));
        tracker.recordSinkHealth(ClientHealth.ready("ok"));

        assertThat(tracker.report().isHealthy()).isTrue();
    }
}
