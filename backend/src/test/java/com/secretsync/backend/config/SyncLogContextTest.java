package com.secretsync.backend.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class SyncLogContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void syncCycleWithoutRequestUsesSyncIdAsCorrelationId() {
        try (SyncLogContext.Scope ignored = SyncLogContext.forSyncCycle("sync-1")) {
            assertThat(MDC.get(SyncLogContext.SYNC_ID)).isEqualTo("sync-1");
            assertThat(MDC.get(SyncLogContext.CORRELATION_ID)).isEqualTo("sync-1");
        }

        assertThat(MDC.get(SyncLogContext.SYNC_ID)).isNull();
        assertThat(MDC.get(SyncLogContext.CORRELATION_ID)).isNull();
    }

    @Test
    void syncCycleInsideRequestKeepsRequestCorrelationId() {
        try (SyncLogContext.Scope request = SyncLogContext.forRequest("req-1", "corr-1")) {
            try (SyncLogContext.Scope cycle = SyncLogContext.forSyncCycle("sync-1")) {
                assertThat(MDC.get(SyncLogContext.REQUEST_ID)).isEqualTo("req-1");
                assertThat(MDC.get(SyncLogContext.CORRELATION_ID)).isEqualTo("corr-1");
                assertThat(MDC.get(SyncLogContext.SYNC_ID)).isEqualTo("sync-1");
            }
            assertThat(MDC.get(SyncLogContext.SYNC_ID)).isNull();
            assertThat(MDC.get(SyncLogContext.CORRELATION_ID)).isEqualTo("corr-1");
        }

        assertThat(MDC.get(SyncLogContext.REQUEST_ID)).isNull();
    }

    @Test
    void blankCandidateGetsFreshId() {
        assertThat(SyncLogContext.orNewId("  ")).isNotBlank();
        assertThat(SyncLogContext.orNewId(null)).isNotEqualTo(SyncLogContext.orNewId(null));
        assertThat(SyncLogContext.orNewId(" abc ")).isEqualTo("abc");
    }

    @Test
    void propagatedTaskSeesSubmitterContextAndLeavesWorkerClean() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> afterRun = new AtomicReference<>("unset");
        Runnable task;
        try (SyncLogContext.Scope ignored = SyncLogContext.forSyncCycle("sync-7")) {
            task = SyncLogContext.propagate(() -> seen.set(MDC.get(SyncLogContext.SYNC_ID)));
        }

        Thread worker = new Thread(() -> {
            task.run();
            afterRun.set(MDC.get(SyncLogContext.SYNC_ID));
        });
        worker.start();
        worker.join(5000);

        assertThat(seen.get()).isEqualTo("sync-7");
        assertThat(afterRun.get()).isNull();
    }
}
