package com.secretsync.backend.service;

import com.secretsync.backend.config.SecretSyncProperties;
import com.secretsync.backend.model.SyncResult;
import com.secretsync.backend.sync.SecretSyncEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledFuture;

/**
 * Periodic driver of the sync engine. Runs on its own scheduler thread; on-demand syncs only meet
 * it inside the engine's single-flight guard.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "secret-sync.sync.scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class SecretSyncScheduler {

    private final SecretSyncEngine syncEngine;
    private final TaskScheduler taskScheduler;
    private final SyncBackoffTrigger trigger;

    private ScheduledFuture<?> schedule;

    public SecretSyncScheduler(SecretSyncEngine syncEngine,
                               @Qualifier("syncTaskScheduler") TaskScheduler taskScheduler,
                               SecretSyncProperties properties) {
        this.syncEngine = syncEngine;
        this.taskScheduler = taskScheduler;
        SecretSyncProperties.Sync sync = properties.getSync();
        this.trigger = new SyncBackoffTrigger(sync.interval(), sync.failureBackoff());
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (schedule != null) {
            return;
        }
        schedule = taskScheduler.schedule(this::runScheduledCycle, trigger);
        log.info("Started periodic sync with interval: {}s", trigger.currentDelay().toSeconds());
    }

    @EventListener(ContextClosedEvent.class)
    public synchronized void stop() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
            log.info("Stopped periodic sync");
        }
    }

    void runScheduledCycle() {
        boolean success;
        try {
            SyncResult result = syncEngine.runOnce();
            success = result.isSuccess();
        } catch (Throwable t) {
            log.error("Error in periodic sync", t);
            success = false;
        }
        trigger.recordOutcome(success);
        if (!success) {
            log.warn("Sync cycle failed, retrying in {}s", trigger.currentDelay().toSeconds());
        }
    }

    SyncBackoffTrigger getTrigger() {
        return trigger;
    }
}
