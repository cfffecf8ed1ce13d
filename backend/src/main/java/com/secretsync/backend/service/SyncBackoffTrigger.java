package com.secretsync.backend.service;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Duration;
import java.time.Instant;

/**
 * Fires immediately, then {@code interval} after a successful cycle or {@code failureBackoff}
 * after a failed one. Delays are measured from the completion of the previous cycle.
 */
public class SyncBackoffTrigger implements Trigger {

    private final Duration interval;
    private final Duration failureBackoff;
    private volatile boolean lastCycleFailed;

    public SyncBackoffTrigger(Duration interval, Duration failureBackoff) {
        this.interval = interval;
        this.failureBackoff = failureBackoff;
    }

    public void recordOutcome(boolean success) {
        lastCycleFailed = !success;
    }

    public Duration currentDelay() {
        return lastCycleFailed ? failureBackoff : interval;
    }

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        Instant lastCompletion = triggerContext.lastCompletion();
        if (lastCompletion == null) {
            return triggerContext.getClock().instant();
        }
        return lastCompletion.plus(currentDelay());
    }
}
