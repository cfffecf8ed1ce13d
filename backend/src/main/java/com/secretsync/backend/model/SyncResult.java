package com.secretsync.backend.model;

import com.secretsync.backend.exception.SyncErrorType;

import java.time.Instant;

/**
 * Outcome of one sync cycle. {@code errorType} is null for successful cycles.
 */
public record SyncResult(SyncOutcome outcome, Instant timestamp, String message, SyncErrorType errorType,
                         int keyCount) {

    public static SyncResult success(Instant timestamp, int keyCount) {
        return success(timestamp, keyCount, null);
    }

    /**
     * @param note appended to the message in parentheses when not null, e.g. key collisions
     */
    public static SyncResult success(Instant timestamp, int keyCount, String note) {
        String message = "Secrets synced successfully" + (note == null ? "" : " (" + note + ")");
        return new SyncResult(SyncOutcome.SUCCESS, timestamp, message, null, keyCount);
    }

    public static SyncResult failure(Instant timestamp, SyncErrorType errorType, String message) {
        return new SyncResult(SyncOutcome.FAILURE, timestamp, message, errorType, 0);
    }

    public boolean isSuccess() {
        return outcome == SyncOutcome.SUCCESS;
    }
}
