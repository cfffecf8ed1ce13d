package com.secretsync.backend.exception;

/**
 * Base for every failure a sync cycle can end with. Messages must never carry secret values.
 */
public abstract class SecretSyncException extends RuntimeException {

    private final SyncErrorType errorType;

    protected SecretSyncException(SyncErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected SecretSyncException(SyncErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public SyncErrorType getErrorType() {
        return errorType;
    }
}
