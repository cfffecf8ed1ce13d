package com.secretsync.backend.exception;

public class SourceUnavailableException extends SecretSyncException {
    public SourceUnavailableException(String message) {
        super(SyncErrorType.SOURCE_UNAVAILABLE, message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(SyncErrorType.SOURCE_UNAVAILABLE, message, cause);
    }
}
