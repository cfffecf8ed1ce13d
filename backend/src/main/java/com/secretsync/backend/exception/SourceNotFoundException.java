package com.secretsync.backend.exception;

public class SourceNotFoundException extends SecretSyncException {
    public SourceNotFoundException(String message) {
        super(SyncErrorType.SOURCE_NOT_FOUND, message);
    }

    public SourceNotFoundException(String message, Throwable cause) {
        super(SyncErrorType.SOURCE_NOT_FOUND, message, cause);
    }
}
