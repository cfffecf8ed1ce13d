package com.secretsync.backend.exception;

public class SinkUnavailableException extends SecretSyncException {
    public SinkUnavailableException(String message) {
        super(SyncErrorType.SINK_UNAVAILABLE, message);
    }

    public SinkUnavailableException(String message, Throwable cause) {
        super(SyncErrorType.SINK_UNAVAILABLE, message, cause);
    }
}
