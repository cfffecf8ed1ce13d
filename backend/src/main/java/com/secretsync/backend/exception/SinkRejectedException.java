package com.secretsync.backend.exception;

public class SinkRejectedException extends SecretSyncException {
    public SinkRejectedException(String message, Throwable cause) {
        super(SyncErrorType.SINK_REJECTED, message, cause);
    }
}
