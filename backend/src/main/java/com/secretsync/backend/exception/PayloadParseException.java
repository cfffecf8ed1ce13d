package com.secretsync.backend.exception;

public class PayloadParseException extends SecretSyncException {
    public PayloadParseException(String message) {
        super(SyncErrorType.PARSE_ERROR, message);
    }
}
