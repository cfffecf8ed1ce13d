package com.secretsync.backend.exception;

public enum SyncErrorType {
    SOURCE_UNAVAILABLE,
    SOURCE_NOT_FOUND,
    PARSE_ERROR,
    SINK_UNAVAILABLE,
    SINK_REJECTED
}
