package com.secretsync.backend.model;

public enum SyncOutcome {
    SUCCESS,
    FAILURE
}
