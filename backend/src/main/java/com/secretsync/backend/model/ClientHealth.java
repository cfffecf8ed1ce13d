package com.secretsync.backend.model;

public record ClientHealth(boolean ready, String detail) {

    public static final ClientHealth NOT_INITIALIZED = new ClientHealth(false, "not yet initialized");

    public static ClientHealth ready(String detail) {
        return new ClientHealth(true, detail);
    }

    public static ClientHealth unavailable(String detail) {
        return new ClientHealth(false, detail);
    }
}
