package com.secretsync.backend.sync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key/value pairs decoded from the source secret, in document order. Lives for one cycle only.
 */
public record SecretPayload(Map<String, String> entries) {

    public SecretPayload {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public int size() {
        return entries.size();
    }
}
