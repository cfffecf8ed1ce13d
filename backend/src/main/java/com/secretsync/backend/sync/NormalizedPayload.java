package com.secretsync.backend.sync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload whose keys all satisfy the Kubernetes secret key syntax.
 *
 * @param entries     normalized key to original value
 * @param collisions  source keys that were overwritten by a later key with the same normalized form
 * @param droppedKeys source keys that normalized to the empty string
 */
public record NormalizedPayload(Map<String, String> entries, List<KeyCollision> collisions, List<String> droppedKeys) {

    public NormalizedPayload {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        collisions = List.copyOf(collisions);
        droppedKeys = List.copyOf(droppedKeys);
    }

    public int size() {
        return entries.size();
    }

    public record KeyCollision(String normalizedKey, String replacedKey, String winningKey) {
    }
}
