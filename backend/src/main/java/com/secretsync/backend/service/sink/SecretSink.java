package com.secretsync.backend.service.sink;

import java.util.Map;

/**
 * Write side of the sync.
 */
public interface SecretSink {

    /**
     * Creates the secret when absent, otherwise replaces its whole key set with {@code data}.
     * Keys missing from {@code data} are removed from the target.
     *
     * @throws com.secretsync.backend.exception.SinkRejectedException    when the cluster refuses the object
     * @throws com.secretsync.backend.exception.SinkUnavailableException on transient failures
     */
    void apply(String namespace, String secretName, Map<String, String> data);
}
