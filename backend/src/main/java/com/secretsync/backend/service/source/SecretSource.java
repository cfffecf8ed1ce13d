package com.secretsync.backend.service.source;

/**
 * Read side of the sync. Implementations do not cache: every call reaches the backing store.
 */
public interface SecretSource {

    /**
     * Returns the raw payload of one secret version.
     *
     * @throws com.secretsync.backend.exception.SourceNotFoundException    when the secret or version does not exist
     * @throws com.secretsync.backend.exception.SourceUnavailableException on any transient or access failure
     */
    byte[] fetch(String projectId, String secretName, String version);
}
