package com.secretsync.backend.service.source;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.NotFoundException;
import com.google.cloud.secretmanager.v1.AccessSecretVersionResponse;
import com.google.cloud.secretmanager.v1.SecretManagerServiceClient;
import com.google.cloud.secretmanager.v1.SecretVersionName;
import com.secretsync.backend.exception.SourceNotFoundException;
import com.secretsync.backend.exception.SourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.zip.CRC32C;
import java.util.zip.Checksum;

@Slf4j
@Component
@RequiredArgsConstructor
public class GcpSecretManagerSource implements SecretSource {

    private final SecretManagerServiceClient client;

    @Override
    public byte[] fetch(String projectId, String secretName, String version) {
        SecretVersionName name = SecretVersionName.of(projectId, secretName, version);
        log.info("Fetching secret from: {}", name);
        AccessSecretVersionResponse response;
        try {
            response = client.accessSecretVersion(name);
        } catch (NotFoundException e) {
            throw new SourceNotFoundException("Secret version not found: " + name, e);
        } catch (ApiException e) {
            throw new SourceUnavailableException("Secret Manager call failed for " + name
                    + " (" + e.getStatusCode().getCode() + ")", e);
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Secret Manager call failed for " + name + ": " + e.getMessage(), e);
        }

        byte[] data = response.getPayload().getData().toByteArray();
        if (response.getPayload().hasDataCrc32C()) {
            Checksum checksum = new CRC32C();
            checksum.update(data, 0, data.length);
            if (response.getPayload().getDataCrc32C() != checksum.getValue()) {
                throw new SourceUnavailableException("Data corruption detected for secret: " + response.getName());
            }
        }
        log.debug("Fetched {} bytes from {}", data.length, response.getName());
        return data;
    }
}
