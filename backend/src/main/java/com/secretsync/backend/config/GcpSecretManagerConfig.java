package com.secretsync.backend.config;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.secretmanager.v1.SecretManagerServiceClient;
import com.google.cloud.secretmanager.v1.SecretManagerServiceSettings;
import com.secretsync.backend.model.ClientHealth;
import com.secretsync.backend.service.SyncHealthTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

@Slf4j
@Configuration
public class GcpSecretManagerConfig {

    /**
     * Uses the configured service account file when it exists, otherwise Application Default
     * Credentials (workload identity on GKE). A client that cannot be built stops startup.
     */
    @Bean(destroyMethod = "close")
    public SecretManagerServiceClient secretManagerServiceClient(SecretSyncProperties properties,
                                                                 SyncHealthTracker healthTracker) {
        String credentialsPath = properties.getGcp().getCredentialsPath();
        try {
            SecretManagerServiceClient client;
            if (credentialsPath != null && !credentialsPath.isBlank() && Files.exists(Path.of(credentialsPath))) {
                GoogleCredentials credentials;
                try (InputStream in = Files.newInputStream(Path.of(credentialsPath))) {
                    credentials = GoogleCredentials.fromStream(in);
                }
                SecretManagerServiceSettings settings = SecretManagerServiceSettings.newBuilder()
                        .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                        .build();
                client = SecretManagerServiceClient.create(settings);
                log.info("GCP Secret Manager client initialized with credentials from {}", credentialsPath);
            } else {
                if (credentialsPath != null && !credentialsPath.isBlank()) {
                    log.warn("GCP credentials file {} not found, falling back to application default credentials",
                            credentialsPath);
                }
                client = SecretManagerServiceClient.create();
                log.info("GCP Secret Manager client initialized with application default credentials");
            }
            healthTracker.recordSourceHealth(ClientHealth.ready("GCP Secret Manager client initialized"));
            return client;
        } catch (IOException e) {
            healthTracker.recordSourceHealth(ClientHealth.unavailable("GCP client not initialized: " + e.getMessage()));
            throw new IllegalStateException("GCP Secret Manager client initialization failed", e);
        }
    }
}
