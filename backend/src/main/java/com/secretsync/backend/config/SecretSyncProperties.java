package com.secretsync.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Bound from the {@code secret-sync} prefix. Required values are validated at bind time so a
 * missing project, secret or namespace stops the context from starting.
 */
@ConfigurationProperties(prefix = "secret-sync")
@Data
@Validated
public class SecretSyncProperties {

    @Valid
    private Gcp gcp = new Gcp();

    @Valid
    private Kubernetes kubernetes = new Kubernetes();

    @Valid
    private Sync sync = new Sync();

    private Api api = new Api();

    @Data
    public static class Gcp {
        @NotBlank(message = "GCP project id is required (GCP_PROJECT_ID)")
        private String projectId;

        @NotBlank(message = "GCP secret name is required (GCP_SECRET_NAME)")
        private String secretName;

        @NotBlank
        private String secretVersion = "latest";

        // Service account JSON; Application Default Credentials are used when empty
        private String credentialsPath;
    }

    @Data
    public static class Kubernetes {
        @NotBlank(message = "Kubernetes namespace is required (K8S_NAMESPACE)")
        private String namespace;

        @NotBlank(message = "Kubernetes secret name is required (K8S_SECRET_NAME)")
        private String secretName;

        @Min(1)
        private int connectTimeoutSeconds = 10;

        @Min(1)
        private int readTimeoutSeconds = 30;
    }

    @Data
    public static class Sync {
        @Min(1)
        private long intervalSeconds = 300;

        @Min(1)
        private long failureBackoffSeconds = 60;

        @Min(1)
        private long stepTimeoutSeconds = 30;

        private boolean schedulerEnabled = true;

        public Duration interval() {
            return Duration.ofSeconds(intervalSeconds);
        }

        public Duration failureBackoff() {
            return Duration.ofSeconds(failureBackoffSeconds);
        }

        public Duration stepTimeout() {
            return Duration.ofSeconds(stepTimeoutSeconds);
        }
    }

    @Data
    public static class Api {
        private String token;

        public boolean isTokenRequired() {
            return token != null && !token.isBlank();
        }
    }
}
