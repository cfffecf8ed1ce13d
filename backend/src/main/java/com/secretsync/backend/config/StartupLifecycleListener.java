package com.secretsync.backend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationFailedEvent;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StartupLifecycleListener implements ApplicationListener<ApplicationFailedEvent> {

    @Override
    public void onApplicationEvent(ApplicationFailedEvent event) {
        Throwable exception = event.getException();
        Throwable root = rootCause(exception);
        log.error("FATAL Startup failure. Root cause: {}", root.getMessage(), exception);
        for (Throwable suppressed : root.getSuppressed()) {
            log.error("FATAL Suppressed: {}", suppressed.getMessage(), suppressed);
        }
    }

    @Component
    @Slf4j
    @RequiredArgsConstructor
    public static class StartupReadyListener implements ApplicationListener<ApplicationReadyEvent> {

        private final SecretSyncProperties properties;

        @Override
        public void onApplicationEvent(ApplicationReadyEvent event) {
            SecretSyncProperties.Gcp gcp = properties.getGcp();
            SecretSyncProperties.Kubernetes kubernetes = properties.getKubernetes();
            log.info("Secret sync ready: projects/{}/secrets/{}/versions/{} -> {}/{} (sync token {})",
                    gcp.getProjectId(), gcp.getSecretName(), gcp.getSecretVersion(),
                    kubernetes.getNamespace(), kubernetes.getSecretName(),
                    properties.getApi().isTokenRequired() ? "required" : "not configured");
        }
    }

    private Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
