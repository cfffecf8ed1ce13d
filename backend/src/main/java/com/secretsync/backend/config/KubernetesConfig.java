package com.secretsync.backend.config;

import com.secretsync.backend.model.ClientHealth;
import com.secretsync.backend.service.SyncHealthTracker;
import io.kubernetes.client.openapi.ApiClient;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.util.Config;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * In-cluster service account configuration when running in a pod, kubeconfig otherwise.
 */
@Slf4j
@Configuration
public class KubernetesConfig {

    @Bean
    public ApiClient kubernetesApiClient(SecretSyncProperties properties) {
        ApiClient client;
        try {
            client = Config.fromCluster();
            log.info("Loaded in-cluster Kubernetes config");
        } catch (IOException | RuntimeException e) {
            log.warn("In-cluster config not available, falling back to kubeconfig: {}", e.getMessage());
            try {
                client = Config.defaultClient();
                log.info("Loaded kubeconfig");
            } catch (IOException ex) {
                ex.addSuppressed(e);
                throw new IllegalStateException("Kubernetes client initialization failed", ex);
            }
        }
        SecretSyncProperties.Kubernetes kubernetes = properties.getKubernetes();
        client.setConnectTimeout(kubernetes.getConnectTimeoutSeconds() * 1000);
        client.setReadTimeout(kubernetes.getReadTimeoutSeconds() * 1000);
        return client;
    }

    @Bean
    public CoreV1Api coreV1Api(ApiClient kubernetesApiClient, SecretSyncProperties properties,
                               SyncHealthTracker healthTracker) {
        CoreV1Api api = new CoreV1Api(kubernetesApiClient);
        String namespace = properties.getKubernetes().getNamespace();
        log.info("Kubernetes client initialized (namespace: {})", namespace);
        healthTracker.recordSinkHealth(ClientHealth.ready("Kubernetes client initialized (namespace: " + namespace + ")"));
        return api;
    }
}
