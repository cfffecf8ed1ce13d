package com.secretsync.backend.service.sink;

import com.secretsync.backend.exception.SinkRejectedException;
import com.secretsync.backend.exception.SinkUnavailableException;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.apis.CoreV1Api;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Secret;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class KubernetesSecretSink implements SecretSink {

    static final String MANAGED_BY_LABEL = "app.kubernetes.io/managed-by";
    static final String MANAGED_BY_VALUE = "secret-sync";

    private static final Set<Integer> REJECTED_STATUSES = Set.of(400, 403, 422);

    private final CoreV1Api coreV1Api;

    @Override
    public void apply(String namespace, String secretName, Map<String, String> data) {
        V1Secret existing = read(namespace, secretName);
        if (existing == null) {
            create(namespace, secretName, data);
        } else {
            replace(namespace, secretName, existing, data);
        }
    }

    private V1Secret read(String namespace, String secretName) {
        try {
            return coreV1Api.readNamespacedSecret(secretName, namespace).execute();
        } catch (ApiException e) {
            if (e.getCode() == 404) {
                return null;
            }
            throw translate("read", namespace, secretName, e);
        }
    }

    private void create(String namespace, String secretName, Map<String, String> data) {
        Map<String, String> labels = new HashMap<>();
        labels.put(MANAGED_BY_LABEL, MANAGED_BY_VALUE);
        V1Secret body = new V1Secret()
                .metadata(new V1ObjectMeta()
                        .name(secretName)
                        .namespace(namespace)
                        .labels(labels))
                .type("Opaque")
                .stringData(new LinkedHashMap<>(data));
        try {
            coreV1Api.createNamespacedSecret(namespace, body).execute();
            log.info("Created new Kubernetes secret: {}/{} ({} keys)", namespace, secretName, data.size());
        } catch (ApiException e) {
            throw translate("create", namespace, secretName, e);
        }
    }

    private void replace(String namespace, String secretName, V1Secret existing, Map<String, String> data) {
        // PUT with data cleared: stringData becomes the complete key set, stale keys are dropped
        existing.setData(null);
        existing.setStringData(new LinkedHashMap<>(data));
        try {
            coreV1Api.replaceNamespacedSecret(secretName, namespace, existing).execute();
            log.info("Updated existing Kubernetes secret: {}/{} ({} keys)", namespace, secretName, data.size());
        } catch (ApiException e) {
            throw translate("replace", namespace, secretName, e);
        }
    }

    private RuntimeException translate(String operation, String namespace, String secretName, ApiException e) {
        String message = "Kubernetes " + operation + " of secret " + namespace + "/" + secretName
                + " failed with status " + e.getCode();
        if (REJECTED_STATUSES.contains(e.getCode())) {
            log.error("{}: {}", message, e.getResponseBody());
            return new SinkRejectedException(message, e);
        }
        return new SinkUnavailableException(message, e);
    }
}
