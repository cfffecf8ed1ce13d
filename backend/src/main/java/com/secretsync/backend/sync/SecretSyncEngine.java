package com.secretsync.backend.sync;

import com.secretsync.backend.config.SecretSyncProperties;
import com.secretsync.backend.config.SyncLogContext;
import com.secretsync.backend.exception.SecretSyncException;
import com.secretsync.backend.exception.SinkUnavailableException;
import com.secretsync.backend.exception.SourceUnavailableException;
import com.secretsync.backend.exception.SyncErrorType;
import com.secretsync.backend.model.ClientHealth;
import com.secretsync.backend.model.SyncResult;
import com.secretsync.backend.service.SyncHealthTracker;
import com.secretsync.backend.service.sink.SecretSink;
import com.secretsync.backend.service.source.SecretSource;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Runs one fetch, parse, normalize and apply cycle.
 *
 * <p>Cycles never overlap. A call made while a cycle is running does not start another one: it
 * waits for the running cycle and returns that cycle's result. The in-flight slot is claimed and
 * published under one lock and released on every exit path.
 *
 * <p>Each cycle gets its own {@code syncId} in the MDC; a cycle started by an HTTP request keeps
 * the request's correlation id.
 *
 * <p>Failures are recorded on the {@link SyncHealthTracker} and returned as a failed
 * {@link SyncResult}; nothing is retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecretSyncEngine {

    private final SecretSource secretSource;
    private final SecretSink secretSink;
    private final SecretPayloadParser payloadParser;
    private final SecretKeyNormalizer keyNormalizer;
    private final SyncHealthTracker healthTracker;
    private final SecretSyncProperties properties;
    private final TimeLimiter syncStepTimeLimiter;
    @Qualifier("syncExecutor")
    private final ThreadPoolTaskExecutor syncExecutor;

    private final ReentrantLock flightLock = new ReentrantLock();
    private CompletableFuture<SyncResult> inFlight;
    private String inFlightSyncId;

    public SyncResult runOnce() {
        CompletableFuture<SyncResult> flight;
        String syncId;
        boolean leader;
        flightLock.lock();
        try {
            if (inFlight != null) {
                flight = inFlight;
                syncId = inFlightSyncId;
                leader = false;
            } else {
                flight = new CompletableFuture<>();
                syncId = SyncLogContext.newId();
                inFlight = flight;
                inFlightSyncId = syncId;
                leader = true;
            }
        } finally {
            flightLock.unlock();
        }

        if (!leader) {
            log.info("Sync already in progress, waiting for cycle {}", syncId);
            return flight.join();
        }

        SyncResult result = null;
        try (SyncLogContext.Scope ignored = SyncLogContext.forSyncCycle(syncId)) {
            result = runCycle();
            return result;
        } finally {
            flightLock.lock();
            try {
                inFlight = null;
                inFlightSyncId = null;
            } finally {
                flightLock.unlock();
            }
            if (result != null) {
                flight.complete(result);
            } else {
                flight.completeExceptionally(new IllegalStateException("Sync cycle aborted"));
            }
        }
    }

    private SyncResult runCycle() {
        SecretSyncProperties.Gcp gcp = properties.getGcp();
        SecretSyncProperties.Kubernetes kubernetes = properties.getKubernetes();
        log.info("Starting secret sync...");
        SyncResult result;
        try {
            byte[] raw = step("fetch", SourceUnavailableException::new,
                    () -> secretSource.fetch(gcp.getProjectId(), gcp.getSecretName(), gcp.getSecretVersion()));
            healthTracker.recordSourceHealth(ClientHealth.ready("GCP Secret Manager reachable"));

            SecretPayload payload = payloadParser.parse(raw);
            log.info("Successfully fetched {} secrets from GCP", payload.size());
            NormalizedPayload normalized = keyNormalizer.normalizeKeys(payload);

            step("apply", SinkUnavailableException::new, () -> {
                secretSink.apply(kubernetes.getNamespace(), kubernetes.getSecretName(), normalized.entries());
                return null;
            });
            healthTracker.recordSinkHealth(ClientHealth.ready(
                    "Kubernetes API reachable (namespace: " + kubernetes.getNamespace() + ")"));

            result = SyncResult.success(Instant.now(), normalized.size(), describeAdjustments(normalized));
            log.info("Secret sync completed successfully ({} keys)", normalized.size());
        } catch (SecretSyncException e) {
            recordAdapterFailure(e);
            result = SyncResult.failure(Instant.now(), e.getErrorType(), e.getMessage());
            log.error("Secret sync failed [{}]: {}", e.getErrorType(), e.getMessage(), e);
        } catch (RuntimeException e) {
            result = SyncResult.failure(Instant.now(), null, "Unexpected error: " + e.getMessage());
            log.error("Secret sync failed unexpectedly", e);
        }
        healthTracker.recordSync(result);
        return result;
    }

    private <T> T step(String name, BiFunction<String, Throwable, ? extends SecretSyncException> unavailable,
                       Supplier<T> call) {
        try {
            Callable<T> task = call::get;
            return syncStepTimeLimiter.executeFutureSupplier(() -> syncExecutor.submit(task));
        } catch (SecretSyncException e) {
            throw e;
        } catch (TimeoutException e) {
            throw unavailable.apply("Sync step '" + name + "' timed out after "
                    + syncStepTimeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable.apply("Sync step '" + name + "' was interrupted", e);
        } catch (Exception e) {
            throw unavailable.apply("Sync step '" + name + "' failed: " + e.getMessage(), e);
        }
    }

    private String describeAdjustments(NormalizedPayload normalized) {
        List<String> parts = new ArrayList<>();
        if (!normalized.collisions().isEmpty()) {
            parts.add(normalized.collisions().size() + " key collision(s), later key kept");
        }
        if (!normalized.droppedKeys().isEmpty()) {
            parts.add(normalized.droppedKeys().size() + " key(s) dropped with empty normalized form");
        }
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private void recordAdapterFailure(SecretSyncException e) {
        if (e.getErrorType() == SyncErrorType.SOURCE_UNAVAILABLE) {
            healthTracker.recordSourceHealth(ClientHealth.unavailable(e.getMessage()));
        } else if (e.getErrorType() == SyncErrorType.SINK_UNAVAILABLE) {
            healthTracker.recordSinkHealth(ClientHealth.unavailable(e.getMessage()));
        }
    }
}
