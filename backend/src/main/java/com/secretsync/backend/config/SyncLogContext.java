package com.secretsync.backend.config;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * MDC keys shared by HTTP requests and sync cycles, so a cycle's log lines carry the same
 * correlation id as the request that triggered it. Scheduled cycles have no request and use their
 * own sync id as correlation id.
 */
public final class SyncLogContext {

    public static final String REQUEST_ID = "requestId";
    public static final String CORRELATION_ID = "correlationId";
    public static final String SYNC_ID = "syncId";

    private SyncLogContext() {
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static String orNewId(String candidate) {
        return (candidate == null || candidate.isBlank()) ? newId() : candidate.trim();
    }

    public static Scope forRequest(String requestId, String correlationId) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(REQUEST_ID, requestId);
        values.put(CORRELATION_ID, correlationId);
        return open(values);
    }

    public static Scope forSyncCycle(String syncId) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(SYNC_ID, syncId);
        String correlationId = MDC.get(CORRELATION_ID);
        values.put(CORRELATION_ID, correlationId != null ? correlationId : syncId);
        return open(values);
    }

    /**
     * Wraps a task so it runs with the submitting thread's MDC. Used as the task decorator of the
     * sync step executor.
     */
    public static Runnable propagate(Runnable task) {
        Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (captured != null) {
                MDC.setContextMap(captured);
            } else {
                MDC.clear();
            }
            try {
                task.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        };
    }

    private static Scope open(Map<String, String> values) {
        Map<String, String> previous = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            previous.put(key, MDC.get(key));
            MDC.put(key, value);
        });
        return () -> previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    /**
     * Restores the MDC entries that were replaced when the scope was opened.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
