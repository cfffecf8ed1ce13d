package com.secretsync.backend.service;

import com.secretsync.backend.model.ClientHealth;
import com.secretsync.backend.model.HealthSnapshot;
import com.secretsync.backend.model.SyncResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide readiness of the two clients and the last sync result. Written by the client
 * bootstrap and the sync engine, read by the health endpoint. Holds only the latest values.
 */
@Service
public class SyncHealthTracker {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private ClientHealth source = ClientHealth.NOT_INITIALIZED;
    private ClientHealth sink = ClientHealth.NOT_INITIALIZED;
    private SyncResult lastSync;

    public void recordSourceHealth(ClientHealth health) {
        lock.writeLock().lock();
        try {
            source = health;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordSinkHealth(ClientHealth health) {
        lock.writeLock().lock();
        try {
            sink = health;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordSync(SyncResult result) {
        lock.writeLock().lock();
        try {
            lastSync = result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public HealthSnapshot report() {
        lock.readLock().lock();
        try {
            return new HealthSnapshot(source, sink, lastSync);
        } finally {
            lock.readLock().unlock();
        }
    }
}
