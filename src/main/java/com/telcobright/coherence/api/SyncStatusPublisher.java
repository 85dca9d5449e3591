package com.telcobright.coherence.api;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.operators.multi.processors.BroadcastProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Broadcast channels for connection status, pending conflict count and background
 * sync status. Subscribers see values published after they subscribe; the latest
 * values are also kept for polling.
 */
public class SyncStatusPublisher {
    private static final Logger logger = LoggerFactory.getLogger(SyncStatusPublisher.class);

    private final BroadcastProcessor<ConnectionStatus> connectionProcessor = BroadcastProcessor.create();
    private final BroadcastProcessor<Integer> pendingConflictProcessor = BroadcastProcessor.create();
    private final BroadcastProcessor<SyncStatus> syncProcessor = BroadcastProcessor.create();

    private final Map<String, ConnectionStatus> latestConnections = new ConcurrentHashMap<>();
    private volatile int pendingConflicts;
    private volatile SyncStatus latestSync;
    private volatile boolean completed;

    public Multi<ConnectionStatus> connectionStatus() {
        return connectionProcessor;
    }

    public Multi<Integer> pendingConflictCount() {
        return pendingConflictProcessor;
    }

    public Multi<SyncStatus> syncStatus() {
        return syncProcessor;
    }

    public synchronized void publishConnection(ConnectionStatus status) {
        latestConnections.put(status.getTable(), status);
        if (!completed) {
            connectionProcessor.onNext(status);
        }
        logger.debug("Connection status: {}", status);
    }

    public synchronized void publishPendingConflicts(int count) {
        pendingConflicts = count;
        if (!completed) {
            pendingConflictProcessor.onNext(count);
        }
    }

    public synchronized void publishSync(SyncStatus status) {
        latestSync = status;
        if (!completed) {
            syncProcessor.onNext(status);
        }
    }

    /**
     * Completes every channel. Later publications only update the polled values.
     */
    public synchronized void complete() {
        if (completed) {
            return;
        }
        completed = true;
        connectionProcessor.onComplete();
        pendingConflictProcessor.onComplete();
        syncProcessor.onComplete();
    }

    public Map<String, ConnectionStatus> getLatestConnections() {
        return Map.copyOf(latestConnections);
    }

    public int getPendingConflicts() {
        return pendingConflicts;
    }

    public SyncStatus getLatestSync() {
        return latestSync;
    }
}
