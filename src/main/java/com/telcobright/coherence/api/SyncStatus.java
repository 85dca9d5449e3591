package com.telcobright.coherence.api;

import com.telcobright.coherence.staleness.SyncStrategy;
import lombok.Getter;

import java.time.Instant;

/**
 * Snapshot of the background sync loop.
 */
@Getter
public class SyncStatus {

    private final boolean active;
    private final boolean syncing;
    private final SyncStrategy strategy;
    private final Instant lastSyncAt;
    private final Instant nextSyncAt;
    private final int failedAttempts;
    // Failed rounds since the last successful one; not reset when retries run out
    private final int consecutiveFailures;
    private final String lastError;

    public SyncStatus(boolean active, boolean syncing, SyncStrategy strategy, Instant lastSyncAt,
                      Instant nextSyncAt, int failedAttempts, int consecutiveFailures, String lastError) {
        this.active = active;
        this.syncing = syncing;
        this.strategy = strategy;
        this.lastSyncAt = lastSyncAt;
        this.nextSyncAt = nextSyncAt;
        this.failedAttempts = failedAttempts;
        this.consecutiveFailures = consecutiveFailures;
        this.lastError = lastError;
    }

    @Override
    public String toString() {
        return String.format("SyncStatus{active=%s, syncing=%s, strategy=%s, lastSync=%s, failedAttempts=%d, consecutiveFailures=%d}",
            active, syncing, strategy, lastSyncAt, failedAttempts, consecutiveFailures);
    }
}
