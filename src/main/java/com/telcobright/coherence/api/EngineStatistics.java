package com.telcobright.coherence.api;

import java.io.Serializable;
import java.time.Instant;

/**
 * Point-in-time counters across the engine's components.
 */
public class EngineStatistics implements Serializable {

    private final long cacheHits;
    private final long cacheMisses;
    private final long totalEntries;
    private final long cachedViews;
    private final long viewInvalidations;
    private final long viewFetches;
    private final long staleDiscards;
    private final long mutationsCommitted;
    private final long mutationsRolledBack;
    private final long batchItemsSucceeded;
    private final long batchItemsFailed;
    private final long eventsApplied;
    private final long conflictsDetected;
    private final long pendingConflicts;
    private final Instant startTime;
    private final Instant currentTime;

    private EngineStatistics(Builder builder) {
        this.cacheHits = builder.cacheHits;
        this.cacheMisses = builder.cacheMisses;
        this.totalEntries = builder.totalEntries;
        this.cachedViews = builder.cachedViews;
        this.viewInvalidations = builder.viewInvalidations;
        this.viewFetches = builder.viewFetches;
        this.staleDiscards = builder.staleDiscards;
        this.mutationsCommitted = builder.mutationsCommitted;
        this.mutationsRolledBack = builder.mutationsRolledBack;
        this.batchItemsSucceeded = builder.batchItemsSucceeded;
        this.batchItemsFailed = builder.batchItemsFailed;
        this.eventsApplied = builder.eventsApplied;
        this.conflictsDetected = builder.conflictsDetected;
        this.pendingConflicts = builder.pendingConflicts;
        this.startTime = builder.startTime;
        this.currentTime = builder.currentTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public long getCacheHits() { return cacheHits; }
    public long getCacheMisses() { return cacheMisses; }
    public long getTotalEntries() { return totalEntries; }
    public long getCachedViews() { return cachedViews; }
    public long getViewInvalidations() { return viewInvalidations; }
    public long getViewFetches() { return viewFetches; }
    public long getStaleDiscards() { return staleDiscards; }
    public long getMutationsCommitted() { return mutationsCommitted; }
    public long getMutationsRolledBack() { return mutationsRolledBack; }
    public long getBatchItemsSucceeded() { return batchItemsSucceeded; }
    public long getBatchItemsFailed() { return batchItemsFailed; }
    public long getEventsApplied() { return eventsApplied; }
    public long getConflictsDetected() { return conflictsDetected; }
    public long getPendingConflicts() { return pendingConflicts; }
    public Instant getStartTime() { return startTime; }
    public Instant getCurrentTime() { return currentTime; }

    public double getCacheHitRate() {
        long total = cacheHits + cacheMisses;
        return total == 0 ? 0 : (double) cacheHits / total;
    }

    public double getMutationSuccessRate() {
        long total = mutationsCommitted + mutationsRolledBack;
        return total == 0 ? 0 : (double) mutationsCommitted / total;
    }

    @Override
    public String toString() {
        return String.format("EngineStatistics{entries=%d, views=%d, hitRate=%.2f, committed=%d, rolledBack=%d, conflicts=%d}",
            totalEntries, cachedViews, getCacheHitRate(), mutationsCommitted, mutationsRolledBack, conflictsDetected);
    }

    // Builder
    public static class Builder {
        private long cacheHits;
        private long cacheMisses;
        private long totalEntries;
        private long cachedViews;
        private long viewInvalidations;
        private long viewFetches;
        private long staleDiscards;
        private long mutationsCommitted;
        private long mutationsRolledBack;
        private long batchItemsSucceeded;
        private long batchItemsFailed;
        private long eventsApplied;
        private long conflictsDetected;
        private long pendingConflicts;
        private Instant startTime;
        private Instant currentTime = Instant.now();

        public Builder cacheHits(long cacheHits) {
            this.cacheHits = cacheHits;
            return this;
        }

        public Builder cacheMisses(long cacheMisses) {
            this.cacheMisses = cacheMisses;
            return this;
        }

        public Builder totalEntries(long totalEntries) {
            this.totalEntries = totalEntries;
            return this;
        }

        public Builder cachedViews(long cachedViews) {
            this.cachedViews = cachedViews;
            return this;
        }

        public Builder viewInvalidations(long viewInvalidations) {
            this.viewInvalidations = viewInvalidations;
            return this;
        }

        public Builder viewFetches(long viewFetches) {
            this.viewFetches = viewFetches;
            return this;
        }

        public Builder staleDiscards(long staleDiscards) {
            this.staleDiscards = staleDiscards;
            return this;
        }

        public Builder mutationsCommitted(long mutationsCommitted) {
            this.mutationsCommitted = mutationsCommitted;
            return this;
        }

        public Builder mutationsRolledBack(long mutationsRolledBack) {
            this.mutationsRolledBack = mutationsRolledBack;
            return this;
        }

        public Builder batchItemsSucceeded(long batchItemsSucceeded) {
            this.batchItemsSucceeded = batchItemsSucceeded;
            return this;
        }

        public Builder batchItemsFailed(long batchItemsFailed) {
            this.batchItemsFailed = batchItemsFailed;
            return this;
        }

        public Builder eventsApplied(long eventsApplied) {
            this.eventsApplied = eventsApplied;
            return this;
        }

        public Builder conflictsDetected(long conflictsDetected) {
            this.conflictsDetected = conflictsDetected;
            return this;
        }

        public Builder pendingConflicts(long pendingConflicts) {
            this.pendingConflicts = pendingConflicts;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder currentTime(Instant currentTime) {
            this.currentTime = currentTime;
            return this;
        }

        public EngineStatistics build() {
            return new EngineStatistics(this);
        }
    }
}
