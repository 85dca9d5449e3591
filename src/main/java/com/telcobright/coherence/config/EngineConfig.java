package com.telcobright.coherence.config;

import com.telcobright.coherence.conflict.AutoResolveStrategy;
import com.telcobright.coherence.staleness.SyncStrategy;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.time.Duration;

/**
 * Engine tunables. Values come from MicroProfile Config ({@code coherence.*} keys,
 * defaults in {@code META-INF/microprofile-config.properties}) or from the builder.
 */
public class EngineConfig {

    public static final String BATCH_SIZE = "coherence.batch.size";
    public static final String INTER_BATCH_DELAY_MS = "coherence.batch.inter-batch-delay-ms";
    public static final String BATCH_MAX_RETRIES = "coherence.batch.max-retries";
    public static final String BATCH_RETRY_DELAY_MS = "coherence.batch.retry-delay-ms";
    public static final String MUTATION_TIMEOUT_MS = "coherence.mutation.timeout-ms";
    public static final String UNDO_WINDOW_MS = "coherence.undo.window-ms";
    public static final String RECONNECT_BASE_DELAY_MS = "coherence.feed.reconnect-base-delay-ms";
    public static final String RECONNECT_MAX_DELAY_MS = "coherence.feed.reconnect-max-delay-ms";
    public static final String MAX_RECONNECT_ATTEMPTS = "coherence.feed.max-reconnect-attempts";
    public static final String AUTO_RECONNECT = "coherence.feed.auto-reconnect";
    public static final String VISIBILITY_REFRESH_INTERVAL_MS = "coherence.staleness.visibility-refresh-interval-ms";
    public static final String DETAIL_RETENTION_MS = "coherence.staleness.detail-retention-ms";
    public static final String SYNC_INTERVAL_MS = "coherence.sync.interval-ms";
    public static final String SYNC_STALE_TIME_MS = "coherence.sync.stale-time-ms";
    public static final String SYNC_MAX_RETRIES = "coherence.sync.max-retries";
    public static final String SYNC_RETRY_DELAY_MS = "coherence.sync.retry-delay-ms";
    public static final String SYNC_STRATEGY = "coherence.sync.strategy";
    public static final String SYNC_ONLY_WHEN_VISIBLE = "coherence.sync.only-when-visible";
    public static final String CONFLICT_HISTORY_SIZE = "coherence.conflict.history-size";
    public static final String CONFLICT_AUTO_RESOLVE = "coherence.conflict.auto-resolve";
    public static final String VERSION_FIELD = "coherence.entity.version-field";

    private final int batchSize;
    private final Duration interBatchDelay;
    private final int batchMaxRetries;
    private final Duration batchRetryDelay;
    private final Duration mutationTimeout;
    private final Duration undoWindow;
    private final Duration reconnectBaseDelay;
    private final Duration reconnectMaxDelay;
    private final int maxReconnectAttempts;
    private final boolean autoReconnect;
    private final Duration visibilityRefreshInterval;
    private final Duration detailRetention;
    private final Duration syncInterval;
    private final Duration staleTime;
    private final int syncMaxRetries;
    private final Duration syncRetryDelay;
    private final SyncStrategy syncStrategy;
    private final boolean syncOnlyWhenVisible;
    private final int conflictHistorySize;
    private final AutoResolveStrategy autoResolveStrategy;
    private final String versionField;

    private EngineConfig(Builder builder) {
        if (builder.batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1: " + builder.batchSize);
        }
        if (builder.maxReconnectAttempts < 0 || builder.syncMaxRetries < 0 || builder.batchMaxRetries < 0) {
            throw new IllegalArgumentException("Attempt limits must not be negative");
        }
        this.batchSize = builder.batchSize;
        this.interBatchDelay = builder.interBatchDelay;
        this.batchMaxRetries = builder.batchMaxRetries;
        this.batchRetryDelay = builder.batchRetryDelay;
        this.mutationTimeout = builder.mutationTimeout;
        this.undoWindow = builder.undoWindow;
        this.reconnectBaseDelay = builder.reconnectBaseDelay;
        this.reconnectMaxDelay = builder.reconnectMaxDelay;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.autoReconnect = builder.autoReconnect;
        this.visibilityRefreshInterval = builder.visibilityRefreshInterval;
        this.detailRetention = builder.detailRetention;
        this.syncInterval = builder.syncInterval;
        this.staleTime = builder.staleTime;
        this.syncMaxRetries = builder.syncMaxRetries;
        this.syncRetryDelay = builder.syncRetryDelay;
        this.syncStrategy = builder.syncStrategy;
        this.syncOnlyWhenVisible = builder.syncOnlyWhenVisible;
        this.conflictHistorySize = builder.conflictHistorySize;
        this.autoResolveStrategy = builder.autoResolveStrategy;
        this.versionField = builder.versionField;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Reads the engine configuration from the application's MicroProfile Config.
     */
    public static EngineConfig load() {
        return fromConfig(ConfigProvider.getConfig());
    }

    public static EngineConfig fromConfig(Config config) {
        Builder builder = builder();
        config.getOptionalValue(BATCH_SIZE, Integer.class).ifPresent(builder::batchSize);
        config.getOptionalValue(INTER_BATCH_DELAY_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::interBatchDelay);
        config.getOptionalValue(BATCH_MAX_RETRIES, Integer.class).ifPresent(builder::batchMaxRetries);
        config.getOptionalValue(BATCH_RETRY_DELAY_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::batchRetryDelay);
        config.getOptionalValue(MUTATION_TIMEOUT_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::mutationTimeout);
        config.getOptionalValue(UNDO_WINDOW_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::undoWindow);
        config.getOptionalValue(RECONNECT_BASE_DELAY_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::reconnectBaseDelay);
        config.getOptionalValue(RECONNECT_MAX_DELAY_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::reconnectMaxDelay);
        config.getOptionalValue(MAX_RECONNECT_ATTEMPTS, Integer.class).ifPresent(builder::maxReconnectAttempts);
        config.getOptionalValue(AUTO_RECONNECT, Boolean.class).ifPresent(builder::autoReconnect);
        config.getOptionalValue(VISIBILITY_REFRESH_INTERVAL_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::visibilityRefreshInterval);
        config.getOptionalValue(DETAIL_RETENTION_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::detailRetention);
        config.getOptionalValue(SYNC_INTERVAL_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::syncInterval);
        config.getOptionalValue(SYNC_STALE_TIME_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::staleTime);
        config.getOptionalValue(SYNC_MAX_RETRIES, Integer.class).ifPresent(builder::syncMaxRetries);
        config.getOptionalValue(SYNC_RETRY_DELAY_MS, Long.class).map(Duration::ofMillis).ifPresent(builder::syncRetryDelay);
        config.getOptionalValue(SYNC_STRATEGY, String.class)
            .map(value -> SyncStrategy.valueOf(value.trim().toUpperCase()))
            .ifPresent(builder::syncStrategy);
        config.getOptionalValue(SYNC_ONLY_WHEN_VISIBLE, Boolean.class).ifPresent(builder::syncOnlyWhenVisible);
        config.getOptionalValue(CONFLICT_HISTORY_SIZE, Integer.class).ifPresent(builder::conflictHistorySize);
        config.getOptionalValue(CONFLICT_AUTO_RESOLVE, String.class)
            .map(value -> AutoResolveStrategy.valueOf(value.trim().toUpperCase()))
            .ifPresent(builder::autoResolveStrategy);
        config.getOptionalValue(VERSION_FIELD, String.class).ifPresent(builder::versionField);
        return builder.build();
    }

    // Getters
    public int getBatchSize() { return batchSize; }
    public Duration getInterBatchDelay() { return interBatchDelay; }
    public int getBatchMaxRetries() { return batchMaxRetries; }
    public Duration getBatchRetryDelay() { return batchRetryDelay; }
    public Duration getMutationTimeout() { return mutationTimeout; }
    public Duration getUndoWindow() { return undoWindow; }
    public Duration getReconnectBaseDelay() { return reconnectBaseDelay; }
    public Duration getReconnectMaxDelay() { return reconnectMaxDelay; }
    public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
    public boolean isAutoReconnect() { return autoReconnect; }
    public Duration getVisibilityRefreshInterval() { return visibilityRefreshInterval; }
    public Duration getDetailRetention() { return detailRetention; }
    public Duration getSyncInterval() { return syncInterval; }
    public Duration getStaleTime() { return staleTime; }
    public int getSyncMaxRetries() { return syncMaxRetries; }
    public Duration getSyncRetryDelay() { return syncRetryDelay; }
    public SyncStrategy getSyncStrategy() { return syncStrategy; }
    public boolean isSyncOnlyWhenVisible() { return syncOnlyWhenVisible; }
    public int getConflictHistorySize() { return conflictHistorySize; }
    public AutoResolveStrategy getAutoResolveStrategy() { return autoResolveStrategy; }
    public String getVersionField() { return versionField; }

    @Override
    public String toString() {
        return String.format("EngineConfig{batchSize=%d, mutationTimeout=%s, undoWindow=%s, maxReconnectAttempts=%d, syncStrategy=%s}",
            batchSize, mutationTimeout, undoWindow, maxReconnectAttempts, syncStrategy);
    }

    // Builder
    public static class Builder {
        private int batchSize = 50;
        private Duration interBatchDelay = Duration.ZERO;
        private int batchMaxRetries = 3;
        private Duration batchRetryDelay = Duration.ofSeconds(1);
        private Duration mutationTimeout = Duration.ofSeconds(30);
        private Duration undoWindow = Duration.ofSeconds(30);
        private Duration reconnectBaseDelay = Duration.ofSeconds(1);
        private Duration reconnectMaxDelay = Duration.ofSeconds(30);
        private int maxReconnectAttempts = 5;
        private boolean autoReconnect = true;
        private Duration visibilityRefreshInterval = Duration.ofMinutes(5);
        private Duration detailRetention = Duration.ofMinutes(5);
        private Duration syncInterval = Duration.ofSeconds(30);
        private Duration staleTime = Duration.ofMinutes(1);
        private int syncMaxRetries = 3;
        private Duration syncRetryDelay = Duration.ofSeconds(5);
        private SyncStrategy syncStrategy = SyncStrategy.BALANCED;
        private boolean syncOnlyWhenVisible = true;
        private int conflictHistorySize = 100;
        private AutoResolveStrategy autoResolveStrategy;
        private String versionField = "version";

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder interBatchDelay(Duration interBatchDelay) {
            this.interBatchDelay = interBatchDelay;
            return this;
        }

        public Builder batchMaxRetries(int batchMaxRetries) {
            this.batchMaxRetries = batchMaxRetries;
            return this;
        }

        public Builder batchRetryDelay(Duration batchRetryDelay) {
            this.batchRetryDelay = batchRetryDelay;
            return this;
        }

        public Builder mutationTimeout(Duration mutationTimeout) {
            this.mutationTimeout = mutationTimeout;
            return this;
        }

        public Builder undoWindow(Duration undoWindow) {
            this.undoWindow = undoWindow;
            return this;
        }

        public Builder reconnectBaseDelay(Duration reconnectBaseDelay) {
            this.reconnectBaseDelay = reconnectBaseDelay;
            return this;
        }

        public Builder reconnectMaxDelay(Duration reconnectMaxDelay) {
            this.reconnectMaxDelay = reconnectMaxDelay;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder autoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public Builder visibilityRefreshInterval(Duration visibilityRefreshInterval) {
            this.visibilityRefreshInterval = visibilityRefreshInterval;
            return this;
        }

        public Builder detailRetention(Duration detailRetention) {
            this.detailRetention = detailRetention;
            return this;
        }

        public Builder syncInterval(Duration syncInterval) {
            this.syncInterval = syncInterval;
            return this;
        }

        public Builder staleTime(Duration staleTime) {
            this.staleTime = staleTime;
            return this;
        }

        public Builder syncMaxRetries(int syncMaxRetries) {
            this.syncMaxRetries = syncMaxRetries;
            return this;
        }

        public Builder syncRetryDelay(Duration syncRetryDelay) {
            this.syncRetryDelay = syncRetryDelay;
            return this;
        }

        public Builder syncStrategy(SyncStrategy syncStrategy) {
            this.syncStrategy = syncStrategy;
            return this;
        }

        public Builder syncOnlyWhenVisible(boolean syncOnlyWhenVisible) {
            this.syncOnlyWhenVisible = syncOnlyWhenVisible;
            return this;
        }

        public Builder conflictHistorySize(int conflictHistorySize) {
            this.conflictHistorySize = conflictHistorySize;
            return this;
        }

        public Builder autoResolveStrategy(AutoResolveStrategy autoResolveStrategy) {
            this.autoResolveStrategy = autoResolveStrategy;
            return this;
        }

        public Builder versionField(String versionField) {
            this.versionField = versionField;
            return this;
        }

        public EngineConfig build() {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
            }
            if (maxReconnectAttempts < 0 || syncMaxRetries < 0 || batchMaxRetries < 0) {
                throw new IllegalArgumentException("Retry limits must not be negative");
            }
            if (mutationTimeout.isNegative() || mutationTimeout.isZero()) {
                throw new IllegalArgumentException("Mutation timeout must be positive: " + mutationTimeout);
            }
            return new EngineConfig(this);
        }
    }
}
