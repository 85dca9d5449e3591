package com.telcobright.coherence.api;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Health of the engine: the cache handle, the change feeds and background sync.
 */
public class HealthStatus implements Serializable {

    public enum Status {
        HEALTHY,
        DEGRADED,
        UNHEALTHY,
        UNKNOWN
    }

    private final Status status;
    private final boolean cacheHealthy;
    private final boolean feedsHealthy;
    private final boolean syncHealthy;
    private final List<HealthCheck> checks;
    private final Instant timestamp;

    private HealthStatus(Builder builder) {
        this.status = builder.status;
        this.cacheHealthy = builder.cacheHealthy;
        this.feedsHealthy = builder.feedsHealthy;
        this.syncHealthy = builder.syncHealthy;
        this.checks = builder.checks;
        this.timestamp = builder.timestamp;
    }

    public static HealthStatus unhealthy(String reason) {
        return builder()
            .status(Status.UNHEALTHY)
            .cacheHealthy(false)
            .addCheck(new HealthCheck("engine", false, reason))
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // Getters
    public Status getStatus() { return status; }
    public boolean isCacheHealthy() { return cacheHealthy; }
    public boolean isFeedsHealthy() { return feedsHealthy; }
    public boolean isSyncHealthy() { return syncHealthy; }
    public List<HealthCheck> getChecks() { return checks; }
    public Instant getTimestamp() { return timestamp; }

    public boolean isHealthy() {
        return status == Status.HEALTHY;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    // Builder
    public static class Builder {
        private Status status = Status.UNKNOWN;
        private boolean cacheHealthy = true;
        private boolean feedsHealthy = true;
        private boolean syncHealthy = true;
        private List<HealthCheck> checks = new ArrayList<>();
        private Instant timestamp = Instant.now();

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder cacheHealthy(boolean cacheHealthy) {
            this.cacheHealthy = cacheHealthy;
            return this;
        }

        public Builder feedsHealthy(boolean feedsHealthy) {
            this.feedsHealthy = feedsHealthy;
            return this;
        }

        public Builder syncHealthy(boolean syncHealthy) {
            this.syncHealthy = syncHealthy;
            return this;
        }

        public Builder addCheck(HealthCheck check) {
            this.checks.add(check);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public HealthStatus build() {
            // A closed cache is unhealthy; a lost feed or failing sync only degrades
            if (!cacheHealthy) {
                status = Status.UNHEALTHY;
            } else if (!feedsHealthy || !syncHealthy) {
                if (status == Status.UNKNOWN || status == Status.HEALTHY) {
                    status = Status.DEGRADED;
                }
            } else if (status == Status.UNKNOWN) {
                status = Status.HEALTHY;
            }
            return new HealthStatus(this);
        }
    }

    /**
     * Individual health check result.
     */
    public static class HealthCheck implements Serializable {
        private final String name;
        private final boolean passed;
        private final String message;

        public HealthCheck(String name, boolean passed, String message) {
            this.name = name;
            this.passed = passed;
            this.message = message;
        }

        public String getName() { return name; }
        public boolean isPassed() { return passed; }
        public String getMessage() { return message; }
    }

    @Override
    public String toString() {
        return String.format("HealthStatus{status=%s, cache=%s, feeds=%s, sync=%s}",
            status, cacheHealthy, feedsHealthy, syncHealthy);
    }
}
