package com.telcobright.coherence.realtime;

import com.telcobright.coherence.config.EngineConfig;

import java.time.Duration;

/**
 * Exponential reconnect backoff: {@code min(base * 2^attempt, max)} for at most
 * {@code maxAttempts} attempts.
 */
public class ReconnectPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final boolean autoReconnect;

    public ReconnectPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts, boolean autoReconnect) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
        this.autoReconnect = autoReconnect;
    }

    public static ReconnectPolicy from(EngineConfig config) {
        return new ReconnectPolicy(config.getReconnectBaseDelay(), config.getReconnectMaxDelay(),
            config.getMaxReconnectAttempts(), config.isAutoReconnect());
    }

    /**
     * Delay before reconnect attempt number {@code attempt} (zero based).
     */
    public Duration delayFor(int attempt) {
        long factor = 1L << Math.min(Math.max(attempt, 0), 30);
        long millis = baseDelay.toMillis() * factor;
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }

    // Getters
    public Duration getBaseDelay() { return baseDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public int getMaxAttempts() { return maxAttempts; }
    public boolean isAutoReconnect() { return autoReconnect; }
}
