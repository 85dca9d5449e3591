package com.telcobright.coherence.staleness;

/**
 * Background sync cadence. The multiplier scales the configured sync interval.
 */
public enum SyncStrategy {
    AGGRESSIVE(0.5),
    BALANCED(1.0),
    CONSERVATIVE(2.0),
    OFF(0.0);

    private final double intervalMultiplier;

    SyncStrategy(double intervalMultiplier) {
        this.intervalMultiplier = intervalMultiplier;
    }

    public double getIntervalMultiplier() {
        return intervalMultiplier;
    }
}
