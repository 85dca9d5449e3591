package com.telcobright.coherence.batch;

import lombok.Getter;

import java.time.Duration;
import java.util.Optional;

/**
 * Progress snapshot emitted after each chunk.
 */
@Getter
public class BatchProgress {

    private final int current;
    private final int total;
    private final double percentage;
    private final int currentBatch;
    private final int totalBatches;
    private final double processingRate;

    @Getter(lombok.AccessLevel.NONE)
    private final Duration estimatedTimeRemaining;

    public BatchProgress(int current, int total, int currentBatch, int totalBatches, Duration elapsed) {
        this.current = current;
        this.total = total;
        this.percentage = total == 0 ? 100.0 : current * 100.0 / total;
        this.currentBatch = currentBatch;
        this.totalBatches = totalBatches;

        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        if (current == 0) {
            this.processingRate = 0;
            this.estimatedTimeRemaining = null;
        } else if (seconds <= 0) {
            this.processingRate = 0;
            this.estimatedTimeRemaining = Duration.ZERO;
        } else {
            this.processingRate = current / seconds;
            double remainingSeconds = (total - current) / processingRate;
            this.estimatedTimeRemaining = Duration.ofMillis(Math.round(remainingSeconds * 1000));
        }
    }

    /**
     * Remaining time at the observed throughput; absent before anything was processed.
     */
    public Optional<Duration> getEstimatedTimeRemaining() {
        return Optional.ofNullable(estimatedTimeRemaining);
    }

    @Override
    public String toString() {
        return String.format("BatchProgress{%d/%d (%.1f%%), batch %d/%d, %.1f items/s}",
            current, total, percentage, currentBatch, totalBatches, processingRate);
    }
}
