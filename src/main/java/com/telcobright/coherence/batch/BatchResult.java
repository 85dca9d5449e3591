package com.telcobright.coherence.batch;

import com.telcobright.coherence.remote.ErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch job. Item failures are collected here, never thrown.
 *
 * For creates, {@link #getSuccessful()} holds the id the server assigned and
 * {@link #getCreatedIds()} maps each client label to that id.
 */
public class BatchResult {

    private final List<String> successful;
    private final List<FailedItem> failed;
    private final Map<String, String> createdIds;
    private final int totalProcessed;
    private final boolean cancelled;

    public BatchResult(List<String> successful, List<FailedItem> failed, boolean cancelled) {
        this(successful, failed, Map.of(), cancelled);
    }

    public BatchResult(List<String> successful, List<FailedItem> failed,
                       Map<String, String> createdIds, boolean cancelled) {
        this.successful = Collections.unmodifiableList(successful);
        this.failed = Collections.unmodifiableList(failed);
        this.createdIds = Collections.unmodifiableMap(new LinkedHashMap<>(createdIds));
        this.totalProcessed = successful.size() + failed.size();
        this.cancelled = cancelled;
    }

    public static BatchResult empty() {
        return new BatchResult(List.of(), List.of(), false);
    }

    // Getters
    public List<String> getSuccessful() { return successful; }
    public List<FailedItem> getFailed() { return failed; }
    public Map<String, String> getCreatedIds() { return createdIds; }
    public int getTotalProcessed() { return totalProcessed; }
    public int getTotalSuccessful() { return successful.size(); }
    public int getTotalFailed() { return failed.size(); }
    public boolean isCancelled() { return cancelled; }

    public boolean isSuccess() {
        return failed.isEmpty() && !cancelled;
    }

    @Override
    public String toString() {
        return String.format("BatchResult{processed=%d, successful=%d, failed=%d, cancelled=%s}",
            totalProcessed, successful.size(), failed.size(), cancelled);
    }

    /**
     * An item that failed, with the kind and message of its last failure.
     */
    public static class FailedItem {
        private final String id;
        private final ErrorKind kind;
        private final String error;
        private final int attempts;

        public FailedItem(String id, ErrorKind kind, String error, int attempts) {
            this.id = id;
            this.kind = kind;
            this.error = error;
            this.attempts = attempts;
        }

        public String getId() { return id; }
        public ErrorKind getKind() { return kind; }
        public String getError() { return error; }
        public int getAttempts() { return attempts; }

        public boolean isRetryable() {
            return kind.isRetryable();
        }

        @Override
        public String toString() {
            return id + ": " + kind + " " + error;
        }
    }
}
