package com.telcobright.coherence.remote;

/**
 * Error taxonomy shared by remote calls, mutations, undo and conflict resolution.
 */
public enum ErrorKind {
    NOT_FOUND(false),
    VALIDATION_ERROR(false),
    TIMEOUT(true),
    NETWORK_ERROR(true),
    CONFLICT(false),
    EXPIRED(false),
    ALREADY_RESOLVED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
