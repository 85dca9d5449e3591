package com.telcobright.coherence.remote;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Helpers for classifying failures that come back from asynchronous remote calls.
 */
public final class RemoteFailures {

    private RemoteFailures() {
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static ErrorKind kindOf(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof CoherenceException) {
            return ((CoherenceException) cause).getKind();
        }
        if (cause instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (cause instanceof IllegalArgumentException) {
            return ErrorKind.VALIDATION_ERROR;
        }
        if (cause instanceof CancellationException) {
            return ErrorKind.CONFLICT;
        }
        return ErrorKind.NETWORK_ERROR;
    }

    public static String messageOf(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof TimeoutException && cause.getMessage() == null) {
            return "Operation timed out";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
