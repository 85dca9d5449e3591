package com.telcobright.coherence.remote;

/**
 * Root of the engine's unchecked exceptions. Every failure carries an {@link ErrorKind}.
 */
public class CoherenceException extends RuntimeException {

    private final ErrorKind kind;

    public CoherenceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CoherenceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
