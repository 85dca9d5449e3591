package com.telcobright.coherence.optimistic;

import com.telcobright.coherence.remote.CoherenceException;
import com.telcobright.coherence.remote.ErrorKind;

/**
 * Failure of a single optimistic mutation or undo, raised after the cache has been
 * restored.
 */
public class MutationException extends CoherenceException {

    private final String entityId;

    public MutationException(String entityId, ErrorKind kind, String message) {
        super(kind, message);
        this.entityId = entityId;
    }

    public MutationException(String entityId, ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
