package com.telcobright.coherence.conflict;

import com.telcobright.coherence.entity.Entity;

import java.util.concurrent.CompletableFuture;

/**
 * Result of a resolve call.
 */
public class Resolution {

    public enum Status {
        RESOLVED,
        ALREADY_RESOLVED,
        NOT_FOUND
    }

    private final Status status;
    private final String conflictId;
    private final ResolutionStrategy strategy;
    private final Entity entity;
    private final CompletableFuture<Entity> push;

    private Resolution(Status status, String conflictId, ResolutionStrategy strategy,
                       Entity entity, CompletableFuture<Entity> push) {
        this.status = status;
        this.conflictId = conflictId;
        this.strategy = strategy;
        this.entity = entity;
        this.push = push;
    }

    public static Resolution resolved(String conflictId, ResolutionStrategy strategy,
                                      Entity entity, CompletableFuture<Entity> push) {
        return new Resolution(Status.RESOLVED, conflictId, strategy, entity, push);
    }

    public static Resolution alreadyResolved(String conflictId) {
        return new Resolution(Status.ALREADY_RESOLVED, conflictId, null, null,
            CompletableFuture.completedFuture(null));
    }

    public static Resolution notFound(String conflictId) {
        return new Resolution(Status.NOT_FOUND, conflictId, null, null,
            CompletableFuture.completedFuture(null));
    }

    // Getters
    public Status getStatus() { return status; }
    public String getConflictId() { return conflictId; }
    public ResolutionStrategy getStrategy() { return strategy; }

    /**
     * The winning entity, or null when the record ends up deleted.
     */
    public Entity getEntity() { return entity; }

    /**
     * Completes when the chosen version has been written back to the server (or
     * immediately when nothing needs pushing).
     */
    public CompletableFuture<Entity> getPush() { return push; }

    public boolean isResolved() {
        return status == Status.RESOLVED;
    }

    @Override
    public String toString() {
        return String.format("Resolution{conflict=%s, status=%s, strategy=%s}", conflictId, status, strategy);
    }
}
