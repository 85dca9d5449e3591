package com.telcobright.coherence.optimistic;

import com.telcobright.coherence.entity.Entity;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Snapshot of a destroyed entity and the action that brings it back.
 */
@Getter
public class UndoRecord {

    private final String undoId;
    private final Entity snapshot;
    private final Instant createdAt;
    private final Instant expiresAt;

    @Getter(lombok.AccessLevel.NONE)
    private final Supplier<CompletableFuture<Entity>> reverseAction;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean executed = new AtomicBoolean(false);

    public UndoRecord(String undoId, Entity snapshot, Instant createdAt, Instant expiresAt,
                      Supplier<CompletableFuture<Entity>> reverseAction) {
        this.undoId = undoId;
        this.snapshot = snapshot;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
        this.reverseAction = reverseAction;
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isExecuted() {
        return executed.get();
    }

    /**
     * Claims the record for execution. Only the first caller gets true.
     */
    boolean claim() {
        return executed.compareAndSet(false, true);
    }

    CompletableFuture<Entity> runReverseAction() {
        return reverseAction.get();
    }

    @Override
    public String toString() {
        return String.format("UndoRecord{id=%s, entity=%s, expiresAt=%s}", undoId, snapshot.getId(), expiresAt);
    }
}
