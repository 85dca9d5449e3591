package com.telcobright.coherence.remote;

import com.telcobright.coherence.entity.ChangeKind;
import com.telcobright.coherence.entity.Entity;

import java.time.Instant;
import java.util.Objects;

/**
 * One notification from the remote change feed. For DELETE the entity is the
 * record as it was when deleted.
 */
public final class ChangeEvent {

    private final ChangeKind type;
    private final Entity entity;
    private final Entity previous;
    private final Instant committedAt;

    public ChangeEvent(ChangeKind type, Entity entity, Entity previous, Instant committedAt) {
        this.type = Objects.requireNonNull(type, "type");
        this.entity = Objects.requireNonNull(entity, "entity");
        this.previous = previous;
        this.committedAt = committedAt;
    }

    public static ChangeEvent insert(Entity entity) {
        return new ChangeEvent(ChangeKind.INSERT, entity, null, null);
    }

    public static ChangeEvent update(Entity entity) {
        return new ChangeEvent(ChangeKind.UPDATE, entity, null, null);
    }

    public static ChangeEvent update(Entity entity, Entity previous) {
        return new ChangeEvent(ChangeKind.UPDATE, entity, previous, null);
    }

    public static ChangeEvent delete(Entity entity) {
        return new ChangeEvent(ChangeKind.DELETE, entity, null, null);
    }

    // Getters
    public ChangeKind getType() { return type; }
    public Entity getEntity() { return entity; }
    public Entity getPrevious() { return previous; }
    public Instant getCommittedAt() { return committedAt; }

    public String getEntityId() {
        return entity.getId();
    }

    @Override
    public String toString() {
        return String.format("ChangeEvent{type=%s, id=%s, version=%d}",
            type, entity.getId(), entity.getVersion());
    }
}
