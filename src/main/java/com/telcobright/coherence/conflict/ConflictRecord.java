package com.telcobright.coherence.conflict;

import com.telcobright.coherence.entity.Entity;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A local speculative version and the server version of the same record that
 * disagree. Resolved exactly once.
 */
@Getter
public class ConflictRecord {

    private final String conflictId;
    private final String entityId;
    private final String entityType;
    private final Entity local;
    private final Entity remote;
    private final Instant detectedAt;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean resolved = new AtomicBoolean(false);

    private volatile String resolution;
    private volatile Instant resolvedAt;

    public ConflictRecord(String conflictId, Entity local, Entity remote, Instant detectedAt) {
        this.conflictId = conflictId;
        this.local = local;
        this.remote = remote;
        this.entityId = local != null ? local.getId() : remote.getId();
        this.entityType = local != null ? local.getEntityType() : remote.getEntityType();
        this.detectedAt = detectedAt;
    }

    /**
     * True when the server side deleted the record.
     */
    public boolean isRemoteDeleted() {
        return remote == null;
    }

    public boolean isResolved() {
        return resolved.get();
    }

    /**
     * Marks the record resolved. Only the first call succeeds.
     */
    boolean markResolved(String resolution, Instant at) {
        if (!resolved.compareAndSet(false, true)) {
            return false;
        }
        this.resolution = resolution;
        this.resolvedAt = at;
        return true;
    }

    @Override
    public String toString() {
        return String.format("ConflictRecord{id=%s, entity=%s, local=v%s, remote=%s, resolution=%s}",
            conflictId, entityId,
            local != null ? local.getVersion() : "-",
            remote != null ? "v" + remote.getVersion() : "deleted",
            resolution);
    }
}
