package com.telcobright.coherence.cache;

import com.telcobright.coherence.entity.CacheEntry;
import com.telcobright.coherence.entity.Entity;

/**
 * Receipt for a speculative write: the token that must match on commit and the
 * entry that existed before, restored verbatim on rollback.
 */
public final class OptimisticWrite {

    private final String id;
    private final long token;
    private final CacheEntry snapshot;
    private final Entity speculative;

    OptimisticWrite(String id, long token, CacheEntry snapshot, Entity speculative) {
        this.id = id;
        this.token = token;
        this.snapshot = snapshot;
        this.speculative = speculative;
    }

    public String getId() { return id; }
    public long getToken() { return token; }
    public CacheEntry getSnapshot() { return snapshot; }

    /**
     * The speculative entity, or null for a speculative delete.
     */
    public Entity getSpeculative() { return speculative; }

    public boolean isDelete() {
        return speculative == null;
    }

    /**
     * The visible entity before the write, or null.
     */
    public Entity getPrevious() {
        return snapshot != null && snapshot.isVisible() ? snapshot.getEntity() : null;
    }
}
