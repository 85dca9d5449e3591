package com.telcobright.coherence.entity;

import lombok.Getter;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable cache slot for one id. Transitions produce new instances so a snapshot
 * taken before a speculative write can be restored verbatim.
 */
@Getter
public final class CacheEntry {

    public static final long NO_BASE_VERSION = Long.MIN_VALUE;
    public static final long NO_TOKEN = 0L;

    private final Entity entity;
    private final EntryState state;
    private final Instant fetchedAt;
    private final long baseVersion;
    private final long inFlightToken;
    private final boolean tombstone;

    private CacheEntry(Entity entity, EntryState state, Instant fetchedAt,
                       long baseVersion, long inFlightToken, boolean tombstone) {
        this.entity = Objects.requireNonNull(entity, "entity");
        this.state = state;
        this.fetchedAt = fetchedAt;
        this.baseVersion = baseVersion;
        this.inFlightToken = inFlightToken;
        this.tombstone = tombstone;
    }

    public static CacheEntry confirmed(Entity entity, Instant fetchedAt) {
        return new CacheEntry(entity, EntryState.CONFIRMED, fetchedAt, NO_BASE_VERSION, NO_TOKEN, false);
    }

    public static CacheEntry stale(Entity entity, Instant fetchedAt) {
        return new CacheEntry(entity, EntryState.STALE, fetchedAt, NO_BASE_VERSION, NO_TOKEN, false);
    }

    public static CacheEntry optimistic(Entity speculative, long baseVersion, long token, Instant at) {
        return new CacheEntry(speculative, EntryState.OPTIMISTIC, at, baseVersion, token, false);
    }

    /**
     * Speculative delete: the entity stays attached so it can be restored, but reads
     * treat the id as absent.
     */
    public static CacheEntry tombstone(Entity deleted, long baseVersion, long token, Instant at) {
        return new CacheEntry(deleted, EntryState.OPTIMISTIC, at, baseVersion, token, true);
    }

    public CacheEntry markStale() {
        return new CacheEntry(entity, EntryState.STALE, fetchedAt, baseVersion, inFlightToken, tombstone);
    }

    public String getId() {
        return entity.getId();
    }

    public boolean isVisible() {
        return !tombstone && state != EntryState.EVICTED;
    }

    public boolean isOptimistic() {
        return state == EntryState.OPTIMISTIC;
    }

    public boolean hasToken(long token) {
        return inFlightToken != NO_TOKEN && inFlightToken == token;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheEntry)) return false;
        CacheEntry that = (CacheEntry) o;
        return baseVersion == that.baseVersion
            && inFlightToken == that.inFlightToken
            && tombstone == that.tombstone
            && entity.equals(that.entity)
            && state == that.state
            && Objects.equals(fetchedAt, that.fetchedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, state, fetchedAt, baseVersion, inFlightToken, tombstone);
    }

    @Override
    public String toString() {
        return String.format("CacheEntry{id=%s, state=%s, version=%d, token=%d, tombstone=%s}",
            entity.getId(), state, entity.getVersion(), inFlightToken, tombstone);
    }
}
