package com.telcobright.coherence.cache;

import com.telcobright.coherence.entity.Entity;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Captured result of a collection query: member ids in server order plus
 * bookkeeping used for invalidation and staleness decisions.
 */
public final class CollectionView {

    private final ViewKey key;
    private final List<String> ids;
    private final long versionToken;
    private final Instant capturedAt;
    private final int updateCount;
    private final boolean valid;

    private CollectionView(ViewKey key, List<String> ids, long versionToken,
                           Instant capturedAt, int updateCount, boolean valid) {
        this.key = key;
        this.ids = Collections.unmodifiableList(ids);
        this.versionToken = versionToken;
        this.capturedAt = capturedAt;
        this.updateCount = updateCount;
        this.valid = valid;
    }

    /**
     * A fresh capture from the server; counts as one more real data delivery.
     */
    public static CollectionView captured(ViewKey key, List<Entity> members, Instant at, int previousUpdateCount) {
        List<String> ids = members.stream().map(Entity::getId).collect(Collectors.toList());
        long token = members.stream().mapToLong(Entity::getVersion).max().orElse(0L);
        return new CollectionView(key, ids, token, at, previousUpdateCount + 1, true);
    }

    /**
     * Placeholder for a view that was requested but never delivered data.
     */
    public static CollectionView empty(ViewKey key, Instant at) {
        return new CollectionView(key, List.of(), 0L, at, 0, false);
    }

    public CollectionView invalidate() {
        return valid ? new CollectionView(key, ids, versionToken, capturedAt, updateCount, false) : this;
    }

    public Duration age(Instant now) {
        return Duration.between(capturedAt, now);
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return age(now).compareTo(maxAge) > 0;
    }

    public int getCount() {
        return ids.size();
    }

    // Getters
    public ViewKey getKey() { return key; }
    public List<String> getIds() { return ids; }
    public long getVersionToken() { return versionToken; }
    public Instant getCapturedAt() { return capturedAt; }
    public int getUpdateCount() { return updateCount; }
    public boolean isValid() { return valid; }

    @Override
    public String toString() {
        return String.format("CollectionView{key=%s, size=%d, updates=%d, valid=%s}",
            key, ids.size(), updateCount, valid);
    }
}
