package com.telcobright.coherence.conflict;

import com.telcobright.coherence.api.SyncStatusPublisher;
import com.telcobright.coherence.entity.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pending conflicts plus a bounded history of resolved ones. At most one conflict
 * is pending per entity id; a newer one supersedes the older.
 */
public class ConflictRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConflictRegistry.class);

    public static final String SUPERSEDED = "SUPERSEDED";

    // conflictId -> record
    private final Map<String, ConflictRecord> pending = new ConcurrentHashMap<>();
    // entityId -> conflictId
    private final Map<String, String> pendingByEntity = new ConcurrentHashMap<>();
    private final Deque<ConflictRecord> history = new ArrayDeque<>();
    // ids of every closed conflict; outlives the bounded history
    private final Set<String> resolvedIds = ConcurrentHashMap.newKeySet();

    private final SyncStatusPublisher publisher;
    private final int historySize;
    private final Clock clock;

    public ConflictRegistry(SyncStatusPublisher publisher, int historySize, Clock clock) {
        this.publisher = publisher;
        this.historySize = historySize;
        this.clock = clock;
    }

    /**
     * Opens a conflict between a local and a remote version (null remote for a delete).
     */
    public ConflictRecord record(Entity local, Entity remote) {
        ConflictRecord record = new ConflictRecord(UUID.randomUUID().toString(), local, remote, clock.instant());
        supersedePending(record.getEntityId());
        pending.put(record.getConflictId(), record);
        pendingByEntity.put(record.getEntityId(), record.getConflictId());
        logger.warn("Conflict detected: {}", record);
        publishCount();
        return record;
    }

    /**
     * Records a conflict that was settled on the spot, for observability only.
     */
    public ConflictRecord recordAutoResolved(Entity local, Entity remote, String resolution) {
        ConflictRecord record = new ConflictRecord(UUID.randomUUID().toString(), local, remote, clock.instant());
        supersedePending(record.getEntityId());
        record.markResolved(resolution, clock.instant());
        resolvedIds.add(record.getConflictId());
        addToHistory(record);
        logger.info("Conflict auto-resolved ({}): {}", resolution, record);
        publishCount();
        return record;
    }

    /**
     * Closes a pending conflict.
     *
     * @return false when it is not pending or was already resolved
     */
    public boolean markResolved(String conflictId, String resolution) {
        ConflictRecord record = pending.get(conflictId);
        if (record == null || !record.markResolved(resolution, clock.instant())) {
            return false;
        }
        pending.remove(conflictId);
        pendingByEntity.remove(record.getEntityId(), conflictId);
        resolvedIds.add(conflictId);
        addToHistory(record);
        publishCount();
        return true;
    }

    /**
     * A pending or historical conflict.
     */
    public Optional<ConflictRecord> find(String conflictId) {
        ConflictRecord record = pending.get(conflictId);
        if (record != null) {
            return Optional.of(record);
        }
        synchronized (history) {
            return history.stream().filter(r -> r.getConflictId().equals(conflictId)).findFirst();
        }
    }

    /**
     * Whether the conflict was closed, even if its record has left the history.
     */
    public boolean wasResolved(String conflictId) {
        return resolvedIds.contains(conflictId);
    }

    public Optional<ConflictRecord> pendingFor(String entityId) {
        String conflictId = pendingByEntity.get(entityId);
        return conflictId == null ? Optional.empty() : Optional.ofNullable(pending.get(conflictId));
    }

    public boolean hasPending(String entityId) {
        return pendingByEntity.containsKey(entityId);
    }

    public List<ConflictRecord> pending() {
        List<ConflictRecord> result = new ArrayList<>(pending.values());
        result.sort((a, b) -> a.getDetectedAt().compareTo(b.getDetectedAt()));
        return result;
    }

    public int pendingCount() {
        return pending.size();
    }

    public List<ConflictRecord> history() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public void clear() {
        pending.clear();
        pendingByEntity.clear();
        resolvedIds.clear();
        synchronized (history) {
            history.clear();
        }
        publishCount();
    }

    private void supersedePending(String entityId) {
        String previousId = pendingByEntity.get(entityId);
        if (previousId != null && markResolved(previousId, SUPERSEDED)) {
            logger.debug("Conflict {} on {} superseded", previousId, entityId);
        }
    }

    private void addToHistory(ConflictRecord record) {
        synchronized (history) {
            history.addLast(record);
            while (history.size() > historySize) {
                history.removeFirst();
            }
        }
    }

    private void publishCount() {
        if (publisher != null) {
            publisher.publishPendingConflicts(pending.size());
        }
    }
}
