package com.telcobright.coherence.realtime;

import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.PutOutcome;
import com.telcobright.coherence.cache.ViewKind;
import com.telcobright.coherence.conflict.AutoResolveStrategy;
import com.telcobright.coherence.conflict.ConflictRecord;
import com.telcobright.coherence.conflict.ConflictRegistry;
import com.telcobright.coherence.conflict.ConflictResolver;
import com.telcobright.coherence.entity.CacheEntry;
import com.telcobright.coherence.entity.EntryState;
import com.telcobright.coherence.remote.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Applies remote change events to the cache.
 *
 * INSERT and UPDATE go through the cache's transition rules: applied, discarded as
 * stale, or turned into a conflict when an optimistic write is pending. DELETE
 * removes the entry; a pending optimistic write on it is cancelled and the delete
 * is recorded as an auto-resolved conflict where the remote side wins.
 */
public class ChangeEventReconciler {
    private static final Logger logger = LoggerFactory.getLogger(ChangeEventReconciler.class);

    public static final String REMOTE_DELETE_RESOLUTION = "REMOTE_DELETE";

    private static final Set<ViewKind> MEMBERSHIP_KINDS =
        EnumSet.of(ViewKind.LIST, ViewKind.COUNT, ViewKind.COUNT_BY_STATUS, ViewKind.SEARCH);

    private final CacheHandle handle;
    private final ConflictRegistry conflicts;
    private final ConflictResolver resolver;
    private final AutoResolveStrategy autoResolveStrategy;
    private final List<ChangeEventListener> listeners = new CopyOnWriteArrayList<>();

    // Statistics
    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private final AtomicLong conflicted = new AtomicLong();
    private final AtomicLong removed = new AtomicLong();

    public ChangeEventReconciler(CacheHandle handle, ConflictRegistry conflicts) {
        this(handle, conflicts, null, null);
    }

    /**
     * @param resolver            used only when {@code autoResolveStrategy} is set
     * @param autoResolveStrategy settles conflicts as soon as they are detected; null
     *                            leaves them pending
     */
    public ChangeEventReconciler(CacheHandle handle, ConflictRegistry conflicts,
                                 ConflictResolver resolver, AutoResolveStrategy autoResolveStrategy) {
        this.handle = handle;
        this.conflicts = conflicts;
        this.resolver = resolver;
        this.autoResolveStrategy = autoResolveStrategy;
    }

    public void addListener(ChangeEventListener listener) {
        listeners.add(listener);
    }

    public ReconcileOutcome apply(ChangeEvent event) {
        ReconcileOutcome outcome;
        switch (event.getType()) {
            case INSERT:
            case UPDATE:
                outcome = applyUpsert(event);
                break;
            case DELETE:
                outcome = applyDelete(event);
                break;
            default:
                throw new IllegalArgumentException("Unsupported change type: " + event.getType());
        }
        logger.debug("Reconciled {} -> {}", event, outcome);
        notifyListeners(event, outcome);
        return outcome;
    }

    private ReconcileOutcome applyUpsert(ChangeEvent event) {
        EntityCache cache = handle.getCache();
        PutOutcome outcome = cache.put(event.getEntity(), EntryState.CONFIRMED, event.getPrevious());
        switch (outcome) {
            case APPLIED:
                applied.incrementAndGet();
                return ReconcileOutcome.APPLIED;
            case CONFLICT:
                conflicted.incrementAndGet();
                Optional<CacheEntry> local = cache.getEntry(event.getEntityId());
                ConflictRecord record = conflicts.record(
                    local.map(CacheEntry::getEntity).orElse(null), event.getEntity());
                if (autoResolveStrategy != null && resolver != null) {
                    resolver.autoResolve(record.getConflictId(), autoResolveStrategy);
                }
                return ReconcileOutcome.CONFLICT;
            default:
                discarded.incrementAndGet();
                logger.debug("Discarded stale {} for {} (version {})",
                    event.getType(), event.getEntityId(), event.getEntity().getVersion());
                return ReconcileOutcome.DISCARDED_STALE;
        }
    }

    private ReconcileOutcome applyDelete(ChangeEvent event) {
        EntityCache cache = handle.getCache();
        String id = event.getEntityId();
        Optional<CacheEntry> gone = cache.remove(id);
        removed.incrementAndGet();

        if (gone.isEmpty()) {
            String entityType = event.getEntity().getEntityType();
            cache.invalidateViewsMatching(key -> key.getEntityType().equals(entityType)
                && MEMBERSHIP_KINDS.contains(key.getKind()));
            return ReconcileOutcome.REMOVED;
        }
        if (gone.get().isOptimistic()) {
            logger.warn("Entity {} deleted remotely while a local change was pending; remote wins", id);
            conflicts.recordAutoResolved(gone.get().getEntity(), null, REMOTE_DELETE_RESOLUTION);
        } else {
            conflicts.pendingFor(id).ifPresent(pending ->
                conflicts.markResolved(pending.getConflictId(), REMOTE_DELETE_RESOLUTION));
        }
        return ReconcileOutcome.REMOVED;
    }

    private void notifyListeners(ChangeEvent event, ReconcileOutcome outcome) {
        for (ChangeEventListener listener : listeners) {
            try {
                listener.onEvent(event, outcome);
            } catch (Exception e) {
                logger.error("Change event listener failed for {}", event, e);
            }
        }
    }

    // Statistics
    public long getAppliedCount() { return applied.get(); }
    public long getDiscardedCount() { return discarded.get(); }
    public long getConflictCount() { return conflicted.get(); }
    public long getRemovedCount() { return removed.get(); }
}
