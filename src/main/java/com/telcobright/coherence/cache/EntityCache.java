package com.telcobright.coherence.cache;

import com.telcobright.coherence.entity.CacheEntry;
import com.telcobright.coherence.entity.ChangeKind;
import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.entity.EntityVersions;
import com.telcobright.coherence.entity.EntryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory entity store plus cached collection views.
 *
 * Structure:
 *   entries: id -> CacheEntry (at most one per id)
 *   views:   ViewKey -> CollectionView
 *
 * Every mutation runs under the write lock; reads share the read lock. Writes are
 * decided by entry transition rules, not by arrival order:
 *   - a CONFIRMED entity replaces an OPTIMISTIC entry only as the confirmation of
 *     that write (matching in-flight token)
 *   - otherwise, against an OPTIMISTIC entry, anything older than the optimistic
 *     base is stale and anything else is a conflict; neither is written
 *   - against a CONFIRMED or STALE entry, an older version is discarded
 * Each applied change invalidates the views the {@link ViewRegistry} says it can affect.
 */
public class EntityCache {
    private static final Logger logger = LoggerFactory.getLogger(EntityCache.class);

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<ViewKey, CollectionView> views = new ConcurrentHashMap<>();
    private final Map<ViewKey, Long> viewGenerations = new ConcurrentHashMap<>();
    private final Map<ViewKey, Integer> pendingFetches = new ConcurrentHashMap<>();

    // Tokens of optimistic writes whose entity was deleted remotely while in flight
    private final Set<Long> cancelledTokens = ConcurrentHashMap.newKeySet();

    private final List<Predicate<String>> pinSources = new CopyOnWriteArrayList<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ViewRegistry viewRegistry;
    private final Clock clock;
    private final AtomicLong tokenSequence = new AtomicLong();

    // Statistics
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong writesApplied = new AtomicLong();
    private final AtomicLong staleDiscards = new AtomicLong();
    private final AtomicLong conflictsDetected = new AtomicLong();
    private final AtomicLong viewInvalidations = new AtomicLong();

    public EntityCache(ViewRegistry viewRegistry, Clock clock) {
        this.viewRegistry = Objects.requireNonNull(viewRegistry, "viewRegistry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ---------------------------------------------------------------- reads

    public Optional<Entity> get(String id) {
        lock.readLock().lock();
        try {
            CacheEntry entry = entries.get(id);
            if (entry == null || !entry.isVisible()) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(entry.getEntity());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Raw entry for an id, including speculative tombstones.
     */
    public Optional<CacheEntry> getEntry(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Visible entities for the given ids, in the given order; absent ids are skipped.
     */
    public List<Entity> getAll(Collection<String> ids) {
        lock.readLock().lock();
        try {
            List<Entity> result = new ArrayList<>(ids.size());
            for (String id : ids) {
                CacheEntry entry = entries.get(id);
                if (entry != null && entry.isVisible()) {
                    result.add(entry.getEntity());
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Entity> resolve(CollectionView view) {
        return getAll(view.getIds());
    }

    public List<CacheEntry> entriesOfType(String entityType) {
        lock.readLock().lock();
        try {
            return entries.values().stream()
                .filter(entry -> entry.getEntity().getEntityType().equals(entityType))
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<CacheEntry> entriesInState(EntryState state) {
        lock.readLock().lock();
        try {
            return entries.values().stream()
                .filter(entry -> entry.getState() == state)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        return entries.size();
    }

    // ---------------------------------------------------------------- writes

    public PutOutcome put(Entity entity, EntryState state) {
        return put(entity, state, null);
    }

    /**
     * Writes a non-speculative entity.
     *
     * @param previous the entity as it was before this change, when the source knows
     *                 it; otherwise changed fields are computed against the cached entity
     */
    public PutOutcome put(Entity entity, EntryState state, Entity previous) {
        Objects.requireNonNull(entity, "entity");
        if (state != EntryState.CONFIRMED && state != EntryState.STALE) {
            throw new IllegalArgumentException("Only CONFIRMED or STALE entities can be put directly, got " + state);
        }
        lock.writeLock().lock();
        try {
            CacheEntry current = entries.get(entity.getId());
            if (current != null && current.isOptimistic()) {
                if (EntityVersions.isOlder(entity.getVersion(), current.getBaseVersion())) {
                    staleDiscards.incrementAndGet();
                    logger.debug("Discarded stale version {} for {} (optimistic base {})",
                        entity.getVersion(), entity.getId(), current.getBaseVersion());
                    return PutOutcome.DISCARDED_STALE;
                }
                conflictsDetected.incrementAndGet();
                logger.debug("Version {} for {} conflicts with in-flight optimistic write",
                    entity.getVersion(), entity.getId());
                return PutOutcome.CONFLICT;
            }
            Entity cached = current != null && current.isVisible() ? current.getEntity() : null;
            if (cached != null && !EntityVersions.remoteSupersedes(entity, cached)) {
                staleDiscards.incrementAndGet();
                logger.debug("Discarded stale version {} for {} (cached {})",
                    entity.getVersion(), entity.getId(), cached.getVersion());
                return PutOutcome.DISCARDED_STALE;
            }

            entries.put(entity.getId(), state == EntryState.STALE
                ? CacheEntry.stale(entity, clock.instant())
                : CacheEntry.confirmed(entity, clock.instant()));
            writesApplied.incrementAndGet();

            Entity before = previous != null ? previous : cached;
            if (before == null) {
                invalidateAffected(ChangeKind.INSERT, entity.getEntityType(), entity.getId(), null);
            } else {
                invalidateAffected(ChangeKind.UPDATE, entity.getEntityType(), entity.getId(),
                    entity.changedFields(before));
            }
            return PutOutcome.APPLIED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores fetched entities without invalidating views. Entries with in-flight
     * writes and newer cached versions are left alone.
     *
     * @return number of entities stored
     */
    public int load(Collection<Entity> fetched) {
        lock.writeLock().lock();
        try {
            int stored = 0;
            for (Entity entity : fetched) {
                CacheEntry current = entries.get(entity.getId());
                if (current != null && current.isOptimistic()) {
                    continue;
                }
                if (current != null && current.isVisible()
                        && !EntityVersions.remoteSupersedes(entity, current.getEntity())) {
                    continue;
                }
                entries.put(entity.getId(), CacheEntry.confirmed(entity, clock.instant()));
                stored++;
            }
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores a refetched entity: a plain update when the id is cached, a silent load
     * otherwise.
     */
    public PutOutcome refresh(Entity entity) {
        lock.writeLock().lock();
        try {
            if (entries.containsKey(entity.getId())) {
                return put(entity, EntryState.CONFIRMED);
            }
            load(List.of(entity));
            return PutOutcome.APPLIED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes an entry because the record is gone. An in-flight optimistic write on the
     * id is cancelled: its commit will be skipped.
     */
    public Optional<CacheEntry> remove(String id) {
        lock.writeLock().lock();
        try {
            CacheEntry removed = entries.remove(id);
            if (removed == null) {
                return Optional.empty();
            }
            if (removed.getInFlightToken() != CacheEntry.NO_TOKEN) {
                cancelledTokens.add(removed.getInFlightToken());
                logger.debug("Cancelled in-flight write {} on removed entity {}", removed.getInFlightToken(), id);
            }
            invalidateAffected(ChangeKind.DELETE, removed.getEntity().getEntityType(), id, null);
            return Optional.of(removed);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Writes the outcome of a conflict resolution. Replaces an optimistic entry
     * regardless of token, so the in-flight write it supersedes can no longer commit
     * or roll back over it. A newer confirmed entry is kept.
     */
    public PutOutcome applyResolved(Entity resolved) {
        lock.writeLock().lock();
        try {
            CacheEntry current = entries.get(resolved.getId());
            if (current != null && !current.isOptimistic() && current.isVisible()
                    && EntityVersions.isOlder(resolved, current.getEntity())) {
                return PutOutcome.DISCARDED_STALE;
            }
            entries.put(resolved.getId(), CacheEntry.confirmed(resolved, clock.instant()));
            writesApplied.incrementAndGet();
            Entity before = current != null ? current.getEntity() : null;
            invalidateAffected(before == null ? ChangeKind.INSERT : ChangeKind.UPDATE,
                resolved.getEntityType(), resolved.getId(),
                before == null ? null : resolved.changedFields(before));
            return PutOutcome.APPLIED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------- optimistic

    /**
     * Applies a speculative change and registers a fresh in-flight token.
     *
     * @param transform receives the visible entity (or null) and returns the
     *                  speculative entity, or null for a delete
     */
    public OptimisticWrite beginOptimistic(String id, UnaryOperator<Entity> transform) {
        lock.writeLock().lock();
        try {
            CacheEntry snapshot = entries.get(id);
            Entity current = snapshot != null && snapshot.isVisible() ? snapshot.getEntity() : null;
            Entity speculative = transform.apply(current);
            if (speculative != null && !speculative.getId().equals(id)) {
                throw new IllegalArgumentException("Speculative entity id " + speculative.getId()
                    + " does not match " + id);
            }
            long token = tokenSequence.incrementAndGet();
            long base = current != null ? current.getVersion() : CacheEntry.NO_BASE_VERSION;
            if (speculative != null) {
                entries.put(id, CacheEntry.optimistic(speculative, base, token, clock.instant()));
            } else if (current != null) {
                entries.put(id, CacheEntry.tombstone(current, base, token, clock.instant()));
            }
            logger.debug("Optimistic write {} on {} (base {})", token, id, base);
            return new OptimisticWrite(id, token, snapshot, speculative);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Confirms an optimistic write with the server's entity (null for a delete).
     *
     * @return APPLIED, CANCELLED when the entity was deleted remotely meanwhile, or
     *         SUPERSEDED when a resolution replaced the write (the server entity is
     *         then applied only if newer than what is cached)
     */
    public PutOutcome commitOptimistic(OptimisticWrite write, Entity confirmed) {
        lock.writeLock().lock();
        try {
            if (cancelledTokens.remove(write.getToken())) {
                logger.debug("Skipped commit of cancelled write {} on {}", write.getToken(), write.getId());
                return PutOutcome.CANCELLED;
            }
            CacheEntry current = entries.get(write.getId());
            Entity before = write.getPrevious();

            if (current == null || current.hasToken(write.getToken())) {
                if (confirmed == null) {
                    entries.remove(write.getId());
                    if (before != null) {
                        invalidateAffected(ChangeKind.DELETE, before.getEntityType(), write.getId(), null);
                    }
                    return PutOutcome.APPLIED;
                }
                boolean sameId = confirmed.getId().equals(write.getId());
                if (!sameId) {
                    entries.remove(write.getId());
                }
                entries.put(confirmed.getId(), CacheEntry.confirmed(confirmed, clock.instant()));
                writesApplied.incrementAndGet();
                if (before == null || !sameId) {
                    invalidateAffected(ChangeKind.INSERT, confirmed.getEntityType(), confirmed.getId(), null);
                } else {
                    invalidateAffected(ChangeKind.UPDATE, confirmed.getEntityType(), confirmed.getId(),
                        confirmed.changedFields(before));
                }
                return PutOutcome.APPLIED;
            }

            if (confirmed != null && !current.isOptimistic() && current.isVisible()
                    && EntityVersions.isOlder(current.getEntity(), confirmed)) {
                entries.put(confirmed.getId(), CacheEntry.confirmed(confirmed, clock.instant()));
                writesApplied.incrementAndGet();
                invalidateAffected(ChangeKind.UPDATE, confirmed.getEntityType(), confirmed.getId(),
                    confirmed.changedFields(current.getEntity()));
            }
            logger.debug("Write {} on {} was superseded", write.getToken(), write.getId());
            return PutOutcome.SUPERSEDED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Restores the entry captured before the write, exactly. Calling it again, or
     * after the write was superseded, changes nothing.
     */
    public PutOutcome rollbackOptimistic(OptimisticWrite write) {
        lock.writeLock().lock();
        try {
            if (cancelledTokens.remove(write.getToken())) {
                return PutOutcome.CANCELLED;
            }
            CacheEntry current = entries.get(write.getId());
            if (current != null && current.hasToken(write.getToken())) {
                if (write.getSnapshot() == null) {
                    entries.remove(write.getId());
                } else {
                    entries.put(write.getId(), write.getSnapshot());
                }
                logger.debug("Rolled back write {} on {}", write.getToken(), write.getId());
                return PutOutcome.APPLIED;
            }
            return current == null && write.getSnapshot() == null ? PutOutcome.APPLIED : PutOutcome.SUPERSEDED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean hasInFlight(String id) {
        CacheEntry entry = entries.get(id);
        return entry != null && entry.isOptimistic() && entry.getInFlightToken() != CacheEntry.NO_TOKEN;
    }

    // ------------------------------------------------------- eviction/pins

    /**
     * Adds a source of pins; a pinned id is never evicted.
     */
    public void addPinSource(Predicate<String> pinned) {
        pinSources.add(pinned);
    }

    public boolean isPinned(String id) {
        if (hasInFlight(id)) {
            return true;
        }
        for (Predicate<String> source : pinSources) {
            if (source.test(id)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops an entry to reclaim memory. Not a data change, so no view is invalidated.
     *
     * @return false when the id is absent or pinned
     */
    public boolean evict(String id) {
        lock.writeLock().lock();
        try {
            if (isPinned(id)) {
                logger.debug("Refused to evict pinned entity {}", id);
                return false;
            }
            return entries.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean markStale(String id) {
        lock.writeLock().lock();
        try {
            CacheEntry entry = entries.get(id);
            if (entry == null || entry.getState() != EntryState.CONFIRMED) {
                return false;
            }
            entries.put(id, entry.markStale());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- views

    public Optional<CollectionView> getView(ViewKey key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(views.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<ViewKey, CollectionView> snapshotViews() {
        lock.readLock().lock();
        try {
            return new HashMap<>(views);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Invalidation generation of a key; bumped on every invalidation.
     */
    public long viewGeneration(ViewKey key) {
        return viewGenerations.getOrDefault(key, 0L);
    }

    /**
     * Registers a fetch of {@code key} and returns the generation it starts at. Pass
     * that generation to {@link #putView(ViewKey, CollectionView, long)} and call
     * {@link #endViewFetch(ViewKey)} once the fetch settles.
     */
    public long beginViewFetch(ViewKey key) {
        lock.writeLock().lock();
        try {
            pendingFetches.merge(key, 1, Integer::sum);
            return viewGeneration(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void endViewFetch(ViewKey key) {
        lock.writeLock().lock();
        try {
            Integer remaining = pendingFetches.computeIfPresent(key, (k, count) -> count > 1 ? count - 1 : null);
            if (remaining == null && !views.containsKey(key)) {
                viewGenerations.remove(key);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void putView(ViewKey key, CollectionView view) {
        lock.writeLock().lock();
        try {
            views.put(key, view);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores a view captured by a fetch that started at {@code expectedGeneration}.
     * If the key was invalidated since, the view is stored already invalid.
     *
     * @return the stored view
     */
    public CollectionView putView(ViewKey key, CollectionView view, long expectedGeneration) {
        lock.writeLock().lock();
        try {
            CollectionView stored = viewGeneration(key) == expectedGeneration ? view : view.invalidate();
            views.put(key, stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean invalidateView(ViewKey key) {
        lock.writeLock().lock();
        try {
            return invalidateLocked(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return number of views newly marked invalid
     */
    public int invalidateViewsMatching(Predicate<ViewKey> predicate) {
        lock.writeLock().lock();
        try {
            int count = 0;
            for (ViewKey key : new ArrayList<>(views.keySet())) {
                if (predicate.test(key) && invalidateLocked(key)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean evictView(ViewKey key) {
        lock.writeLock().lock();
        try {
            boolean removed = views.remove(key) != null;
            // The generation only matters to a fetch that is still outstanding
            if (!pendingFetches.containsKey(key)) {
                viewGenerations.remove(key);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            int entryCount = entries.size();
            int viewCount = views.size();
            entries.clear();
            views.clear();
            viewGenerations.clear();
            pendingFetches.clear();
            cancelledTokens.clear();
            logger.info("Cleared cache: entries={}, views={}", entryCount, viewCount);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean invalidateLocked(ViewKey key) {
        CollectionView view = views.get(key);
        if (view != null || pendingFetches.containsKey(key)) {
            viewGenerations.merge(key, 1L, Long::sum);
        }
        if (view == null || !view.isValid()) {
            return false;
        }
        views.put(key, view.invalidate());
        viewInvalidations.incrementAndGet();
        return true;
    }

    private void invalidateAffected(ChangeKind kind, String entityType, String id, Set<String> changedFields) {
        Set<ViewKey> families = viewRegistry.affectedFamilies(kind, entityType, changedFields);
        int invalidated = 0;
        for (ViewKey key : new ArrayList<>(views.keySet())) {
            boolean affected = families.contains(key.family())
                || (key.getEntityType().equals(entityType) && viewRegistry.getDefinition(key).isEmpty())
                || filtersOnChangedField(key, entityType, changedFields);
            if (affected && key.getKind() == ViewKind.DETAIL && key.getEntityType().equals(entityType)) {
                affected = id.equals(key.getParam(ViewKey.ID_PARAM));
            }
            if (affected && invalidateLocked(key)) {
                invalidated++;
            }
        }
        if (invalidated > 0) {
            logger.debug("{} of {} {} invalidated {} view(s)", kind, entityType, id, invalidated);
        }
    }

    /**
     * Key parameters of membership views are equality filters, so a change to a
     * field named by a parameter can move the entity in or out of the view.
     */
    private boolean filtersOnChangedField(ViewKey key, String entityType, Set<String> changedFields) {
        if (changedFields == null || key.getKind() == ViewKind.DETAIL || !key.getEntityType().equals(entityType)) {
            return false;
        }
        boolean membership = viewRegistry.getDefinition(key).map(ViewDefinition::isMembershipSensitive).orElse(true);
        if (!membership) {
            return false;
        }
        for (String param : key.getParams().keySet()) {
            if (changedFields.contains(param)) {
                return true;
            }
        }
        return false;
    }

    // Statistics
    public long getHits() { return hits.get(); }
    public long getMisses() { return misses.get(); }
    public long getWritesApplied() { return writesApplied.get(); }
    public long getStaleDiscards() { return staleDiscards.get(); }
    public long getConflictsDetected() { return conflictsDetected.get(); }
    public long getViewInvalidations() { return viewInvalidations.get(); }
    public int getViewCount() { return views.size(); }
    public int getTrackedGenerationCount() { return viewGenerations.size(); }
}
