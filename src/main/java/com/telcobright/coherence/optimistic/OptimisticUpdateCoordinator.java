package com.telcobright.coherence.optimistic;

import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.Drainable;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.OptimisticWrite;
import com.telcobright.coherence.cache.PutOutcome;
import com.telcobright.coherence.config.EngineConfig;
import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.entity.EntryState;
import com.telcobright.coherence.remote.ErrorKind;
import com.telcobright.coherence.remote.RemoteFailures;
import com.telcobright.coherence.remote.RemoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Speculative single-entity mutations.
 *
 * Flow per mutation:
 * 1. Snapshot the entry and write the speculative entity as OPTIMISTIC (write lock,
 *    synchronous, fresh in-flight token)
 * 2. Call the remote store with a timeout
 * 3. Success: commit the server entity as CONFIRMED and invalidate dependent views
 * 4. Failure or timeout: restore the snapshot exactly, then fail the caller's future
 *
 * Mutations on the same id run one after another through chained futures; no
 * thread blocks while waiting. Callers get a dependent future, so cancelling it
 * never stops the commit or rollback.
 */
public class OptimisticUpdateCoordinator implements Drainable {
    private static final Logger logger = LoggerFactory.getLogger(OptimisticUpdateCoordinator.class);

    private final CacheHandle handle;
    private final RemoteStore remoteStore;
    private final UndoLog undoLog;
    private final Duration defaultTimeout;

    // id -> completion gate of the last mutation queued for that id
    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    // Statistics
    private final AtomicLong committed = new AtomicLong();
    private final AtomicLong rolledBack = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();

    public OptimisticUpdateCoordinator(CacheHandle handle, RemoteStore remoteStore, EngineConfig config) {
        this(handle, remoteStore, config.getMutationTimeout(), new UndoLog(config.getUndoWindow(), handle.getClock()));
    }

    public OptimisticUpdateCoordinator(CacheHandle handle, RemoteStore remoteStore,
                                       Duration defaultTimeout, UndoLog undoLog) {
        this.handle = handle;
        this.remoteStore = remoteStore;
        this.defaultTimeout = defaultTimeout;
        this.undoLog = undoLog;
        handle.registerDrainable(this);
    }

    public CompletableFuture<Entity> mutate(String id, UnaryOperator<Entity> localTransform,
                                            Function<Entity, CompletableFuture<Entity>> remoteCall) {
        return mutate(id, localTransform, remoteCall, defaultTimeout);
    }

    /**
     * Applies {@code localTransform} to the cached entity right away and confirms or
     * reverts it once {@code remoteCall} settles.
     *
     * @param localTransform receives the visible entity (or null); returns the
     *                       speculative entity, or null for a delete
     * @param remoteCall     receives the speculative entity; completes with the
     *                       server's entity (null for a delete)
     * @return the server entity; fails with {@link MutationException} after rollback
     */
    public CompletableFuture<Entity> mutate(String id, UnaryOperator<Entity> localTransform,
                                            Function<Entity, CompletableFuture<Entity>> remoteCall,
                                            Duration timeout) {
        handle.ensureOpen();
        CompletableFuture<Entity> outcome = enqueue(id, () -> execute(id, localTransform, remoteCall, timeout));
        return outcome.thenApply(Function.identity());
    }

    /**
     * Patches a record. Uncached records are updated remotely and cached on success.
     */
    public CompletableFuture<Entity> update(String entityType, String id, Map<String, Object> patch) {
        if (handle.getCache().get(id).isPresent()) {
            return mutate(id,
                current -> {
                    if (current == null) {
                        throw new MutationException(id, ErrorKind.NOT_FOUND, id + " is no longer cached");
                    }
                    return current.withFields(patch);
                },
                speculative -> remoteStore.update(entityType, id, patch));
        }
        handle.ensureOpen();
        return enqueue(id, () -> remoteStore.update(entityType, id, patch)
                .orTimeout(defaultTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((updated, failure) -> {
                    if (failure != null) {
                        throw new MutationException(id, RemoteFailures.kindOf(failure),
                            RemoteFailures.messageOf(failure), RemoteFailures.unwrap(failure));
                    }
                    handle.getCache().refresh(updated);
                    return updated;
                }))
            .thenApply(Function.identity());
    }

    /**
     * Creates a record through {@code remoteCreate}; the provisional entity is visible
     * until the server answers. The server may assign another id.
     */
    public CompletableFuture<Entity> create(Entity provisional, Function<Entity, CompletableFuture<Entity>> remoteCreate) {
        return mutate(provisional.getId(), current -> provisional, remoteCreate);
    }

    public CompletableFuture<Entity> create(Entity provisional) {
        return create(provisional, speculative ->
            remoteStore.create(speculative.getEntityType(), speculative.getFields()));
    }

    /**
     * Speculatively deletes a record. On success the returned undo record can restore
     * it within the undo window; nothing is returned for a record that was not cached.
     */
    public CompletableFuture<Optional<UndoRecord>> delete(String entityType, String id) {
        AtomicReference<Entity> removed = new AtomicReference<>();
        return mutate(id,
                current -> {
                    removed.set(current);
                    return null;
                },
                speculative -> remoteStore.delete(entityType, id).thenApply(ignored -> (Entity) null))
            .thenApply(ignored -> {
                Entity snapshot = removed.get();
                if (snapshot == null) {
                    return Optional.<UndoRecord>empty();
                }
                return Optional.of(undoLog.register(snapshot, () -> restore(snapshot)));
            });
    }

    /**
     * Re-creates a deleted record from its undo record.
     */
    public CompletableFuture<Entity> undo(String undoId) {
        return undoLog.execute(undoId);
    }

    private CompletableFuture<Entity> restore(Entity snapshot) {
        Map<String, Object> payload = new LinkedHashMap<>(snapshot.getFields());
        payload.putIfAbsent("id", snapshot.getId());
        return remoteStore.create(snapshot.getEntityType(), payload)
            .thenApply(created -> {
                handle.getCache().put(created, EntryState.CONFIRMED);
                logger.info("Restored {} {} from undo", snapshot.getEntityType(), created.getId());
                return created;
            });
    }

    private CompletableFuture<Entity> execute(String id, UnaryOperator<Entity> localTransform,
                                              Function<Entity, CompletableFuture<Entity>> remoteCall,
                                              Duration timeout) {
        EntityCache cache = handle.getCache();
        OptimisticWrite write;
        try {
            write = cache.beginOptimistic(id, localTransform);
        } catch (MutationException e) {
            return CompletableFuture.failedFuture(e);
        } catch (RuntimeException e) {
            logger.warn("Local transform failed for {}: {}", id, e.getMessage());
            return CompletableFuture.failedFuture(
                new MutationException(id, ErrorKind.VALIDATION_ERROR, e.getMessage(), e));
        }

        CompletableFuture<Entity> remote;
        try {
            remote = remoteCall.apply(write.getSpeculative());
            if (remote == null) {
                remote = CompletableFuture.failedFuture(new IllegalStateException("Remote call returned no result"));
            }
        } catch (RuntimeException e) {
            remote = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Entity> bounded = remote.thenApply(Function.identity());
        bounded.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return bounded
            .handle((confirmed, failure) -> failure == null ? commit(write, confirmed) : rollback(write, failure))
            .thenCompose(Function.identity());
    }

    private CompletableFuture<Entity> commit(OptimisticWrite write, Entity confirmed) {
        PutOutcome outcome = handle.getCache().commitOptimistic(write, confirmed);
        if (outcome == PutOutcome.CANCELLED) {
            cancelled.incrementAndGet();
            logger.warn("Mutation on {} dropped: entity was deleted remotely while in flight", write.getId());
            return CompletableFuture.failedFuture(new MutationException(write.getId(), ErrorKind.CONFLICT,
                "Entity " + write.getId() + " was deleted remotely while the mutation was in flight"));
        }
        committed.incrementAndGet();
        logger.debug("Committed mutation on {} ({})", write.getId(), outcome);
        return CompletableFuture.completedFuture(confirmed);
    }

    private CompletableFuture<Entity> rollback(OptimisticWrite write, Throwable failure) {
        handle.getCache().rollbackOptimistic(write);
        rolledBack.incrementAndGet();
        ErrorKind kind = RemoteFailures.kindOf(failure);
        String message = RemoteFailures.messageOf(failure);
        logger.warn("Mutation on {} failed ({}), rolled back: {}", write.getId(), kind, message);
        return CompletableFuture.failedFuture(
            new MutationException(write.getId(), kind, message, RemoteFailures.unwrap(failure)));
    }

    private <T> CompletableFuture<T> enqueue(String id, Supplier<CompletableFuture<T>> task) {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(id, gate);
        CompletableFuture<Void> start = previous != null ? previous : CompletableFuture.completedFuture(null);
        CompletableFuture<T> outcome = start.thenCompose(ignored -> task.get());
        outcome.whenComplete((value, failure) -> {
            tails.remove(id, gate);
            gate.complete(null);
        });
        return outcome;
    }

    @Override
    public boolean drain(Duration timeout) {
        CompletableFuture<?>[] pending = tails.values().toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return true;
        }
        logger.info("Draining {} in-flight mutation chain(s)...", pending.length);
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            logger.warn("Mutations still in flight after {}", timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            logger.error("Unexpected failure while draining mutations", e);
            return false;
        }
    }

    public int getInFlightCount() {
        return tails.size();
    }

    public UndoLog getUndoLog() {
        return undoLog;
    }

    // Statistics
    public long getCommittedCount() { return committed.get(); }
    public long getRolledBackCount() { return rolledBack.get(); }
    public long getCancelledCount() { return cancelled.get(); }
}
