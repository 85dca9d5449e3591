package com.telcobright.coherence.cache;

import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.remote.RemoteFailures;
import com.telcobright.coherence.remote.RemoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves collection views from the cache and lazily recomputes invalid or missing
 * ones from the remote store. Concurrent reads of the same key share one fetch.
 */
public class ViewLoader {
    private static final Logger logger = LoggerFactory.getLogger(ViewLoader.class);

    private final CacheHandle handle;
    private final RemoteStore remoteStore;
    private final Map<ViewKey, CompletableFuture<CollectionView>> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong fetches = new AtomicLong();

    public ViewLoader(CacheHandle handle, RemoteStore remoteStore) {
        this.handle = handle;
        this.remoteStore = remoteStore;
    }

    /**
     * Returns the cached view when valid, otherwise fetches it.
     */
    public CompletableFuture<CollectionView> read(ViewKey key) {
        Optional<CollectionView> cached = handle.getCache().getView(key);
        if (cached.isPresent() && cached.get().isValid()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        return refetch(key);
    }

    /**
     * Members of the view as currently cached, in view order.
     */
    public CompletableFuture<List<Entity>> readEntities(ViewKey key) {
        return read(key).thenApply(handle.getCache()::resolve);
    }

    /**
     * Fetches the view from the remote store regardless of its cached state.
     */
    public CompletableFuture<CollectionView> refetch(ViewKey key) {
        ViewDefinition definition = handle.getViewRegistry().getDefinition(key)
            .orElseThrow(() -> new IllegalArgumentException("No view definition registered for " + key));

        CompletableFuture<CollectionView> promise = new CompletableFuture<>();
        CompletableFuture<CollectionView> existing = inFlight.putIfAbsent(key, promise);
        if (existing != null) {
            return existing;
        }
        fetch(key, definition).whenComplete((view, failure) -> {
            inFlight.remove(key, promise);
            if (failure != null) {
                logger.warn("Failed to load view {}: {}", key, RemoteFailures.messageOf(failure));
                promise.completeExceptionally(RemoteFailures.unwrap(failure));
            } else {
                promise.complete(view);
            }
        });
        return promise;
    }

    private CompletableFuture<CollectionView> fetch(ViewKey key, ViewDefinition definition) {
        EntityCache cache = handle.getCache();
        long generation = cache.beginViewFetch(key);
        Optional<CollectionView> previous = cache.getView(key);
        int previousUpdates = previous.map(CollectionView::getUpdateCount).orElse(0);
        if (previous.isEmpty()) {
            // Placeholder until data arrives; abandoned fetches stay at zero updates
            cache.putView(key, CollectionView.empty(key, handle.getClock().instant()));
        }

        CompletableFuture<List<Entity>> members;
        try {
            if (key.getKind() == ViewKind.DETAIL) {
                members = remoteStore.fetchOne(key.getEntityType(), key.getParam(ViewKey.ID_PARAM))
                    .thenApply(List::of);
            } else {
                members = remoteStore.fetchCollection(definition.queryFor(key));
            }
        } catch (RuntimeException e) {
            members = CompletableFuture.failedFuture(e);
        }

        return members.thenApply(entities -> {
            fetches.incrementAndGet();
            cache.load(entities);
            CollectionView captured = CollectionView.captured(key, entities, handle.getClock().instant(), previousUpdates);
            CollectionView stored = cache.putView(key, captured, generation);
            logger.debug("Loaded view {}: {} member(s)", key, entities.size());
            return stored;
        }).whenComplete((view, failure) -> cache.endViewFetch(key));
    }

    public long getFetchCount() {
        return fetches.get();
    }
}
