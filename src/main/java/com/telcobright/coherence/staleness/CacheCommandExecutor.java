package com.telcobright.coherence.staleness;

import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.ViewLoader;
import com.telcobright.coherence.remote.RemoteFailures;
import com.telcobright.coherence.remote.RemoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Carries out cache commands. Evictions are applied immediately; refetches run
 * concurrently and the returned future completes once all of them have.
 */
public class CacheCommandExecutor {
    private static final Logger logger = LoggerFactory.getLogger(CacheCommandExecutor.class);

    private final CacheHandle handle;
    private final ViewLoader viewLoader;
    private final RemoteStore remoteStore;

    // Statistics
    private final AtomicLong executed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public CacheCommandExecutor(CacheHandle handle, ViewLoader viewLoader, RemoteStore remoteStore) {
        this.handle = handle;
        this.viewLoader = viewLoader;
        this.remoteStore = remoteStore;
    }

    /**
     * @return completes when every refetch has finished; fails with the first
     *         refetch failure after all have finished
     */
    public CompletableFuture<Void> execute(List<CacheCommand> commands) {
        EntityCache cache = handle.getCache();
        List<CompletableFuture<?>> refetches = new ArrayList<>();
        for (CacheCommand command : commands) {
            switch (command.getType()) {
                case EVICT_VIEW:
                    cache.evictView(command.getViewKey());
                    executed.incrementAndGet();
                    break;
                case EVICT_ENTITY:
                    cache.evict(command.getEntityId());
                    executed.incrementAndGet();
                    break;
                case REFETCH_VIEW:
                    refetches.add(track(command, refetchView(command)));
                    break;
                case REFETCH_ENTITY:
                    refetches.add(track(command, refetchEntity(command)));
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported command: " + command.getType());
            }
        }
        return CompletableFuture.allOf(refetches.toArray(new CompletableFuture<?>[0]));
    }

    private CompletableFuture<?> refetchView(CacheCommand command) {
        try {
            return viewLoader.refetch(command.getViewKey());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<?> refetchEntity(CacheCommand command) {
        try {
            return remoteStore.fetchOne(command.getEntityType(), command.getEntityId())
                .thenAccept(handle.getCache()::refresh);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<?> track(CacheCommand command, CompletableFuture<?> future) {
        return future.whenComplete((result, failure) -> {
            if (failure != null) {
                failed.incrementAndGet();
                logger.warn("Cache command {} failed: {}", command, RemoteFailures.messageOf(failure));
            } else {
                executed.incrementAndGet();
            }
        });
    }

    // Statistics
    public long getExecutedCount() { return executed.get(); }
    public long getFailedCount() { return failed.get(); }
}
