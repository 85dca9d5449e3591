package com.telcobright.coherence.staleness;

import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.CollectionView;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.ViewKey;
import com.telcobright.coherence.cache.ViewLoader;
import com.telcobright.coherence.cache.ViewRegistry;
import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.entity.EntryState;
import com.telcobright.coherence.remote.RemoteStoreException;
import com.telcobright.coherence.support.InMemoryRemoteStore;
import com.telcobright.coherence.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

public class CacheCommandExecutorTest {

    private MutableClock clock;
    private EntityCache cache;
    private InMemoryRemoteStore remoteStore;
    private CacheCommandExecutor executor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        CacheHandle handle = new CacheHandle("test", new ViewRegistry(), clock);
        handle.getViewRegistry().registerStandardViews("member", "name", "status");
        handle.init();
        cache = handle.getCache();
        remoteStore = new InMemoryRemoteStore();
        executor = new CacheCommandExecutor(handle, new ViewLoader(handle, remoteStore), remoteStore);
    }

    private static Entity member(String id, long version, String status) {
        return Entity.builder().entityType("member").id(id).version(version).field("status", status).build();
    }

    @Test
    void testEvictionsApplyImmediately() {
        ViewKey search = ViewKey.search("member", "ann");
        cache.putView(search, CollectionView.empty(search, clock.instant()));
        cache.put(member("m1", 1, "active"), EntryState.CONFIRMED);

        CompletableFuture<Void> done = executor.execute(List.of(
            CacheCommand.evictView(search), CacheCommand.evictEntity("member", "m1")));

        assertTrue(done.isDone());
        assertFalse(cache.getView(search).isPresent());
        assertFalse(cache.getEntry("m1").isPresent());
        assertEquals(2, executor.getExecutedCount());
    }

    @Test
    void testRefetchesLoadFromRemote() {
        remoteStore.seed(member("m1", 3, "active"), member("m2", 1, "inactive"));
        cache.put(member("m2", 0, "active"), EntryState.CONFIRMED);
        cache.markStale("m2");

        executor.execute(List.of(
            CacheCommand.refetchView(ViewKey.list("member")),
            CacheCommand.refetchEntity("member", "m2"))).join();

        CollectionView view = cache.getView(ViewKey.list("member")).orElseThrow();
        assertEquals(List.of("m1", "m2"), view.getIds());
        assertEquals(EntryState.CONFIRMED, cache.getEntry("m2").orElseThrow().getState());
        assertEquals("inactive", cache.get("m2").orElseThrow().getString("status"));
    }

    @Test
    void testFailedRefetchIsCountedAndReported() {
        remoteStore.seed(member("m1", 1, "active"));
        remoteStore.failOn("fetchOne", "m9", RemoteStoreException.network("connection refused"));

        CompletableFuture<Void> done = executor.execute(List.of(
            CacheCommand.refetchEntity("member", "m1"),
            CacheCommand.refetchEntity("member", "m9")));

        assertThrows(CompletionException.class, done::join);
        assertEquals(1, executor.getExecutedCount());
        assertEquals(1, executor.getFailedCount());
        assertTrue(cache.get("m1").isPresent());
    }

    @Test
    void testRefetchOfUnregisteredViewFails() {
        CompletableFuture<Void> done = executor.execute(List.of(
            CacheCommand.refetchView(ViewKey.list("invoice"))));

        assertThrows(CompletionException.class, done::join);
        assertEquals(1, executor.getFailedCount());
    }
}
