package com.telcobright.coherence.conflict;

import com.telcobright.coherence.api.SyncStatusPublisher;
import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.ViewRegistry;
import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.entity.EntryState;
import com.telcobright.coherence.optimistic.OptimisticUpdateCoordinator;
import com.telcobright.coherence.optimistic.UndoLog;
import com.telcobright.coherence.support.InMemoryRemoteStore;
import com.telcobright.coherence.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ConflictResolverTest {

    private MutableClock clock;
    private CacheHandle handle;
    private EntityCache cache;
    private InMemoryRemoteStore remoteStore;
    private SyncStatusPublisher publisher;
    private ConflictRegistry registry;
    private OptimisticUpdateCoordinator coordinator;
    private ConflictResolver resolver;

    private Entity local;
    private Entity remote;
    private ConflictRecord conflict;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        handle = new CacheHandle("test", new ViewRegistry(), clock);
        handle.getViewRegistry().registerStandardViews("member", "name", "status");
        handle.init();
        cache = handle.getCache();
        remoteStore = new InMemoryRemoteStore();
        publisher = new SyncStatusPublisher();
        registry = new ConflictRegistry(publisher, 10, clock);
        coordinator = new OptimisticUpdateCoordinator(handle, remoteStore,
            Duration.ofSeconds(5), new UndoLog(Duration.ofSeconds(30), clock));
        resolver = new ConflictResolver(handle, registry, coordinator, remoteStore);

        // Local user suspended m1 while someone else renamed it and deactivated it
        remote = member("m1", 6, "Ann Lee", "inactive");
        remoteStore.seed(remote);
        cache.put(member("m1", 5, "Ann", "active"), EntryState.CONFIRMED);
        cache.beginOptimistic("m1", current -> current.withField("status", "suspended"));
        local = cache.get("m1").orElseThrow();
        conflict = registry.record(local, remote);
    }

    private static Entity member(String id, long version, String name, String status) {
        return Entity.builder().entityType("member").id(id).version(version)
            .field("name", name)
            .field("status", status)
            .build();
    }

    @Test
    void testRemoteTakesServerVersion() {
        Resolution resolution = resolver.resolve(conflict.getConflictId(), ResolutionStrategy.REMOTE);

        assertTrue(resolution.isResolved());
        assertEquals(remote, resolution.getPush().join());
        assertEquals(remote, cache.get("m1").orElseThrow());
        assertEquals(EntryState.CONFIRMED, cache.getEntry("m1").orElseThrow().getState());
        assertEquals(0, remoteStore.updateCalls.get());
        assertEquals(0, publisher.getPendingConflicts());
    }

    @Test
    void testLocalPushesLocalVersionAgain() {
        Resolution resolution = resolver.resolve(conflict.getConflictId(), ResolutionStrategy.LOCAL);

        Entity pushed = resolution.getPush().join();

        assertEquals(7, pushed.getVersion());
        assertEquals("suspended", pushed.getString("status"));
        assertEquals("suspended", remoteStore.stored("m1").getString("status"));
        assertEquals(EntryState.CONFIRMED, cache.getEntry("m1").orElseThrow().getState());
        assertEquals(7, cache.get("m1").orElseThrow().getVersion());
    }

    @Test
    void testMergeKeepsChosenLocalFields() {
        Resolution resolution = resolver.resolve(conflict.getConflictId(), ResolutionStrategy.MERGE,
            Set.of("status"), null);

        Entity merged = resolution.getEntity();
        assertEquals("Ann Lee", merged.getString("name"));
        assertEquals("suspended", merged.getString("status"));
        assertEquals(6, merged.getVersion());

        Entity pushed = resolution.getPush().join();
        assertEquals(7, pushed.getVersion());
        assertEquals("Ann Lee", remoteStore.stored("m1").getString("name"));
        assertEquals("suspended", remoteStore.stored("m1").getString("status"));
    }

    @Test
    void testMergeWithCustomFunction() {
        Resolution resolution = resolver.resolve(conflict.getConflictId(), ResolutionStrategy.MERGE, Set.of(),
            (mine, theirs) -> theirs.withField("status", mine.getString("status") + "/" + theirs.getString("status")));

        assertEquals("suspended/inactive", resolution.getEntity().getString("status"));
        resolution.getPush().join();
        assertEquals("suspended/inactive", cache.get("m1").orElseThrow().getString("status"));
    }

    @Test
    void testConflictIsResolvedOnlyOnce() {
        resolver.resolve(conflict.getConflictId(), ResolutionStrategy.REMOTE);

        Resolution second = resolver.resolve(conflict.getConflictId(), ResolutionStrategy.LOCAL);

        assertEquals(Resolution.Status.ALREADY_RESOLVED, second.getStatus());
        assertEquals(0, remoteStore.updateCalls.get());
        assertEquals("inactive", cache.get("m1").orElseThrow().getString("status"));
        assertEquals("REMOTE", registry.find(conflict.getConflictId()).orElseThrow().getResolution());
    }

    @Test
    void testUnknownConflict() {
        assertEquals(Resolution.Status.NOT_FOUND, resolver.resolve("nope", ResolutionStrategy.REMOTE).getStatus());
        assertEquals(Resolution.Status.NOT_FOUND, resolver.autoResolve("nope", AutoResolveStrategy.LOCAL_WINS).getStatus());
    }

    @Test
    void testRemoteDeleteResolvedRemotelyRemovesEntry() {
        ConflictRecord deleted = registry.record(local, null);

        resolver.resolve(deleted.getConflictId(), ResolutionStrategy.REMOTE);

        assertFalse(cache.getEntry("m1").isPresent());
        // The newer conflict superseded the first one
        assertEquals(ConflictRegistry.SUPERSEDED, registry.find(conflict.getConflictId()).orElseThrow().getResolution());
    }

    @Test
    void testRemoteDeleteResolvedLocallyRecreates() {
        ConflictRecord deleted = registry.record(local, null);

        Entity recreated = resolver.resolve(deleted.getConflictId(), ResolutionStrategy.LOCAL).getPush().join();

        assertEquals(1, remoteStore.createCalls.get());
        assertEquals("suspended", recreated.getString("status"));
        assertTrue(cache.get(recreated.getId()).isPresent());
    }

    @Test
    void testNewestWinsPicksHigherVersionAndPrefersRemoteOnTie() {
        ConflictRecord localNewer = new ConflictRecord("c1", member("m1", 7, "Ann", "suspended"), remote, null);
        ConflictRecord tie = new ConflictRecord("c2", member("m1", 6, "Ann", "suspended"), remote, null);
        ConflictRecord gone = new ConflictRecord("c3", local, null, null);

        assertEquals(ResolutionStrategy.LOCAL, ConflictResolver.choose(localNewer, AutoResolveStrategy.NEWEST_WINS));
        assertEquals(ResolutionStrategy.REMOTE, ConflictResolver.choose(tie, AutoResolveStrategy.NEWEST_WINS));
        assertEquals(ResolutionStrategy.REMOTE, ConflictResolver.choose(gone, AutoResolveStrategy.NEWEST_WINS));
        assertEquals(ResolutionStrategy.LOCAL, ConflictResolver.choose(tie, AutoResolveStrategy.LOCAL_WINS));
        assertEquals(ResolutionStrategy.REMOTE, ConflictResolver.choose(localNewer, AutoResolveStrategy.REMOTE_WINS));
    }

    @Test
    void testAutoResolveAllSettlesEveryPendingConflict() {
        Entity other = member("m2", 2, "Bob", "active");
        cache.put(member("m2", 1, "Bob", "active"), EntryState.CONFIRMED);
        registry.record(member("m2", 1, "Bob", "suspended"), other);

        List<Resolution> resolutions = resolver.autoResolveAll(AutoResolveStrategy.REMOTE_WINS);

        assertEquals(2, resolutions.size());
        assertTrue(resolutions.stream().allMatch(Resolution::isResolved));
        assertEquals(0, registry.pendingCount());
        assertEquals(2, registry.history().size());
        assertEquals(other, cache.get("m2").orElseThrow());
    }

    @Test
    void testResolvedConflictStaysResolvedAfterLeavingHistory() {
        ConflictRegistry shortHistory = new ConflictRegistry(publisher, 1, clock);
        ConflictResolver shortResolver = new ConflictResolver(handle, shortHistory, coordinator, remoteStore);
        ConflictRecord first = shortHistory.record(local, remote);
        assertTrue(shortResolver.resolve(first.getConflictId(), ResolutionStrategy.REMOTE).isResolved());

        ConflictRecord second = shortHistory.record(local, remote);
        assertTrue(shortResolver.resolve(second.getConflictId(), ResolutionStrategy.REMOTE).isResolved());
        assertTrue(shortHistory.find(first.getConflictId()).isEmpty());

        assertEquals(Resolution.Status.ALREADY_RESOLVED,
            shortResolver.resolve(first.getConflictId(), ResolutionStrategy.LOCAL).getStatus());
        assertEquals(Resolution.Status.ALREADY_RESOLVED,
            shortResolver.autoResolve(first.getConflictId(), AutoResolveStrategy.NEWEST_WINS).getStatus());
        assertEquals(Resolution.Status.NOT_FOUND,
            shortResolver.resolve("no-such-conflict", ResolutionStrategy.REMOTE).getStatus());
        assertEquals(0, remoteStore.updateCalls.get());
    }
}
