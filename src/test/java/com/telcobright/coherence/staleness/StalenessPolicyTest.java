package com.telcobright.coherence.staleness;

import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.CollectionView;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.ViewKey;
import com.telcobright.coherence.cache.ViewRegistry;
import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.entity.EntryState;
import com.telcobright.coherence.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Refresh and eviction decisions on navigation, focus and network changes.
 */
public class StalenessPolicyTest {

    private static final ViewKey MEMBER_LIST = ViewKey.list("member");
    private static final ViewKey MEMBER_COUNT = ViewKey.count("member");
    private static final ViewKey INVOICE_LIST = ViewKey.list("invoice");

    private MutableClock clock;
    private EntityCache cache;
    private StalenessPolicy policy;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        ViewRegistry registry = new ViewRegistry();
        registry.registerStandardViews("member", "name", "status");
        registry.registerStandardViews("invoice", "status");
        CacheHandle handle = new CacheHandle("test", registry, clock);
        handle.init();
        cache = handle.getCache();

        policy = new StalenessPolicy(handle, Duration.ofMinutes(5), Duration.ofMinutes(5));
        policy.registerView(ViewScope.builder("members", "members", "member")
            .owns(MEMBER_LIST, MEMBER_COUNT)
            .maxAge(Duration.ofMinutes(1))
            .build());
        policy.registerView(ViewScope.builder("member-detail", "members", "member")
            .showsEntity(true)
            .build());
        policy.registerView(ViewScope.builder("member-edit", "members", "member")
            .showsEntity(true)
            .alwaysRefresh(true)
            .build());
        policy.registerView(ViewScope.builder("invoices", "billing", "invoice")
            .owns(INVOICE_LIST)
            .build());
    }

    private void cacheView(ViewKey key) {
        cache.putView(key, CollectionView.captured(key, List.of(), clock.instant(), 0));
    }

    private static Entity member(String id) {
        return Entity.builder().entityType("member").id(id).version(1).field("status", "active").build();
    }

    @Test
    void testFirstVisitFetchesOwnedViews() {
        List<CacheCommand> commands = policy.onContextTransition(ContextTransition.navigation("members"));

        assertEquals(List.of(CacheCommand.refetchView(MEMBER_LIST), CacheCommand.refetchView(MEMBER_COUNT)), commands);
        assertEquals("members", policy.getCurrentView().orElseThrow().getName());
    }

    @Test
    void testOnlyViewsPastMaxAgeAreRefetched() {
        cacheView(MEMBER_LIST);
        cacheView(MEMBER_COUNT);
        assertTrue(policy.onContextTransition(ContextTransition.navigation("members")).isEmpty());

        clock.advance(Duration.ofSeconds(61));
        cacheView(MEMBER_COUNT);

        assertEquals(List.of(CacheCommand.refetchView(MEMBER_LIST)),
            policy.onContextTransition(ContextTransition.navigation("members")));
    }

    @Test
    void testInvalidatedViewIsRefetched() {
        cacheView(MEMBER_LIST);
        cacheView(MEMBER_COUNT);
        cache.put(member("m1"), EntryState.CONFIRMED);

        // An insert changes membership of both views
        assertEquals(List.of(CacheCommand.refetchView(MEMBER_LIST), CacheCommand.refetchView(MEMBER_COUNT)),
            policy.onContextTransition(ContextTransition.navigation("members")));
    }

    @Test
    void testDetailScreenRefetchesStaleRecordOnly() {
        cache.put(member("m1"), EntryState.CONFIRMED);
        assertTrue(policy.onContextTransition(ContextTransition.navigation("member-detail", "m1")).isEmpty());

        cache.markStale("m1");
        assertEquals(List.of(CacheCommand.refetchEntity("member", "m1")),
            policy.onContextTransition(ContextTransition.navigation("member-detail", "m1")));

        assertEquals(List.of(CacheCommand.refetchEntity("member", "m2")),
            policy.onContextTransition(ContextTransition.navigation("member-detail", "m2")));
    }

    @Test
    void testRecordWithPendingWriteIsNotRefetched() {
        cache.beginOptimistic("m1", current -> member("m1"));

        assertTrue(policy.onContextTransition(ContextTransition.navigation("member-edit", "m1")).isEmpty());
    }

    @Test
    void testAlwaysRefreshIgnoresAge() {
        cache.put(member("m1"), EntryState.CONFIRMED);

        assertEquals(List.of(CacheCommand.refetchEntity("member", "m1")),
            policy.onContextTransition(ContextTransition.navigation("member-edit", "m1")));
    }

    @Test
    void testVisibilityRefreshIsThrottledPerScope() {
        policy.onContextTransition(ContextTransition.navigation("members"));

        // Navigation just refreshed the scope
        assertTrue(policy.onContextTransition(ContextTransition.visibilityRegained()).isEmpty());

        clock.advance(Duration.ofMinutes(6));
        assertEquals(2, policy.onContextTransition(ContextTransition.visibilityRegained()).size());

        clock.advance(Duration.ofMinutes(1));
        assertTrue(policy.onContextTransition(ContextTransition.visibilityRegained()).isEmpty());
    }

    @Test
    void testVisibilityWithoutCurrentViewDoesNothing() {
        assertTrue(policy.onContextTransition(ContextTransition.visibilityRegained()).isEmpty());
        assertTrue(policy.onContextTransition(ContextTransition.networkRegained()).isEmpty());
        assertTrue(policy.onContextTransition(ContextTransition.manualRefresh()).isEmpty());
    }

    @Test
    void testNetworkRegainedRefetchesOnlyStaleViews() {
        cacheView(MEMBER_LIST);
        policy.onContextTransition(ContextTransition.navigation("members"));
        cacheView(MEMBER_COUNT);

        assertTrue(policy.onContextTransition(ContextTransition.networkRegained()).isEmpty());

        clock.advance(Duration.ofMinutes(2));
        assertEquals(2, policy.onContextTransition(ContextTransition.networkRegained()).size());
    }

    @Test
    void testManualRefreshRefetchesEverythingOwned() {
        cacheView(MEMBER_LIST);
        cacheView(MEMBER_COUNT);
        policy.onContextTransition(ContextTransition.navigation("members"));

        assertEquals(List.of(CacheCommand.refetchView(MEMBER_LIST), CacheCommand.refetchView(MEMBER_COUNT)),
            policy.onContextTransition(ContextTransition.manualRefresh()));
    }

    @Test
    void testLeavingScopeEvictsAbandonedViewsAndOldRecords() {
        ViewKey search = ViewKey.search("member", "ann");
        cache.putView(search, CollectionView.empty(search, clock.instant()));
        cacheView(MEMBER_LIST);
        cache.put(member("m1"), EntryState.CONFIRMED);
        cache.put(member("m2"), EntryState.CONFIRMED);
        cache.addPinSource("m2"::equals);
        policy.onContextTransition(ContextTransition.navigation("members"));

        clock.advance(Duration.ofMinutes(6));
        cache.put(member("m3"), EntryState.CONFIRMED);

        List<CacheCommand> commands = policy.onContextTransition(ContextTransition.navigation("invoices"));

        assertTrue(commands.contains(CacheCommand.evictView(search)));
        assertFalse(commands.contains(CacheCommand.evictView(MEMBER_LIST)));
        assertTrue(commands.contains(CacheCommand.evictEntity("member", "m1")));
        assertFalse(commands.contains(CacheCommand.evictEntity("member", "m2")));
        assertFalse(commands.contains(CacheCommand.evictEntity("member", "m3")));
        assertTrue(commands.contains(CacheCommand.refetchView(INVOICE_LIST)));
    }

    @Test
    void testMovingWithinScopeEvictsNothing() {
        ViewKey search = ViewKey.search("member", "ann");
        cache.putView(search, CollectionView.empty(search, clock.instant()));
        policy.onContextTransition(ContextTransition.navigation("members"));

        List<CacheCommand> commands = policy.onContextTransition(ContextTransition.navigation("member-detail", "m1"));

        assertTrue(commands.stream().noneMatch(command -> command.getType() == CacheCommand.Type.EVICT_VIEW));
    }

    @Test
    void testUnregisteredViewLeavesScope() {
        ViewKey search = ViewKey.search("member", "ann");
        cache.putView(search, CollectionView.empty(search, clock.instant()));
        policy.onContextTransition(ContextTransition.navigation("members"));

        List<CacheCommand> commands = policy.onContextTransition(ContextTransition.navigation("settings"));

        assertEquals(List.of(CacheCommand.evictView(search)), commands);
        assertTrue(policy.getCurrentView().isEmpty());
    }

    @Test
    void testWarmFetchesOnlyMissingOrOutdatedViews() {
        ViewKey active = ViewKey.list("member", Map.of("status", "active"));
        cacheView(MEMBER_LIST);
        cacheView(MEMBER_COUNT);
        cacheView(active);
        cache.invalidateView(active);
        clock.advance(Duration.ofMinutes(6));

        Map<ViewKey, Duration> staleTimes = new LinkedHashMap<>();
        staleTimes.put(MEMBER_LIST, Duration.ofMinutes(5));
        staleTimes.put(MEMBER_COUNT, Duration.ofMinutes(15));
        staleTimes.put(active, Duration.ofMinutes(15));
        staleTimes.put(INVOICE_LIST, Duration.ofMinutes(5));

        List<CacheCommand> commands = policy.warm(staleTimes);

        // The count is six minutes old but allowed fifteen
        assertEquals(List.of(CacheCommand.refetchView(MEMBER_LIST), CacheCommand.refetchView(active),
            CacheCommand.refetchView(INVOICE_LIST)), commands);
        assertTrue(policy.getCurrentView().isEmpty());
    }

    @Test
    void testWarmScopeUsesScreenMaxAge() {
        cacheView(MEMBER_LIST);
        cacheView(INVOICE_LIST);
        clock.advance(Duration.ofSeconds(30));

        assertEquals(List.of(CacheCommand.refetchView(MEMBER_COUNT)), policy.warmScope("members"));

        clock.advance(Duration.ofMinutes(1));
        assertEquals(List.of(CacheCommand.refetchView(MEMBER_LIST), CacheCommand.refetchView(MEMBER_COUNT)),
            policy.warmScope("members"));
        assertTrue(policy.warmScope("unknown").isEmpty());
    }
}
