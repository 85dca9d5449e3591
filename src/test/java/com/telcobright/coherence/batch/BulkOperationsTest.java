package com.telcobright.coherence.batch;

import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.ViewRegistry;
import com.telcobright.coherence.config.EngineConfig;
import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.entity.EntryState;
import com.telcobright.coherence.optimistic.OptimisticUpdateCoordinator;
import com.telcobright.coherence.support.InMemoryRemoteStore;
import com.telcobright.coherence.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

public class BulkOperationsTest {

    private CacheHandle handle;
    private InMemoryRemoteStore remoteStore;
    private ExecutorService pool;
    private BulkOperations bulk;

    @BeforeEach
    void setUp() {
        handle = new CacheHandle("test", new ViewRegistry(), MutableClock.startingAt("2024-03-01T10:00:00Z"));
        handle.getViewRegistry().registerStandardViews("member", "status");
        handle.init();
        remoteStore = new InMemoryRemoteStore();
        for (int i = 1; i <= 5; i++) {
            remoteStore.seed(Entity.of("member", "m" + i, 1, Map.of("status", "active")));
        }
        pool = Executors.newSingleThreadExecutor();
        BatchMutationExecutor executor = new BatchMutationExecutor(handle,
            new RemoteStoreDispatcher(remoteStore), EngineConfig.defaults(), pool);
        bulk = new BulkOperations(executor, 2);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void testBulkStatusUpdate() {
        List<BatchProgress> events = new ArrayList<>();

        BatchResult result = bulk.bulkUpdateStatus("member", List.of("m1", "m2", "m3"), "suspended", events::add);

        assertTrue(result.isSuccess());
        assertEquals(2, events.size());
        assertEquals("suspended", remoteStore.stored("m2").getString("status"));
        assertEquals("active", remoteStore.stored("m4").getString("status"));
    }

    @Test
    void testSoftDeleteMarksInactive() {
        BatchResult result = bulk.bulkDelete("member", List.of("m1", "m2"), true, null);

        assertEquals(2, result.getTotalSuccessful());
        assertTrue(remoteStore.contains("m1"));
        assertEquals(BulkOperations.INACTIVE_STATUS, remoteStore.stored("m1").getString("status"));
        assertEquals(0, remoteStore.deleteCalls.get());
    }

    @Test
    void testHardDeleteReportsMissingRecords() {
        BatchResult result = bulk.bulkDelete("member", List.of("m1", "ghost", "m3"), false, null);

        assertEquals(List.of("m1", "m3"), result.getSuccessful());
        assertEquals("ghost", result.getFailed().get(0).getId());
        assertFalse(remoteStore.contains("m1"));
        assertTrue(remoteStore.contains("m2"));
    }

    @Test
    void testBulkUpdateAppliesPerRecordPatches() {
        Map<String, Map<String, Object>> patches = new LinkedHashMap<>();
        patches.put("m1", Map.of("name", "Ann"));
        patches.put("m2", Map.of("name", "Bob"));

        BatchResult result = bulk.bulkUpdate("member", patches, null);

        assertEquals(List.of("m1", "m2"), result.getSuccessful());
        assertEquals("Ann", remoteStore.stored("m1").getString("name"));
        assertEquals(2, remoteStore.stored("m2").getVersion());
    }

    @Test
    void testBulkCreate() {
        Map<String, Map<String, Object>> payloads = new LinkedHashMap<>();
        payloads.put("new-1", Map.of("id", "m10", "status", "active"));
        payloads.put("new-2", Map.of("id", "m11", "status", "pending"));

        BatchResult result = bulk.bulkCreate("member", payloads, null);

        assertEquals(2, result.getTotalSuccessful());
        assertEquals("pending", remoteStore.stored("m11").getString("status"));
    }

    @Test
    void testBulkCreateReportsIdsTheServerAssigned() {
        Map<String, Map<String, Object>> payloads = new LinkedHashMap<>();
        payloads.put("draft-1", Map.of("name", "Ann"));
        payloads.put("draft-2", Map.of("name", "Bob"));

        BatchResult result = bulk.bulkCreate("member", payloads, null);

        assertEquals(List.of("member-1", "member-2"), result.getSuccessful());
        assertEquals("member-1", result.getCreatedIds().get("draft-1"));
        assertEquals("member-2", result.getCreatedIds().get("draft-2"));
        assertEquals("Bob", remoteStore.stored("member-2").getString("name"));
    }

    @Test
    void testOptimisticDispatchShowsChangesInCache() {
        handle.getCache().put(remoteStore.stored("m1"), EntryState.CONFIRMED);
        OptimisticUpdateCoordinator coordinator = new OptimisticUpdateCoordinator(handle, remoteStore, EngineConfig.defaults());
        BatchMutationExecutor executor = new BatchMutationExecutor(handle,
            new OptimisticMutationDispatcher(coordinator), EngineConfig.defaults(), pool);

        BatchResult result = new BulkOperations(executor, 10)
            .bulkUpdateStatus("member", List.of("m1", "m2"), "suspended", null);

        assertTrue(result.isSuccess());
        assertEquals(1, coordinator.getCommittedCount());
        assertEquals(2, remoteStore.updateCalls.get());
        assertEquals("suspended", handle.getCache().get("m1").orElseThrow().getString("status"));
        // The uncached record is cached from the server answer
        assertEquals("suspended", handle.getCache().get("m2").orElseThrow().getString("status"));
    }
}
