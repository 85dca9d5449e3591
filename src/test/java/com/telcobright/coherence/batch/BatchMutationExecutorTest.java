package com.telcobright.coherence.batch;

import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.CollectionView;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.ViewKey;
import com.telcobright.coherence.cache.ViewRegistry;
import com.telcobright.coherence.config.EngineConfig;
import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.entity.EntryState;
import com.telcobright.coherence.remote.ErrorKind;
import com.telcobright.coherence.remote.RemoteStoreException;
import com.telcobright.coherence.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Chunked batch execution: partial failures, progress, cancellation and view invalidation.
 */
public class BatchMutationExecutorTest {

    private MutableClock clock;
    private CacheHandle handle;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        handle = new CacheHandle("test", new ViewRegistry(), clock);
        handle.getViewRegistry().registerStandardViews("member", "name", "status");
        handle.init();
        pool = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private BatchMutationExecutor executor(MutationDispatcher dispatcher) {
        return executor(dispatcher, 0);
    }

    private BatchMutationExecutor executor(MutationDispatcher dispatcher, int maxRetries) {
        EngineConfig config = EngineConfig.builder()
            .mutationTimeout(Duration.ofMillis(200))
            .batchMaxRetries(maxRetries)
            .batchRetryDelay(Duration.ofMillis(5))
            .build();
        return new BatchMutationExecutor(handle, dispatcher, config, pool);
    }

    private static List<MutationRequest> updates(int count) {
        List<MutationRequest> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(MutationRequest.update("member", "item-" + i, Map.of("status", "active")));
        }
        return items;
    }

    private static CompletableFuture<?> failItemFive(MutationRequest request) {
        if (request.getId().equals("item-5")) {
            return CompletableFuture.failedFuture(RemoteStoreException.validation("bad field"));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Test
    void testPartialFailureIsCollectedAndSiblingsContinue() {
        List<BatchProgress> events = new ArrayList<>();

        BatchResult result = executor(BatchMutationExecutorTest::failItemFive).run(updates(10), 3, events::add);

        assertEquals(10, result.getTotalProcessed());
        assertEquals(9, result.getTotalSuccessful());
        assertEquals(1, result.getTotalFailed());
        assertEquals("item-5", result.getFailed().get(0).getId());
        assertEquals("bad field", result.getFailed().get(0).getError());
        assertEquals(ErrorKind.VALIDATION_ERROR, result.getFailed().get(0).getKind());
        assertFalse(result.isSuccess());
        assertFalse(result.getSuccessful().contains("item-5"));

        assertEquals(4, events.size());
        assertEquals(List.of(3, 6, 9, 10), events.stream().map(BatchProgress::getCurrent).collect(Collectors.toList()));
        assertEquals(100.0, events.get(3).getPercentage());
        assertEquals(4, events.get(3).getTotalBatches());
    }

    @Test
    void testSubmittedJobStreamsProgressAndCompletes() {
        BatchHandle job = executor(BatchMutationExecutorTest::failItemFive).submit(updates(10), 3);

        List<BatchProgress> events = job.progress().collect().asList().await().atMost(Duration.ofSeconds(5));
        BatchResult result = job.result().join();

        assertEquals(4, events.size());
        assertEquals(100.0, events.get(events.size() - 1).getPercentage());
        assertEquals(9, result.getTotalSuccessful());
    }

    @Test
    void testEmptyBatchProducesZeroResultAndNoProgress() {
        List<BatchProgress> events = new ArrayList<>();

        BatchResult result = executor(BatchMutationExecutorTest::failItemFive).run(List.of(), 3, events::add);

        assertEquals(0, result.getTotalProcessed());
        assertEquals(0, result.getTotalSuccessful());
        assertEquals(0, result.getTotalFailed());
        assertTrue(events.isEmpty());
    }

    @Test
    void testStructuralErrorsAreRejected() {
        BatchMutationExecutor executor = executor(BatchMutationExecutorTest::failItemFive);
        List<MutationRequest> withNull = new ArrayList<>(updates(2));
        withNull.add(null);

        assertThrows(IllegalArgumentException.class, () -> executor.run(updates(3), 0, null));
        assertThrows(IllegalArgumentException.class, () -> executor.run(withNull, 2, null));
        assertThrows(IllegalArgumentException.class, () -> executor.submit(null, 2));
    }

    @Test
    void testCancellationStopsBeforeNextChunk() {
        CompletableFuture<Void> firstChunk = new CompletableFuture<>();
        CompletableFuture<Void> started = new CompletableFuture<>();
        MutationDispatcher dispatcher = request -> {
            started.complete(null);
            int index = Integer.parseInt(request.getId().substring("item-".length()));
            return index < 3 ? firstChunk : CompletableFuture.completedFuture(null);
        };

        BatchHandle job = executor(dispatcher).submit(updates(10), 3);
        started.join();
        job.cancel();
        firstChunk.complete(null);
        BatchResult result = job.result().join();

        // The dispatched chunk runs to completion; nothing after it starts
        assertTrue(result.isCancelled());
        assertEquals(3, result.getTotalProcessed());
        assertEquals(List.of("item-0", "item-1", "item-2"), result.getSuccessful());
    }

    @Test
    void testItemThatNeverAnswersTimesOut() {
        MutationDispatcher dispatcher = request -> request.getId().equals("item-1")
            ? new CompletableFuture<>()
            : CompletableFuture.completedFuture(null);

        BatchResult result = executor(dispatcher).run(updates(3), 3, null);

        assertEquals(2, result.getTotalSuccessful());
        assertEquals("item-1", result.getFailed().get(0).getId());
        assertEquals("Operation timed out", result.getFailed().get(0).getError());
        assertEquals(ErrorKind.TIMEOUT, result.getFailed().get(0).getKind());
    }

    @Test
    void testDispatcherThatThrowsFailsOnlyThatItem() {
        MutationDispatcher dispatcher = request -> {
            if (request.getId().equals("item-0")) {
                throw new IllegalStateException("dispatcher blew up");
            }
            return CompletableFuture.completedFuture(null);
        };

        BatchResult result = executor(dispatcher).run(updates(2), 5, null);

        assertEquals(List.of("item-1"), result.getSuccessful());
        assertEquals("dispatcher blew up", result.getFailed().get(0).getError());
    }

    @Test
    void testSuccessfulItemsInvalidateViewsAndMarkEntriesStale() {
        EntityCache cache = handle.getCache();
        cache.put(Entity.of("member", "item-0", 1, Map.of("status", "pending")), EntryState.CONFIRMED);
        cache.put(Entity.of("member", "item-5", 1, Map.of("status", "pending")), EntryState.CONFIRMED);
        for (ViewKey key : List.of(ViewKey.list("member"), ViewKey.count("member"),
                ViewKey.detail("member", "item-0"), ViewKey.detail("member", "item-5"),
                ViewKey.list("invoice"))) {
            cache.putView(key, CollectionView.captured(key, List.of(), clock.instant(), 0));
        }

        executor(BatchMutationExecutorTest::failItemFive).run(updates(10), 3, null);

        assertFalse(cache.getView(ViewKey.list("member")).orElseThrow().isValid());
        assertFalse(cache.getView(ViewKey.count("member")).orElseThrow().isValid());
        assertFalse(cache.getView(ViewKey.detail("member", "item-0")).orElseThrow().isValid());
        // The failed item's detail and other entity types are untouched
        assertTrue(cache.getView(ViewKey.detail("member", "item-5")).orElseThrow().isValid());
        assertTrue(cache.getView(ViewKey.list("invoice")).orElseThrow().isValid());
        assertEquals(EntryState.STALE, cache.getEntry("item-0").orElseThrow().getState());
        assertEquals(EntryState.CONFIRMED, cache.getEntry("item-5").orElseThrow().getState());
    }

    @Test
    void testNetworkFailureIsRetriedUntilItSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        MutationDispatcher dispatcher = request -> {
            if (request.getId().equals("item-1") && calls.incrementAndGet() < 3) {
                return CompletableFuture.failedFuture(RemoteStoreException.network("connection reset"));
            }
            return CompletableFuture.completedFuture(null);
        };
        BatchMutationExecutor executor = executor(dispatcher, 3);

        BatchResult result = executor.run(updates(3), 3, null);

        assertTrue(result.isSuccess());
        assertEquals(List.of("item-0", "item-1", "item-2"), result.getSuccessful());
        assertEquals(3, calls.get());
        assertEquals(2, executor.getItemsRetried());
    }

    @Test
    void testRetriesStopAtTheLimit() {
        AtomicInteger calls = new AtomicInteger();
        MutationDispatcher dispatcher = request -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(RemoteStoreException.network("gateway timeout"));
        };

        BatchResult result = executor(dispatcher, 2).run(updates(1), 1, null);

        BatchResult.FailedItem failure = result.getFailed().get(0);
        assertEquals(3, calls.get());
        assertEquals(3, failure.getAttempts());
        assertEquals(ErrorKind.NETWORK_ERROR, failure.getKind());
        assertTrue(failure.isRetryable());
    }

    @Test
    void testPermanentFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        MutationDispatcher dispatcher = request -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(RemoteStoreException.validation("name is required"));
        };

        BatchResult result = executor(dispatcher, 3).run(updates(1), 1, null);

        assertEquals(1, calls.get());
        assertEquals(1, result.getFailed().get(0).getAttempts());
        assertFalse(result.getFailed().get(0).isRetryable());
    }

    @Test
    void testCreateReportsServerAssignedId() {
        MutationDispatcher dispatcher = request -> CompletableFuture.completedFuture(
            Entity.of(request.getEntityType(), "srv-" + request.getId(), 1, request.getPayload()));
        List<MutationRequest> items = List.of(
            MutationRequest.create("member", "draft-a", Map.of("name", "Ann")),
            MutationRequest.update("member", "m7", Map.of("name", "Bob")));

        BatchResult result = executor(dispatcher).run(items, 5, null);

        assertEquals(List.of("srv-draft-a", "m7"), result.getSuccessful());
        assertEquals(Map.of("draft-a", "srv-draft-a"), result.getCreatedIds());
    }
}
