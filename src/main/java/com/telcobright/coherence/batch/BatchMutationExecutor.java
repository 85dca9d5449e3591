package com.telcobright.coherence.batch;

import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.ViewKey;
import com.telcobright.coherence.cache.ViewKind;
import com.telcobright.coherence.config.EngineConfig;
import com.telcobright.coherence.entity.ChangeKind;
import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.remote.ErrorKind;
import com.telcobright.coherence.remote.RemoteFailures;
import io.smallrye.mutiny.operators.multi.processors.UnicastProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Runs large mutation sets against the remote store in consecutive chunks.
 *
 * Chunks run one after another; items inside a chunk are dispatched together.
 * Items that fail with a retryable kind are dispatched again, up to the configured
 * number of retries, waiting {@code retryDelay * attempt} before each round. A
 * failing item is recorded and its siblings and later chunks carry on. Progress
 * is reported after every chunk. When the job ends, list and count views of the
 * touched entity types are invalidated along with the successful ids' details.
 */
public class BatchMutationExecutor {
    private static final Logger logger = LoggerFactory.getLogger(BatchMutationExecutor.class);

    private static final Set<ViewKind> COLLECTION_KINDS =
        EnumSet.of(ViewKind.LIST, ViewKind.COUNT, ViewKind.COUNT_BY_STATUS, ViewKind.SEARCH);

    private final CacheHandle handle;
    private final MutationDispatcher dispatcher;
    private final ExecutorService executor;
    private final int defaultBatchSize;
    private final Duration interBatchDelay;
    private final Duration itemTimeout;
    private final int maxRetries;
    private final Duration retryDelay;

    // Statistics
    private final AtomicLong jobsCompleted = new AtomicLong();
    private final AtomicLong itemsSucceeded = new AtomicLong();
    private final AtomicLong itemsFailed = new AtomicLong();
    private final AtomicLong itemsRetried = new AtomicLong();

    public BatchMutationExecutor(CacheHandle handle, MutationDispatcher dispatcher,
                                 EngineConfig config, ExecutorService executor) {
        this.handle = handle;
        this.dispatcher = dispatcher;
        this.executor = executor;
        this.defaultBatchSize = config.getBatchSize();
        this.interBatchDelay = config.getInterBatchDelay();
        this.itemTimeout = config.getMutationTimeout();
        this.maxRetries = config.getBatchMaxRetries();
        this.retryDelay = config.getBatchRetryDelay();
    }

    public BatchResult run(List<MutationRequest> items) {
        return run(items, defaultBatchSize, null);
    }

    /**
     * Runs the job on the calling thread.
     *
     * @param onProgress called after each chunk; may be null
     * @throws IllegalArgumentException for a batch size below 1 or null items
     */
    public BatchResult run(List<MutationRequest> items, int batchSize, Consumer<BatchProgress> onProgress) {
        return execute(items, batchSize, onProgress, new AtomicBoolean(false));
    }

    public BatchHandle submit(List<MutationRequest> items) {
        return submit(items, defaultBatchSize);
    }

    /**
     * Runs the job on the executor. Progress is buffered until the stream is
     * subscribed; the stream completes when the job ends.
     */
    public BatchHandle submit(List<MutationRequest> items, int batchSize) {
        validate(items, batchSize);
        UnicastProcessor<BatchProgress> progress = UnicastProcessor.create();
        AtomicBoolean cancelRequested = new AtomicBoolean(false);
        CompletableFuture<BatchResult> result = CompletableFuture.supplyAsync(
            () -> execute(items, batchSize, progress::onNext, cancelRequested), executor);
        result.whenComplete((outcome, failure) -> {
            if (failure != null) {
                progress.onError(RemoteFailures.unwrap(failure));
            } else {
                progress.onComplete();
            }
        });
        return new BatchHandle(progress, result, cancelRequested);
    }

    private BatchResult execute(List<MutationRequest> items, int batchSize,
                                Consumer<BatchProgress> onProgress, AtomicBoolean cancelRequested) {
        validate(items, batchSize);
        if (items.isEmpty()) {
            return BatchResult.empty();
        }

        int total = items.size();
        int totalBatches = (total + batchSize - 1) / batchSize;
        List<String> successful = new ArrayList<>();
        List<BatchResult.FailedItem> failed = new ArrayList<>();
        List<MutationRequest> succeeded = new ArrayList<>();
        Map<String, String> createdIds = new LinkedHashMap<>();
        boolean cancelled = false;
        long startNanos = System.nanoTime();

        logger.info("Starting batch job: items={}, batchSize={}, batches={}", total, batchSize, totalBatches);

        for (int batch = 0; batch < totalBatches; batch++) {
            if (cancelRequested.get()) {
                cancelled = true;
                logger.info("Batch job cancelled after {} of {} chunk(s)", batch, totalBatches);
                break;
            }
            if (batch > 0 && !interBatchDelay.isZero() && !pause(interBatchDelay)) {
                logger.warn("Batch job interrupted between chunks");
                cancelled = true;
                break;
            }

            List<MutationRequest> chunk = items.subList(batch * batchSize, Math.min(total, (batch + 1) * batchSize));
            processChunk(chunk, successful, failed, succeeded, createdIds);

            int processed = successful.size() + failed.size();
            BatchProgress progress = new BatchProgress(processed, total, batch + 1, totalBatches,
                Duration.ofNanos(System.nanoTime() - startNanos));
            logger.debug("Batch progress: {}", progress);
            report(onProgress, progress);
        }

        invalidateTouchedViews(succeeded);

        BatchResult result = new BatchResult(successful, failed, createdIds, cancelled);
        jobsCompleted.incrementAndGet();
        itemsSucceeded.addAndGet(result.getTotalSuccessful());
        itemsFailed.addAndGet(result.getTotalFailed());
        if (result.getTotalFailed() > 0) {
            logger.warn("Batch job finished with failures: {}", result);
        } else {
            logger.info("Batch job finished: {}", result);
        }
        return result;
    }

    private void processChunk(List<MutationRequest> chunk, List<String> successful,
                              List<BatchResult.FailedItem> failed, List<MutationRequest> succeeded,
                              Map<String, String> createdIds) {
        Object[] values = new Object[chunk.size()];
        Throwable[] failures = new Throwable[chunk.size()];
        int[] attempts = new int[chunk.size()];

        List<Integer> toRun = new ArrayList<>();
        for (int i = 0; i < chunk.size(); i++) {
            toRun.add(i);
        }
        for (int attempt = 1; ; attempt++) {
            CompletableFuture<?>[] pending = new CompletableFuture<?>[toRun.size()];
            for (int n = 0; n < toRun.size(); n++) {
                pending[n] = dispatch(chunk.get(toRun.get(n)));
            }
            List<Integer> retryable = new ArrayList<>();
            for (int n = 0; n < toRun.size(); n++) {
                int i = toRun.get(n);
                attempts[i] = attempt;
                failures[i] = pending[n].handle((value, error) -> error).join();
                if (failures[i] == null) {
                    values[i] = pending[n].join();
                } else if (RemoteFailures.kindOf(failures[i]).isRetryable()) {
                    retryable.add(i);
                }
            }
            if (retryable.isEmpty() || attempt > maxRetries) {
                break;
            }
            logger.debug("Retrying {} batch item(s), attempt {} of {}", retryable.size(), attempt + 1, maxRetries + 1);
            itemsRetried.addAndGet(retryable.size());
            if (!retryDelay.isZero() && !pause(retryDelay.multipliedBy(attempt))) {
                logger.warn("Batch retry wait interrupted; keeping {} failure(s)", retryable.size());
                break;
            }
            toRun = retryable;
        }

        for (int i = 0; i < chunk.size(); i++) {
            MutationRequest request = chunk.get(i);
            if (failures[i] == null) {
                String id = request.getId();
                if (request.getKind() == ChangeKind.INSERT && values[i] instanceof Entity) {
                    id = ((Entity) values[i]).getId();
                    createdIds.put(request.getId(), id);
                }
                successful.add(id);
                succeeded.add(request);
            } else {
                ErrorKind kind = RemoteFailures.kindOf(failures[i]);
                String message = RemoteFailures.messageOf(failures[i]);
                failed.add(new BatchResult.FailedItem(request.getId(), kind, message, attempts[i]));
                logger.warn("Batch item {} failed after {} attempt(s): {} {}", request.getId(), attempts[i], kind, message);
            }
        }
    }

    private CompletableFuture<?> dispatch(MutationRequest request) {
        CompletableFuture<?> dispatched;
        try {
            dispatched = dispatcher.dispatch(request);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (dispatched == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Dispatcher returned no result"));
        }
        CompletableFuture<Object> bounded = dispatched.thenApply(value -> (Object) value);
        bounded.orTimeout(itemTimeout.toMillis(), TimeUnit.MILLISECONDS);
        return bounded;
    }

    private void invalidateTouchedViews(List<MutationRequest> succeeded) {
        if (succeeded.isEmpty()) {
            return;
        }
        EntityCache cache = handle.getCache();
        Map<String, Set<String>> idsByType = new HashMap<>();
        for (MutationRequest request : succeeded) {
            idsByType.computeIfAbsent(request.getEntityType(), type -> new HashSet<>()).add(request.getId());
        }
        int invalidated = 0;
        for (Map.Entry<String, Set<String>> entry : idsByType.entrySet()) {
            String entityType = entry.getKey();
            Set<String> ids = entry.getValue();
            invalidated += cache.invalidateViewsMatching(key -> key.getEntityType().equals(entityType)
                && (COLLECTION_KINDS.contains(key.getKind())
                    || (key.getKind() == ViewKind.DETAIL && ids.contains(key.getParam(ViewKey.ID_PARAM)))));
            ids.forEach(cache::markStale);
        }
        logger.debug("Batch job invalidated {} view(s) across {} entity type(s)", invalidated, idsByType.size());
    }

    private static boolean pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void report(Consumer<BatchProgress> onProgress, BatchProgress progress) {
        if (onProgress == null) {
            return;
        }
        try {
            onProgress.accept(progress);
        } catch (Exception e) {
            logger.error("Progress callback failed", e);
        }
    }

    private static void validate(List<MutationRequest> items, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1: " + batchSize);
        }
        if (items == null) {
            throw new IllegalArgumentException("Items must not be null");
        }
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) == null) {
                throw new IllegalArgumentException("Null item at position " + i);
            }
        }
    }

    // Statistics
    public long getJobsCompleted() { return jobsCompleted.get(); }
    public long getItemsSucceeded() { return itemsSucceeded.get(); }
    public long getItemsFailed() { return itemsFailed.get(); }
    public long getItemsRetried() { return itemsRetried.get(); }
}
