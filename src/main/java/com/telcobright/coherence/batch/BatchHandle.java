package com.telcobright.coherence.batch;

import io.smallrye.mutiny.Multi;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A submitted batch job: its progress stream, its eventual result and a cancel
 * switch observed between chunks.
 */
public class BatchHandle {

    private final Multi<BatchProgress> progress;
    private final CompletableFuture<BatchResult> result;
    private final AtomicBoolean cancelRequested;

    BatchHandle(Multi<BatchProgress> progress, CompletableFuture<BatchResult> result, AtomicBoolean cancelRequested) {
        this.progress = progress;
        this.result = result;
        this.cancelRequested = cancelRequested;
    }

    /**
     * Progress events, one per chunk; completes when the job ends.
     */
    public Multi<BatchProgress> progress() {
        return progress;
    }

    public CompletableFuture<BatchResult> result() {
        return result;
    }

    /**
     * Stops dispatching further chunks. Items already dispatched run to completion.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }
}
