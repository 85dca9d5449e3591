package com.telcobright.coherence.batch;

import java.util.concurrent.CompletableFuture;

/**
 * Sends one batch item to the remote side.
 */
@FunctionalInterface
public interface MutationDispatcher {

    CompletableFuture<?> dispatch(MutationRequest request);
}
