package com.telcobright.coherence.batch;

import com.telcobright.coherence.remote.RemoteStore;

import java.util.concurrent.CompletableFuture;

/**
 * Dispatches batch items straight to the remote store, without speculative cache
 * writes.
 */
public class RemoteStoreDispatcher implements MutationDispatcher {

    private final RemoteStore remoteStore;

    public RemoteStoreDispatcher(RemoteStore remoteStore) {
        this.remoteStore = remoteStore;
    }

    @Override
    public CompletableFuture<?> dispatch(MutationRequest request) {
        switch (request.getKind()) {
            case INSERT:
                return remoteStore.create(request.getEntityType(), request.getPayload());
            case UPDATE:
                return remoteStore.update(request.getEntityType(), request.getId(), request.getPayload());
            case DELETE:
                return remoteStore.delete(request.getEntityType(), request.getId());
            default:
                throw new IllegalArgumentException("Unsupported mutation kind: " + request.getKind());
        }
    }
}
