package com.telcobright.coherence.batch;

import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.optimistic.OptimisticUpdateCoordinator;

import java.util.concurrent.CompletableFuture;

/**
 * Routes each batch item through the optimistic coordinator, so the cache shows
 * the change before the server confirms it.
 */
public class OptimisticMutationDispatcher implements MutationDispatcher {

    private final OptimisticUpdateCoordinator coordinator;

    public OptimisticMutationDispatcher(OptimisticUpdateCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public CompletableFuture<?> dispatch(MutationRequest request) {
        switch (request.getKind()) {
            case INSERT:
                Entity provisional = Entity.builder()
                    .entityType(request.getEntityType())
                    .id(request.getId())
                    .fields(request.getPayload())
                    .build();
                return coordinator.create(provisional);
            case UPDATE:
                return coordinator.update(request.getEntityType(), request.getId(), request.getPayload());
            case DELETE:
                return coordinator.delete(request.getEntityType(), request.getId());
            default:
                throw new IllegalArgumentException("Unsupported mutation kind: " + request.getKind());
        }
    }
}
