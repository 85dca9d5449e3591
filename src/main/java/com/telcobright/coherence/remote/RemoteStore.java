package com.telcobright.coherence.remote;

import com.telcobright.coherence.entity.Entity;
import io.smallrye.mutiny.Multi;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port to the authoritative remote store. Implementations complete futures
 * exceptionally with {@link RemoteStoreException} on failure.
 */
public interface RemoteStore {

    CompletableFuture<Entity> fetchOne(String entityType, String id);

    CompletableFuture<List<Entity>> fetchCollection(CollectionQuery query);

    /**
     * Creates a record. The server may assign a different id than the payload carries.
     */
    CompletableFuture<Entity> create(String entityType, Map<String, Object> payload);

    CompletableFuture<Entity> update(String entityType, String id, Map<String, Object> patch);

    CompletableFuture<Void> delete(String entityType, String id);

    /**
     * Push feed of committed changes on a table, ordered per id. The stream fails on
     * transport errors and completes when the server closes the channel.
     */
    Multi<ChangeEvent> subscribeChanges(String table);
}
