package com.telcobright.coherence.batch;

import com.telcobright.coherence.entity.ChangeKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One item of a batch job. For CREATE the id is a client-side label used in the
 * result; the server may assign another.
 */
public final class MutationRequest {

    private final ChangeKind kind;
    private final String entityType;
    private final String id;
    private final Map<String, Object> payload;

    private MutationRequest(ChangeKind kind, String entityType, String id, Map<String, Object> payload) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.id = Objects.requireNonNull(id, "id");
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static MutationRequest create(String entityType, String id, Map<String, Object> payload) {
        return new MutationRequest(ChangeKind.INSERT, entityType, id, payload);
    }

    public static MutationRequest update(String entityType, String id, Map<String, Object> patch) {
        return new MutationRequest(ChangeKind.UPDATE, entityType, id, patch);
    }

    public static MutationRequest delete(String entityType, String id) {
        return new MutationRequest(ChangeKind.DELETE, entityType, id, Map.of());
    }

    // Getters
    public ChangeKind getKind() { return kind; }
    public String getEntityType() { return entityType; }
    public String getId() { return id; }
    public Map<String, Object> getPayload() { return payload; }

    @Override
    public String toString() {
        return String.format("MutationRequest{%s %s %s}", kind, entityType, id);
    }
}
