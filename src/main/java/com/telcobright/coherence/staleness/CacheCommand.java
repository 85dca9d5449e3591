package com.telcobright.coherence.staleness;

import com.telcobright.coherence.cache.ViewKey;

import java.util.Objects;

/**
 * Instruction issued by the staleness policy and carried out by
 * {@link CacheCommandExecutor}.
 */
public final class CacheCommand {

    public enum Type {
        REFETCH_VIEW,
        REFETCH_ENTITY,
        EVICT_VIEW,
        EVICT_ENTITY
    }

    private final Type type;
    private final ViewKey viewKey;
    private final String entityType;
    private final String entityId;

    private CacheCommand(Type type, ViewKey viewKey, String entityType, String entityId) {
        this.type = type;
        this.viewKey = viewKey;
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public static CacheCommand refetchView(ViewKey key) {
        return new CacheCommand(Type.REFETCH_VIEW, key, key.getEntityType(), null);
    }

    public static CacheCommand evictView(ViewKey key) {
        return new CacheCommand(Type.EVICT_VIEW, key, key.getEntityType(), null);
    }

    public static CacheCommand refetchEntity(String entityType, String id) {
        return new CacheCommand(Type.REFETCH_ENTITY, null, entityType, id);
    }

    public static CacheCommand evictEntity(String entityType, String id) {
        return new CacheCommand(Type.EVICT_ENTITY, null, entityType, id);
    }

    // Getters
    public Type getType() { return type; }
    public ViewKey getViewKey() { return viewKey; }
    public String getEntityType() { return entityType; }
    public String getEntityId() { return entityId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheCommand)) return false;
        CacheCommand that = (CacheCommand) o;
        return type == that.type
            && Objects.equals(viewKey, that.viewKey)
            && Objects.equals(entityType, that.entityType)
            && Objects.equals(entityId, that.entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, viewKey, entityType, entityId);
    }

    @Override
    public String toString() {
        return viewKey != null ? type + "(" + viewKey + ")" : type + "(" + entityType + ":" + entityId + ")";
    }
}
