package com.telcobright.coherence.entity;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, versioned record held by the cache.
 *
 * Identity is the id; conflict comparison uses the version; {@link #equals(Object)}
 * covers type, id, version and every field so restored snapshots compare exactly.
 */
public final class Entity {

    private final String entityType;
    private final String id;
    private final long version;
    private final Map<String, Object> fields;

    private Entity(Builder builder) {
        this.entityType = Objects.requireNonNull(builder.entityType, "entityType");
        this.id = Objects.requireNonNull(builder.id, "id");
        this.version = builder.version;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Entity of(String entityType, String id, long version, Map<String, Object> fields) {
        return builder().entityType(entityType).id(id).version(version).fields(fields).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .entityType(entityType)
            .id(id)
            .version(version)
            .fields(fields);
    }

    // Getters
    public String getEntityType() { return entityType; }
    public String getId() { return id; }
    public long getVersion() { return version; }
    public Map<String, Object> getFields() { return fields; }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    /**
     * Copy with the given fields overlaid; version unchanged.
     */
    public Entity withFields(Map<String, Object> patch) {
        return toBuilder().fields(patch).build();
    }

    public Entity withField(String field, Object value) {
        return toBuilder().field(field, value).build();
    }

    public Entity withVersion(long newVersion) {
        return toBuilder().version(newVersion).build();
    }

    /**
     * Names of fields whose values differ between this entity and {@code other},
     * including fields present on only one side.
     */
    public Set<String> changedFields(Entity other) {
        Set<String> changed = new HashSet<>();
        if (other == null) {
            changed.addAll(fields.keySet());
            return changed;
        }
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (!other.fields.containsKey(entry.getKey())
                    || !Objects.equals(entry.getValue(), other.fields.get(entry.getKey()))) {
                changed.add(entry.getKey());
            }
        }
        for (String key : other.fields.keySet()) {
            if (!fields.containsKey(key)) {
                changed.add(key);
            }
        }
        return changed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entity)) return false;
        Entity that = (Entity) o;
        return version == that.version
            && entityType.equals(that.entityType)
            && id.equals(that.id)
            && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityType, id, version, fields);
    }

    @Override
    public String toString() {
        return String.format("Entity{type=%s, id=%s, version=%d, fields=%s}",
            entityType, id, version, fields);
    }

    // Builder
    public static class Builder {
        private String entityType;
        private String id;
        private long version;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder field(String name, Object value) {
            this.fields.put(name, value);
            return this;
        }

        public Builder fields(Map<String, Object> fields) {
            if (fields != null) {
                this.fields.putAll(fields);
            }
            return this;
        }

        public Entity build() {
            return new Entity(this);
        }
    }
}
