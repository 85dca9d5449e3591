package com.telcobright.coherence.cache;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Typed identifier of a cached collection view: kind, entity type, view name and
 * parameters. A key with no parameters names a view family; parameterized keys
 * (pages, filters, search terms) belong to the family with the same kind, type
 * and name.
 */
public final class ViewKey {

    public static final String ID_PARAM = "id";
    public static final String TERM_PARAM = "term";

    private final ViewKind kind;
    private final String entityType;
    private final String name;
    private final SortedMap<String, String> params;

    private ViewKey(ViewKind kind, String entityType, String name, Map<String, String> params) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.name = Objects.requireNonNull(name, "name");
        this.params = Collections.unmodifiableSortedMap(new TreeMap<>(params));
    }

    public static ViewKey of(ViewKind kind, String entityType, String name, Map<String, String> params) {
        return new ViewKey(kind, entityType, name, params);
    }

    public static ViewKey list(String entityType) {
        return new ViewKey(ViewKind.LIST, entityType, "list", Map.of());
    }

    public static ViewKey list(String entityType, Map<String, String> params) {
        return new ViewKey(ViewKind.LIST, entityType, "list", params);
    }

    public static ViewKey count(String entityType) {
        return new ViewKey(ViewKind.COUNT, entityType, "count", Map.of());
    }

    public static ViewKey countByStatus(String entityType) {
        return new ViewKey(ViewKind.COUNT_BY_STATUS, entityType, "countByStatus", Map.of());
    }

    public static ViewKey countByStatus(String entityType, String status) {
        return new ViewKey(ViewKind.COUNT_BY_STATUS, entityType, "countByStatus", Map.of("status", status));
    }

    public static ViewKey detail(String entityType, String id) {
        return new ViewKey(ViewKind.DETAIL, entityType, "detail", Map.of(ID_PARAM, id));
    }

    public static ViewKey search(String entityType, String term) {
        return new ViewKey(ViewKind.SEARCH, entityType, "search", Map.of(TERM_PARAM, term));
    }

    public static ViewKey custom(String entityType, String name, Map<String, String> params) {
        return new ViewKey(ViewKind.CUSTOM, entityType, name, params);
    }

    /**
     * The parameterless key naming this key's view family.
     */
    public ViewKey family() {
        return params.isEmpty() ? this : new ViewKey(kind, entityType, name, Map.of());
    }

    public boolean isFamily() {
        return params.isEmpty();
    }

    public boolean belongsTo(ViewKey family) {
        return kind == family.kind && entityType.equals(family.entityType) && name.equals(family.name);
    }

    public String getParam(String param) {
        return params.get(param);
    }

    // Getters
    public ViewKind getKind() { return kind; }
    public String getEntityType() { return entityType; }
    public String getName() { return name; }
    public Map<String, String> getParams() { return params; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ViewKey)) return false;
        ViewKey that = (ViewKey) o;
        return kind == that.kind
            && entityType.equals(that.entityType)
            && name.equals(that.name)
            && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, entityType, name, params);
    }

    @Override
    public String toString() {
        return params.isEmpty()
            ? String.format("%s:%s:%s", kind, entityType, name)
            : String.format("%s:%s:%s%s", kind, entityType, name, params);
    }
}
