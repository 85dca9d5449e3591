package com.telcobright.coherence.remote;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Collection read against the remote store: equality filters, one order column and
 * an optional page window.
 */
public final class CollectionQuery {

    private final String entityType;
    private final Map<String, String> filter;
    private final String orderBy;
    private final boolean ascending;
    private final Integer limit;
    private final Integer offset;

    private CollectionQuery(Builder builder) {
        this.entityType = Objects.requireNonNull(builder.entityType, "entityType");
        this.filter = Collections.unmodifiableMap(new LinkedHashMap<>(builder.filter));
        this.orderBy = builder.orderBy;
        this.ascending = builder.ascending;
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static Builder builder(String entityType) {
        return new Builder().entityType(entityType);
    }

    // Getters
    public String getEntityType() { return entityType; }
    public Map<String, String> getFilter() { return filter; }
    public String getOrderBy() { return orderBy; }
    public boolean isAscending() { return ascending; }
    public Integer getLimit() { return limit; }
    public Integer getOffset() { return offset; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CollectionQuery)) return false;
        CollectionQuery that = (CollectionQuery) o;
        return ascending == that.ascending
            && entityType.equals(that.entityType)
            && filter.equals(that.filter)
            && Objects.equals(orderBy, that.orderBy)
            && Objects.equals(limit, that.limit)
            && Objects.equals(offset, that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityType, filter, orderBy, ascending, limit, offset);
    }

    @Override
    public String toString() {
        return String.format("CollectionQuery{type=%s, filter=%s, orderBy=%s %s, limit=%s, offset=%s}",
            entityType, filter, orderBy, ascending ? "asc" : "desc", limit, offset);
    }

    public static class Builder {
        private String entityType;
        private final Map<String, String> filter = new LinkedHashMap<>();
        private String orderBy;
        private boolean ascending = true;
        private Integer limit;
        private Integer offset;

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder filter(String field, String value) {
            this.filter.put(field, value);
            return this;
        }

        public Builder filter(Map<String, String> filter) {
            this.filter.putAll(filter);
            return this;
        }

        public Builder orderBy(String field, boolean ascending) {
            this.orderBy = field;
            this.ascending = ascending;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public CollectionQuery build() {
            return new CollectionQuery(this);
        }
    }
}
