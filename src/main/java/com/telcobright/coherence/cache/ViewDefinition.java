package com.telcobright.coherence.cache;

import com.telcobright.coherence.remote.CollectionQuery;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Describes what a view family depends on, so invalidation can be computed from
 * the kind of change and the fields it touched.
 */
public final class ViewDefinition {

    private final ViewKey family;
    private final Set<String> referencedFields;
    private final boolean anyField;
    private final boolean membershipSensitive;
    private final String orderBy;
    private final boolean ascending;
    private final Function<ViewKey, CollectionQuery> queryFactory;

    private ViewDefinition(Builder builder) {
        this.family = Objects.requireNonNull(builder.family, "family").family();
        this.referencedFields = Collections.unmodifiableSet(new HashSet<>(builder.referencedFields));
        this.anyField = builder.anyField;
        this.membershipSensitive = builder.membershipSensitive;
        this.orderBy = builder.orderBy;
        this.ascending = builder.ascending;
        this.queryFactory = builder.queryFactory;
    }

    public static Builder builder(ViewKey family) {
        return new Builder(family);
    }

    /**
     * Membership-sensitive list whose filter and order reference the given fields.
     */
    public static ViewDefinition list(String entityType, String... referencedFields) {
        return builder(ViewKey.list(entityType))
            .membershipSensitive(true)
            .referencedFields(referencedFields)
            .build();
    }

    public static ViewDefinition count(String entityType) {
        return builder(ViewKey.count(entityType)).membershipSensitive(true).build();
    }

    public static ViewDefinition countByStatus(String entityType, String statusField) {
        return builder(ViewKey.countByStatus(entityType))
            .membershipSensitive(true)
            .referencedFields(statusField)
            .build();
    }

    public static ViewDefinition detail(String entityType) {
        return builder(ViewKey.of(ViewKind.DETAIL, entityType, "detail", Map.of()))
            .membershipSensitive(true)
            .anyField(true)
            .build();
    }

    public static ViewDefinition search(String entityType, String... searchedFields) {
        return builder(ViewKey.of(ViewKind.SEARCH, entityType, "search", Map.of()))
            .membershipSensitive(true)
            .referencedFields(searchedFields)
            .build();
    }

    /**
     * Whether a change touching {@code changedFields} can alter this view's content.
     * A null set means the changed fields are unknown.
     */
    public boolean dependsOnAny(Set<String> changedFields) {
        if (anyField || changedFields == null) {
            return true;
        }
        for (String field : changedFields) {
            if (referencedFields.contains(field)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Remote query for a concrete key of this family. Key parameters become
     * equality filters unless a custom factory is set.
     */
    public CollectionQuery queryFor(ViewKey key) {
        if (queryFactory != null) {
            return queryFactory.apply(key);
        }
        CollectionQuery.Builder query = CollectionQuery.builder(key.getEntityType()).filter(key.getParams());
        if (orderBy != null) {
            query.orderBy(orderBy, ascending);
        }
        return query.build();
    }

    // Getters
    public ViewKey getFamily() { return family; }
    public Set<String> getReferencedFields() { return referencedFields; }
    public boolean isAnyField() { return anyField; }
    public boolean isMembershipSensitive() { return membershipSensitive; }
    public String getOrderBy() { return orderBy; }

    @Override
    public String toString() {
        return String.format("ViewDefinition{family=%s, fields=%s, membership=%s}",
            family, anyField ? "*" : referencedFields, membershipSensitive);
    }

    public static class Builder {
        private final ViewKey family;
        private final Set<String> referencedFields = new HashSet<>();
        private boolean anyField;
        private boolean membershipSensitive = true;
        private String orderBy;
        private boolean ascending = true;
        private Function<ViewKey, CollectionQuery> queryFactory;

        private Builder(ViewKey family) {
            this.family = family;
        }

        public Builder referencedFields(String... fields) {
            this.referencedFields.addAll(Arrays.asList(fields));
            return this;
        }

        public Builder anyField(boolean anyField) {
            this.anyField = anyField;
            return this;
        }

        public Builder membershipSensitive(boolean membershipSensitive) {
            this.membershipSensitive = membershipSensitive;
            return this;
        }

        /**
         * Orders results by {@code field}; the field also becomes a referenced field.
         */
        public Builder orderBy(String field, boolean ascending) {
            this.orderBy = field;
            this.ascending = ascending;
            this.referencedFields.add(field);
            return this;
        }

        public Builder queryFactory(Function<ViewKey, CollectionQuery> queryFactory) {
            this.queryFactory = queryFactory;
            return this;
        }

        public ViewDefinition build() {
            return new ViewDefinition(this);
        }
    }
}
