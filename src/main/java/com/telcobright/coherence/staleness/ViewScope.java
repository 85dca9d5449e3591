package com.telcobright.coherence.staleness;

import com.telcobright.coherence.cache.ViewKey;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A named screen: the views it shows, how old they may be, and the scope it
 * belongs to. Screens in the same scope share cached data; leaving a scope makes
 * its data eligible for eviction.
 */
public final class ViewScope {

    private final String name;
    private final String scope;
    private final String entityType;
    private final Set<ViewKey> ownedViews;
    private final Duration maxAge;
    private final boolean showsEntity;
    private final boolean alwaysRefresh;

    private ViewScope(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.scope = Objects.requireNonNull(builder.scope, "scope");
        this.entityType = Objects.requireNonNull(builder.entityType, "entityType");
        this.ownedViews = Collections.unmodifiableSet(new LinkedHashSet<>(builder.ownedViews));
        this.maxAge = builder.maxAge;
        this.showsEntity = builder.showsEntity;
        this.alwaysRefresh = builder.alwaysRefresh;
    }

    public static Builder builder(String name, String scope, String entityType) {
        return new Builder(name, scope, entityType);
    }

    // Getters
    public String getName() { return name; }
    public String getScope() { return scope; }
    public String getEntityType() { return entityType; }
    public Set<ViewKey> getOwnedViews() { return ownedViews; }
    public Duration getMaxAge() { return maxAge; }
    public boolean isShowsEntity() { return showsEntity; }
    public boolean isAlwaysRefresh() { return alwaysRefresh; }

    @Override
    public String toString() {
        return String.format("ViewScope{name=%s, scope=%s, views=%d}", name, scope, ownedViews.size());
    }

    public static class Builder {
        private final String name;
        private final String scope;
        private final String entityType;
        private final Set<ViewKey> ownedViews = new LinkedHashSet<>();
        private Duration maxAge = Duration.ofMinutes(1);
        private boolean showsEntity;
        private boolean alwaysRefresh;

        private Builder(String name, String scope, String entityType) {
            this.name = name;
            this.scope = scope;
            this.entityType = entityType;
        }

        public Builder owns(ViewKey... keys) {
            Collections.addAll(ownedViews, keys);
            return this;
        }

        public Builder maxAge(Duration maxAge) {
            this.maxAge = maxAge;
            return this;
        }

        /**
         * The screen shows the record named by the navigation's entity id.
         */
        public Builder showsEntity(boolean showsEntity) {
            this.showsEntity = showsEntity;
            return this;
        }

        /**
         * Refetch on every entry regardless of age (edit forms).
         */
        public Builder alwaysRefresh(boolean alwaysRefresh) {
            this.alwaysRefresh = alwaysRefresh;
            return this;
        }

        public ViewScope build() {
            return new ViewScope(this);
        }
    }
}
