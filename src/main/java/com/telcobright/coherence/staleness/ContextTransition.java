package com.telcobright.coherence.staleness;

import java.util.Objects;

/**
 * A change in what the user is looking at, or in the conditions for fetching.
 */
public final class ContextTransition {

    public enum Type {
        NAVIGATION,
        VISIBILITY_REGAINED,
        NETWORK_REGAINED,
        MANUAL_REFRESH
    }

    private final Type type;
    private final String viewName;
    private final String entityId;

    private ContextTransition(Type type, String viewName, String entityId) {
        this.type = type;
        this.viewName = viewName;
        this.entityId = entityId;
    }

    public static ContextTransition navigation(String viewName) {
        return new ContextTransition(Type.NAVIGATION, Objects.requireNonNull(viewName, "viewName"), null);
    }

    /**
     * Navigation to a view showing one record.
     */
    public static ContextTransition navigation(String viewName, String entityId) {
        return new ContextTransition(Type.NAVIGATION, Objects.requireNonNull(viewName, "viewName"), entityId);
    }

    public static ContextTransition visibilityRegained() {
        return new ContextTransition(Type.VISIBILITY_REGAINED, null, null);
    }

    public static ContextTransition networkRegained() {
        return new ContextTransition(Type.NETWORK_REGAINED, null, null);
    }

    public static ContextTransition manualRefresh() {
        return new ContextTransition(Type.MANUAL_REFRESH, null, null);
    }

    // Getters
    public Type getType() { return type; }
    public String getViewName() { return viewName; }
    public String getEntityId() { return entityId; }

    @Override
    public String toString() {
        return viewName == null ? type.name() : String.format("%s(%s%s)", type, viewName,
            entityId == null ? "" : ", " + entityId);
    }
}
