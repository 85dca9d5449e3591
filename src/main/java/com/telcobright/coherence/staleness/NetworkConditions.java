package com.telcobright.coherence.staleness;

/**
 * Connectivity as reported by the host environment.
 */
public final class NetworkConditions {

    public enum EffectiveType {
        SLOW_2G,
        TWO_G,
        THREE_G,
        FOUR_G,
        UNKNOWN
    }

    private final boolean online;
    private final EffectiveType effectiveType;
    private final boolean saveData;

    public NetworkConditions(boolean online, EffectiveType effectiveType, boolean saveData) {
        this.online = online;
        this.effectiveType = effectiveType;
        this.saveData = saveData;
    }

    public static NetworkConditions online() {
        return new NetworkConditions(true, EffectiveType.UNKNOWN, false);
    }

    public static NetworkConditions offline() {
        return new NetworkConditions(false, EffectiveType.UNKNOWN, false);
    }

    /**
     * Strategy suited to these conditions; {@code fallback} when the link type is unknown.
     */
    public SyncStrategy recommend(SyncStrategy fallback) {
        if (!online) {
            return SyncStrategy.OFF;
        }
        if (saveData) {
            return SyncStrategy.CONSERVATIVE;
        }
        switch (effectiveType) {
            case SLOW_2G:
            case TWO_G:
                return SyncStrategy.CONSERVATIVE;
            case THREE_G:
                return SyncStrategy.BALANCED;
            case FOUR_G:
                return SyncStrategy.AGGRESSIVE;
            default:
                return fallback;
        }
    }

    // Getters
    public boolean isOnline() { return online; }
    public EffectiveType getEffectiveType() { return effectiveType; }
    public boolean isSaveData() { return saveData; }

    @Override
    public String toString() {
        return String.format("NetworkConditions{online=%s, type=%s, saveData=%s}", online, effectiveType, saveData);
    }
}
