package com.telcobright.coherence.entity;

/**
 * Cache entry states.
 */
public enum EntryState {
    /** Matches the server as of {@code fetchedAt}. */
    CONFIRMED,
    /** Speculative local write awaiting server confirmation. */
    OPTIMISTIC,
    /** Known to be outdated; served until refetched. */
    STALE,
    EVICTED
}
