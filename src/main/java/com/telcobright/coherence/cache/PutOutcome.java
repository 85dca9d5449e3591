package com.telcobright.coherence.cache;

/**
 * Result of a cache write under the entry transition rules.
 */
public enum PutOutcome {
    APPLIED,
    /** Incoming version is older than what the entry already reflects. */
    DISCARDED_STALE,
    /** Unconfirmed concurrent change against an optimistic entry; nothing written. */
    CONFLICT,
    /** The optimistic write's token was replaced by a conflict resolution. */
    SUPERSEDED,
    /** The entity was deleted remotely while the optimistic write was in flight. */
    CANCELLED
}
