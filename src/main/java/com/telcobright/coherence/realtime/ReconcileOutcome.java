package com.telcobright.coherence.realtime;

/**
 * What applying one change event did to the cache.
 */
public enum ReconcileOutcome {
    APPLIED,
    DISCARDED_STALE,
    CONFLICT,
    REMOVED
}
