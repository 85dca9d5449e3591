package com.telcobright.coherence.conflict;

/**
 * Manual conflict resolution choices.
 */
public enum ResolutionStrategy {
    /** Keep the local version and push it again. */
    LOCAL,
    /** Drop local changes and take the server version. */
    REMOTE,
    /** Combine both and push the result. */
    MERGE
}
