package com.telcobright.coherence.conflict;

/**
 * Unattended conflict policies.
 */
public enum AutoResolveStrategy {
    /** Higher version wins; equal versions go to the remote side. */
    NEWEST_WINS,
    LOCAL_WINS,
    REMOTE_WINS
}
