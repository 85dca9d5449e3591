package com.telcobright.coherence.api;

/**
 * Why a change feed is disconnected.
 */
public enum DisconnectReason {
    NONE,
    ERROR,
    TIMEOUT,
    CLOSED,
    /** Reconnect attempts exhausted; stays down until a manual reconnect. */
    PERMANENT,
    STOPPED
}
