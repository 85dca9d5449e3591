package com.telcobright.coherence.entity;

/**
 * Kind of data change, shared by mutation requests, change-feed events and view
 * invalidation.
 */
public enum ChangeKind {
    INSERT,
    UPDATE,
    DELETE
}
