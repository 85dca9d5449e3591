package com.telcobright.coherence.entity;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;

/**
 * The one place entity versions are compared. Cache transition rules, the change
 * reconciler and the conflict resolver all go through here.
 *
 * Equal versions prefer the remote (server) side.
 */
public final class EntityVersions {

    public static final Comparator<Entity> BY_VERSION = Comparator.comparingLong(Entity::getVersion);

    private EntityVersions() {
    }

    public static int compare(long left, long right) {
        return Long.compare(left, right);
    }

    /**
     * True when {@code candidate} is strictly older than {@code reference}.
     */
    public static boolean isOlder(long candidate, long reference) {
        return compare(candidate, reference) < 0;
    }

    public static boolean isOlder(Entity candidate, Entity reference) {
        return isOlder(candidate.getVersion(), reference.getVersion());
    }

    /**
     * Whether an incoming remote entity may replace the current one.
     * Ties go to the incoming remote entity.
     */
    public static boolean remoteSupersedes(Entity remote, Entity current) {
        return current == null || !isOlder(remote, current);
    }

    /**
     * Newest of a local and a remote version of the same record. Ties prefer remote.
     */
    public static Entity newest(Entity local, Entity remote) {
        if (local == null) return remote;
        if (remote == null) return local;
        return compare(local.getVersion(), remote.getVersion()) > 0 ? local : remote;
    }

    /**
     * Converts an ISO-8601 timestamp into an epoch-millis version.
     */
    public static long fromTimestamp(String isoTimestamp) {
        try {
            return OffsetDateTime.parse(isoTimestamp).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return Instant.parse(isoTimestamp).toEpochMilli();
        }
    }
}
