package com.telcobright.coherence.optimistic;

import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.remote.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Undo records for destructive operations, each valid for a fixed window.
 */
public class UndoLog {
    private static final Logger logger = LoggerFactory.getLogger(UndoLog.class);

    private final Map<String, UndoRecord> records = new ConcurrentHashMap<>();
    private final Duration window;
    private final Clock clock;

    public UndoLog(Duration window, Clock clock) {
        this.window = window;
        this.clock = clock;
    }

    public UndoRecord register(Entity snapshot, Supplier<CompletableFuture<Entity>> reverseAction) {
        purgeExpired();
        Instant now = clock.instant();
        UndoRecord record = new UndoRecord(UUID.randomUUID().toString(), snapshot, now, now.plus(window), reverseAction);
        records.put(record.getUndoId(), record);
        logger.debug("Registered undo {} for {} until {}", record.getUndoId(), snapshot.getId(), record.getExpiresAt());
        return record;
    }

    public Optional<UndoRecord> get(String undoId) {
        return Optional.ofNullable(records.get(undoId));
    }

    /**
     * Runs the reverse action once. Fails with NOT_FOUND for unknown ids, EXPIRED after
     * the window and ALREADY_RESOLVED on repeated execution. Expired records are only
     * dropped by {@link #purgeExpired()}.
     */
    public CompletableFuture<Entity> execute(String undoId) {
        UndoRecord record = records.get(undoId);
        if (record == null) {
            return CompletableFuture.failedFuture(
                new MutationException(null, ErrorKind.NOT_FOUND, "Unknown undo record: " + undoId));
        }
        String entityId = record.getSnapshot().getId();
        if (record.isExpired(clock.instant())) {
            return CompletableFuture.failedFuture(
                new MutationException(entityId, ErrorKind.EXPIRED, "Undo window elapsed for " + entityId));
        }
        if (!record.claim()) {
            return CompletableFuture.failedFuture(
                new MutationException(entityId, ErrorKind.ALREADY_RESOLVED, "Undo already executed for " + entityId));
        }
        logger.info("Executing undo {} for {}", undoId, entityId);
        CompletableFuture<Entity> restored;
        try {
            restored = record.runReverseAction();
        } catch (RuntimeException e) {
            restored = CompletableFuture.failedFuture(e);
        }
        return restored;
    }

    /**
     * Drops records that expired more than one window ago. Recently expired ones stay
     * so a late undo still reports EXPIRED rather than NOT_FOUND.
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(window);
        int before = records.size();
        records.values().removeIf(record -> record.isExpired(cutoff));
        return before - records.size();
    }

    public int size() {
        return records.size();
    }
}
