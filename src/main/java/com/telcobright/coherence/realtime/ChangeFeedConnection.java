package com.telcobright.coherence.realtime;

import com.telcobright.coherence.api.ConnectionState;
import com.telcobright.coherence.api.ConnectionStatus;
import com.telcobright.coherence.api.DisconnectReason;
import com.telcobright.coherence.api.SyncStatusPublisher;
import com.telcobright.coherence.remote.ChangeEvent;
import com.telcobright.coherence.remote.RemoteFailures;
import com.telcobright.coherence.remote.RemoteStore;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.subscription.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes one table's change feed and keeps it connected.
 *
 * States: DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED(ERROR | TIMEOUT | CLOSED).
 * After an error or timeout a reconnect is scheduled with exponential backoff; once
 * the attempt limit is reached the feed stays DISCONNECTED(PERMANENT) until
 * {@link #reconnect()}. A delivered event resets the attempt counter. A feed closed
 * by the server is not reopened automatically.
 *
 * Every (re)connect starts a new generation; callbacks from older subscriptions
 * are ignored.
 */
public class ChangeFeedConnection {
    private static final Logger logger = LoggerFactory.getLogger(ChangeFeedConnection.class);

    private final String table;
    private final RemoteStore remoteStore;
    private final ChangeEventReconciler reconciler;
    private final ReconnectPolicy policy;
    private final ScheduledExecutorService scheduler;
    private final SyncStatusPublisher publisher;
    private final Clock clock;

    private final Object lock = new Object();
    private boolean running;
    private long generation;
    private int attempts;
    private Cancellable subscription;
    private ScheduledFuture<?> pendingReconnect;
    private ConnectionStatus status;

    private final AtomicLong eventsReceived = new AtomicLong();

    public ChangeFeedConnection(String table, RemoteStore remoteStore, ChangeEventReconciler reconciler,
                                ReconnectPolicy policy, ScheduledExecutorService scheduler,
                                SyncStatusPublisher publisher, Clock clock) {
        this.table = table;
        this.remoteStore = remoteStore;
        this.reconciler = reconciler;
        this.policy = policy;
        this.scheduler = scheduler;
        this.publisher = publisher;
        this.clock = clock;
        this.status = ConnectionStatus.initial(table, clock.instant());
    }

    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
            attempts = 0;
            logger.info("Starting change feed for table: {}", table);
            connectLocked();
        }
    }

    /**
     * Tears down the current subscription and connects again with a fresh attempt
     * budget. Also leaves the PERMANENT state.
     */
    public void reconnect() {
        synchronized (lock) {
            logger.info("Manual reconnect of change feed: {}", table);
            running = true;
            attempts = 0;
            cancelLocked();
            connectLocked();
        }
    }

    public void stop() {
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            generation++;
            cancelLocked();
            updateStatusLocked(ConnectionState.DISCONNECTED, DisconnectReason.STOPPED, null);
            logger.info("Stopped change feed for table: {} (events received: {})", table, eventsReceived.get());
        }
    }

    public ConnectionStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    public String getTable() {
        return table;
    }

    public long getEventsReceived() {
        return eventsReceived.get();
    }

    private void connectLocked() {
        long current = ++generation;
        updateStatusLocked(ConnectionState.CONNECTING, DisconnectReason.NONE, status.getLastError());

        Multi<ChangeEvent> feed;
        try {
            feed = remoteStore.subscribeChanges(table);
        } catch (RuntimeException e) {
            onFailure(current, e);
            return;
        }
        Cancellable cancellable = feed
            .onSubscription().invoke(ignored -> onSubscribed(current))
            .subscribe().with(
                event -> onEvent(current, event),
                failure -> onFailure(current, failure),
                () -> onClosed(current));
        if (current == generation) {
            subscription = cancellable;
        }
    }

    private void onSubscribed(long current) {
        synchronized (lock) {
            if (current != generation) {
                return;
            }
            updateStatusLocked(ConnectionState.CONNECTED, DisconnectReason.NONE, null);
            logger.info("Change feed connected: {}", table);
        }
    }

    private void onEvent(long current, ChangeEvent event) {
        synchronized (lock) {
            if (current != generation) {
                return;
            }
            if (attempts > 0) {
                attempts = 0;
                updateStatusLocked(status.getState(), status.getReason(), status.getLastError());
            }
        }
        eventsReceived.incrementAndGet();
        try {
            reconciler.apply(event);
        } catch (RuntimeException e) {
            logger.error("Failed to apply change event {} from {}", event, table, e);
        }
    }

    private void onFailure(long current, Throwable failure) {
        synchronized (lock) {
            if (current != generation) {
                return;
            }
            subscription = null;
            Throwable cause = RemoteFailures.unwrap(failure);
            DisconnectReason reason = cause instanceof TimeoutException ? DisconnectReason.TIMEOUT : DisconnectReason.ERROR;
            String message = RemoteFailures.messageOf(cause);
            logger.warn("Change feed {} disconnected ({}): {}", table, reason, message);
            updateStatusLocked(ConnectionState.DISCONNECTED, reason, message);
            scheduleReconnectLocked();
        }
    }

    private void onClosed(long current) {
        synchronized (lock) {
            if (current != generation) {
                return;
            }
            subscription = null;
            updateStatusLocked(ConnectionState.DISCONNECTED, DisconnectReason.CLOSED, null);
            logger.info("Change feed {} closed by the server", table);
        }
    }

    private void scheduleReconnectLocked() {
        if (!running || !policy.isAutoReconnect()) {
            return;
        }
        if (attempts >= policy.getMaxAttempts()) {
            logger.error("Giving up on change feed {} after {} reconnect attempt(s)", table, attempts);
            updateStatusLocked(ConnectionState.DISCONNECTED, DisconnectReason.PERMANENT, status.getLastError());
            return;
        }
        Duration delay = policy.delayFor(attempts);
        attempts++;
        updateStatusLocked(status.getState(), status.getReason(), status.getLastError());
        long current = generation;
        logger.info("Reconnecting change feed {} in {} ms (attempt {}/{})",
            table, delay.toMillis(), attempts, policy.getMaxAttempts());
        pendingReconnect = scheduler.schedule(() -> attemptReconnect(current), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void attemptReconnect(long scheduledAt) {
        synchronized (lock) {
            if (!running || scheduledAt != generation) {
                return;
            }
            pendingReconnect = null;
            connectLocked();
        }
    }

    private void cancelLocked() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
        if (subscription != null) {
            subscription.cancel();
            subscription = null;
        }
    }

    private void updateStatusLocked(ConnectionState state, DisconnectReason reason, String lastError) {
        Instant now = clock.instant();
        Instant connectedSince = state == ConnectionState.CONNECTED
            ? (status.getState() == ConnectionState.CONNECTED ? status.getConnectedSince() : now)
            : null;
        status = new ConnectionStatus(table, state, reason, lastError, attempts, connectedSince, now);
        if (publisher != null) {
            publisher.publishConnection(status);
        }
    }
}
