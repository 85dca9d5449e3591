package com.telcobright.coherence.staleness;

import com.telcobright.coherence.api.SyncStatus;
import com.telcobright.coherence.api.SyncStatusPublisher;
import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.CollectionView;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.ViewKey;
import com.telcobright.coherence.cache.ViewRegistry;
import com.telcobright.coherence.config.EngineConfig;
import com.telcobright.coherence.entity.CacheEntry;
import com.telcobright.coherence.entity.EntryState;
import com.telcobright.coherence.remote.RemoteFailures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically refetches stale views and entries while the application is in use.
 *
 * The interval is the configured sync interval scaled by the current strategy,
 * which follows the network conditions. Nothing runs while paused, offline or
 * (optionally) hidden. A failed round is retried after {@code retryDelay * attempt}
 * up to the configured number of retries, then the regular interval resumes.
 */
public class BackgroundSync {
    private static final Logger logger = LoggerFactory.getLogger(BackgroundSync.class);

    private final CacheHandle handle;
    private final CacheCommandExecutor commandExecutor;
    private final ScheduledExecutorService scheduler;
    private final SyncStatusPublisher publisher;

    private final Duration syncInterval;
    private final Duration staleTime;
    private final int maxRetries;
    private final Duration retryDelay;
    private final SyncStrategy configuredStrategy;
    private final boolean onlyWhenVisible;

    private boolean active;
    private boolean paused;
    private boolean visible = true;
    private boolean syncing;
    private NetworkConditions network = NetworkConditions.online();
    private SyncStrategy strategy;
    private int failedAttempts;
    private int consecutiveFailures;
    private String lastError;
    private Instant lastSyncAt;
    private Instant nextSyncAt;
    private ScheduledFuture<?> scheduled;

    // Statistics
    private final AtomicLong roundsCompleted = new AtomicLong();
    private final AtomicLong roundsFailed = new AtomicLong();

    public BackgroundSync(CacheHandle handle, CacheCommandExecutor commandExecutor, EngineConfig config,
                          ScheduledExecutorService scheduler, SyncStatusPublisher publisher) {
        this.handle = handle;
        this.commandExecutor = commandExecutor;
        this.scheduler = scheduler;
        this.publisher = publisher;
        this.syncInterval = config.getSyncInterval();
        this.staleTime = config.getStaleTime();
        this.maxRetries = config.getSyncMaxRetries();
        this.retryDelay = config.getSyncRetryDelay();
        this.configuredStrategy = config.getSyncStrategy();
        this.onlyWhenVisible = config.isSyncOnlyWhenVisible();
        this.strategy = configuredStrategy;
    }

    public synchronized void start() {
        if (active) {
            return;
        }
        active = true;
        logger.info("Starting background sync: strategy={}, interval={} ms", strategy, currentInterval().toMillis());
        scheduleLocked(currentInterval());
        publishLocked();
    }

    public synchronized void stop() {
        if (!active) {
            return;
        }
        active = false;
        cancelScheduledLocked();
        logger.info("Stopped background sync (rounds completed: {}, failed: {})",
            roundsCompleted.get(), roundsFailed.get());
        publishLocked();
    }

    public synchronized void pause() {
        paused = true;
        cancelScheduledLocked();
        logger.debug("Background sync paused");
        publishLocked();
    }

    public synchronized void resume() {
        if (!paused) {
            return;
        }
        paused = false;
        logger.debug("Background sync resumed");
        scheduleLocked(currentInterval());
        publishLocked();
    }

    public synchronized void setVisible(boolean visible) {
        boolean regained = visible && !this.visible;
        this.visible = visible;
        if (!visible && onlyWhenVisible) {
            cancelScheduledLocked();
        } else if (regained) {
            scheduleLocked(currentInterval());
        }
        publishLocked();
    }

    /**
     * Adopts new network conditions. Coming back online triggers an immediate round.
     */
    public void updateNetwork(NetworkConditions conditions) {
        boolean cameOnline;
        synchronized (this) {
            cameOnline = !network.isOnline() && conditions.isOnline();
            network = conditions;
            SyncStrategy next = configuredStrategy == SyncStrategy.OFF
                ? SyncStrategy.OFF
                : conditions.recommend(configuredStrategy);
            if (next != strategy) {
                logger.info("Sync strategy changed from {} to {} ({})", strategy, next, conditions);
                strategy = next;
            }
            scheduleLocked(currentInterval());
            publishLocked();
        }
        if (cameOnline) {
            triggerSync();
        }
    }

    /**
     * Runs a round now.
     *
     * @return true when the round ran and every refetch succeeded; false when it was
     *         skipped or failed
     */
    public CompletableFuture<Boolean> triggerSync() {
        List<CacheCommand> commands;
        synchronized (this) {
            if (!canSyncLocked() || syncing) {
                logger.debug("Skipping sync round (active={}, paused={}, online={}, visible={}, syncing={})",
                    active, paused, network.isOnline(), visible, syncing);
                return CompletableFuture.completedFuture(false);
            }
            syncing = true;
            cancelScheduledLocked();
            commands = staleCommands();
            publishLocked();
        }
        logger.debug("Sync round: {} command(s)", commands.size());
        CompletableFuture<Void> round;
        try {
            round = commandExecutor.execute(commands);
        } catch (RuntimeException e) {
            round = CompletableFuture.failedFuture(e);
        }
        return round.handle((ignored, failure) -> finishRound(failure));
    }

    private synchronized boolean finishRound(Throwable failure) {
        syncing = false;
        if (failure == null) {
            failedAttempts = 0;
            consecutiveFailures = 0;
            lastError = null;
            lastSyncAt = handle.getClock().instant();
            roundsCompleted.incrementAndGet();
            scheduleLocked(currentInterval());
            publishLocked();
            return true;
        }

        roundsFailed.incrementAndGet();
        failedAttempts++;
        consecutiveFailures++;
        lastError = RemoteFailures.messageOf(failure);
        if (failedAttempts <= maxRetries) {
            Duration delay = retryDelay.multipliedBy(failedAttempts);
            logger.warn("Sync round failed (attempt {}/{}), retrying in {} ms: {}",
                failedAttempts, maxRetries, delay.toMillis(), lastError);
            scheduleLocked(delay);
        } else {
            logger.error("Sync round failed {} time(s), waiting for the next interval: {}", failedAttempts, lastError);
            failedAttempts = 0;
            scheduleLocked(currentInterval());
        }
        publishLocked();
        return false;
    }

    /**
     * Invalid or outdated views that once held data, plus entries marked stale.
     */
    private List<CacheCommand> staleCommands() {
        EntityCache cache = handle.getCache();
        ViewRegistry registry = handle.getViewRegistry();
        Instant now = handle.getClock().instant();
        List<CacheCommand> commands = new ArrayList<>();

        List<ViewKey> staleViews = new ArrayList<>();
        for (Map.Entry<ViewKey, CollectionView> entry : cache.snapshotViews().entrySet()) {
            CollectionView view = entry.getValue();
            if (view.getUpdateCount() > 0
                    && (!view.isValid() || view.isOlderThan(staleTime, now))
                    && registry.getDefinition(entry.getKey()).isPresent()) {
                staleViews.add(entry.getKey());
            }
        }
        staleViews.sort(Comparator.comparing(ViewKey::toString));
        staleViews.forEach(key -> commands.add(CacheCommand.refetchView(key)));

        for (CacheEntry entry : cache.entriesInState(EntryState.STALE)) {
            if (!cache.hasInFlight(entry.getId())) {
                commands.add(CacheCommand.refetchEntity(entry.getEntity().getEntityType(), entry.getId()));
            }
        }
        return commands;
    }

    private boolean canSyncLocked() {
        return active && !paused && network.isOnline() && strategy != SyncStrategy.OFF
            && (visible || !onlyWhenVisible);
    }

    private Duration currentInterval() {
        return Duration.ofMillis((long) (syncInterval.toMillis() * strategy.getIntervalMultiplier()));
    }

    private void scheduleLocked(Duration delay) {
        cancelScheduledLocked();
        if (!canSyncLocked()) {
            return;
        }
        nextSyncAt = handle.getClock().instant().plus(delay);
        scheduled = scheduler.schedule(this::runScheduled, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runScheduled() {
        synchronized (this) {
            scheduled = null;
        }
        triggerSync();
    }

    private void cancelScheduledLocked() {
        nextSyncAt = null;
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduled = null;
        }
    }

    private void publishLocked() {
        if (publisher != null) {
            publisher.publishSync(statusLocked());
        }
    }

    private SyncStatus statusLocked() {
        return new SyncStatus(active && !paused, syncing, strategy, lastSyncAt, nextSyncAt, failedAttempts,
            consecutiveFailures, lastError);
    }

    public synchronized SyncStatus getStatus() {
        return statusLocked();
    }

    // Getters
    public synchronized SyncStrategy getStrategy() { return strategy; }
    public synchronized boolean isPaused() { return paused; }
    public long getRoundsCompleted() { return roundsCompleted.get(); }
    public long getRoundsFailed() { return roundsFailed.get(); }
}
