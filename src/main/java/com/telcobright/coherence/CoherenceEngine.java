package com.telcobright.coherence;

import com.telcobright.coherence.api.ConnectionState;
import com.telcobright.coherence.api.ConnectionStatus;
import com.telcobright.coherence.api.EngineStatistics;
import com.telcobright.coherence.api.HealthStatus;
import com.telcobright.coherence.api.SyncStatus;
import com.telcobright.coherence.api.SyncStatusPublisher;
import com.telcobright.coherence.batch.BatchMutationExecutor;
import com.telcobright.coherence.batch.BulkOperations;
import com.telcobright.coherence.batch.OptimisticMutationDispatcher;
import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.ViewKey;
import com.telcobright.coherence.cache.ViewLoader;
import com.telcobright.coherence.cache.ViewRegistry;
import com.telcobright.coherence.conflict.ConflictRegistry;
import com.telcobright.coherence.conflict.ConflictResolver;
import com.telcobright.coherence.config.EngineConfig;
import com.telcobright.coherence.optimistic.OptimisticUpdateCoordinator;
import com.telcobright.coherence.realtime.ChangeEventDeserializer;
import com.telcobright.coherence.realtime.ChangeEventReconciler;
import com.telcobright.coherence.realtime.ReconcileOutcome;
import com.telcobright.coherence.realtime.ChangeFeedConnection;
import com.telcobright.coherence.realtime.ReconnectPolicy;
import com.telcobright.coherence.remote.RemoteStore;
import com.telcobright.coherence.staleness.BackgroundSync;
import com.telcobright.coherence.staleness.CacheCommand;
import com.telcobright.coherence.staleness.CacheCommandExecutor;
import com.telcobright.coherence.staleness.ContextTransition;
import com.telcobright.coherence.staleness.StalenessPolicy;
import com.telcobright.coherence.staleness.ViewScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single entry point wiring the cache, the mutation paths, the change feeds and
 * the refresh policy around one {@link RemoteStore}.
 *
 * Lifecycle: construct, register entity types and view scopes, {@link #initialize()},
 * connect feeds, and finally {@link #shutdown()}, which waits for in-flight
 * mutations up to the mutation timeout.
 */
public class CoherenceEngine {
    private static final Logger logger = LoggerFactory.getLogger(CoherenceEngine.class);

    private final EngineConfig config;
    private final RemoteStore remoteStore;
    private final CacheHandle handle;
    private final SyncStatusPublisher publisher;
    private final ConflictRegistry conflicts;
    private final OptimisticUpdateCoordinator coordinator;
    private final ConflictResolver resolver;
    private final ChangeEventReconciler reconciler;
    private final ChangeEventDeserializer deserializer;
    private final ViewLoader viewLoader;
    private final BatchMutationExecutor batchExecutor;
    private final BulkOperations bulkOperations;
    private final StalenessPolicy stalenessPolicy;
    private final CacheCommandExecutor commandExecutor;
    private final BackgroundSync backgroundSync;
    private final ReconnectPolicy reconnectPolicy;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService batchPool;
    private final boolean ownsExecutors;

    // Change feeds by table
    private final Map<String, ChangeFeedConnection> feeds = new ConcurrentHashMap<>();

    // State management
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private Instant startTime;

    public CoherenceEngine(String name, RemoteStore remoteStore, EngineConfig config) {
        this(name, remoteStore, config, Clock.systemUTC(),
            Executors.newSingleThreadScheduledExecutor(daemonThreads(name + "-scheduler")),
            Executors.newCachedThreadPool(daemonThreads(name + "-batch")), true);
    }

    /**
     * Uses caller-owned executors; they are not shut down with the engine.
     */
    public CoherenceEngine(String name, RemoteStore remoteStore, EngineConfig config, Clock clock,
                           ScheduledExecutorService scheduler, ExecutorService batchPool) {
        this(name, remoteStore, config, clock, scheduler, batchPool, false);
    }

    private CoherenceEngine(String name, RemoteStore remoteStore, EngineConfig config, Clock clock,
                            ScheduledExecutorService scheduler, ExecutorService batchPool, boolean ownsExecutors) {
        this.config = config;
        this.remoteStore = remoteStore;
        this.scheduler = scheduler;
        this.batchPool = batchPool;
        this.ownsExecutors = ownsExecutors;

        this.handle = new CacheHandle(name, new ViewRegistry(), clock);
        this.publisher = new SyncStatusPublisher();
        this.conflicts = new ConflictRegistry(publisher, config.getConflictHistorySize(), clock);
        this.handle.getCache().addPinSource(conflicts::hasPending);

        this.coordinator = new OptimisticUpdateCoordinator(handle, remoteStore, config);
        this.resolver = new ConflictResolver(handle, conflicts, coordinator, remoteStore);
        this.reconciler = new ChangeEventReconciler(handle, conflicts, resolver, config.getAutoResolveStrategy());
        this.deserializer = new ChangeEventDeserializer(config.getVersionField());
        this.viewLoader = new ViewLoader(handle, remoteStore);
        // Bulk items share the coordinator's per-id queue with single mutations
        this.batchExecutor = new BatchMutationExecutor(handle, new OptimisticMutationDispatcher(coordinator), config, batchPool);
        this.bulkOperations = new BulkOperations(batchExecutor, config.getBatchSize());
        this.stalenessPolicy = new StalenessPolicy(handle, config);
        this.commandExecutor = new CacheCommandExecutor(handle, viewLoader, remoteStore);
        this.backgroundSync = new BackgroundSync(handle, commandExecutor, config, scheduler, publisher);
        this.reconnectPolicy = ReconnectPolicy.from(config);
    }

    /**
     * Registers list, count, count-by-status and detail views for an entity type.
     *
     * @param listFields fields the list view filters or displays
     */
    public void registerEntityType(String entityType, String... listFields) {
        handle.getViewRegistry().registerStandardViews(entityType, listFields);
        logger.info("Registered entity type: {}", entityType);
    }

    public void registerView(ViewScope view) {
        stalenessPolicy.registerView(view);
    }

    public void initialize() {
        if (initialized.compareAndSet(false, true)) {
            logger.info("Initializing coherence engine '{}'...", handle.getName());
            startTime = handle.getClock().instant();
            handle.init();
            try {
                backgroundSync.start();
            } catch (Exception e) {
                logger.error("Failed to start background sync", e);
            }
            logger.info("Coherence engine '{}' initialized: batchSize={}, syncStrategy={}",
                handle.getName(), config.getBatchSize(), config.getSyncStrategy());
        }
    }

    /**
     * Subscribes to a table's change feed; calling it again for the same table
     * returns the existing connection.
     */
    public ChangeFeedConnection connectFeed(String table) {
        handle.ensureOpen();
        ChangeFeedConnection created = new ChangeFeedConnection(table, remoteStore, reconciler,
            reconnectPolicy, scheduler, publisher, handle.getClock());
        ChangeFeedConnection existing = feeds.putIfAbsent(table, created);
        if (existing != null) {
            return existing;
        }
        created.start();
        return created;
    }

    public void disconnectFeed(String table) {
        ChangeFeedConnection feed = feeds.remove(table);
        if (feed != null) {
            feed.stop();
        }
    }

    /**
     * Decodes one change-feed JSON payload received outside a subscription (a
     * webhook, a replayed log) and reconciles it like a feed event.
     *
     * @throws com.telcobright.coherence.remote.RemoteStoreException for malformed payloads
     */
    public ReconcileOutcome applyChangePayload(String json) {
        handle.ensureOpen();
        return reconciler.apply(deserializer.deserialize(json));
    }

    public Optional<ChangeFeedConnection> getFeed(String table) {
        return Optional.ofNullable(feeds.get(table));
    }

    /**
     * Applies the refresh and eviction the transition calls for.
     */
    public CompletableFuture<Void> onContextTransition(ContextTransition transition) {
        handle.ensureOpen();
        List<CacheCommand> commands = stalenessPolicy.onContextTransition(transition);
        return commandExecutor.execute(commands);
    }

    /**
     * Prefetches the given views unless they are cached and younger than their stale time.
     */
    public CompletableFuture<Void> warmCache(Map<ViewKey, Duration> staleTimes) {
        handle.ensureOpen();
        return commandExecutor.execute(stalenessPolicy.warm(staleTimes));
    }

    public CompletableFuture<Void> warmScope(String scope) {
        handle.ensureOpen();
        return commandExecutor.execute(stalenessPolicy.warmScope(scope));
    }

    public EngineStatistics getStatistics() {
        EntityCache cache = handle.getCache();
        return EngineStatistics.builder()
            .cacheHits(cache.getHits())
            .cacheMisses(cache.getMisses())
            .totalEntries(cache.size())
            .cachedViews(cache.getViewCount())
            .viewInvalidations(cache.getViewInvalidations())
            .viewFetches(viewLoader.getFetchCount())
            .staleDiscards(cache.getStaleDiscards())
            .mutationsCommitted(coordinator.getCommittedCount())
            .mutationsRolledBack(coordinator.getRolledBackCount())
            .batchItemsSucceeded(batchExecutor.getItemsSucceeded())
            .batchItemsFailed(batchExecutor.getItemsFailed())
            .eventsApplied(reconciler.getAppliedCount())
            .conflictsDetected(cache.getConflictsDetected())
            .pendingConflicts(conflicts.pendingCount())
            .startTime(startTime)
            .currentTime(handle.getClock().instant())
            .build();
    }

    public HealthStatus getHealthStatus() {
        if (!handle.isOpen()) {
            return HealthStatus.unhealthy("Cache '" + handle.getName() + "' is not open");
        }
        HealthStatus.Builder health = HealthStatus.builder()
            .timestamp(handle.getClock().instant())
            .addCheck(new HealthStatus.HealthCheck("cache", true, "entries=" + handle.getCache().size()));

        boolean feedsHealthy = true;
        for (ChangeFeedConnection feed : feeds.values()) {
            ConnectionStatus status = feed.getStatus();
            boolean up = status.getState() != ConnectionState.DISCONNECTED;
            feedsHealthy &= up;
            health.addCheck(new HealthStatus.HealthCheck("feed:" + feed.getTable(), up,
                up ? status.getState().name() : status.getReason() + ": " + status.getLastError()));
        }

        SyncStatus sync = backgroundSync.getStatus();
        boolean syncHealthy = sync.getConsecutiveFailures() == 0;
        health.addCheck(new HealthStatus.HealthCheck("sync", syncHealthy,
            syncHealthy ? "strategy=" + sync.getStrategy() : sync.getLastError()));

        return health.feedsHealthy(feedsHealthy).syncHealthy(syncHealthy).build();
    }

    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down coherence engine '{}'...", handle.getName());

        for (ChangeFeedConnection feed : feeds.values()) {
            try {
                feed.stop();
            } catch (Exception e) {
                logger.error("Error stopping change feed: {}", feed.getTable(), e);
            }
        }
        feeds.clear();

        try {
            backgroundSync.stop();
        } catch (Exception e) {
            logger.error("Error stopping background sync", e);
        }

        handle.shutdown(config.getMutationTimeout());
        publisher.complete();

        if (ownsExecutors) {
            scheduler.shutdownNow();
            batchPool.shutdown();
            try {
                if (!batchPool.awaitTermination(config.getMutationTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    batchPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                batchPool.shutdownNow();
            }
        }
        logger.info("Coherence engine '{}' shutdown complete", handle.getName());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        return runnable -> {
            Thread thread = new Thread(runnable, prefix);
            thread.setDaemon(true);
            return thread;
        };
    }

    // Getters
    public EngineConfig getConfig() { return config; }
    public CacheHandle getHandle() { return handle; }
    public EntityCache getCache() { return handle.getCache(); }
    public SyncStatusPublisher getPublisher() { return publisher; }
    public ConflictRegistry getConflicts() { return conflicts; }
    public OptimisticUpdateCoordinator getCoordinator() { return coordinator; }
    public ConflictResolver getResolver() { return resolver; }
    public ChangeEventReconciler getReconciler() { return reconciler; }
    public ViewLoader getViewLoader() { return viewLoader; }
    public BatchMutationExecutor getBatchExecutor() { return batchExecutor; }
    public BulkOperations getBulkOperations() { return bulkOperations; }
    public StalenessPolicy getStalenessPolicy() { return stalenessPolicy; }
    public BackgroundSync getBackgroundSync() { return backgroundSync; }
    public Map<String, ChangeFeedConnection> getFeeds() { return Collections.unmodifiableMap(feeds); }
}
