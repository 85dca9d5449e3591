package com.telcobright.coherence.staleness;

import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.CollectionView;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.cache.ViewKey;
import com.telcobright.coherence.config.EngineConfig;
import com.telcobright.coherence.entity.CacheEntry;
import com.telcobright.coherence.entity.EntryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides what to refetch and what to evict as the user moves between screens.
 *
 * The policy only issues {@link CacheCommand}s; {@link CacheCommandExecutor}
 * carries them out. Transitions are handled one at a time.
 */
public class StalenessPolicy {
    private static final Logger logger = LoggerFactory.getLogger(StalenessPolicy.class);

    private final CacheHandle handle;
    private final Duration visibilityRefreshInterval;
    private final Duration detailRetention;

    private final Map<String, ViewScope> viewsByName = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastRefreshByScope = new HashMap<>();

    private ViewScope currentView;
    private String currentEntityId;

    public StalenessPolicy(CacheHandle handle, EngineConfig config) {
        this(handle, config.getVisibilityRefreshInterval(), config.getDetailRetention());
    }

    public StalenessPolicy(CacheHandle handle, Duration visibilityRefreshInterval, Duration detailRetention) {
        this.handle = handle;
        this.visibilityRefreshInterval = visibilityRefreshInterval;
        this.detailRetention = detailRetention;
    }

    public void registerView(ViewScope view) {
        ViewScope previous = viewsByName.put(view.getName(), view);
        if (previous != null) {
            logger.warn("Replaced view scope registration for {}", view.getName());
        }
    }

    public synchronized List<CacheCommand> onContextTransition(ContextTransition transition) {
        List<CacheCommand> commands;
        switch (transition.getType()) {
            case NAVIGATION:
                commands = navigate(transition);
                break;
            case VISIBILITY_REGAINED:
                commands = visibilityRegained();
                break;
            case NETWORK_REGAINED:
                commands = currentView == null ? List.of() : staleCommands(currentView, currentEntityId);
                break;
            case MANUAL_REFRESH:
                commands = currentView == null ? List.of() : refreshCommands(currentView, currentEntityId);
                break;
            default:
                throw new IllegalArgumentException("Unsupported transition: " + transition.getType());
        }
        if (!commands.isEmpty()) {
            logger.debug("{} -> {} command(s): {}", transition, commands.size(), commands);
        }
        return commands;
    }

    private List<CacheCommand> navigate(ContextTransition transition) {
        ViewScope target = viewsByName.get(transition.getViewName());
        ViewScope previous = currentView;
        List<CacheCommand> commands = new ArrayList<>();

        if (previous != null && (target == null || !previous.getScope().equals(target.getScope()))) {
            commands.addAll(leaveScope(previous.getScope()));
        }
        currentView = target;
        currentEntityId = transition.getEntityId();
        if (target == null) {
            logger.debug("Navigated to unregistered view {}", transition.getViewName());
            return commands;
        }

        List<CacheCommand> refetches = target.isAlwaysRefresh()
            ? refreshCommands(target, currentEntityId)
            : staleCommands(target, currentEntityId);
        if (!refetches.isEmpty()) {
            lastRefreshByScope.put(target.getScope(), now());
        }
        commands.addAll(refetches);
        return commands;
    }

    private List<CacheCommand> visibilityRegained() {
        if (currentView == null) {
            return List.of();
        }
        String scope = currentView.getScope();
        Instant last = lastRefreshByScope.get(scope);
        if (last != null && Duration.between(last, now()).compareTo(visibilityRefreshInterval) < 0) {
            logger.debug("Skipping visibility refresh of scope {}, last refresh at {}", scope, last);
            return List.of();
        }
        lastRefreshByScope.put(scope, now());
        return refreshCommands(currentView, currentEntityId);
    }

    /**
     * Prefetch commands for views about to be needed, each with its own stale time.
     * A view is only refetched when it is absent, invalid or older than its stale time.
     */
    public List<CacheCommand> warm(Map<ViewKey, Duration> staleTimes) {
        EntityCache cache = handle.getCache();
        Instant now = now();
        List<CacheCommand> commands = new ArrayList<>();
        for (Map.Entry<ViewKey, Duration> entry : staleTimes.entrySet()) {
            Optional<CollectionView> cached = cache.getView(entry.getKey());
            if (cached.isEmpty() || !cached.get().isValid() || cached.get().isOlderThan(entry.getValue(), now)) {
                commands.add(CacheCommand.refetchView(entry.getKey()));
            }
        }
        logger.debug("Warm-up of {} view(s): {} to fetch", staleTimes.size(), commands.size());
        return commands;
    }

    /**
     * Warms every view owned by the registered screens of {@code scope}, using each
     * screen's max age as the stale time.
     */
    public List<CacheCommand> warmScope(String scope) {
        Map<ViewKey, Duration> staleTimes = new LinkedHashMap<>();
        List<ViewScope> views = new ArrayList<>(viewsByName.values());
        views.sort((a, b) -> a.getName().compareTo(b.getName()));
        for (ViewScope view : views) {
            if (view.getScope().equals(scope)) {
                view.getOwnedViews().forEach(key -> staleTimes.putIfAbsent(key, view.getMaxAge()));
            }
        }
        return warm(staleTimes);
    }

    /**
     * Refetch commands for owned views that are missing, invalid or older than the
     * view's max age, plus the shown record when stale.
     */
    private List<CacheCommand> staleCommands(ViewScope view, String entityId) {
        EntityCache cache = handle.getCache();
        Instant now = now();
        List<CacheCommand> commands = new ArrayList<>();
        for (ViewKey key : view.getOwnedViews()) {
            Optional<CollectionView> cached = cache.getView(key);
            if (cached.isEmpty() || !cached.get().isValid() || cached.get().isOlderThan(view.getMaxAge(), now)) {
                commands.add(CacheCommand.refetchView(key));
            }
        }
        if (view.isShowsEntity() && entityId != null && !cache.hasInFlight(entityId)) {
            Optional<CacheEntry> entry = cache.getEntry(entityId);
            if (entry.isEmpty()
                    || entry.get().getState() == EntryState.STALE
                    || Duration.between(entry.get().getFetchedAt(), now).compareTo(view.getMaxAge()) > 0) {
                commands.add(CacheCommand.refetchEntity(view.getEntityType(), entityId));
            }
        }
        return commands;
    }

    private List<CacheCommand> refreshCommands(ViewScope view, String entityId) {
        List<CacheCommand> commands = new ArrayList<>();
        for (ViewKey key : view.getOwnedViews()) {
            commands.add(CacheCommand.refetchView(key));
        }
        if (view.isShowsEntity() && entityId != null && !handle.getCache().hasInFlight(entityId)) {
            commands.add(CacheCommand.refetchEntity(view.getEntityType(), entityId));
        }
        return commands;
    }

    /**
     * Views of the scope's entity types that never delivered data, and entries of
     * those types older than the retention threshold. Pinned ids are kept.
     */
    private List<CacheCommand> leaveScope(String scope) {
        Set<String> entityTypes = new LinkedHashSet<>();
        for (ViewScope view : viewsByName.values()) {
            if (view.getScope().equals(scope)) {
                entityTypes.add(view.getEntityType());
            }
        }
        EntityCache cache = handle.getCache();
        Instant now = now();
        List<CacheCommand> commands = new ArrayList<>();

        List<ViewKey> abandoned = new ArrayList<>();
        for (Map.Entry<ViewKey, CollectionView> entry : cache.snapshotViews().entrySet()) {
            if (entityTypes.contains(entry.getKey().getEntityType()) && entry.getValue().getUpdateCount() == 0) {
                abandoned.add(entry.getKey());
            }
        }
        abandoned.sort((a, b) -> a.toString().compareTo(b.toString()));
        abandoned.forEach(key -> commands.add(CacheCommand.evictView(key)));

        for (String entityType : entityTypes) {
            for (CacheEntry entry : cache.entriesOfType(entityType)) {
                if (Duration.between(entry.getFetchedAt(), now).compareTo(detailRetention) > 0
                        && !cache.isPinned(entry.getId())) {
                    commands.add(CacheCommand.evictEntity(entityType, entry.getId()));
                }
            }
        }
        logger.debug("Leaving scope {}: {} eviction(s)", scope, commands.size());
        return commands;
    }

    private Instant now() {
        return handle.getClock().instant();
    }

    // Getters
    public synchronized Optional<ViewScope> getCurrentView() { return Optional.ofNullable(currentView); }
    public Map<String, ViewScope> getRegisteredViews() { return Collections.unmodifiableMap(viewsByName); }
}
