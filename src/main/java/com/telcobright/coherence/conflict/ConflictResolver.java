package com.telcobright.coherence.conflict;

import com.telcobright.coherence.cache.CacheHandle;
import com.telcobright.coherence.cache.EntityCache;
import com.telcobright.coherence.entity.Entity;
import com.telcobright.coherence.entity.EntityVersions;
import com.telcobright.coherence.optimistic.OptimisticUpdateCoordinator;
import com.telcobright.coherence.remote.RemoteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.BinaryOperator;

/**
 * Settles conflicts between a speculative local version and the server version.
 *
 * LOCAL re-pushes the local version through the coordinator, REMOTE takes the
 * server version, MERGE combines both and pushes the result. Each conflict is
 * resolved once; a repeated call reports ALREADY_RESOLVED without touching the cache.
 */
public class ConflictResolver {
    private static final Logger logger = LoggerFactory.getLogger(ConflictResolver.class);

    private final CacheHandle handle;
    private final ConflictRegistry registry;
    private final OptimisticUpdateCoordinator coordinator;
    private final RemoteStore remoteStore;

    public ConflictResolver(CacheHandle handle, ConflictRegistry registry,
                            OptimisticUpdateCoordinator coordinator, RemoteStore remoteStore) {
        this.handle = handle;
        this.registry = registry;
        this.coordinator = coordinator;
        this.remoteStore = remoteStore;
    }

    public Resolution resolve(String conflictId, ResolutionStrategy strategy) {
        return resolve(conflictId, strategy, Set.of(), null);
    }

    /**
     * @param mergeFields local fields that win in a MERGE; empty means all local fields
     * @param mergeFn     custom merge, overriding {@code mergeFields}; may be null
     */
    public Resolution resolve(String conflictId, ResolutionStrategy strategy,
                              Set<String> mergeFields, BinaryOperator<Entity> mergeFn) {
        Optional<ConflictRecord> found = registry.find(conflictId);
        if (found.isEmpty()) {
            if (registry.wasResolved(conflictId)) {
                return Resolution.alreadyResolved(conflictId);
            }
            logger.warn("Cannot resolve unknown conflict {}", conflictId);
            return Resolution.notFound(conflictId);
        }
        ConflictRecord record = found.get();
        if (!registry.markResolved(conflictId, strategy.name())) {
            logger.debug("Conflict {} already resolved as {}", conflictId, record.getResolution());
            return Resolution.alreadyResolved(conflictId);
        }

        EntityCache cache = handle.getCache();
        Entity local = record.getLocal();
        Entity remote = record.getRemote();
        Resolution resolution;

        switch (strategy) {
            case LOCAL:
                resolution = Resolution.resolved(conflictId, strategy, local, push(local, record.isRemoteDeleted()));
                break;
            case REMOTE:
                if (remote == null) {
                    cache.remove(record.getEntityId());
                } else {
                    cache.applyResolved(remote);
                }
                resolution = Resolution.resolved(conflictId, strategy, remote, CompletableFuture.completedFuture(remote));
                break;
            case MERGE:
                if (remote == null) {
                    resolution = Resolution.resolved(conflictId, strategy, local, push(local, true));
                    break;
                }
                BinaryOperator<Entity> merger = mergeFn != null ? mergeFn : fieldMerge(mergeFields);
                Entity merged = merger.apply(local, remote);
                cache.applyResolved(merged);
                resolution = Resolution.resolved(conflictId, strategy, merged, push(merged, false));
                break;
            default:
                throw new IllegalArgumentException("Unsupported strategy: " + strategy);
        }
        logger.info("Resolved conflict {} on {} with {}", conflictId, record.getEntityId(), strategy);
        return resolution;
    }

    /**
     * Resolves without user input.
     */
    public Resolution autoResolve(String conflictId, AutoResolveStrategy strategy) {
        Optional<ConflictRecord> found = registry.find(conflictId);
        if (found.isEmpty()) {
            return registry.wasResolved(conflictId) ? Resolution.alreadyResolved(conflictId) : Resolution.notFound(conflictId);
        }
        return resolve(conflictId, choose(found.get(), strategy));
    }

    public List<Resolution> autoResolveAll(AutoResolveStrategy strategy) {
        List<Resolution> resolutions = new ArrayList<>();
        for (ConflictRecord record : registry.pending()) {
            resolutions.add(autoResolve(record.getConflictId(), strategy));
        }
        logger.info("Auto-resolved {} conflict(s) with {}", resolutions.size(), strategy);
        return resolutions;
    }

    /**
     * Manual strategy an automatic policy picks for a conflict.
     */
    public static ResolutionStrategy choose(ConflictRecord record, AutoResolveStrategy strategy) {
        switch (strategy) {
            case LOCAL_WINS:
                return ResolutionStrategy.LOCAL;
            case REMOTE_WINS:
                return ResolutionStrategy.REMOTE;
            case NEWEST_WINS:
                if (record.isRemoteDeleted()) {
                    return ResolutionStrategy.REMOTE;
                }
                Entity newest = EntityVersions.newest(record.getLocal(), record.getRemote());
                return newest == record.getLocal() ? ResolutionStrategy.LOCAL : ResolutionStrategy.REMOTE;
            default:
                throw new IllegalArgumentException("Unsupported strategy: " + strategy);
        }
    }

    /**
     * Remote fields overlaid with the local values of {@code fields} (all local fields
     * when empty); the version is the higher of the two.
     */
    public static BinaryOperator<Entity> fieldMerge(Set<String> fields) {
        return (local, remote) -> {
            Entity.Builder merged = remote.toBuilder()
                .version(Math.max(local.getVersion(), remote.getVersion()));
            for (Map.Entry<String, Object> entry : local.getFields().entrySet()) {
                if (fields.isEmpty() || fields.contains(entry.getKey())) {
                    merged.field(entry.getKey(), entry.getValue());
                }
            }
            return merged.build();
        };
    }

    private CompletableFuture<Entity> push(Entity entity, boolean recreate) {
        CompletableFuture<Entity> pushed;
        if (recreate) {
            pushed = coordinator.create(entity);
        } else {
            pushed = coordinator.mutate(entity.getId(),
                current -> entity,
                speculative -> remoteStore.update(entity.getEntityType(), entity.getId(), entity.getFields()));
        }
        pushed.whenComplete((result, failure) -> {
            if (failure != null) {
                logger.warn("Pushing resolved version of {} failed: {}", entity.getId(), failure.getMessage());
            }
        });
        return pushed;
    }
}
