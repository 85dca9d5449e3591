package com.telcobright.coherence.cache;

import com.telcobright.coherence.entity.ChangeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry of view definitions and the "invalidating A also invalidates B"
 * relation between view families. The relation is kept transitively closed, so
 * lookups at invalidation time never walk the graph.
 */
public class ViewRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ViewRegistry.class);

    public static final String DEFAULT_STATUS_FIELD = "status";

    // family -> definition
    private final Map<ViewKey, ViewDefinition> definitions = new ConcurrentHashMap<>();

    // direct edges and their closure, both family -> families
    private final Map<ViewKey, Set<ViewKey>> directLinks = new ConcurrentHashMap<>();
    private volatile Map<ViewKey, Set<ViewKey>> closure = Map.of();

    public void register(ViewDefinition definition) {
        ViewDefinition previous = definitions.put(definition.getFamily(), definition);
        if (previous != null) {
            logger.warn("Replacing view definition for {}", definition.getFamily());
        }
        logger.debug("Registered view definition: {}", definition);
    }

    /**
     * Registers list, count, count-by-status and detail views for an entity type.
     *
     * @param listFields fields the list view filters or orders by
     */
    public void registerStandardViews(String entityType, String... listFields) {
        register(ViewDefinition.list(entityType, listFields));
        register(ViewDefinition.count(entityType));
        register(ViewDefinition.countByStatus(entityType, DEFAULT_STATUS_FIELD));
        register(ViewDefinition.detail(entityType));
        logger.info("Registered standard views for entity type: {}", entityType);
    }

    /**
     * Declares that invalidating {@code from} must also invalidate {@code to}.
     */
    public synchronized void link(ViewKey from, ViewKey to) {
        directLinks.computeIfAbsent(from.family(), k -> ConcurrentHashMap.newKeySet()).add(to.family());
        closure = computeClosure();
        logger.debug("Linked view invalidation {} -> {}", from.family(), to.family());
    }

    public Optional<ViewDefinition> getDefinition(ViewKey key) {
        return Optional.ofNullable(definitions.get(key.family()));
    }

    public List<ViewDefinition> definitionsFor(String entityType) {
        return definitions.values().stream()
            .filter(definition -> definition.getFamily().getEntityType().equals(entityType))
            .collect(Collectors.toList());
    }

    /**
     * Families reachable from {@code family} through the invalidation relation,
     * excluding the family itself.
     */
    public Set<ViewKey> invalidates(ViewKey family) {
        return closure.getOrDefault(family.family(), Collections.emptySet());
    }

    /**
     * View families whose content a change could alter, closed under the
     * invalidation relation.
     *
     * @param changedFields fields touched by an UPDATE, or null when unknown
     */
    public Set<ViewKey> affectedFamilies(ChangeKind kind, String entityType, Set<String> changedFields) {
        Set<ViewKey> affected = new HashSet<>();
        for (ViewDefinition definition : definitions.values()) {
            if (!definition.getFamily().getEntityType().equals(entityType)) {
                continue;
            }
            boolean hit;
            if (kind == ChangeKind.UPDATE) {
                hit = definition.dependsOnAny(changedFields);
            } else {
                hit = definition.isMembershipSensitive();
            }
            if (hit) {
                affected.add(definition.getFamily());
            }
        }
        Set<ViewKey> transitive = new HashSet<>();
        for (ViewKey family : affected) {
            transitive.addAll(invalidates(family));
        }
        affected.addAll(transitive);
        return affected;
    }

    private Map<ViewKey, Set<ViewKey>> computeClosure() {
        Map<ViewKey, Set<ViewKey>> result = new ConcurrentHashMap<>();
        for (ViewKey start : directLinks.keySet()) {
            Set<ViewKey> reached = new HashSet<>();
            Deque<ViewKey> pending = new ArrayDeque<>(directLinks.get(start));
            while (!pending.isEmpty()) {
                ViewKey next = pending.poll();
                if (next.equals(start) || !reached.add(next)) {
                    continue;
                }
                pending.addAll(directLinks.getOrDefault(next, Collections.emptySet()));
            }
            result.put(start, Collections.unmodifiableSet(reached));
        }
        return result;
    }
}
