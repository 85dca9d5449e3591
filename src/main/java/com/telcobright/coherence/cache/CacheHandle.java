package com.telcobright.coherence.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one cache instance and its lifecycle. Components receive the handle in
 * their constructor; there is no process-wide cache.
 */
public class CacheHandle {
    private static final Logger logger = LoggerFactory.getLogger(CacheHandle.class);

    private final String name;
    private final ViewRegistry viewRegistry;
    private final EntityCache cache;
    private final Clock clock;
    private final List<Drainable> drainables = new CopyOnWriteArrayList<>();

    // State management
    private final AtomicBoolean initialized = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public CacheHandle(String name, ViewRegistry viewRegistry, Clock clock) {
        this.name = name;
        this.viewRegistry = viewRegistry;
        this.clock = clock;
        this.cache = new EntityCache(viewRegistry, clock);
    }

    public static CacheHandle create(String name) {
        return new CacheHandle(name, new ViewRegistry(), Clock.systemUTC());
    }

    public void init() {
        if (initialized.compareAndSet(false, true)) {
            logger.info("Cache '{}' initialized", name);
        }
    }

    public boolean isOpen() {
        return initialized.get() && !shutdown.get();
    }

    /**
     * @throws IllegalStateException when the handle is not initialized or already shut down
     */
    public void ensureOpen() {
        if (!initialized.get()) {
            throw new IllegalStateException("Cache '" + name + "' not initialized");
        }
        if (shutdown.get()) {
            throw new IllegalStateException("Cache '" + name + "' is shut down");
        }
    }

    public void registerDrainable(Drainable drainable) {
        drainables.add(drainable);
    }

    /**
     * Stops accepting work and waits for in-flight mutations to settle.
     *
     * @return true when everything drained within the timeout
     */
    public boolean shutdown(Duration timeout) {
        if (!shutdown.compareAndSet(false, true)) {
            return true;
        }
        logger.info("Shutting down cache '{}'...", name);
        boolean drained = true;
        for (Drainable drainable : drainables) {
            try {
                drained &= drainable.drain(timeout);
            } catch (Exception e) {
                logger.error("Error draining {}", drainable.getClass().getSimpleName(), e);
                drained = false;
            }
        }
        if (!drained) {
            logger.warn("Cache '{}' shut down with unsettled in-flight work", name);
        }
        logger.info("Cache '{}' shutdown complete: entries={}, views={}", name, cache.size(), cache.getViewCount());
        return drained;
    }

    // Getters
    public String getName() { return name; }
    public EntityCache getCache() { return cache; }
    public ViewRegistry getViewRegistry() { return viewRegistry; }
    public Clock getClock() { return clock; }
}
