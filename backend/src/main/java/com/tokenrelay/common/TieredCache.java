package com.tokenrelay.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;

/**
 * Two-tier in-memory cache. The standard tier holds entries with a per-entry TTL in insertion order; entries read
 * {@code hotThreshold} times are promoted to the hot tier, which is consulted first.
 * <p>
 * Eviction on overflow is by insertion order (oldest inserted key first), not LRU. Expired entries read as absent
 * and are dropped lazily on {@link #get(String)}; a periodic sweep removes the rest. Hot entries share the
 * standard entry's deadline, so a value is never returned after {@code storedAt + ttl}.
 */
@Slf4j
public class TieredCache implements AutoCloseable {

    public static final int DEFAULT_HOT_THRESHOLD = 10;

    private final String name;
    private final int maxSize;
    private final Duration defaultTtl;
    private final int hotThreshold;
    private final Clock clock;

    private final LinkedHashMap<String, Entry> standard = new LinkedHashMap<>();
    private final Map<String, Entry> hot = new HashMap<>();
    private final List<Runnable> sweepListeners = new CopyOnWriteArrayList<>();
    private final ScheduledFuture<?> sweepTask;

    public TieredCache(String name, int maxSize, Duration defaultTtl, int hotThreshold, Clock clock,
                       TaskScheduler scheduler, Duration sweepInterval) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        this.name = name;
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.hotThreshold = Math.max(1, hotThreshold);
        this.clock = clock;
        this.sweepTask = scheduler.scheduleWithFixedDelay(this::runSweep, Instant.now().plus(sweepInterval), sweepInterval);
    }

    @SuppressWarnings("unchecked")
    public synchronized <T> Optional<T> get(String key) {
        long now = clock.millis();
        Entry hotEntry = hot.get(key);
        if (hotEntry != null) {
            if (!hotEntry.isExpired(now)) {
                return Optional.of((T) hotEntry.value);
            }
            hot.remove(key);
        }
        Entry entry = standard.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(now)) {
            standard.remove(key);
            return Optional.empty();
        }
        entry.hitCount++;
        if (entry.hitCount >= hotThreshold) {
            hot.put(key, entry);
        }
        return Optional.of((T) entry.value);
    }

    public void set(String key, Object value) {
        set(key, value, defaultTtl);
    }

    public synchronized void set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        // put on an existing key keeps its insertion position
        standard.put(key, new Entry(value, clock.millis(), effectiveTtl.toMillis()));
        hot.remove(key);
        if (standard.size() > maxSize) {
            Iterator<String> oldest = standard.keySet().iterator();
            String evicted = oldest.next();
            oldest.remove();
            hot.remove(evicted);
            log.trace("Cache {} evicted {}", name, evicted);
        }
    }

    /**
     * Present values for the given keys, in the order given.
     */
    public synchronized <T> Map<String, T> getMany(Collection<String> keys) {
        Map<String, T> result = new LinkedHashMap<>();
        for (String key : keys) {
            this.<T>get(key).ifPresent(v -> result.put(key, v));
        }
        return result;
    }

    public synchronized void setMany(Map<String, ?> entries) {
        entries.forEach(this::set);
    }

    public synchronized void invalidate(String key) {
        standard.remove(key);
        hot.remove(key);
    }

    public synchronized void invalidate(Collection<String> keys) {
        keys.forEach(this::invalidate);
    }

    public synchronized void clear() {
        standard.clear();
        hot.clear();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(name, hot.size(), standard.size(), hot.size() + standard.size(), maxSize);
    }

    /**
     * Removes expired standard entries together with their hot copies.
     *
     * @return number of entries removed
     */
    public synchronized int sweepExpired() {
        long now = clock.millis();
        List<String> expired = new ArrayList<>();
        standard.forEach((key, entry) -> {
            if (entry.isExpired(now)) {
                expired.add(key);
            }
        });
        for (String key : expired) {
            standard.remove(key);
            hot.remove(key);
        }
        return expired.size();
    }

    /**
     * Registers work to run after every periodic sweep (owners evict their own bookkeeping alongside the cache).
     */
    public void addSweepListener(Runnable listener) {
        sweepListeners.add(listener);
    }

    public String getName() {
        return name;
    }

    void runSweep() {
        try {
            int removed = sweepExpired();
            if (removed > 0) {
                log.debug("Cache {} swept {} expired entries", name, removed);
            }
            sweepListeners.forEach(Runnable::run);
        } catch (RuntimeException e) {
            log.warn("Cache {} sweep failed", name, e);
        }
    }

    @Override
    public void close() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
        }
        clear();
    }

    private static final class Entry {

        private final Object value;
        private final long storedAt;
        private final long ttlMs;
        private int hitCount;

        private Entry(Object value, long storedAt, long ttlMs) {
            this.value = value;
            this.storedAt = storedAt;
            this.ttlMs = ttlMs;
        }

        private boolean isExpired(long now) {
            return now - storedAt >= ttlMs;
        }
    }
}
