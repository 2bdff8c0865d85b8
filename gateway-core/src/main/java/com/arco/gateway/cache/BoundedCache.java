package com.arco.gateway.cache;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory LRU cache with a fixed capacity.
 *
 * Backed by an access-ordered {@link LinkedHashMap}, so the map's iteration order is the
 * recency order and eviction always drops the least recently used key. Structural changes
 * and hit/miss counters share one lock.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class BoundedCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> map;
    private final ReentrantLock lock = new ReentrantLock();

    private long hits;
    private long misses;

    /**
     * @param maxSize maximum number of entries (must be > 0)
     * @throws IllegalArgumentException if maxSize <= 0
     */
    public BoundedCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;
        this.map = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedCache.this.maxSize;
            }
        };
    }

    /**
     * Look up {@code key}, marking it most recently used on a hit.
     */
    public Optional<V> get(K key) {
        lock.lock();
        try {
            V value = map.get(key);
            if (value != null) {
                hits++;
                return Optional.of(value);
            }
            misses++;
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Insert or replace {@code key}. A new key evicts the least recently used entry when full.
     */
    public void set(K key, V value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("BoundedCache does not accept null keys or values");
        }
        lock.lock();
        try {
            map.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Membership test; does not change recency or counters.
     */
    public boolean containsKey(K key) {
        lock.lock();
        try {
            return map.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public Optional<V> remove(K key) {
        lock.lock();
        try {
            return Optional.ofNullable(map.remove(key));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return map.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxSize() {
        return maxSize;
    }

    /**
     * Keys from least to most recently used.
     */
    public List<K> keys() {
        lock.lock();
        try {
            return List.copyOf(map.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every entry and reset the hit/miss counters in one step.
     */
    public void clear() {
        lock.lock();
        try {
            map.clear();
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
    }

    public Stats getStats() {
        lock.lock();
        try {
            long total = hits + misses;
            double hitRate = total > 0 ? (double) hits / total : 0.0;
            return new Stats(map.size(), maxSize, hits, misses, hitRate, (double) map.size() / maxSize);
        } finally {
            lock.unlock();
        }
    }

    public record Stats(int size, int maxSize, long hits, long misses, double hitRate, double utilization) {
    }
}
