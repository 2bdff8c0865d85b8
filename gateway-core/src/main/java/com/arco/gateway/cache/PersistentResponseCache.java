package com.arco.gateway.cache;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TTL cache of API responses keyed by request fingerprint, durable across restarts.
 *
 * The cache is an optimization only: read failures count as misses and write failures
 * are logged and dropped, so a broken store never fails a request. An expired entry is
 * indistinguishable from an absent one.
 */
public class PersistentResponseCache implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(PersistentResponseCache.class);

    private final CacheStore store;
    private final Duration ttl;
    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong expired = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();

    public PersistentResponseCache(CacheStore store, Duration ttl, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.store = store;
        this.ttl = ttl;
        this.clock = clock;
        logger.info("Response cache initialized: ttl={}s, store={}", ttl.toSeconds(),
            store.getClass().getSimpleName());
    }

    public Optional<JsonNode> get(String target, Map<String, ?> params) {
        return get(Fingerprint.of(target, params));
    }

    /**
     * Fresh payload for {@code fingerprint}, or empty if absent, expired or unreadable.
     */
    public Optional<JsonNode> get(String fingerprint) {
        return getEntry(fingerprint).map(CacheEntry::payload);
    }

    /**
     * Fresh entry for {@code fingerprint}, including its write time.
     */
    public Optional<CacheEntry> getEntry(String fingerprint) {
        Optional<CacheEntry> entry;
        try {
            entry = store.read(fingerprint);
        } catch (IOException e) {
            logger.warn("Cache read failed for {}, treating as miss: {}", fingerprint, e.getMessage());
            misses.incrementAndGet();
            return Optional.empty();
        }

        if (entry.isEmpty()) {
            misses.incrementAndGet();
            return Optional.empty();
        }

        if (entry.get().isExpired(clock.instant(), ttl)) {
            logger.debug("Cache expired for {}", fingerprint);
            expired.incrementAndGet();
            misses.incrementAndGet();
            evict(fingerprint);
            return Optional.empty();
        }

        hits.incrementAndGet();
        return entry;
    }

    public void set(String target, Map<String, ?> params, JsonNode payload) {
        set(Fingerprint.of(target, params), payload);
    }

    /**
     * Persist {@code payload}; failures are logged and swallowed.
     */
    public void set(String fingerprint, JsonNode payload) {
        try {
            store.write(new CacheEntry(fingerprint, payload, clock.instant()));
            writes.incrementAndGet();
            logger.debug("Cache saved for {}", fingerprint);
        } catch (CacheWriteException e) {
            writeFailures.incrementAndGet();
            logger.warn("Cache write failed for {}: {}", fingerprint,
                e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        }
    }

    /**
     * Remove every expired entry from the store.
     *
     * @return number of entries removed, or 0 if the store could not be purged
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        try {
            int removed = store.deleteStoredBefore(cutoff);
            if (removed > 0) {
                logger.info("Purged {} expired cache entries", removed);
            }
            return removed;
        } catch (IOException e) {
            logger.warn("Cache purge failed: {}", e.getMessage());
            return 0;
        }
    }

    public void clear() {
        try {
            store.clear();
        } catch (IOException e) {
            logger.warn("Cache clear failed: {}", e.getMessage());
        }
    }

    public Stats getStats() {
        return new Stats(hits.get(), misses.get(), expired.get(), writes.get(), writeFailures.get());
    }

    @Override
    public void close() {
        try {
            store.close();
        } catch (IOException e) {
            logger.warn("Error closing cache store: {}", e.getMessage());
        }
    }

    private void evict(String fingerprint) {
        try {
            store.delete(fingerprint);
        } catch (IOException e) {
            logger.debug("Could not evict expired entry {}: {}", fingerprint, e.getMessage());
        }
    }

    public record Stats(long hits, long misses, long expired, long writes, long writeFailures) {
    }
}
