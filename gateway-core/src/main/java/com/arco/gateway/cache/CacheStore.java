package com.arco.gateway.cache;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable storage for cache entries, one entry per fingerprint. Implementations do not
 * check freshness; {@link PersistentResponseCache} does.
 */
public interface CacheStore extends Closeable {

    Optional<CacheEntry> read(String fingerprint) throws IOException;

    /**
     * Insert or replace the entry for its fingerprint. Last writer wins.
     */
    void write(CacheEntry entry) throws CacheWriteException;

    void delete(String fingerprint) throws IOException;

    /**
     * Remove every entry stored before {@code cutoff}.
     *
     * @return number of entries removed
     */
    int deleteStoredBefore(Instant cutoff) throws IOException;

    void clear() throws IOException;

    int size() throws IOException;
}
