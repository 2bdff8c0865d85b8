package com.arco.gateway.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached payload and the time it was written.
 */
public record CacheEntry(
    String fingerprint,
    JsonNode payload,
    Instant storedAt
) {
    /**
     * An entry is expired once strictly more than {@code ttl} has passed since it was stored.
     */
    public boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(storedAt, now).compareTo(ttl) > 0;
    }
}
