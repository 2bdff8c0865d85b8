package com.arco.gateway;

import com.arco.gateway.cache.BoundedCache;
import com.arco.gateway.cache.PersistentResponseCache;
import com.arco.gateway.metrics.PerformanceMonitor;
import com.arco.gateway.ratelimit.RateLimiterSnapshot;

import java.util.List;

/**
 * Point-in-time view of a gateway.
 *
 * @param calls         monitor summary
 * @param responseCache persistent cache counters, null when caching is disabled
 * @param memoryCache   in-memory tier counters
 * @param apis          limiter state per registered API, by name
 * @param closed        whether {@link ApiGateway#close()} has run
 */
public record GatewayStats(
    PerformanceMonitor.Summary calls,
    PersistentResponseCache.Stats responseCache,
    BoundedCache.Stats memoryCache,
    List<RateLimiterSnapshot> apis,
    boolean closed
) {
}
