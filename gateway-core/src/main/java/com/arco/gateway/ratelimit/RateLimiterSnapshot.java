package com.arco.gateway.ratelimit;

import java.time.Duration;

/**
 * Point-in-time view of one API's limiter state, for monitoring only.
 */
public record RateLimiterSnapshot(
    String name,
    double callsPerSecond,
    int maxConcurrent,
    int inFlight,
    int consecutiveErrors,
    int successStreak,
    Duration currentInterval
) {
}
