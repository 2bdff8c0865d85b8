package com.arco.gateway.ratelimit;

import com.arco.gateway.config.ConfigurationException;

import java.time.Duration;

/**
 * Rate and concurrency limits for one named API. Immutable once registered.
 */
public record ApiRegistration(
    String name,
    double callsPerSecond,
    int maxConcurrent
) {
    public ApiRegistration {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("API name is required");
        }
        if (!(callsPerSecond > 0) || Double.isInfinite(callsPerSecond)) {
            throw new ConfigurationException(
                "callsPerSecond must be a positive number for API '" + name + "': " + callsPerSecond);
        }
        if (maxConcurrent < 1) {
            throw new ConfigurationException(
                "maxConcurrent must be at least 1 for API '" + name + "': " + maxConcurrent);
        }
    }

    /**
     * Interval between grants with no backoff or acceleration applied.
     */
    public Duration baseInterval() {
        return Duration.ofNanos(Math.round(1_000_000_000d / callsPerSecond));
    }
}
