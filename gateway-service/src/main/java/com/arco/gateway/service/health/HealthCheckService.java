package com.arco.gateway.service.health;

import com.arco.gateway.ApiGateway;
import com.arco.gateway.GatewayStats;
import com.arco.gateway.ratelimit.RateLimiterSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Health of the gateway and its components.
 */
public final class HealthCheckService {
    private static final Logger logger = LoggerFactory.getLogger(HealthCheckService.class);

    private final ApiGateway gateway;

    public HealthCheckService(ApiGateway gateway) {
        this.gateway = gateway;
    }

    public HealthStatus getHealth() {
        Map<String, ComponentHealth> components = new LinkedHashMap<>();

        if (gateway.isClosed()) {
            components.put("gateway", new ComponentHealth(Status.DOWN, "Gateway closed", null));
            return new HealthStatus(Status.DOWN, Instant.now(), components);
        }

        GatewayStats stats;
        try {
            stats = gateway.getStats();
        } catch (RuntimeException e) {
            logger.error("Gateway health check failed", e);
            components.put("gateway", new ComponentHealth(Status.DOWN, "Stats unavailable", e.getMessage()));
            return new HealthStatus(Status.DOWN, Instant.now(), components);
        }

        components.put("gateway", new ComponentHealth(Status.UP, "Accepting queries", null));
        components.put("cache", checkCache(stats));
        components.put("rate_limiter", checkRateLimiter(stats));

        boolean anyDegraded = components.values().stream()
            .anyMatch(c -> c.status() == Status.DEGRADED);

        return new HealthStatus(anyDegraded ? Status.DEGRADED : Status.UP, Instant.now(), components);
    }

    private ComponentHealth checkCache(GatewayStats stats) {
        if (stats.responseCache() == null) {
            return new ComponentHealth(Status.UP, "Persistent cache disabled", null);
        }
        long writeFailures = stats.responseCache().writeFailures();
        if (writeFailures > 0) {
            return new ComponentHealth(Status.DEGRADED, "Cache writes failing", writeFailures + " failed writes");
        }
        return new ComponentHealth(Status.UP, "Cache writable", null);
    }

    private ComponentHealth checkRateLimiter(GatewayStats stats) {
        String backingOff = stats.apis().stream()
            .filter(api -> api.consecutiveErrors() > 0)
            .map(RateLimiterSnapshot::name)
            .collect(Collectors.joining(", "));
        if (!backingOff.isEmpty()) {
            return new ComponentHealth(Status.DEGRADED, "Backing off: " + backingOff, null);
        }
        return new ComponentHealth(Status.UP, stats.apis().size() + " APIs registered", null);
    }

    public enum Status {
        UP,       // All systems operational
        DEGRADED, // Some upstreams failing but queries still served
        DOWN      // Gateway closed
    }

    public record HealthStatus(
        Status status,
        Instant timestamp,
        Map<String, ComponentHealth> components
    ) {
    }

    public record ComponentHealth(
        Status status,
        String message,
        String error
    ) {
    }
}
