package com.arco.gateway.metrics;

import com.arco.gateway.ErrorKind;
import com.arco.gateway.GatewayResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Passive aggregation of call outcomes: totals, success rate, average latency and
 * failures by kind. Optionally mirrors every call into a Micrometer registry.
 *
 * Observes only; no method throws.
 */
public final class PerformanceMonitor {
    private static final Logger logger = LoggerFactory.getLogger(PerformanceMonitor.class);

    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long cacheHits;
    private Duration totalLatency = Duration.ZERO;
    private Duration averageLatency = Duration.ZERO;
    private final Map<ErrorKind, Long> failuresByKind = new EnumMap<>(ErrorKind.class);
    private Instant lastReset;

    public PerformanceMonitor(MeterRegistry meterRegistry, Clock clock) {
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.lastReset = clock.instant();
    }

    public PerformanceMonitor() {
        this(null, Clock.systemUTC());
    }

    /**
     * Count one completed call.
     */
    public void recordCall(boolean success, Duration latency) {
        Duration safeLatency = latency == null || latency.isNegative() ? Duration.ZERO : latency;
        lock.lock();
        try {
            totalCalls++;
            if (success) {
                successfulCalls++;
            } else {
                failedCalls++;
            }
            totalLatency = totalLatency.plus(safeLatency);
            averageLatency = totalLatency.dividedBy(totalCalls);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Count a live (non-cached) query outcome and publish it to the meter registry.
     */
    public void recordCall(String apiName, GatewayResult result) {
        if (result == null) {
            return;
        }
        recordCall(result.success(), result.latency());
        if (!result.success() && result.errorKind() != null) {
            lock.lock();
            try {
                failuresByKind.merge(result.errorKind(), 1L, Long::sum);
            } finally {
                lock.unlock();
            }
        }
        publish(apiName, result);
    }

    public void recordCacheHit(String apiName) {
        lock.lock();
        try {
            cacheHits++;
        } finally {
            lock.unlock();
        }
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("gateway.cache.hit", "api", String.valueOf(apiName)).increment();
        } catch (RuntimeException e) {
            logger.debug("Failed to publish cache hit metric: {}", e.getMessage());
        }
    }

    public Summary getSummary() {
        lock.lock();
        try {
            double successRate = totalCalls == 0 ? 0.0 : (double) successfulCalls / totalCalls;
            Duration uptime = Duration.between(lastReset, clock.instant());
            return new Summary(totalCalls, successRate, averageLatency, failedCalls,
                uptime.isNegative() ? Duration.ZERO : uptime, cacheHits, Map.copyOf(failuresByKind));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Zero all counters and restart the uptime clock.
     */
    public void reset() {
        lock.lock();
        try {
            totalCalls = 0;
            successfulCalls = 0;
            failedCalls = 0;
            cacheHits = 0;
            totalLatency = Duration.ZERO;
            averageLatency = Duration.ZERO;
            failuresByKind.clear();
            lastReset = clock.instant();
        } finally {
            lock.unlock();
        }
        logger.info("Performance metrics reset");
    }

    private void publish(String apiName, GatewayResult result) {
        if (meterRegistry == null) {
            return;
        }
        try {
            String api = String.valueOf(apiName);
            Timer.builder("gateway.api.call")
                .tag("api", api)
                .tag("outcome", result.success() ? "success" : "failure")
                .register(meterRegistry)
                .record(result.latency() == null ? Duration.ZERO : result.latency());
            if (result.success()) {
                meterRegistry.counter("gateway.api.success", "api", api).increment();
            } else {
                meterRegistry.counter("gateway.api.failure",
                    "api", api,
                    "error", String.valueOf(result.errorKind())).increment();
            }
        } catch (RuntimeException e) {
            logger.debug("Failed to publish call metrics for {}: {}", apiName, e.getMessage());
        }
    }

    /**
     * @param totalCalls       live calls recorded since the last reset
     * @param successRate      successful / total, 0 when no calls
     * @param averageLatency   mean latency per call
     * @param failCount        failed calls
     * @param uptimeSinceReset time since construction or the last reset
     * @param cacheHits        queries answered from cache
     * @param failuresByKind   failed calls per error kind
     */
    public record Summary(
        long totalCalls,
        double successRate,
        Duration averageLatency,
        long failCount,
        Duration uptimeSinceReset,
        long cacheHits,
        Map<ErrorKind, Long> failuresByKind
    ) {
    }
}
