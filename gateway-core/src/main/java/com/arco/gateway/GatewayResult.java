package com.arco.gateway;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Outcome of one logical query. Callers check {@link #success()} instead of catching.
 *
 * @param success   true when a payload was obtained
 * @param payload   processed payload; null on failure
 * @param status    last HTTP status seen, or -1 if no response was received
 * @param errorKind failure category; null on success
 * @param detail    human-readable failure detail; null on success
 * @param fromCache true when served from cache without a network call
 * @param latency   wall time spent inside the gateway
 * @param attempts  network calls made (0 for cache hits and immediate rejections)
 */
public record GatewayResult(
    boolean success,
    JsonNode payload,
    int status,
    ErrorKind errorKind,
    String detail,
    boolean fromCache,
    Duration latency,
    int attempts
) {
    public static final int NO_STATUS = -1;

    public static GatewayResult cached(JsonNode payload, Duration latency) {
        return new GatewayResult(true, payload, NO_STATUS, null, null, true, latency, 0);
    }

    public static GatewayResult success(JsonNode payload, int status, Duration latency, int attempts) {
        return new GatewayResult(true, payload, status, null, null, false, latency, attempts);
    }

    public static GatewayResult failure(ErrorKind kind, int status, String detail, Duration latency, int attempts) {
        return new GatewayResult(false, null, status, kind, detail, false, latency, attempts);
    }
}
