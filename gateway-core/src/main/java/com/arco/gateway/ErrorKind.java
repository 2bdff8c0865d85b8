package com.arco.gateway;

/**
 * Why a query failed. Carried by every failed {@link GatewayResult}.
 */
public enum ErrorKind {
    /** Unknown API name, invalid request or closed gateway. Never retried. */
    CONFIGURATION(false),
    /** Upstream answered 429. */
    RATE_LIMITED(true),
    /** Connection, DNS or TLS failure. */
    TRANSPORT(true),
    /** Connect, read or call deadline exceeded. */
    TIMEOUT(true),
    /** Any other non-2xx status. */
    UPSTREAM(true),
    /** The response body or the caller's processor failed on a 2xx response. */
    PROCESSING(false),
    /** The API's circuit breaker is open; no call was made. */
    CIRCUIT_OPEN(false),
    /** The calling thread was interrupted while waiting or calling. */
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
