package com.arco.gateway;

/**
 * Verbs the gateway can issue. Only GET responses are cached.
 */
public enum HttpMethod {
    GET,
    POST;

    public boolean isCacheable() {
        return this == GET;
    }
}
