package com.arco.gateway;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Per-call transformation of a successful raw payload, applied before caching.
 */
@FunctionalInterface
public interface ResponseProcessor {

    ResponseProcessor IDENTITY = raw -> raw;

    JsonNode process(JsonNode raw);
}
