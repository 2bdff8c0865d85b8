package com.arco.gateway;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One logical query against a named API.
 *
 * @param apiName   registered API whose rate limit applies
 * @param target    absolute URL
 * @param params    query parameters for GET, JSON body fields for POST
 * @param method    HTTP verb
 * @param useCache  whether a cached response may be served and a fresh one stored
 * @param headers   caller-supplied headers (credentials are passed through untouched)
 * @param processor applied to a successful payload before it is cached and returned
 */
public record GatewayRequest(
    String apiName,
    String target,
    Map<String, Object> params,
    HttpMethod method,
    boolean useCache,
    Map<String, String> headers,
    ResponseProcessor processor
) {
    public GatewayRequest {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        method = method == null ? HttpMethod.GET : method;
        processor = processor == null ? ResponseProcessor.IDENTITY : processor;
    }

    public static GatewayRequest get(String apiName, String target, Map<String, ?> params) {
        return builder(apiName, target).params(params).build();
    }

    public static Builder builder(String apiName, String target) {
        return new Builder(apiName, target);
    }

    public static final class Builder {
        private final String apiName;
        private final String target;
        private final Map<String, Object> params = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private HttpMethod method = HttpMethod.GET;
        private boolean useCache = true;
        private ResponseProcessor processor = ResponseProcessor.IDENTITY;

        private Builder(String apiName, String target) {
            this.apiName = apiName;
            this.target = target;
        }

        public Builder params(Map<String, ?> values) {
            if (values != null) {
                params.putAll(values);
            }
            return this;
        }

        public Builder param(String name, Object value) {
            params.put(name, value);
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
            return this;
        }

        public Builder method(HttpMethod value) {
            this.method = value;
            return this;
        }

        public Builder useCache(boolean value) {
            this.useCache = value;
            return this;
        }

        public Builder processor(ResponseProcessor value) {
            this.processor = value;
            return this;
        }

        public GatewayRequest build() {
            return new GatewayRequest(apiName, target, params, method, useCache, headers, processor);
        }
    }
}
