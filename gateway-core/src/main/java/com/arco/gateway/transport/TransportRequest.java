package com.arco.gateway.transport;

import com.arco.gateway.HttpMethod;

import java.util.Map;

/**
 * @param method  GET sends params as the query string, POST as a JSON body
 * @param url     absolute target URL
 * @param params  request parameters
 * @param headers extra headers, sent as given
 */
public record TransportRequest(
    HttpMethod method,
    String url,
    Map<String, Object> params,
    Map<String, String> headers
) {
    public TransportRequest {
        params = params == null ? Map.of() : params;
        headers = headers == null ? Map.of() : headers;
    }
}
