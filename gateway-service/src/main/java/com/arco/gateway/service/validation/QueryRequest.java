package com.arco.gateway.service.validation;

import com.arco.gateway.GatewayRequest;
import com.arco.gateway.HttpMethod;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.Map;

/**
 * Validated body of {@code POST /api/gateway/query}.
 */
public record QueryRequest(
    @NotBlank(message = "API name is required")
    String api,

    @NotBlank(message = "Target URL is required")
    @Pattern(regexp = "^https?://.+", message = "Target must be an absolute http(s) URL")
    String target,

    Map<String, Object> params,

    @Pattern(regexp = "^(GET|POST)$", message = "Method must be GET or POST")
    String method,

    Boolean useCache
) {
    public GatewayRequest toGatewayRequest() {
        return GatewayRequest.builder(api, target)
            .params(params)
            .method(method == null ? HttpMethod.GET : HttpMethod.valueOf(method))
            .useCache(useCache == null || useCache)
            .build();
    }
}
