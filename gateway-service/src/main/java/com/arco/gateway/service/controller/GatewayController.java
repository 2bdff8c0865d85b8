package com.arco.gateway.service.controller;

import com.arco.gateway.ApiGateway;
import com.arco.gateway.GatewayResult;
import com.arco.gateway.service.validation.QueryRequest;
import io.javalin.Javalin;
import io.javalin.http.Context;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints over one {@link ApiGateway}: stats, registered APIs, ad-hoc queries
 * and maintenance actions.
 */
public final class GatewayController {
    private static final Logger logger = LoggerFactory.getLogger(GatewayController.class);
    private static final Validator validator = Validation.buildDefaultValidatorFactory().getValidator();

    private final ApiGateway gateway;

    public GatewayController(ApiGateway gateway) {
        this.gateway = gateway;
    }

    public void registerRoutes(Javalin app) {
        app.get("/api/gateway/stats", this::getStats);
        app.get("/api/gateway/apis", this::getApis);
        app.post("/api/gateway/query", this::query);
        app.post("/api/gateway/cache/purge", this::purgeCache);
        app.post("/api/gateway/monitor/reset", this::resetMonitor);
    }

    private void getStats(Context ctx) {
        ctx.json(gateway.getStats());
    }

    private void getApis(Context ctx) {
        ctx.json(gateway.apiSnapshots());
    }

    /**
     * Run one query. A failed query is still a 200 carrying the failed result;
     * only an invalid body is a 400.
     */
    private void query(Context ctx) {
        QueryRequest request;
        try {
            request = ctx.bodyAsClass(QueryRequest.class);
        } catch (Exception e) {
            logger.debug("Unreadable query body: {}", e.getMessage());
            ctx.status(400).json(Map.of(
                "valid", false,
                "errors", List.of(Map.of("field", "body", "message", "Request body must be a JSON object"))
            ));
            return;
        }
        if (request == null) {
            ctx.status(400).json(Map.of(
                "valid", false,
                "errors", List.of(Map.of("field", "body", "message", "Request body is required"))
            ));
            return;
        }

        var violations = validator.validate(request);
        if (!violations.isEmpty()) {
            var errors = violations.stream()
                .map(v -> Map.of(
                    "field", v.getPropertyPath().toString(),
                    "message", v.getMessage()
                ))
                .toList();
            ctx.status(400).json(Map.of(
                "valid", false,
                "errors", errors
            ));
            return;
        }

        GatewayResult result = gateway.query(request.toGatewayRequest());
        logger.atDebug()
            .addKeyValue("api", request.api())
            .addKeyValue("success", result.success())
            .addKeyValue("fromCache", result.fromCache())
            .log("Query via REST completed");
        ctx.json(result);
    }

    private void purgeCache(Context ctx) {
        int removed = gateway.purgeExpiredCache();
        ctx.json(Map.of("removed", removed));
    }

    private void resetMonitor(Context ctx) {
        gateway.resetMonitor();
        ctx.json(Map.of("reset", true));
    }
}
