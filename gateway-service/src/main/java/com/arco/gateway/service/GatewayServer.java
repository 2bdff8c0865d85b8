package com.arco.gateway.service;

import com.arco.gateway.ApiGateway;
import com.arco.gateway.service.controller.GatewayController;
import com.arco.gateway.service.health.HealthCheckService;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front of the gateway service: health, Prometheus metrics and the gateway REST API.
 */
public final class GatewayServer {
    private static final Logger logger = LoggerFactory.getLogger(GatewayServer.class);

    private final Javalin app;
    private final HealthCheckService healthCheckService;

    public GatewayServer(ApiGateway gateway, MetricsService metricsService) {
        this.healthCheckService = new HealthCheckService(gateway);

        this.app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;

            // Records, JsonNode payloads and java.time values
            var objectMapper = new ObjectMapper();
            objectMapper.registerModule(new JavaTimeModule());
            objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));
        });

        new GatewayController(gateway).registerRoutes(app);

        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(metricsService.scrape());
        });

        app.get("/health", ctx -> {
            var health = healthCheckService.getHealth();
            ctx.status(switch (health.status()) {
                case UP -> 200;
                case DEGRADED -> 200; // Still serving queries
                case DOWN -> 503;
            });
            ctx.json(health);
        });
    }

    /**
     * Start listening; port 0 picks a free port.
     */
    public void start(int port) {
        app.start(port);
        logger.info("Gateway server started at http://localhost:{}", app.port());
        logger.info("   REST API: http://localhost:{}/api/gateway/*", app.port());
        logger.info("   Health: http://localhost:{}/health", app.port());
        logger.info("   Metrics: http://localhost:{}/metrics", app.port());
    }

    public int port() {
        return app.port();
    }

    public void stop() {
        app.stop();
        logger.info("Gateway server stopped");
    }
}
