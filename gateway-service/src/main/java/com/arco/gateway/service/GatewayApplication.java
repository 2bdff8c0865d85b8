package com.arco.gateway.service;

import com.arco.gateway.ApiGateway;
import com.arco.gateway.config.ConfigurationException;
import com.arco.gateway.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service entry point: builds one gateway from configuration, serves it over HTTP and
 * tears both down on shutdown.
 */
public final class GatewayApplication {
    private static final Logger logger = LoggerFactory.getLogger(GatewayApplication.class);

    private GatewayApplication() {
    }

    public static void main(String[] args) {
        GatewayConfig config;
        try {
            config = GatewayConfig.load();
        } catch (ConfigurationException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        var metricsService = new MetricsService();
        var gateway = ApiGateway.create(config, metricsService.getRegistry());
        var server = new GatewayServer(gateway, metricsService);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping gateway...");
            server.stop();
            gateway.close();
            metricsService.close();
        }, "gateway-shutdown"));

        server.start(config.getServerPort());
        logger.info("ARCO API Gateway running with {} registered APIs", gateway.apiSnapshots().size());
    }
}
