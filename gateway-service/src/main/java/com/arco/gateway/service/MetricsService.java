package com.arco.gateway.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus-backed meter registry for the service. The gateway publishes its call
 * timers and counters here; {@code /metrics} serves {@link #scrape()}.
 */
public final class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    private final PrometheusMeterRegistry registry;

    public MetricsService() {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        registry.config().commonTags("service", "arco-api-gateway");
        logger.info("MetricsService initialized with Prometheus registry");
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Prometheus text exposition of every registered meter.
     */
    public String scrape() {
        return registry.scrape();
    }

    public void close() {
        registry.close();
    }
}
