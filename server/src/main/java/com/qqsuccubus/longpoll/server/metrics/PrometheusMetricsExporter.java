package com.qqsuccubus.longpoll.server.metrics;

import com.qqsuccubus.longpoll.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Serves the {@code /metrics} scrape. Queue and poll meters from {@link MetricsService} and
 * Reactor Netty's HTTP server meters all land in the global registry, which this exporter
 * mirrors into a Prometheus registry tagged with the node id.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String nodeId) {
        this(Metrics.REGISTRY, nodeId);
    }

    PrometheusMetricsExporter(MeterRegistry registry, String nodeId) {
        this.registry = registry;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        } else {
            log.warn("Registry {} is not composite; /metrics only shows meters registered on the exporter",
                registry.getClass().getSimpleName());
        }
        prometheusRegistry.config().commonTags(MetricsTags.NODE_ID, nodeId);
        log.info("Prometheus exporter attached for node {}", nodeId);
    }

    /**
     * Prometheus text exposition of every meter seen so far.
     */
    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
