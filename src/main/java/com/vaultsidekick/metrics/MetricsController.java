package com.vaultsidekick.metrics;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints exposing sidekick metrics.
 *
 * /metrics is the Prometheus scrape target; the JSON views are for dashboards,
 * debugging tools, and tests.
 */
@RestController
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sidekick", name = "one-shot", havingValue = "false", matchIfMissing = true)
public class MetricsController {

    private final PrometheusMeterRegistry prometheusRegistry;
    private final SidekickMetrics metrics;

    @GetMapping(value = "/metrics", produces = TextFormat.CONTENT_TYPE_004)
    public String scrape() {
        return prometheusRegistry.scrape();
    }

    @GetMapping("/metrics/snapshot")
    public MetricsSnapshot snapshot() {
        return metrics.snapshot();
    }

    @GetMapping("/metrics/descriptors")
    public List<MetricDescriptor> descriptors() {
        return metrics.descriptors();
    }
}
