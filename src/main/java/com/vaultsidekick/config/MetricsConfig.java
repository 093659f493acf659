package com.vaultsidekick.config;

import com.vaultsidekick.metrics.MetricsAggregator;
import com.vaultsidekick.metrics.NoOpMetrics;
import com.vaultsidekick.metrics.SidekickMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Metrics wiring.
 *
 * Continuous mode gets a Prometheus registry with the aggregator registered as a
 * collector. One-shot mode exports nothing, so it gets {@link NoOpMetrics} instead.
 */
@Slf4j
@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnProperty(prefix = "sidekick", name = "one-shot", havingValue = "false", matchIfMissing = true)
    public PrometheusMeterRegistry prometheusMeterRegistry() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        return registry;
    }

    @Bean
    @ConditionalOnProperty(prefix = "sidekick", name = "one-shot", havingValue = "false", matchIfMissing = true)
    public SidekickMetrics metricsAggregator(PrometheusMeterRegistry prometheusMeterRegistry,
                                             SidekickProperties properties,
                                             Clock clock) {
        return MetricsAggregator.create(
                properties.getMetrics().getRole(),
                prometheusMeterRegistry.getPrometheusRegistry(),
                clock
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "sidekick", name = "one-shot", havingValue = "true")
    public SidekickMetrics noOpMetrics(Clock clock) {
        log.info("One-shot mode, metrics are not collected");
        return new NoOpMetrics(clock);
    }
}
