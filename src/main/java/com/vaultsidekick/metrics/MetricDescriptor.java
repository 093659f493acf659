package com.vaultsidekick.metrics;

import java.util.List;

/**
 * Static description of a metric family: what an exporter can advertise before any data exists.
 */
public record MetricDescriptor(
        String name,
        Kind kind,
        List<String> labelNames,
        String help
) {

    public enum Kind {
        GAUGE,
        COUNTER
    }

    public MetricDescriptor {
        labelNames = List.copyOf(labelNames);
    }
}
