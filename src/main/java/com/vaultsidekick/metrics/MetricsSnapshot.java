package com.vaultsidekick.metrics;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable point-in-time copy of the aggregated metrics.
 *
 * This is a READ MODEL:
 * - No logic
 * - Keys missing from a map mean no data was ever recorded for them
 */
public record MetricsSnapshot(

        String role,

        /* -------- Gauges -------- */
        Map<String, Double> resourceExpirySeconds,

        /* -------- Per resource counters -------- */
        Map<String, Long> resourceTotals,
        Map<String, Long> resourceSuccesses,
        Map<String, Long> resourceErrors,

        /* -------- resource id -> stage -> counts -------- */
        Map<String, Map<String, StageCounts>> stageCounters,

        /* -------- Authentication -------- */
        long authTotal,
        long authSuccess,
        long authError,

        /* -------- reason -> count -------- */
        Map<String, Long> genericErrors,

        Instant capturedAt
) {

    public static MetricsSnapshot empty(String role, Instant capturedAt) {
        return new MetricsSnapshot(role, Map.of(), Map.of(), Map.of(), Map.of(), Map.of(),
                0, 0, 0, Map.of(), capturedAt);
    }

    public long resourceTotal(String resourceId) {
        return resourceTotals.getOrDefault(resourceId, 0L);
    }

    public long resourceSuccess(String resourceId) {
        return resourceSuccesses.getOrDefault(resourceId, 0L);
    }

    public long resourceError(String resourceId) {
        return resourceErrors.getOrDefault(resourceId, 0L);
    }

    public long genericError(String reason) {
        return genericErrors.getOrDefault(reason, 0L);
    }

    public StageCounts stage(String resourceId, String stage) {
        return stageCounters.getOrDefault(resourceId, Map.of()).getOrDefault(stage, StageCounts.ZERO);
    }
}
