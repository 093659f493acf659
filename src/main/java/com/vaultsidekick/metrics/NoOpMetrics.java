package com.vaultsidekick.metrics;

import java.time.Clock;
import java.time.Duration;

/**
 * No-op metrics implementation.
 * Used in one-shot mode, where telemetry is never exported.
 */
public class NoOpMetrics implements SidekickMetrics {

    private final Clock clock;

    public NoOpMetrics(Clock clock) {
        this.clock = clock;
    }

    /* -------- Resources -------- */

    @Override
    public void incrResourceTotal(String resourceId) {
        // no-op
    }

    @Override
    public void incrResourceSuccess(String resourceId) {
        // no-op
    }

    @Override
    public void incrResourceError(String resourceId) {
        // no-op
    }

    @Override
    public void recordResourceOutcome(String resourceId, boolean success) {
        // no-op
    }

    @Override
    public void setResourceExpiry(String resourceId, Duration expiresIn) {
        // no-op
    }

    /* -------- Stages, auth, errors -------- */

    @Override
    public void incrStage(String resourceId, String stage, StageOutcome outcome) {
        // no-op
    }

    @Override
    public void incrAuth(StageOutcome outcome) {
        // no-op
    }

    @Override
    public void incrGenericError(String reason) {
        // no-op
    }

    /* -------- Snapshot -------- */

    @Override
    public MetricsSnapshot snapshot() {
        return MetricsSnapshot.empty("", clock.instant());
    }
}
