package com.vaultsidekick.metrics;

import java.time.Duration;
import java.util.List;

/**
 * Metrics API used by the subscribers and the watcher, exposed via /metrics.
 */
public interface SidekickMetrics {

    /** Stage name used for writing a resource out. */
    String WRITE_STAGE = "write";

    void incrResourceTotal(String resourceId);

    void incrResourceSuccess(String resourceId);

    void incrResourceError(String resourceId);

    /**
     * Counts one attempt together with its success or error counter in a single update.
     */
    void recordResourceOutcome(String resourceId, boolean success);

    void setResourceExpiry(String resourceId, Duration expiresIn);

    void incrStage(String resourceId, String stage, StageOutcome outcome);

    void incrAuth(StageOutcome outcome);

    void incrGenericError(String reason);

    MetricsSnapshot snapshot();

    default List<MetricDescriptor> descriptors() {
        return MetricFamilies.ALL;
    }
}
