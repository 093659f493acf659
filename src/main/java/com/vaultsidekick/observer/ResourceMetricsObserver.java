package com.vaultsidekick.observer;

import com.vaultsidekick.fabric.EventSubscriber;
import com.vaultsidekick.metrics.SidekickMetrics;
import com.vaultsidekick.model.LifecycleEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keeps the per-resource attempt counters in step with the event stream.
 */
@Slf4j
@Component
public class ResourceMetricsObserver extends EventSubscriber {

    public ResourceMetricsObserver(SidekickMetrics metrics) {
        super(metrics);
    }

    @Override
    public String name() {
        return "resource-metrics-observer";
    }

    @Override
    protected void onEvent(LifecycleEvent event) {
        metrics.recordResourceOutcome(event.getResourceId(), event.isSuccess());
        if (!event.isSuccess()) {
            log.debug("Attempt {} for resource {} failed: {}",
                    event.getRetryCount(), event.getResourceId(),
                    event.getAttemptError() != null ? event.getAttemptError().getMessage() : "unknown error");
        }
    }
}
