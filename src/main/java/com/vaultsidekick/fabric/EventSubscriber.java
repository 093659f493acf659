package com.vaultsidekick.fabric;

import com.vaultsidekick.metrics.SidekickMetrics;
import com.vaultsidekick.model.LifecycleEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for components that consume a {@link Subscription} on their own thread.
 *
 * A failure while handling one event is logged and counted, then the loop moves on to
 * the next event; it never reaches the fabric or the other subscribers.
 */
@Slf4j
public abstract class EventSubscriber {

    public static final String SUBSCRIBER_FAILURE = "subscriber_failure";

    protected final SidekickMetrics metrics;

    private volatile Thread worker;

    protected EventSubscriber(SidekickMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Human readable name, also used for the consumer thread.
     */
    public abstract String name();

    /**
     * Handles one event. Runs on the subscriber thread, in delivery order.
     */
    protected abstract void onEvent(LifecycleEvent event) throws InterruptedException;

    public synchronized void start(Subscription subscription) {
        if (worker != null) {
            throw new IllegalStateException(name() + " is already started");
        }
        worker = new Thread(() -> consume(subscription), name());
        worker.start();
        log.info("Started {} on {}", name(), subscription);
    }

    public void stop() {
        Thread current = worker;
        if (current != null) {
            current.interrupt();
        }
    }

    public boolean isRunning() {
        Thread current = worker;
        return current != null && current.isAlive();
    }

    void consume(Subscription subscription) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                LifecycleEvent event = subscription.take();
                try {
                    onEvent(event);
                } catch (RuntimeException e) {
                    log.error("{} failed to handle event for resource {}", name(), event.getResourceId(), e);
                    metrics.incrGenericError(SUBSCRIBER_FAILURE);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("{} stopped", name());
    }
}
