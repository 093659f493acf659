package com.vaultsidekick.fabric;

import com.vaultsidekick.model.LifecycleEvent;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO delivery queue handed out by {@link EventFabric#register()}.
 *
 * Events are observed in the order they were published.
 */
public final class Subscription {

    private final int id;
    private final BlockingQueue<LifecycleEvent> queue;

    Subscription(int id, int capacity) {
        this.id = id;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Waits for the next event.
     */
    public LifecycleEvent take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or null if none arrived in time
     */
    public LifecycleEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public int pending() {
        return queue.size();
    }

    public int capacity() {
        return queue.size() + queue.remainingCapacity();
    }

    public int getId() {
        return id;
    }

    void deliver(LifecycleEvent event) throws InterruptedException {
        queue.put(event);
    }

    @Override
    public String toString() {
        return "Subscription-" + id;
    }
}
