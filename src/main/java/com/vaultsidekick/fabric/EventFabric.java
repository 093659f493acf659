package com.vaultsidekick.fabric;

import com.vaultsidekick.model.LifecycleEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fans every lifecycle event out to all registered subscriptions.
 *
 * Each subscription is a bounded queue. Publishing blocks the producer while any
 * subscription is full, so nothing is ever dropped, but a subscriber that stops
 * draining its queue stalls the watcher's fetch/renew loop as well. The queue
 * capacity is the only slack between watcher and subscribers.
 *
 * Concurrent producers are serialized, so all subscriptions see events in the same
 * order. Subscriptions registered after publishing started only see later events.
 */
@Slf4j
@Component
public class EventFabric {

    public static final int DEFAULT_QUEUE_CAPACITY = 10;

    private final int queueCapacity;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger nextId = new AtomicInteger();
    // one publish at a time, held across the whole fan-out
    private final ReentrantLock publishLock = new ReentrantLock();

    public EventFabric(
            @Value("${sidekick.fabric.queue-capacity:" + DEFAULT_QUEUE_CAPACITY + "}") int queueCapacity
    ) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queue capacity must be positive, got " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
        log.info("Initialized EventFabric with queue capacity: {}", queueCapacity);
    }

    /**
     * Creates a new subscription. Call before the watcher starts producing.
     */
    public Subscription register() {
        Subscription subscription = new Subscription(nextId.incrementAndGet(), queueCapacity);
        subscriptions.add(subscription);
        log.debug("Registered {}", subscription);
        return subscription;
    }

    /**
     * Delivers the event to every subscription, in registration order.
     * Blocks while a subscription's queue is full, and while another producer is publishing.
     *
     * @throws InterruptedException if the producer is interrupted while blocked
     */
    public void publish(LifecycleEvent event) throws InterruptedException {
        publishLock.lockInterruptibly();
        try {
            for (Subscription subscription : subscriptions) {
                if (subscription.pending() == subscription.capacity()) {
                    log.debug("{} is full, blocking producer for resource {}", subscription, event.getResourceId());
                }
                subscription.deliver(event);
            }
        } finally {
            publishLock.unlock();
        }
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }
}
