package com.vaultsidekick.coordinator;

import com.vaultsidekick.config.SidekickProperties;
import com.vaultsidekick.fabric.EventSubscriber;
import com.vaultsidekick.fabric.Subscription;
import com.vaultsidekick.metrics.SidekickMetrics;
import com.vaultsidekick.metrics.StageOutcome;
import com.vaultsidekick.model.LifecycleEvent;
import com.vaultsidekick.model.Resource;
import com.vaultsidekick.output.ResourceWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes out every retrieved secret and, in one-shot mode, decides when the run is over.
 *
 * Each event is handled as its own task on a bounded worker pool: the secret is written
 * first, without any lock held, then the run state is updated under a single lock.
 * Tasks may finish out of order.
 *
 * One-shot bookkeeping:
 * - a pending resource leaves the pending set on its first processed success
 * - on failure its observed retry count goes up; once it exceeds a positive
 *   max-retries the resource leaves the set and the run is marked failed
 * - when the set is empty the process terminates, exactly once, with 0 or 1
 *
 * In continuous mode the coordinator only writes and never terminates the process.
 */
@Slf4j
@Component
public class RunCoordinator extends EventSubscriber {

    public static final String RESOURCE_WRITE_FAILED = "resource_write_failed";

    private final boolean oneShot;
    private final ResourceWriter writer;
    private final ProcessTerminator terminator;

    private final ExecutorService workers;
    private final Semaphore inFlight;

    private final ReentrantLock stateLock = new ReentrantLock();
    // guarded by stateLock
    private final Set<String> pending = new LinkedHashSet<>();
    private final Map<String, Integer> observedRetries = new HashMap<>();
    private boolean permanentFailure;
    private RunState state = RunState.RUNNING;

    private final CountDownLatch terminated = new CountDownLatch(1);

    @Autowired
    public RunCoordinator(SidekickProperties properties,
                          ResourceWriter writer,
                          SidekickMetrics metrics,
                          ProcessTerminator terminator) {
        this(properties.isOneShot(),
                properties.declaredResources(),
                properties.getCoordinator().getWorkers(),
                writer,
                metrics,
                terminator);
    }

    public RunCoordinator(boolean oneShot,
                          List<Resource> declaredResources,
                          int workerCount,
                          ResourceWriter writer,
                          SidekickMetrics metrics,
                          ProcessTerminator terminator) {
        super(metrics);
        if (workerCount <= 0) {
            throw new IllegalArgumentException("worker count must be positive, got " + workerCount);
        }
        this.oneShot = oneShot;
        this.writer = writer;
        this.terminator = terminator;
        this.inFlight = new Semaphore(workerCount);
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(workerCount,
                r -> new Thread(r, "run-coordinator-worker-" + threadIndex.incrementAndGet()));

        if (oneShot) {
            declaredResources.forEach(resource -> pending.add(resource.getId()));
        }
        log.info("Initialized RunCoordinator (oneShot={}, resources={}, workers={})",
                oneShot, declaredResources.size(), workerCount);
    }

    @Override
    public String name() {
        return "run-coordinator";
    }

    /**
     * Starts consuming events. A one-shot run with nothing declared ends right here.
     */
    @Override
    public void start(Subscription subscription) {
        if (oneShot && finishIfNothingDeclared()) {
            return;
        }
        super.start(subscription);
    }

    @Override
    protected void onEvent(LifecycleEvent event) throws InterruptedException {
        log.debug("Received an update for resource {} ({})", event.getResourceId(), event.getOutcome());
        inFlight.acquire();
        try {
            workers.execute(() -> {
                try {
                    process(event);
                } catch (RuntimeException e) {
                    log.error("Failed to process event for resource {}", event.getResourceId(), e);
                    metrics.incrGenericError(SUBSCRIBER_FAILURE);
                } finally {
                    inFlight.release();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.release();
            throw e;
        }
    }

    void process(LifecycleEvent event) {
        if (event.isSuccess()) {
            materialize(event);
        }
        if (!oneShot) {
            return;
        }
        RunState reached = transition(event);
        if (reached != null) {
            finish(reached);
        }
    }

    private void materialize(LifecycleEvent event) {
        String resourceId = event.getResourceId();
        metrics.incrStage(resourceId, SidekickMetrics.WRITE_STAGE, StageOutcome.TOTAL);
        try {
            writer.write(event.getResource(), event.getPayload());
            metrics.incrStage(resourceId, SidekickMetrics.WRITE_STAGE, StageOutcome.SUCCESS);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write out the update for resource {}", resourceId, e);
            metrics.incrStage(resourceId, SidekickMetrics.WRITE_STAGE, StageOutcome.ERROR);
            metrics.incrGenericError(RESOURCE_WRITE_FAILED);
        }
    }

    /**
     * Applies one event to the pending set.
     *
     * @return the terminal state if this event drained the set, otherwise null
     */
    private RunState transition(LifecycleEvent event) {
        String resourceId = event.getResourceId();
        stateLock.lock();
        try {
            if (state.isTerminal() || !pending.contains(resourceId)) {
                return null;
            }

            if (event.isSuccess()) {
                pending.remove(resourceId);
                log.info("Resource {} retrieved, {} left to process", resourceId, pending.size());
            } else {
                int retries = observedRetries.merge(resourceId, 1, Integer::sum);
                int maxRetries = event.getMaxRetries();
                if (maxRetries > 0 && retries > maxRetries) {
                    pending.remove(resourceId);
                    permanentFailure = true;
                    log.warn("Giving up on resource {} after {} failed attempts (max retries {})",
                            resourceId, retries, maxRetries);
                } else {
                    log.debug("Resource {} failed attempt {} (max retries {})", resourceId, retries, maxRetries);
                }
            }

            if (pending.isEmpty()) {
                state = permanentFailure ? RunState.DRAINED_FAILED : RunState.DRAINED_OK;
                return state;
            }
            return null;
        } finally {
            stateLock.unlock();
        }
    }

    private boolean finishIfNothingDeclared() {
        stateLock.lock();
        try {
            if (!pending.isEmpty() || state.isTerminal()) {
                return false;
            }
            state = RunState.DRAINED_OK;
        } finally {
            stateLock.unlock();
        }
        log.info("Nothing to retrieve from vault");
        finish(RunState.DRAINED_OK);
        return true;
    }

    // called without stateLock held
    private void finish(RunState reached) {
        log.info("No resources left to process, run finished as {}", reached);
        terminated.countDown();
        terminator.terminate(reached.exitStatus());
    }

    public RunState state() {
        stateLock.lock();
        try {
            return state;
        } finally {
            stateLock.unlock();
        }
    }

    public Set<String> pendingResources() {
        stateLock.lock();
        try {
            return Set.copyOf(pending);
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Waits until the run reaches a terminal state.
     *
     * @return true if it did within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void stop() {
        super.stop();
        workers.shutdownNow();
    }
}
