package com.vaultsidekick.metrics;

import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Process-wide store of the sidekick's counters and gauges.
 *
 * All state sits in plain maps behind one read/write lock: every update takes the
 * write lock, snapshots take the read lock, so a snapshot never sees half of a
 * compound update such as {@link #recordResourceOutcome(String, boolean)}.
 *
 * The aggregator is also the Prometheus collector for its families and can only be
 * obtained through {@link #create(String, CollectorRegistry, Clock)}. At most one
 * aggregator exists per process; creating a second one fails, whatever the registry.
 */
@Slf4j
public final class MetricsAggregator extends Collector implements Collector.Describable, SidekickMetrics {

    private static final AtomicBoolean CREATED = new AtomicBoolean(false);

    private final String role;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // resource id -> latest time until expiry
    private final Map<String, Duration> resourceExpiry = new HashMap<>();

    private final Map<String, Long> resourceTotals = new HashMap<>();
    private final Map<String, Long> resourceSuccesses = new HashMap<>();
    private final Map<String, Long> resourceErrors = new HashMap<>();

    // resource id -> stage -> counters
    private final Map<String, Map<String, MutableStageCounts>> stageCounters = new HashMap<>();

    private long authTotal;
    private long authSuccess;
    private long authError;

    // reason -> count
    private final Map<String, Long> genericErrors = new HashMap<>();

    private MetricsAggregator(String role, Clock clock) {
        this.role = role;
        this.clock = clock;
    }

    /**
     * Creates the aggregator and registers it as a collector.
     *
     * @throws IllegalStateException if an aggregator was already created in this process,
     *                               or the sidekick metric names are taken on {@code registry}
     */
    public static MetricsAggregator create(String role, CollectorRegistry registry, Clock clock) {
        if (!CREATED.compareAndSet(false, true)) {
            throw new IllegalStateException(
                    "A metrics aggregator already exists in this process; only one may own the sidekick metrics");
        }
        MetricsAggregator aggregator = new MetricsAggregator(role == null ? "" : role, clock);
        try {
            registry.register(aggregator);
        } catch (IllegalArgumentException e) {
            CREATED.set(false);
            throw new IllegalStateException(
                    "The sidekick metric names are already registered by another collector", e);
        }
        log.info("Registered metrics aggregator (role={}, families={})", role, MetricFamilies.ALL.size());
        return aggregator;
    }

    public static MetricsAggregator create(String role, CollectorRegistry registry) {
        return create(role, registry, Clock.systemUTC());
    }

    // tests only: frees the process-wide slot so each test can build its own aggregator
    static void resetCreatedFlag() {
        CREATED.set(false);
    }

    /* ---------- Updates ---------- */

    @Override
    public void incrResourceTotal(String resourceId) {
        write(() -> increment(resourceTotals, resourceId));
    }

    @Override
    public void incrResourceSuccess(String resourceId) {
        write(() -> increment(resourceSuccesses, resourceId));
    }

    @Override
    public void incrResourceError(String resourceId) {
        write(() -> increment(resourceErrors, resourceId));
    }

    @Override
    public void recordResourceOutcome(String resourceId, boolean success) {
        write(() -> {
            increment(resourceTotals, resourceId);
            increment(success ? resourceSuccesses : resourceErrors, resourceId);
        });
    }

    @Override
    public void setResourceExpiry(String resourceId, Duration expiresIn) {
        write(() -> resourceExpiry.put(resourceId, expiresIn));
    }

    @Override
    public void incrStage(String resourceId, String stage, StageOutcome outcome) {
        write(() -> stageCounters
                .computeIfAbsent(resourceId, id -> new HashMap<>())
                .computeIfAbsent(stage, s -> new MutableStageCounts())
                .increment(outcome));
    }

    @Override
    public void incrAuth(StageOutcome outcome) {
        write(() -> {
            switch (outcome) {
                case TOTAL -> authTotal++;
                case SUCCESS -> authSuccess++;
                case ERROR -> authError++;
            }
        });
    }

    @Override
    public void incrGenericError(String reason) {
        write(() -> increment(genericErrors, reason));
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        lock.readLock().lock();
        try {
            Map<String, Map<String, StageCounts>> stages = new LinkedHashMap<>();
            stageCounters.forEach((resourceId, byStage) -> {
                Map<String, StageCounts> copy = new LinkedHashMap<>();
                byStage.forEach((stage, counts) -> copy.put(stage, counts.freeze()));
                stages.put(resourceId, Collections.unmodifiableMap(copy));
            });

            return new MetricsSnapshot(
                    role,
                    copy(resourceExpiry, MetricsAggregator::toSeconds),
                    Map.copyOf(resourceTotals),
                    Map.copyOf(resourceSuccesses),
                    Map.copyOf(resourceErrors),
                    Collections.unmodifiableMap(stages),
                    authTotal,
                    authSuccess,
                    authError,
                    Map.copyOf(genericErrors),
                    clock.instant()
            );
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getRole() {
        return role;
    }

    /* ---------- Prometheus collector ---------- */

    @Override
    public List<MetricFamilySamples> describe() {
        List<MetricFamilySamples> families = new ArrayList<>();
        for (MetricDescriptor descriptor : MetricFamilies.ALL) {
            families.add(family(descriptor, List.of()));
        }
        return families;
    }

    @Override
    public List<MetricFamilySamples> collect() {
        MetricsSnapshot snapshot = snapshot();
        List<MetricFamilySamples> families = new ArrayList<>();

        families.add(perResource(MetricFamilies.CERTIFICATE_EXPIRY, snapshot.resourceExpirySeconds(), Double::doubleValue));
        families.add(perResource(MetricFamilies.RESOURCE_TOTAL, snapshot.resourceTotals(), Long::doubleValue));
        families.add(perResource(MetricFamilies.RESOURCE_SUCCESS, snapshot.resourceSuccesses(), Long::doubleValue));
        families.add(perResource(MetricFamilies.RESOURCE_ERROR, snapshot.resourceErrors(), Long::doubleValue));

        families.add(perStage(MetricFamilies.STAGE_TOTAL, snapshot, StageOutcome.TOTAL));
        families.add(perStage(MetricFamilies.STAGE_SUCCESS, snapshot, StageOutcome.SUCCESS));
        families.add(perStage(MetricFamilies.STAGE_ERROR, snapshot, StageOutcome.ERROR));

        families.add(single(MetricFamilies.AUTH_TOTAL, snapshot.authTotal()));
        families.add(single(MetricFamilies.AUTH_SUCCESS, snapshot.authSuccess()));
        families.add(single(MetricFamilies.AUTH_ERROR, snapshot.authError()));

        families.add(perResource(MetricFamilies.GENERIC_ERROR, snapshot.genericErrors(), Long::doubleValue));
        return families;
    }

    private <V> MetricFamilySamples perResource(MetricDescriptor descriptor, Map<String, V> values,
                                                ToDoubleFunction<V> toDouble) {
        List<MetricFamilySamples.Sample> samples = new ArrayList<>();
        values.forEach((key, value) ->
                samples.add(sample(descriptor, List.of(key, role), toDouble.applyAsDouble(value))));
        return family(descriptor, samples);
    }

    private MetricFamilySamples perStage(MetricDescriptor descriptor, MetricsSnapshot snapshot, StageOutcome outcome) {
        List<MetricFamilySamples.Sample> samples = new ArrayList<>();
        snapshot.stageCounters().forEach((resourceId, byStage) ->
                byStage.forEach((stage, counts) ->
                        samples.add(sample(descriptor, List.of(resourceId, stage, role), counts.get(outcome)))));
        return family(descriptor, samples);
    }

    private MetricFamilySamples single(MetricDescriptor descriptor, long value) {
        return family(descriptor, List.of(sample(descriptor, List.of(role), value)));
    }

    // samples keep the family name, counters included, so scraped series match the family table
    private static MetricFamilySamples.Sample sample(MetricDescriptor descriptor, List<String> labelValues, double value) {
        return new MetricFamilySamples.Sample(descriptor.name(), descriptor.labelNames(), labelValues, value);
    }

    private static MetricFamilySamples family(MetricDescriptor descriptor, List<MetricFamilySamples.Sample> samples) {
        Type type = descriptor.kind() == MetricDescriptor.Kind.COUNTER ? Type.COUNTER : Type.GAUGE;
        return new MetricFamilySamples(descriptor.name(), type, descriptor.help(), samples);
    }

    /* ---------- Internals ---------- */

    private void write(Runnable update) {
        lock.writeLock().lock();
        try {
            update.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void increment(Map<String, Long> counters, String key) {
        counters.merge(key, 1L, Long::sum);
    }

    private static <V, R> Map<String, R> copy(Map<String, V> source, Function<V, R> mapper) {
        Map<String, R> result = new HashMap<>();
        source.forEach((key, value) -> result.put(key, mapper.apply(value)));
        return Collections.unmodifiableMap(result);
    }

    private static double toSeconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }

    private static final class MutableStageCounts {
        long total;
        long success;
        long error;

        void increment(StageOutcome outcome) {
            switch (outcome) {
                case TOTAL -> total++;
                case SUCCESS -> success++;
                case ERROR -> error++;
            }
        }

        StageCounts freeze() {
            return new StageCounts(total, success, error);
        }
    }
}
