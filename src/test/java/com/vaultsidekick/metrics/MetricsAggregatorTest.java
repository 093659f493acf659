package com.vaultsidekick.metrics;

import io.prometheus.client.Collector;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MetricsAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-01-24T12:00:00Z");
    private static final String RENDER_STAGE = "render";

    private MetricsAggregator newAggregator() {
        return AggregatorFixtures.fresh("test-role", new CollectorRegistry(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /**
     * Concurrent increments are never lost.
     */
    @Test
    void testConcurrentIncrementsAreNotLost() throws Exception {
        MetricsAggregator aggregator = newAggregator();
        int threads = 8;
        int perThread = 1000;

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        aggregator.incrResourceTotal("secret:db");
                        aggregator.incrStage("secret:db", SidekickMetrics.WRITE_STAGE, StageOutcome.TOTAL);
                        aggregator.incrAuth(StageOutcome.TOTAL);
                        aggregator.incrGenericError("boom");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        MetricsSnapshot snapshot = aggregator.snapshot();
        long expected = (long) threads * perThread;
        assertThat(snapshot.resourceTotal("secret:db")).isEqualTo(expected);
        assertThat(snapshot.stage("secret:db", SidekickMetrics.WRITE_STAGE).total()).isEqualTo(expected);
        assertThat(snapshot.authTotal()).isEqualTo(expected);
        assertThat(snapshot.genericError("boom")).isEqualTo(expected);
    }

    /**
     * A snapshot taken mid-flight never shows a total without its success/error half.
     */
    @Test
    void testSnapshotNeverSeesPartialOutcome() throws Exception {
        MetricsAggregator aggregator = newAggregator();
        AtomicBoolean running = new AtomicBoolean(true);
        List<String> violations = Collections.synchronizedList(new ArrayList<>());

        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            for (int w = 0; w < 4; w++) {
                boolean success = w % 2 == 0;
                pool.submit(() -> {
                    while (running.get()) {
                        aggregator.recordResourceOutcome("pki:certs", success);
                    }
                });
            }
            for (int r = 0; r < 2; r++) {
                pool.submit(() -> {
                    while (running.get()) {
                        MetricsSnapshot snapshot = aggregator.snapshot();
                        long total = snapshot.resourceTotal("pki:certs");
                        long parts = snapshot.resourceSuccess("pki:certs") + snapshot.resourceError("pki:certs");
                        if (total != parts) {
                            violations.add(total + " != " + parts);
                        }
                    }
                });
            }
            Thread.sleep(300);
        } finally {
            running.set(false);
            pool.shutdown();
            pool.awaitTermination(10, TimeUnit.SECONDS);
        }

        assertThat(violations).isEmpty();
        MetricsSnapshot last = aggregator.snapshot();
        assertThat(last.resourceTotal("pki:certs")).isPositive();
    }

    @Test
    void testDescriptorsAvailableBeforeAnyData() {
        MetricsAggregator aggregator = newAggregator();

        assertThat(aggregator.descriptors())
                .extracting(MetricDescriptor::name)
                .contains(
                        "vault_sidekick_certificate_expiry_gauge",
                        "vault_sidekick_resource_total_counter",
                        "vault_sidekick_error_counter"
                )
                .hasSize(11);
        assertThat(aggregator.describe())
                .extracting(family -> family.name)
                .containsExactlyElementsOf(aggregator.descriptors().stream().map(MetricDescriptor::name).toList());
        assertThat(aggregator.snapshot().resourceTotals()).isEmpty();
    }

    /**
     * Only one aggregator may exist per process, even across registries.
     */
    @Test
    void testSecondCreationFailsOnAnyRegistry() {
        AggregatorFixtures.fresh("role-a", new CollectorRegistry());
        CollectorRegistry otherRegistry = new CollectorRegistry();

        assertThatThrownBy(() -> MetricsAggregator.create("role-b", otherRegistry))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already exists");
        assertThat(otherRegistry.metricFamilySamples().hasMoreElements()).isFalse();
    }

    @Test
    void testSecondCreationFailsOnSameRegistry() {
        CollectorRegistry registry = new CollectorRegistry();
        AggregatorFixtures.fresh("role-a", registry);

        assertThatThrownBy(() -> MetricsAggregator.create("role-b", registry))
                .isInstanceOf(IllegalStateException.class);
    }

    /**
     * Losing the metric names to another collector does not use up the process-wide slot.
     */
    @Test
    void testFailedRegistrationReleasesSlot() {
        CollectorRegistry taken = new CollectorRegistry();
        AggregatorFixtures.fresh("role-a", taken);
        AggregatorFixtures.reset();

        assertThatThrownBy(() -> MetricsAggregator.create("role-b", taken))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);

        MetricsAggregator aggregator = MetricsAggregator.create("role-c", new CollectorRegistry());
        assertThat(aggregator.getRole()).isEqualTo("role-c");
    }

    @Test
    void testExpiryGaugeKeepsLatestValue() {
        MetricsAggregator aggregator = newAggregator();

        aggregator.setResourceExpiry("pki:certs", Duration.ofHours(2));
        aggregator.setResourceExpiry("pki:certs", Duration.ofMinutes(30));

        assertThat(aggregator.snapshot().resourceExpirySeconds()).containsEntry("pki:certs", 1800.0);
    }

    @Test
    void testStageCountersAreSeparatedByStage() {
        MetricsAggregator aggregator = newAggregator();

        aggregator.incrStage("secret:db", SidekickMetrics.WRITE_STAGE, StageOutcome.TOTAL);
        aggregator.incrStage("secret:db", SidekickMetrics.WRITE_STAGE, StageOutcome.ERROR);
        aggregator.incrStage("secret:db", RENDER_STAGE, StageOutcome.TOTAL);
        aggregator.incrStage("secret:db", RENDER_STAGE, StageOutcome.SUCCESS);

        MetricsSnapshot snapshot = aggregator.snapshot();
        assertThat(snapshot.stage("secret:db", SidekickMetrics.WRITE_STAGE)).isEqualTo(new StageCounts(1, 0, 1));
        assertThat(snapshot.stage("secret:db", RENDER_STAGE)).isEqualTo(new StageCounts(1, 1, 0));
        assertThat(snapshot.stage("secret:other", SidekickMetrics.WRITE_STAGE)).isEqualTo(StageCounts.ZERO);
    }

    /**
     * Snapshots are copies: later updates do not leak into them.
     */
    @Test
    void testSnapshotIsPointInTime() {
        MetricsAggregator aggregator = newAggregator();
        aggregator.incrResourceSuccess("secret:db");

        MetricsSnapshot before = aggregator.snapshot();
        aggregator.incrResourceSuccess("secret:db");

        assertThat(before.resourceSuccess("secret:db")).isEqualTo(1);
        assertThat(aggregator.snapshot().resourceSuccess("secret:db")).isEqualTo(2);
        assertThat(before.capturedAt()).isEqualTo(NOW);
        assertThat(before.role()).isEqualTo("test-role");
    }

    @Test
    void testCollectLabelsSamplesWithRole() {
        MetricsAggregator aggregator = newAggregator();
        aggregator.incrResourceError("secret:db");
        aggregator.incrAuth(StageOutcome.SUCCESS);

        List<Collector.MetricFamilySamples> families = aggregator.collect();

        Collector.MetricFamilySamples errors = families.stream()
                .filter(f -> f.name.equals("vault_sidekick_resource_error_counter"))
                .findFirst()
                .orElseThrow();
        assertThat(errors.type).isEqualTo(Collector.Type.COUNTER);
        assertThat(errors.samples).hasSize(1);
        assertThat(errors.samples.get(0).labelNames).containsExactly("resource_id", "role");
        assertThat(errors.samples.get(0).labelValues).containsExactly("secret:db", "test-role");
        assertThat(errors.samples.get(0).value).isEqualTo(1.0);

        Collector.MetricFamilySamples authSuccess = families.stream()
                .filter(f -> f.name.equals("vault_sidekick_auth_success_counter"))
                .findFirst()
                .orElseThrow();
        assertThat(authSuccess.samples.get(0).labelValues).containsExactly("test-role");
        assertThat(authSuccess.samples.get(0).value).isEqualTo(1.0);
    }
}
