package com.vaultsidekick.observer;

import com.vaultsidekick.fabric.EventSubscriber;
import com.vaultsidekick.metrics.AggregatorFixtures;
import com.vaultsidekick.metrics.MetricsAggregator;
import com.vaultsidekick.metrics.MetricsSnapshot;
import com.vaultsidekick.model.Resource;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static com.vaultsidekick.testutil.TestFactory.failure;
import static com.vaultsidekick.testutil.TestFactory.pki;
import static com.vaultsidekick.testutil.TestFactory.secret;
import static com.vaultsidekick.testutil.TestFactory.success;
import static org.assertj.core.api.Assertions.assertThat;

public class ExpiryObserverTest {

    private static final Instant NOW = Instant.parse("2026-01-24T12:00:00Z");

    private MetricsAggregator metrics;
    private ExpiryObserver observer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        metrics = AggregatorFixtures.fresh("test-role", new CollectorRegistry(), clock);
        observer = new ExpiryObserver(metrics, clock);
    }

    @Test
    void testExpiryGaugeIsTimeRemaining() {
        Resource certs = pki("pki/issue/example");
        long expiration = NOW.plusSeconds(3600).getEpochSecond();

        observer.onEvent(success(certs, Map.of(ExpiryObserver.EXPIRATION_FIELD, expiration)));

        assertThat(metrics.snapshot().resourceExpirySeconds()).containsEntry(certs.getId(), 3600.0);
    }

    @Test
    void testNumericStringExpiration() {
        Resource certs = pki("pki/issue/example");
        String expiration = Long.toString(NOW.plusSeconds(120).getEpochSecond());

        observer.onEvent(success(certs, Map.of(ExpiryObserver.EXPIRATION_FIELD, expiration)));

        assertThat(metrics.snapshot().resourceExpirySeconds()).containsEntry(certs.getId(), 120.0);
    }

    /**
     * Already expired certificates report a negative remaining time.
     */
    @Test
    void testExpiredCertificateIsNegative() {
        Resource certs = pki("pki/issue/example");
        long expiration = NOW.minusSeconds(60).getEpochSecond();

        observer.onEvent(success(certs, Map.of(ExpiryObserver.EXPIRATION_FIELD, expiration)));

        assertThat(metrics.snapshot().resourceExpirySeconds()).containsEntry(certs.getId(), -60.0);
    }

    /**
     * Missing expiration is counted exactly once and leaves the gauge alone.
     */
    @Test
    void testMissingExpirationIsCountedNotFatal() {
        Resource certs = pki("pki/issue/example");

        observer.onEvent(success(certs, Map.of("certificate", "-----BEGIN CERTIFICATE-----")));

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.genericError(ExpiryObserver.NO_EXPIRATION)).isEqualTo(1);
        assertThat(snapshot.genericErrors()).hasSize(1);
        assertThat(snapshot.resourceExpirySeconds()).doesNotContainKey(certs.getId());
    }

    @Test
    void testNonNumericExpirationIsCounted() {
        Resource certs = pki("pki/issue/example");

        observer.onEvent(success(certs, Map.of(ExpiryObserver.EXPIRATION_FIELD, "tomorrow")));
        observer.onEvent(success(certs, Map.of(ExpiryObserver.EXPIRATION_FIELD, new BigDecimal("1700000000.5"))));
        observer.onEvent(success(certs, Map.of(ExpiryObserver.EXPIRATION_FIELD, 1.7e9)));

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.genericError(ExpiryObserver.EXPIRATION_NOT_NUMERIC)).isEqualTo(3);
        assertThat(snapshot.resourceExpirySeconds()).isEmpty();
    }

    /**
     * An integral expiration no instant can represent is a malformed payload, not a handler failure.
     */
    @Test
    void testOutOfRangeExpirationIsCounted() {
        Resource certs = pki("pki/issue/example");

        observer.onEvent(success(certs, Map.of(ExpiryObserver.EXPIRATION_FIELD, Long.MAX_VALUE)));
        observer.onEvent(success(certs, Map.of(ExpiryObserver.EXPIRATION_FIELD, Long.toString(Long.MIN_VALUE))));

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.genericError(ExpiryObserver.EXPIRATION_OUT_OF_RANGE)).isEqualTo(2);
        assertThat(snapshot.genericError(EventSubscriber.SUBSCRIBER_FAILURE)).isZero();
        assertThat(snapshot.resourceExpirySeconds()).isEmpty();
    }

    @Test
    void testBadPayloadDoesNotOverwritePreviousGauge() {
        Resource certs = pki("pki/issue/example");
        observer.onEvent(success(certs, Map.of(ExpiryObserver.EXPIRATION_FIELD, NOW.plusSeconds(600).getEpochSecond())));

        observer.onEvent(success(certs, Map.of()));

        assertThat(metrics.snapshot().resourceExpirySeconds()).containsEntry(certs.getId(), 600.0);
    }

    @Test
    void testOtherKindsAndFailuresAreIgnored() {
        observer.onEvent(success(secret("secret/db", 0), Map.of()));
        observer.onEvent(failure(pki("pki/issue/example"), 1));

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.genericErrors()).isEmpty();
        assertThat(snapshot.resourceExpirySeconds()).isEmpty();
    }
}
