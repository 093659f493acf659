package com.vaultsidekick.observer;

import com.vaultsidekick.fabric.EventSubscriber;
import com.vaultsidekick.metrics.SidekickMetrics;
import com.vaultsidekick.model.LifecycleEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;

/**
 * Reports how long each issued certificate has left before it expires.
 *
 * Only successful events of the pki kind are looked at. A payload without a usable
 * expiration (missing, not an integral number, or beyond the representable instants)
 * is counted as a generic error and otherwise ignored.
 */
@Slf4j
@Component
public class ExpiryObserver extends EventSubscriber {

    public static final String EXPIRATION_FIELD = "expiration";

    public static final String NO_EXPIRATION = "no_expiration_in_resource";
    public static final String EXPIRATION_NOT_NUMERIC = "expiration_not_numeric";
    public static final String EXPIRATION_OUT_OF_RANGE = "expiration_out_of_range";

    private final Clock clock;

    public ExpiryObserver(SidekickMetrics metrics, Clock clock) {
        super(metrics);
        this.clock = clock;
    }

    @Override
    public String name() {
        return "expiry-observer";
    }

    @Override
    protected void onEvent(LifecycleEvent event) {
        if (!event.isSuccess() || !event.getResource().isExpiryBearing()) {
            return;
        }

        Object raw = event.getPayload().get(EXPIRATION_FIELD);
        if (raw == null) {
            log.warn("No expiration in payload of resource {}", event.getResourceId());
            metrics.incrGenericError(NO_EXPIRATION);
            return;
        }

        Long epochSeconds = toEpochSeconds(raw);
        if (epochSeconds == null) {
            log.warn("Expiration of resource {} is not an integral number: {}", event.getResourceId(), raw);
            metrics.incrGenericError(EXPIRATION_NOT_NUMERIC);
            return;
        }

        Duration expiresIn;
        try {
            expiresIn = Duration.between(clock.instant(), Instant.ofEpochSecond(epochSeconds));
        } catch (DateTimeException | ArithmeticException e) {
            log.warn("Expiration of resource {} is out of range: {}", event.getResourceId(), epochSeconds);
            metrics.incrGenericError(EXPIRATION_OUT_OF_RANGE);
            return;
        }
        metrics.setResourceExpiry(event.getResourceId(), expiresIn);
        log.debug("Resource {} expires in {}", event.getResourceId(), expiresIn);
    }

    /**
     * Accepts integral numbers and strings holding one; anything else yields null.
     */
    static Long toEpochSeconds(Object raw) {
        try {
            if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).longValue();
            }
            if (raw instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (raw instanceof BigDecimal decimal) {
                return decimal.longValueExact();
            }
            if (raw instanceof CharSequence text) {
                return Long.parseLong(text.toString().trim());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            log.debug("Cannot read {} as epoch seconds: {}", raw, e.getMessage());
        }
        return null;
    }
}
