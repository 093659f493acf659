package com.vaultsidekick.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One reported outcome of a fetch or renew attempt for a resource.
 *
 * Instances are immutable, so a single instance is handed to every subscriber.
 * The payload keeps the order the watcher produced it in.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LifecycleEvent {

    Resource resource;
    EventOutcome outcome;
    Map<String, Object> payload;
    Throwable attemptError;
    int retryCount;

    public static LifecycleEvent success(Resource resource, Map<String, Object> payload, int retryCount) {
        Objects.requireNonNull(resource, "resource");
        Map<String, Object> copy = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        return new LifecycleEvent(resource, EventOutcome.SUCCESS, copy, null, retryCount);
    }

    public static LifecycleEvent failure(Resource resource, Throwable attemptError, int retryCount) {
        Objects.requireNonNull(resource, "resource");
        return new LifecycleEvent(resource, EventOutcome.FAILURE, Collections.emptyMap(), attemptError, retryCount);
    }

    public String getResourceId() {
        return resource.getId();
    }

    public int getMaxRetries() {
        return resource.getMaxRetries();
    }

    public boolean isSuccess() {
        return outcome == EventOutcome.SUCCESS;
    }
}
