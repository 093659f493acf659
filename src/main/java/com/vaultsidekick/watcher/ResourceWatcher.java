package com.vaultsidekick.watcher;

import com.vaultsidekick.fabric.EventFabric;
import com.vaultsidekick.model.Resource;

/**
 * Authenticates to Vault and keeps fetching/renewing the watched resources,
 * publishing one lifecycle event per attempt.
 *
 * Implementations report authentication attempts through
 * {@link com.vaultsidekick.metrics.SidekickMetrics#incrAuth} and must set the retry
 * count of every event faithfully.
 */
public interface ResourceWatcher {

    void watch(Resource resource);

    /**
     * Starts producing events. Must not block the caller.
     */
    void start(EventFabric fabric);
}
