package com.vaultsidekick.model;

/**
 * Result of a single fetch or renew attempt reported by the watcher.
 */
public enum EventOutcome {
    SUCCESS,
    FAILURE
}
