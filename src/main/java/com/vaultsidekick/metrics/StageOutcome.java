package com.vaultsidekick.metrics;

/**
 * Which counter of a stage (or of authentication) an update applies to.
 */
public enum StageOutcome {
    TOTAL,
    SUCCESS,
    ERROR
}
