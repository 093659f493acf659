package com.vaultsidekick.metrics;

/**
 * Total/success/error counts of one processing stage for one resource.
 */
public record StageCounts(long total, long success, long error) {

    public static final StageCounts ZERO = new StageCounts(0, 0, 0);

    public long get(StageOutcome outcome) {
        return switch (outcome) {
            case TOTAL -> total;
            case SUCCESS -> success;
            case ERROR -> error;
        };
    }
}
