package com.vaultsidekick.coordinator;

/**
 * Run state of a single process invocation.
 */
public enum RunState {
    RUNNING(-1),
    DRAINED_OK(0),
    DRAINED_FAILED(1);

    private final int exitStatus;

    RunState(int exitStatus) {
        this.exitStatus = exitStatus;
    }

    public int exitStatus() {
        if (!isTerminal()) {
            throw new IllegalStateException("a running process has no exit status");
        }
        return exitStatus;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
