package com.vaultsidekick.coordinator;

/**
 * Ends the process once the run has reached a terminal state.
 */
public interface ProcessTerminator {

    void terminate(int exitStatus);
}
