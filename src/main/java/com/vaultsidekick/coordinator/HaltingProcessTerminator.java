package com.vaultsidekick.coordinator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Exits immediately with the given status. In-flight work is not drained.
 */
@Slf4j
@Component
public class HaltingProcessTerminator implements ProcessTerminator {

    @Override
    public void terminate(int exitStatus) {
        log.info("Exiting with status {}", exitStatus);
        Runtime.getRuntime().halt(exitStatus);
    }
}
