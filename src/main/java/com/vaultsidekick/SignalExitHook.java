package com.vaultsidekick;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Makes an operator's interrupt, terminate or hangup end the process with status 0.
 *
 * The JVM turns those signals into a shutdown; this hook then halts right away, without
 * waiting for in-flight work. SIGQUIT stays with the JVM, which uses it for thread dumps.
 * Only installed once startup has succeeded, so startup failures keep their own status.
 */
@Slf4j
final class SignalExitHook {

    private static final AtomicBoolean INSTALLED = new AtomicBoolean();

    private SignalExitHook() {
    }

    static void install() {
        if (!INSTALLED.compareAndSet(false, true)) {
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Received a termination signal, shutting down the service");
            Runtime.getRuntime().halt(0);
        }, "sidekick-signal-exit"));
    }
}
