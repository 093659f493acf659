package com.vaultsidekick;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the Vault sidekick.
 *
 * Keeps secrets retrieved from Vault written out locally and, unless running in
 * one-shot mode, exposes synchronization metrics for Prometheus.
 */
@Slf4j
@SpringBootApplication
public class SidekickApplication {

    public static void main(String[] args) {
        log.info("Starting Vault Sidekick...");
        SpringApplication.run(SidekickApplication.class, args);
    }
}
