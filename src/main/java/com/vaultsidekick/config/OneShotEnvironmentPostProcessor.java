package com.vaultsidekick.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

/**
 * Keeps one-shot runs from starting a web server.
 *
 * Runs after the config files are loaded and before Spring Boot binds
 * {@code spring.main.*}, so the web application type can still be switched.
 */
public class OneShotEnvironmentPostProcessor implements EnvironmentPostProcessor {

    static final String PROPERTY_SOURCE_NAME = "sidekickOneShot";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        boolean oneShot = environment.getProperty("sidekick.one-shot", Boolean.class, false);
        if (oneShot) {
            environment.getPropertySources().addFirst(new MapPropertySource(
                    PROPERTY_SOURCE_NAME,
                    Map.of("spring.main.web-application-type", "none")
            ));
        }
    }
}
