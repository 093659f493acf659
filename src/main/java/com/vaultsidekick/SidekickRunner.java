package com.vaultsidekick;

import com.vaultsidekick.config.SidekickProperties;
import com.vaultsidekick.fabric.EventFabric;
import com.vaultsidekick.fabric.EventSubscriber;
import com.vaultsidekick.model.Resource;
import com.vaultsidekick.watcher.ResourceWatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Wires the event flow once the context is up.
 *
 * Every subscriber gets its own subscription before the watcher is started, so no
 * subscriber misses an event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SidekickRunner implements ApplicationRunner {

    private final SidekickProperties properties;
    private final EventFabric fabric;
    private final List<EventSubscriber> subscribers;
    private final ObjectProvider<ResourceWatcher> watcherProvider;

    @Override
    public void run(ApplicationArguments args) {
        List<Resource> resources = properties.declaredResources();
        if (properties.isOneShot()) {
            log.info("Running in one-shot mode with {} resources", resources.size());
        } else {
            log.info("Running in continuous mode with {} resources, metrics on port {}",
                    resources.size(), properties.getMetrics().getPort());
        }

        SignalExitHook.install();

        for (EventSubscriber subscriber : subscribers) {
            subscriber.start(fabric.register());
        }

        ResourceWatcher watcher = watcherProvider.getIfAvailable();
        if (watcher == null) {
            log.warn("No resource watcher is configured, no secrets will be retrieved");
            return;
        }
        for (Resource resource : resources) {
            log.debug("Watching resource {}", resource.getId());
            watcher.watch(resource);
        }
        watcher.start(fabric);
    }
}
