package com.vaultsidekick.config;

import com.vaultsidekick.fabric.EventFabric;
import com.vaultsidekick.model.Resource;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from the {@code sidekick.*} namespace.
 *
 * Environment variables override the file via relaxed binding, e.g. SIDEKICK_ONE_SHOT=true.
 */
@Data
@ConfigurationProperties(prefix = "sidekick")
public class SidekickProperties {

    /**
     * Exit once every resource has been retrieved once (or given up on).
     */
    private boolean oneShot;

    private List<ResourceProperties> resources = new ArrayList<>();

    private Fabric fabric = new Fabric();

    private Coordinator coordinator = new Coordinator();

    private Metrics metrics = new Metrics();

    private Output output = new Output();

    public List<Resource> declaredResources() {
        return resources.stream()
                .map(ResourceProperties::toResource)
                .toList();
    }

    @Data
    public static class ResourceProperties {
        private String kind;
        private String path;
        private int maxRetries;
        private String fileName;

        Resource toResource() {
            if (kind == null || kind.isBlank() || path == null || path.isBlank()) {
                throw new IllegalArgumentException(
                        "resource must declare both kind and path, got kind=" + kind + ", path=" + path);
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("max-retries must not be negative for " + kind + ":" + path);
            }
            return Resource.builder()
                    .kind(kind)
                    .path(path)
                    .maxRetries(maxRetries)
                    .fileName(fileName)
                    .build();
        }
    }

    @Data
    public static class Fabric {
        private int queueCapacity = EventFabric.DEFAULT_QUEUE_CAPACITY;
    }

    @Data
    public static class Coordinator {
        /**
         * Upper bound on events processed concurrently by the run coordinator.
         */
        private int workers = 4;
    }

    @Data
    public static class Metrics {
        private int port = 8080;

        /**
         * Value of the role label on every exported metric.
         */
        private String role = "";
    }

    @Data
    public static class Output {
        private String directory = "/etc/secrets";
        private boolean dryRun;
    }
}
