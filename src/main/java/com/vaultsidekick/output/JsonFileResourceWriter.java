package com.vaultsidekick.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vaultsidekick.model.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default writer: stores the secret payload as a JSON document in the output directory.
 *
 * The file is written to a temporary sibling and moved into place, so readers never
 * see a half-written secret. Writing the same resource again replaces the file.
 */
@Slf4j
@Component
public class JsonFileResourceWriter implements ResourceWriter {

    private final Path outputDirectory;
    private final boolean dryRun;
    private final ObjectMapper objectMapper;
    private final AtomicLong writeCount = new AtomicLong(0);

    public JsonFileResourceWriter(
            @Value("${sidekick.output.directory:/etc/secrets}") String outputDirectory,
            @Value("${sidekick.output.dry-run:false}") boolean dryRun,
            ObjectMapper objectMapper
    ) {
        this.outputDirectory = Paths.get(outputDirectory);
        this.dryRun = dryRun;
        this.objectMapper = objectMapper;
        log.info("Initialized output writer (directory={}, dryRun={})", this.outputDirectory, dryRun);
    }

    @Override
    public void write(Resource resource, Map<String, Object> payload) throws IOException {
        Path target = outputDirectory.resolve(fileNameFor(resource));
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);

        if (dryRun) {
            log.info("Dry run, not writing resource {} to {}", resource.getId(), target);
            return;
        }

        Files.createDirectories(outputDirectory);
        Path temp = Files.createTempFile(outputDirectory, ".sidekick-", ".tmp");
        try {
            Files.writeString(temp, json);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }

        long count = writeCount.incrementAndGet();
        log.debug("Written resource {} to {} (total writes: {})", resource.getId(), target, count);
    }

    /**
     * Get the total number of writes performed.
     *
     * @return total write count
     */
    public long getWriteCount() {
        return writeCount.get();
    }

    static String fileNameFor(Resource resource) {
        String base = resource.getFileName() != null && !resource.getFileName().isBlank()
                ? resource.getFileName()
                : resource.getId();
        return base.replaceAll("[^A-Za-z0-9._-]", "_") + ".json";
    }
}
