package com.vaultsidekick.output;

import com.vaultsidekick.model.Resource;

import java.io.IOException;
import java.util.Map;

/**
 * Materializes a freshly retrieved secret, e.g. as a file on disk.
 */
public interface ResourceWriter {

    void write(Resource resource, Map<String, Object> payload) throws IOException;
}
