package com.mlpromote.promotion;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.mlpromote.serving.ServingConfiguration;

/**
 * Last known-good serving configuration per environment. Each update replaces the whole value
 * for its environment, so readers never see a partially written configuration.
 */
public class LastKnownGoodStore {
    private static final Logger log = LoggerFactory.getLogger(LastKnownGoodStore.class);

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .build();
    private final Map<String, ServingConfiguration> configurations = new ConcurrentHashMap<>();
    private final Path storePath;

    public LastKnownGoodStore() {
        this.storePath = null;
    }

    public LastKnownGoodStore(Path storePath) throws IOException {
        this.storePath = storePath;
        if (storePath != null && Files.exists(storePath) && Files.size(storePath) > 0L) {
            Map<String, ServingConfiguration> persisted = objectMapper.readValue(
                    storePath.toFile(),
                    new TypeReference<Map<String, ServingConfiguration>>() {
                    });
            configurations.putAll(persisted);
        }
    }

    public Optional<ServingConfiguration> get(String environment) {
        return Optional.ofNullable(configurations.get(environment));
    }

    void record(ServingConfiguration configuration) {
        configurations.put(configuration.environment(), configuration);
        persist();
    }

    private synchronized void persist() {
        if (storePath == null) {
            return;
        }
        try {
            if (storePath.getParent() != null) {
                Files.createDirectories(storePath.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(storePath.toFile(), Map.copyOf(configurations));
        } catch (IOException e) {
            log.warn("last-known-good.persist.failed path={} reason={}", storePath, e.getMessage(), e);
        }
    }
}
