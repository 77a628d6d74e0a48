package com.mlpromote.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public final class AppConfigLoader {

    private AppConfigLoader() {
    }

    /**
     * Reads a YAML config. A missing file yields the built-in defaults, which configure no
     * environments.
     */
    public static AppConfig load(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }
}
