package com.texclean.runtime;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class ConfigLoader {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    public CleanerConfig load(Path config) throws IOException {
        if (config == null || !Files.exists(config)) {
            return new CleanerConfig();
        }
        if (Files.size(config) == 0L) {
            return new CleanerConfig();
        }
        CleanerConfig loaded = mapper.readValue(config.toFile(), CleanerConfig.class);
        return loaded == null ? new CleanerConfig() : loaded;
    }

    public CleanerConfig load(InputStream config) throws IOException {
        CleanerConfig loaded = mapper.readValue(config, CleanerConfig.class);
        return loaded == null ? new CleanerConfig() : loaded;
    }

    public CleanerConfig loadResource(String resource) throws IOException {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Config resource not found on classpath: " + resource);
            }
            return load(in);
        }
    }
}
