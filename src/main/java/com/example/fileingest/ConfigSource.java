package com.example.fileingest;

import java.nio.file.Path;

/**
 * Supplies the configuration that is read once at the start of every crawl.
 */
@FunctionalInterface
public interface ConfigSource {
    /**
     * @throws ConfigurationException if the configuration is missing or invalid
     */
    IngestConfig load();

    static ConfigSource fixed(IngestConfig config) {
        return () -> config;
    }

    static ConfigSource file(Path path) {
        ConfigLoader loader = new ConfigLoader();
        return () -> loader.load(path);
    }
}
