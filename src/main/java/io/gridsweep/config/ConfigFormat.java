package io.gridsweep.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.gridsweep.param.ConfigurationException;
import io.gridsweep.util.Jsons;

import java.nio.file.Path;
import java.util.Locale;

public enum ConfigFormat {
    YAML("yaml"),
    JSON("json");

    private final String extension;

    ConfigFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    ObjectMapper mapper() {
        return this == YAML ? Jsons.yamlMapper() : Jsons.mapper();
    }

    public static ConfigFormat fromPath(Path path) {
        String file = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (file.endsWith(".yaml") || file.endsWith(".yml")) {
            return YAML;
        }
        if (file.endsWith(".json")) {
            return JSON;
        }
        throw new ConfigurationException("Unsupported config file format: " + path);
    }
}
