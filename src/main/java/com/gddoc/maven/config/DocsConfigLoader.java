package com.gddoc.maven.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads documentation settings from YAML files.
 */
public class DocsConfigLoader {

    public static final String DEFAULT_RESOURCE = "/gddoc/default.yaml";

    private static final Yaml yaml = new Yaml();

    /**
     * Loads the given file, or the bundled defaults when it does not exist.
     */
    public static DocsConfig loadOrDefault(Path configPath) throws IOException {
        if (configPath != null && Files.isRegularFile(configPath)) {
            return load(configPath);
        }
        return loadFromResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads configuration from a YAML file.
     */
    public static DocsConfig load(Path configPath) throws IOException {
        try (InputStream inputStream = Files.newInputStream(configPath)) {
            return parse(inputStream, configPath.toString());
        }
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static DocsConfig loadFromResource(String resourcePath) throws IOException {
        try (InputStream inputStream = DocsConfigLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return parse(inputStream, resourcePath);
        }
    }

    private static DocsConfig parse(InputStream inputStream, String source) throws IOException {
        Object data;
        try {
            data = yaml.load(inputStream);
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
        if (data != null && !(data instanceof Map)) {
            throw new IOException("Expected a mapping at the top of " + source);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) data;
        return DocsConfig.fromMap(map);
    }
}
