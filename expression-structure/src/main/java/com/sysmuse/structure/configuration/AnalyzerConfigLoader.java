package com.sysmuse.structure.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sysmuse.structure.util.LoggingUtil;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Loads and saves {@link AnalyzerConfig} as JSON using Jackson.
 */
public class AnalyzerConfigLoader {

    public static final String DEFAULT_RESOURCE = "structure-analyzer.json";

    private final ObjectMapper objectMapper;

    public AnalyzerConfigLoader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Load a configuration from a JSON file.
     *
     * @throws IOException if the file is missing or cannot be parsed
     */
    public AnalyzerConfig loadFromJSON(String filename) throws IOException {
        File file = new File(filename);
        if (!file.exists()) {
            throw new IOException("Configuration file not found: " + filename);
        }
        AnalyzerConfig config = objectMapper.readValue(file, AnalyzerConfig.class);
        config.validate();
        return config;
    }

    /**
     * Load a configuration from the classpath, falling back to defaults when the
     * resource does not exist.
     */
    public AnalyzerConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                LoggingUtil.debug("No configuration resource " + resource + ", using defaults");
                return new AnalyzerConfig();
            }
            AnalyzerConfig config = objectMapper.readValue(in, AnalyzerConfig.class);
            config.validate();
            return config;
        }
    }

    public AnalyzerConfig loadDefault() throws IOException {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public void saveToJSON(AnalyzerConfig config, String filename) throws IOException {
        File file = new File(filename);
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();
        objectMapper.writeValue(file, config);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
