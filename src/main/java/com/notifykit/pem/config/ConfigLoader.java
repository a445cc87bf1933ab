package com.notifykit.pem.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.notifykit.pem.exception.NotifyException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PEM Configuration Loader
 * Provides multiple ways to load and merge configuration
 */
public class ConfigLoader {

    private final ObjectMapper objectMapper;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    /**
     * @param environment variables consulted by {@link #fromEnvironment()}
     */
    public ConfigLoader(Map<String, String> environment) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.environment = environment;
    }

    /**
     * Load configuration from a JSON file
     *
     * @param path path to JSON configuration file
     * @return configuration map
     * @throws NotifyException if file not found or invalid JSON
     */
    public Map<String, Object> fromFile(String path) throws NotifyException {
        Path filePath = Paths.get(path).toAbsolutePath();

        if (!Files.exists(filePath)) {
            throw new NotifyException("Configuration file not found: " + filePath, "CONFIG_FILE_NOT_FOUND");
        }

        try {
            Map<String, Object> config = objectMapper.readValue(
                filePath.toFile(), new TypeReference<Map<String, Object>>() {});
            return resolveStoragePath(config, filePath.getParent());
        } catch (IOException e) {
            throw new NotifyException("Invalid JSON in configuration file: " + filePath, "CONFIG_PARSE_ERROR", e);
        }
    }

    /**
     * Load configuration from environment variables
     *
     * @return configuration map
     */
    public Map<String, Object> fromEnvironment() {
        Map<String, Object> config = new HashMap<>();

        for (Map.Entry<String, String> entry : PemConfigConstants.ENV_VAR_MAPPING.entrySet()) {
            String envVar = entry.getKey();
            String configKey = entry.getValue();
            String value = environment.get(envVar);

            if (value != null && !value.isEmpty()) {
                config.put(configKey, parseEnvValue(configKey, value));
            }
        }

        return config;
    }

    /**
     * Merge multiple configuration sources
     * Priority: later sources override earlier sources
     *
     * @param sources configuration maps in order of increasing priority
     * @return merged configuration
     */
    @SafeVarargs
    public final Map<String, Object> merge(Map<String, Object>... sources) {
        Map<String, Object> merged = new HashMap<>();

        for (Map<String, Object> source : sources) {
            for (Map.Entry<String, Object> entry : source.entrySet()) {
                if (entry.getValue() != null) {
                    merged.put(entry.getKey(), entry.getValue());
                }
            }
        }

        return merged;
    }

    /**
     * Resolve configuration map to PemConfig object
     *
     * @param configMap configuration map
     * @return resolved PemConfig
     */
    public PemConfig resolve(Map<String, Object> configMap) {
        PemConfig.Builder builder = PemConfig.builder();

        if (configMap.containsKey("storagePath")) {
            builder.storagePath(String.valueOf(configMap.get("storagePath")));
        }
        if (configMap.containsKey("storageMode")) {
            Object mode = configMap.get("storageMode");
            if (mode instanceof StorageMode) {
                builder.storageMode((StorageMode) mode);
            } else {
                try {
                    builder.storageMode(StorageMode.fromString(String.valueOf(mode)));
                } catch (IllegalArgumentException e) {
                    throw new ConfigValidationException(e.getMessage(), "storageMode");
                }
            }
        }
        if (configMap.containsKey("pemAutogen")) {
            builder.pemAutogen(toBoolean(configMap.get("pemAutogen"), PemConfigConstants.DEFAULT_PEM_AUTOGEN));
        }
        if (configMap.containsKey("maxPemKeySize")) {
            builder.maxPemKeySize(toInt(configMap.get("maxPemKeySize"), PemConfigConstants.DEFAULT_MAX_PEM_KEY_SIZE));
        }
        if (configMap.containsKey("webPushRecordSize")) {
            builder.webPushRecordSize(
                toInt(configMap.get("webPushRecordSize"), PemConfigConstants.DEFAULT_WEBPUSH_RECORD_SIZE));
        }

        return builder.build();
    }

    /**
     * Load, merge, and resolve configuration from multiple sources
     *
     * @param filePath path to JSON configuration file (optional, null to skip)
     * @param loadEnv whether to load from environment variables
     * @param programmaticConfig programmatic configuration (optional, null to skip)
     * @return resolved PemConfig
     */
    public PemConfig load(String filePath, boolean loadEnv, Map<String, Object> programmaticConfig) {
        Map<String, Object> fileConfig = filePath != null ? fromFile(filePath) : new HashMap<>();
        Map<String, Object> envConfig = loadEnv ? fromEnvironment() : new HashMap<>();
        Map<String, Object> progConfig = programmaticConfig != null ? programmaticConfig : new HashMap<>();

        Map<String, Object> merged = merge(fileConfig, envConfig, progConfig);
        return resolve(merged);
    }

    /**
     * Load configuration from file with optional environment overrides
     *
     * @param filePath path to JSON configuration file
     * @return resolved PemConfig
     */
    public PemConfig loadFromFile(String filePath) {
        return load(filePath, true, null);
    }

    /**
     * Load configuration from environment variables only
     *
     * @param programmaticConfig additional programmatic overrides
     * @return resolved PemConfig
     */
    public PemConfig loadFromEnvironment(Map<String, Object> programmaticConfig) {
        return load(null, true, programmaticConfig);
    }

    /**
     * Create a configuration template file
     *
     * @param path path to write template
     * @throws NotifyException if writing fails
     */
    public void createTemplate(String path) throws NotifyException {
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("storagePath", "./data/keys");
        template.put("storageMode", PemConfigConstants.DEFAULT_STORAGE_MODE.getValue());
        template.put("pemAutogen", PemConfigConstants.DEFAULT_PEM_AUTOGEN);
        template.put("maxPemKeySize", PemConfigConstants.DEFAULT_MAX_PEM_KEY_SIZE);
        template.put("webPushRecordSize", PemConfigConstants.DEFAULT_WEBPUSH_RECORD_SIZE);

        Path filePath = Paths.get(path).toAbsolutePath();
        try {
            Files.createDirectories(filePath.getParent());
            objectMapper.writeValue(filePath.toFile(), template);
        } catch (IOException e) {
            throw new NotifyException("Failed to create configuration template: " + e.getMessage(),
                "CONFIG_WRITE_ERROR", e);
        }
    }

    private Object parseEnvValue(String key, String value) {
        // Boolean fields
        if ("pemAutogen".equals(key)) {
            return toBoolean(value, PemConfigConstants.DEFAULT_PEM_AUTOGEN);
        }

        // Numeric fields
        if ("maxPemKeySize".equals(key) || "webPushRecordSize".equals(key)) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return value;
            }
        }

        return value;
    }

    private Map<String, Object> resolveStoragePath(Map<String, Object> config, Path basePath) {
        Map<String, Object> processed = new HashMap<>(config);

        // Relative storage paths are anchored at the configuration file
        Object storagePath = processed.get("storagePath");
        if (storagePath instanceof String) {
            String pathStr = (String) storagePath;
            if (!pathStr.trim().isEmpty() && !Paths.get(pathStr).isAbsolute()) {
                processed.put("storagePath", basePath.resolve(pathStr).normalize().toString());
            }
        }

        return processed;
    }

    private int toInt(Object value, int defaultValue) {
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private boolean toBoolean(Object value, boolean defaultValue) {
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        String str = String.valueOf(value).trim();
        return "true".equalsIgnoreCase(str) || "1".equals(str) || "yes".equalsIgnoreCase(str);
    }
}
