package com.notifykit.pem.config;

import com.notifykit.pem.exception.NotifyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader
 */
class ConfigLoaderTest {
    
    private ConfigLoader loader;
    
    @BeforeEach
    void setUp() {
        loader = new ConfigLoader(new HashMap<>());
    }
    
    @Nested
    @DisplayName("merge")
    class Merge {
        
        @Test
        @DisplayName("should merge multiple configurations with priority")
        void shouldMergeWithPriority() {
            Map<String, Object> base = new HashMap<>();
            base.put("storagePath", "/var/lib/keys");
            base.put("storageMode", "flush");
            
            Map<String, Object> override = new HashMap<>();
            override.put("storageMode", "memory");
            override.put("maxPemKeySize", 4000);
            
            Map<String, Object> result = loader.merge(base, override);
            
            assertEquals("/var/lib/keys", result.get("storagePath"));
            assertEquals("memory", result.get("storageMode"));
            assertEquals(4000, result.get("maxPemKeySize"));
        }
        
        @Test
        @DisplayName("should not include null values from overrides")
        void shouldFilterNullValues() {
            Map<String, Object> base = new HashMap<>();
            base.put("storageMode", "flush");
            
            Map<String, Object> override = new HashMap<>();
            override.put("storageMode", null);
            
            Map<String, Object> result = loader.merge(base, override);
            
            assertEquals("flush", result.get("storageMode"));
        }
    }
    
    @Nested
    @DisplayName("resolve")
    class Resolve {
        
        @Test
        @DisplayName("should apply default values")
        void shouldApplyDefaults() {
            PemConfig config = loader.resolve(new HashMap<>());
            
            assertNull(config.getStoragePath());
            assertEquals(PemConfigConstants.DEFAULT_STORAGE_MODE, config.getStorageMode());
            assertEquals(PemConfigConstants.DEFAULT_PEM_AUTOGEN, config.isPemAutogen());
            assertEquals(PemConfigConstants.DEFAULT_MAX_PEM_KEY_SIZE, config.getMaxPemKeySize());
            assertEquals(PemConfigConstants.DEFAULT_WEBPUSH_RECORD_SIZE, config.getWebPushRecordSize());
        }
        
        @Test
        @DisplayName("should parse storage mode case-insensitively")
        void shouldParseStorageMode() {
            Map<String, Object> configMap = new HashMap<>();
            configMap.put("storageMode", " MEMORY ");
            
            assertEquals(StorageMode.MEMORY, loader.resolve(configMap).getStorageMode());
        }
        
        @Test
        @DisplayName("should reject unknown storage mode")
        void shouldRejectUnknownStorageMode() {
            Map<String, Object> configMap = new HashMap<>();
            configMap.put("storageMode", "cloud");
            
            ConfigValidationException e = assertThrows(ConfigValidationException.class,
                () -> loader.resolve(configMap));
            assertEquals("storageMode", e.getField());
        }
        
        @Test
        @DisplayName("should coerce string flags and numbers")
        void shouldCoerceValues() {
            Map<String, Object> configMap = new HashMap<>();
            configMap.put("pemAutogen", "no");
            configMap.put("maxPemKeySize", "2048");
            
            PemConfig config = loader.resolve(configMap);
            
            assertFalse(config.isPemAutogen());
            assertEquals(2048, config.getMaxPemKeySize());
        }
    }
    
    @Nested
    @DisplayName("fromEnvironment")
    class FromEnvironment {
        
        @Test
        @DisplayName("should read mapped environment variables")
        void shouldReadEnvironment() {
            Map<String, String> env = new HashMap<>();
            env.put(PemConfigConstants.ENV_STORAGE_PATH, "/tmp/keys");
            env.put(PemConfigConstants.ENV_STORAGE_MODE, "flush");
            env.put(PemConfigConstants.ENV_PEM_AUTOGEN, "false");
            env.put(PemConfigConstants.ENV_WEBPUSH_RECORD_SIZE, "1024");
            env.put("UNRELATED", "value");
            
            PemConfig config = new ConfigLoader(env).loadFromEnvironment(null);
            
            assertEquals("/tmp/keys", config.getStoragePath());
            assertEquals(StorageMode.FLUSH, config.getStorageMode());
            assertFalse(config.isPemAutogen());
            assertEquals(1024, config.getWebPushRecordSize());
        }
        
        @Test
        @DisplayName("should let programmatic values override the environment")
        void shouldPreferProgrammaticValues() {
            Map<String, String> env = new HashMap<>();
            env.put(PemConfigConstants.ENV_STORAGE_MODE, "flush");
            
            Map<String, Object> programmatic = new HashMap<>();
            programmatic.put("storageMode", StorageMode.MEMORY);
            
            PemConfig config = new ConfigLoader(env).loadFromEnvironment(programmatic);
            
            assertEquals(StorageMode.MEMORY, config.getStorageMode());
        }
    }
    
    @Nested
    @DisplayName("fromFile")
    class FromFile {
        
        @TempDir
        Path tempDir;
        
        @Test
        @DisplayName("should load configuration from JSON file")
        void shouldLoadFromJsonFile() throws IOException {
            String json = """
                {
                    "storagePath": "/srv/notify/keys",
                    "storageMode": "flush",
                    "pemAutogen": false
                }
                """;
            
            Path configFile = tempDir.resolve("config.json");
            Files.writeString(configFile, json);
            
            Map<String, Object> result = loader.fromFile(configFile.toString());
            
            assertEquals("flush", result.get("storageMode"));
            assertEquals(false, result.get("pemAutogen"));
        }
        
        @Test
        @DisplayName("should resolve relative storage path against the file")
        void shouldResolveRelativeStoragePath() throws IOException {
            Path configFile = tempDir.resolve("config.json");
            Files.writeString(configFile, "{\"storagePath\": \"keys\"}");
            
            PemConfig config = loader.loadFromFile(configFile.toString());
            
            assertEquals(tempDir.toAbsolutePath().resolve("keys").normalize(), config.getStorageDirectory());
        }
        
        @Test
        @DisplayName("should throw for missing file")
        void shouldThrowForMissingFile() {
            NotifyException e = assertThrows(NotifyException.class, () -> {
                loader.fromFile("/nonexistent/path.json");
            });
            assertEquals("CONFIG_FILE_NOT_FOUND", e.getCode());
        }
        
        @Test
        @DisplayName("should throw for invalid JSON")
        void shouldThrowForInvalidJson() throws IOException {
            Path configFile = tempDir.resolve("broken.json");
            Files.writeString(configFile, "{ storagePath: ");
            
            NotifyException e = assertThrows(NotifyException.class,
                () -> loader.fromFile(configFile.toString()));
            assertEquals("CONFIG_PARSE_ERROR", e.getCode());
        }
    }
    
    @Nested
    @DisplayName("createTemplate")
    class CreateTemplate {
        
        @TempDir
        Path tempDir;
        
        @Test
        @DisplayName("should create template configuration file")
        void shouldCreateTemplateFile() throws IOException {
            Path templatePath = tempDir.resolve("config/template.json");
            
            loader.createTemplate(templatePath.toString());
            
            assertTrue(Files.exists(templatePath));
            String content = Files.readString(templatePath);
            assertTrue(content.contains("storagePath"));
            assertTrue(content.contains("storageMode"));
            assertTrue(content.contains("pemAutogen"));
        }
        
        @Test
        @DisplayName("should produce a template that loads back")
        void shouldLoadTemplate() {
            Path templatePath = tempDir.resolve("template.json");
            loader.createTemplate(templatePath.toString());
            
            PemConfig config = loader.loadFromFile(templatePath.toString());
            
            assertEquals(StorageMode.AUTO, config.getStorageMode());
            assertEquals(tempDir.toAbsolutePath().resolve("data/keys").normalize(), config.getStorageDirectory());
        }
    }
}
