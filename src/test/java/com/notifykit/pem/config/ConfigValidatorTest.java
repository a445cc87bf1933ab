package com.notifykit.pem.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigValidator
 */
class ConfigValidatorTest {

    private ConfigValidator validator;

    @BeforeEach
    void setUp() {
        validator = new ConfigValidator();
    }

    @Nested
    @DisplayName("storage")
    class Storage {

        @Test
        @DisplayName("should accept a missing storage path")
        void shouldAcceptMissingPath() {
            PemConfig config = PemConfig.builder().buildUnchecked();

            assertTrue(validator.validate(config).isValid());
        }

        @Test
        @DisplayName("should reject a blank storage path")
        void shouldRejectBlankPath() {
            PemConfig config = PemConfig.builder().storagePath("   ").buildUnchecked();

            ConfigValidator.ValidationResult result = validator.validate(config);

            assertFalse(result.isValid());
            assertEquals("storagePath", result.getErrors().get(0).getField());
        }

        @Test
        @DisplayName("should fall back to the default mode when none is set")
        void shouldDefaultStorageMode() {
            PemConfig config = PemConfig.builder().storageMode(null).buildUnchecked();

            assertEquals(PemConfigConstants.DEFAULT_STORAGE_MODE, config.getStorageMode());
            assertTrue(validator.validate(config).isValid());
        }
    }

    @Nested
    @DisplayName("ranges")
    class Ranges {

        @Test
        @DisplayName("should reject a key size below the minimum")
        void shouldRejectSmallKeySize() {
            PemConfig config = PemConfig.builder().maxPemKeySize(10).buildUnchecked();

            ConfigValidator.ValidationResult result = validator.validate(config);

            assertFalse(result.isValid());
            assertEquals("maxPemKeySize", result.getErrors().get(0).getField());
            assertEquals(10, result.getErrors().get(0).getValue());
        }

        @Test
        @DisplayName("should reject a key size above the maximum")
        void shouldRejectLargeKeySize() {
            PemConfig config = PemConfig.builder()
                .maxPemKeySize(PemConfigConstants.MAX_PEM_KEY_SIZE + 1)
                .buildUnchecked();

            assertFalse(validator.validate(config).isValid());
        }

        @Test
        @DisplayName("should reject record sizes outside RFC 8188 bounds")
        void shouldRejectRecordSize() {
            PemConfig tooSmall = PemConfig.builder().webPushRecordSize(17).buildUnchecked();
            PemConfig tooLarge = PemConfig.builder().webPushRecordSize(8192).buildUnchecked();

            assertFalse(validator.validate(tooSmall).isValid());
            assertFalse(validator.validate(tooLarge).isValid());
        }

        @Test
        @DisplayName("should collect every error")
        void shouldCollectAllErrors() {
            PemConfig config = PemConfig.builder()
                .storagePath("")
                .maxPemKeySize(0)
                .webPushRecordSize(0)
                .buildUnchecked();

            assertEquals(3, validator.validate(config).getErrors().size());
        }
    }

    @Nested
    @DisplayName("validateOrThrow")
    class ValidateOrThrow {

        @Test
        @DisplayName("should throw with the first failing field")
        void shouldThrowWithField() {
            PemConfig config = PemConfig.builder().maxPemKeySize(1).buildUnchecked();

            ConfigValidationException e = assertThrows(ConfigValidationException.class,
                () -> validator.validateOrThrow(config));

            assertEquals("maxPemKeySize", e.getField());
            assertEquals("CONFIG_VALIDATION_ERROR", e.getCode());
            assertTrue(e.getMessage().contains("maxPemKeySize"));
        }

        @Test
        @DisplayName("should not throw for valid configuration")
        void shouldNotThrowForValid() {
            assertDoesNotThrow(() -> validator.validateOrThrow(PemConfig.defaults()));
        }
    }
}
