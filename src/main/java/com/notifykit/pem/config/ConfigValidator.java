package com.notifykit.pem.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PEM Configuration Validator
 * Collects every problem with a configuration before reporting
 */
public class ConfigValidator {

    /**
     * Validation error detail
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        private final Object value;

        public ValidationError(String field, String message) {
            this(field, message, null);
        }

        public ValidationError(String field, String message, Object value) {
            this.field = field;
            this.message = message;
            this.value = value;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }
        public Object getValue() { return value; }

        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    /**
     * Validation result
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<ValidationError> errors;

        public ValidationResult(boolean valid, List<ValidationError> errors) {
            this.valid = valid;
            this.errors = Collections.unmodifiableList(errors);
        }

        public boolean isValid() { return valid; }
        public List<ValidationError> getErrors() { return errors; }
    }

    /**
     * Validate the configuration
     *
     * @param config the configuration to validate
     * @return the validation result
     */
    public ValidationResult validate(PemConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateStorage(config, errors);
        validateRanges(config, errors);

        return new ValidationResult(errors.isEmpty(), errors);
    }

    /**
     * Validate and throw exception if invalid
     *
     * @param config the configuration to validate
     * @throws ConfigValidationException if validation fails
     */
    public void validateOrThrow(PemConfig config) {
        ValidationResult result = validate(config);
        if (!result.isValid()) {
            StringBuilder sb = new StringBuilder("Configuration validation failed: ");
            List<ValidationError> errors = result.getErrors();
            for (int i = 0; i < errors.size(); i++) {
                if (i > 0) sb.append("; ");
                sb.append(errors.get(i));
            }
            throw new ConfigValidationException(sb.toString(), errors.get(0).getField());
        }
    }

    private void validateStorage(PemConfig config, List<ValidationError> errors) {
        if (config.getStorageMode() == null) {
            errors.add(new ValidationError("storageMode", "storageMode is required"));
        }

        String storagePath = config.getStoragePath();
        if (storagePath != null) {
            if (storagePath.trim().isEmpty()) {
                errors.add(new ValidationError("storagePath",
                    "storagePath must not be blank; omit it to disable persistence", storagePath));
            } else {
                try {
                    Paths.get(storagePath);
                } catch (InvalidPathException e) {
                    errors.add(new ValidationError("storagePath",
                        "storagePath is not a valid path: " + e.getReason(), storagePath));
                }
            }
        }
    }

    private void validateRanges(PemConfig config, List<ValidationError> errors) {
        int maxKeySize = config.getMaxPemKeySize();
        if (maxKeySize < PemConfigConstants.MIN_PEM_KEY_SIZE) {
            errors.add(new ValidationError("maxPemKeySize",
                "maxPemKeySize should be at least " + PemConfigConstants.MIN_PEM_KEY_SIZE + " bytes", maxKeySize));
        } else if (maxKeySize > PemConfigConstants.MAX_PEM_KEY_SIZE) {
            errors.add(new ValidationError("maxPemKeySize",
                "maxPemKeySize should not exceed " + PemConfigConstants.MAX_PEM_KEY_SIZE + " bytes", maxKeySize));
        }

        int recordSize = config.getWebPushRecordSize();
        if (recordSize < PemConfigConstants.MIN_WEBPUSH_RECORD_SIZE) {
            errors.add(new ValidationError("webPushRecordSize",
                "webPushRecordSize must be at least " + PemConfigConstants.MIN_WEBPUSH_RECORD_SIZE, recordSize));
        } else if (recordSize > PemConfigConstants.MAX_WEBPUSH_RECORD_SIZE) {
            errors.add(new ValidationError("webPushRecordSize",
                "webPushRecordSize should not exceed " + PemConfigConstants.MAX_WEBPUSH_RECORD_SIZE, recordSize));
        }
    }
}
