package com.notifykit.pem.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * PEM controller configuration.
 * Exposes the storage settings a key context is built from.
 * Use the Builder pattern to construct instances
 */
public class PemConfig {

    // Persistent storage
    private final String storagePath;
    private final StorageMode storageMode;

    // Key policy
    private final boolean pemAutogen;
    private final int maxPemKeySize;

    // Web Push
    private final int webPushRecordSize;

    private PemConfig(Builder builder) {
        this.storagePath = builder.storagePath;
        this.storageMode = builder.storageMode != null
            ? builder.storageMode : PemConfigConstants.DEFAULT_STORAGE_MODE;
        this.pemAutogen = builder.pemAutogen;
        this.maxPemKeySize = builder.maxPemKeySize;
        this.webPushRecordSize = builder.webPushRecordSize;
    }

    // Getters

    public String getStoragePath() {
        return storagePath;
    }

    /**
     * Storage path as a {@link Path}, or {@code null} when none is configured
     */
    public Path getStorageDirectory() {
        if (storagePath == null || storagePath.trim().isEmpty()) {
            return null;
        }
        return Paths.get(storagePath);
    }

    public StorageMode getStorageMode() {
        return storageMode;
    }

    public boolean isPemAutogen() {
        return pemAutogen;
    }

    public int getMaxPemKeySize() {
        return maxPemKeySize;
    }

    public int getWebPushRecordSize() {
        return webPushRecordSize;
    }

    /**
     * Create a new Builder instance
     *
     * @return a new Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration with every default applied
     */
    public static PemConfig defaults() {
        return builder().build();
    }

    /**
     * Create a Builder initialized with this config's values
     *
     * @return a new Builder with current values
     */
    public Builder toBuilder() {
        return new Builder()
            .storagePath(this.storagePath)
            .storageMode(this.storageMode)
            .pemAutogen(this.pemAutogen)
            .maxPemKeySize(this.maxPemKeySize)
            .webPushRecordSize(this.webPushRecordSize);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PemConfig that = (PemConfig) o;
        return pemAutogen == that.pemAutogen &&
               maxPemKeySize == that.maxPemKeySize &&
               webPushRecordSize == that.webPushRecordSize &&
               Objects.equals(storagePath, that.storagePath) &&
               storageMode == that.storageMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(storagePath, storageMode, pemAutogen, maxPemKeySize, webPushRecordSize);
    }

    @Override
    public String toString() {
        return "PemConfig{" +
               "storagePath='" + storagePath + '\'' +
               ", storageMode=" + storageMode +
               ", pemAutogen=" + pemAutogen +
               ", maxPemKeySize=" + maxPemKeySize +
               ", webPushRecordSize=" + webPushRecordSize +
               '}';
    }

    /**
     * Builder for PemConfig
     */
    public static class Builder {
        private String storagePath;
        private StorageMode storageMode = PemConfigConstants.DEFAULT_STORAGE_MODE;
        private boolean pemAutogen = PemConfigConstants.DEFAULT_PEM_AUTOGEN;
        private int maxPemKeySize = PemConfigConstants.DEFAULT_MAX_PEM_KEY_SIZE;
        private int webPushRecordSize = PemConfigConstants.DEFAULT_WEBPUSH_RECORD_SIZE;

        public Builder storagePath(String storagePath) {
            this.storagePath = storagePath;
            return this;
        }

        public Builder storagePath(Path storagePath) {
            this.storagePath = storagePath != null ? storagePath.toString() : null;
            return this;
        }

        public Builder storageMode(StorageMode storageMode) {
            this.storageMode = storageMode;
            return this;
        }

        public Builder pemAutogen(boolean pemAutogen) {
            this.pemAutogen = pemAutogen;
            return this;
        }

        public Builder maxPemKeySize(int maxPemKeySize) {
            this.maxPemKeySize = maxPemKeySize;
            return this;
        }

        public Builder webPushRecordSize(int webPushRecordSize) {
            this.webPushRecordSize = webPushRecordSize;
            return this;
        }

        /**
         * Build and validate the PemConfig
         *
         * @return the validated PemConfig
         * @throws ConfigValidationException if validation fails
         */
        public PemConfig build() {
            PemConfig config = new PemConfig(this);
            ConfigValidator validator = new ConfigValidator();
            validator.validateOrThrow(config);
            return config;
        }

        /**
         * Build without validation
         *
         * @return the PemConfig (unvalidated)
         */
        public PemConfig buildUnchecked() {
            return new PemConfig(this);
        }
    }
}
