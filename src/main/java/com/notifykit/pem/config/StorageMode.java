package com.notifykit.pem.config;

/**
 * Persistent storage modes.
 *
 * <p>{@link #MEMORY} keeps nothing on disk, so keys can never be generated
 * or written; {@link #AUTO} and {@link #FLUSH} permit persistence.
 */
public enum StorageMode {
    AUTO("auto"),
    FLUSH("flush"),
    MEMORY("memory");
    
    private final String value;
    
    StorageMode(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    /**
     * Whether files may be written in this mode
     */
    public boolean isWritable() {
        return this != MEMORY;
    }
    
    public static StorageMode fromString(String value) {
        if (value == null) {
            return PemConfigConstants.DEFAULT_STORAGE_MODE;
        }
        
        for (StorageMode mode : StorageMode.values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown storage mode: " + value);
    }
}
