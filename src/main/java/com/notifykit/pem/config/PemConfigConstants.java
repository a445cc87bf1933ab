package com.notifykit.pem.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * PEM configuration constants and defaults
 */
public final class PemConfigConstants {
    
    private PemConfigConstants() {
        // Utility class
    }
    
    // Default values
    public static final StorageMode DEFAULT_STORAGE_MODE = StorageMode.AUTO;
    public static final boolean DEFAULT_PEM_AUTOGEN = true;
    public static final int DEFAULT_MAX_PEM_KEY_SIZE = 8000;
    public static final int DEFAULT_WEBPUSH_RECORD_SIZE = 4096;
    
    // Validation limits
    public static final int MIN_PEM_KEY_SIZE = 256;
    public static final int MAX_PEM_KEY_SIZE = 65536;
    // RFC 8188: a record must hold at least the 16 byte tag, a delimiter and one octet
    public static final int MIN_WEBPUSH_RECORD_SIZE = 18;
    // RFC 8030 push services are only required to accept 4096 byte bodies
    public static final int MAX_WEBPUSH_RECORD_SIZE = 4096;
    
    // Environment variable names
    public static final String ENV_STORAGE_PATH = "NOTIFY_STORAGE_PATH";
    public static final String ENV_STORAGE_MODE = "NOTIFY_STORAGE_MODE";
    public static final String ENV_PEM_AUTOGEN = "NOTIFY_PEM_AUTOGEN";
    public static final String ENV_MAX_PEM_KEY_SIZE = "NOTIFY_PEM_MAX_KEY_SIZE";
    public static final String ENV_WEBPUSH_RECORD_SIZE = "NOTIFY_WEBPUSH_RECORD_SIZE";
    
    /**
     * Environment variable to config field mapping
     */
    public static final Map<String, String> ENV_VAR_MAPPING;
    
    static {
        Map<String, String> map = new HashMap<>();
        map.put(ENV_STORAGE_PATH, "storagePath");
        map.put(ENV_STORAGE_MODE, "storageMode");
        map.put(ENV_PEM_AUTOGEN, "pemAutogen");
        map.put(ENV_MAX_PEM_KEY_SIZE, "maxPemKeySize");
        map.put(ENV_WEBPUSH_RECORD_SIZE, "webPushRecordSize");
        ENV_VAR_MAPPING = Collections.unmodifiableMap(map);
    }
}
