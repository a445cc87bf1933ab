package com.notifykit.pem.crypto;

import com.notifykit.pem.config.PemConfig;
import com.notifykit.pem.config.PemConfigConstants;
import com.notifykit.pem.config.StorageMode;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Where and under which policy a key pair lives.
 *
 * <p>Identity is the pair (name, directory). A blank name selects the
 * default context, whose files are {@code public_key.pem} and
 * {@code private_key.pem}; a named context prefixes them with
 * {@code "{name}-"}.
 */
public final class KeyContext {

    private static final String NAME_STRIP_CHARS = " \t/-+!$@#*";

    private final String name;
    private final Path directory;
    private final StorageMode storageMode;
    private final boolean pemAutogen;
    private final int maxPemKeySize;

    public KeyContext(String name, Path directory, StorageMode storageMode,
                      boolean pemAutogen, int maxPemKeySize) {
        this.name = normalizeName(name);
        this.directory = directory;
        this.storageMode = storageMode != null ? storageMode : PemConfigConstants.DEFAULT_STORAGE_MODE;
        this.pemAutogen = pemAutogen;
        this.maxPemKeySize = maxPemKeySize;
    }

    /**
     * Builds a context from configuration.
     *
     * @param config storage settings
     * @param directory key directory, or {@code null} to use the configured storage path
     * @param name context name, or {@code null} for the default context
     */
    public static KeyContext of(PemConfig config, Path directory, String name) {
        Path dir = directory != null ? directory : config.getStorageDirectory();
        return new KeyContext(name, dir, config.getStorageMode(),
            config.isPemAutogen(), config.getMaxPemKeySize());
    }

    /**
     * Strips surrounding whitespace and {@code /-+!$@#*} then lower-cases.
     *
     * @return the normalized name, or {@code null} when nothing is left
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return null;
        }
        int start = 0;
        int end = name.length();
        while (start < end && NAME_STRIP_CHARS.indexOf(name.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && NAME_STRIP_CHARS.indexOf(name.charAt(end - 1)) >= 0) {
            end--;
        }
        String normalized = name.substring(start, end).toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public Optional<Path> getDirectory() {
        return Optional.ofNullable(directory);
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

    /**
     * Whether key files may be written for this context
     */
    public boolean isWritable() {
        return directory != null && storageMode.isWritable();
    }

    /**
     * File name prefix for a key name: {@code "{name}-"}, or empty for the default context
     */
    static String filePrefix(String name) {
        return name == null || name.isEmpty() ? "" : name + "-";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyContext that = (KeyContext) o;
        return Objects.equals(name, that.name) && Objects.equals(directory, that.directory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, directory);
    }

    @Override
    public String toString() {
        return "KeyContext{" +
               "name=" + (name != null ? name : "<default>") +
               ", directory=" + directory +
               ", storageMode=" + storageMode +
               ", pemAutogen=" + pemAutogen +
               '}';
    }
}
