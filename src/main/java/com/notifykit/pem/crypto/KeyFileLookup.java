package com.notifykit.pem.crypto;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving a key file for a context.
 */
public final class KeyFileLookup {

    public enum Status {
        /** A usable key file exists */
        FOUND,
        /** Nothing was configured and no candidate file exists; generation may fill the gap */
        NOT_CONFIGURED,
        /** An explicit key file was given but cannot be used */
        MISCONFIGURED
    }

    private static final KeyFileLookup NOT_CONFIGURED = new KeyFileLookup(Status.NOT_CONFIGURED, null);

    private final Status status;
    private final Path path;

    private KeyFileLookup(Status status, Path path) {
        this.status = status;
        this.path = path;
    }

    public static KeyFileLookup found(Path path) {
        return new KeyFileLookup(Status.FOUND, Objects.requireNonNull(path, "path"));
    }

    public static KeyFileLookup notConfigured() {
        return NOT_CONFIGURED;
    }

    public static KeyFileLookup misconfigured(Path path) {
        return new KeyFileLookup(Status.MISCONFIGURED, path);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    public boolean isMisconfigured() {
        return status == Status.MISCONFIGURED;
    }

    /**
     * The resolved file for {@code FOUND}, the offending override for {@code MISCONFIGURED}
     */
    public Optional<Path> getPath() {
        return Optional.ofNullable(path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyFileLookup that = (KeyFileLookup) o;
        return status == that.status && Objects.equals(path, that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, path);
    }

    @Override
    public String toString() {
        return path == null ? status.name() : status + "(" + path + ")";
    }
}
