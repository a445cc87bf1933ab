package com.notifykit.pem.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Locates, reads and writes the PEM files of one {@link KeyContext}.
 *
 * <p>Explicit key files (overrides) take precedence over the context
 * directory. An override that cannot be used is reported as
 * {@link KeyFileLookup.Status#MISCONFIGURED} rather than silently ignored.
 */
public class KeyFileStore {

    private static final Logger logger = LoggerFactory.getLogger(KeyFileStore.class);

    static final String PUBLIC_KEY_FILE = "public_key.pem";
    static final String PRIVATE_KEY_FILE = "private_key.pem";

    private static final List<String> DEFAULT_PUBLIC_NAMES =
        List.of(PUBLIC_KEY_FILE, "public.pem", "pub.pem");
    private static final List<String> DEFAULT_PRIVATE_NAMES =
        List.of(PRIVATE_KEY_FILE, "private.pem", "prv.pem");

    /** Owner read/write only (0600) */
    private static final Set<PosixFilePermission> SECRET_FILE_PERMISSIONS = EnumSet.of(
        PosixFilePermission.OWNER_READ,
        PosixFilePermission.OWNER_WRITE
    );

    private final KeyContext context;
    private final PemBackend backend;

    private Path publicOverride;
    private Path privateOverride;

    public KeyFileStore(KeyContext context, PemBackend backend) {
        this.context = context;
        this.backend = backend;
    }

    public KeyContext getContext() {
        return context;
    }

    public Path getPublicOverride() {
        return publicOverride;
    }

    public Path getPrivateOverride() {
        return privateOverride;
    }

    public void setPublicOverride(Path path) {
        this.publicOverride = path;
    }

    public void setPrivateOverride(Path path) {
        this.privateOverride = path;
    }

    /**
     * Makes freshly written files the explicit key files of this store
     */
    public void pin(Path publicKeyFile, Path privateKeyFile) {
        this.publicOverride = publicKeyFile;
        this.privateOverride = privateKeyFile;
    }

    /**
     * Resolves the public key file.
     *
     * @param names extra context names to try before the context's own files
     */
    public KeyFileLookup publicKeyfile(String... names) {
        return resolve(publicOverride, PUBLIC_KEY_FILE, DEFAULT_PUBLIC_NAMES, names);
    }

    /**
     * Resolves the private key file.
     *
     * @param names extra context names to try before the context's own files
     */
    public KeyFileLookup privateKeyfile(String... names) {
        return resolve(privateOverride, PRIVATE_KEY_FILE, DEFAULT_PRIVATE_NAMES, names);
    }

    /**
     * Candidate file names in lookup order
     */
    List<String> candidates(String baseName, List<String> defaults, String... names) {
        List<String> fnames = new ArrayList<>();
        Optional<String> name = context.getName();
        if (name.isPresent()) {
            fnames.add(KeyContext.filePrefix(name.get()) + baseName);
        } else {
            fnames.addAll(defaults);
        }

        if (names != null) {
            for (String extra : names) {
                if (extra == null || extra.isEmpty()) {
                    continue;
                }
                fnames.add(0, KeyContext.filePrefix(extra) + baseName);
                fnames.add(0, KeyContext.filePrefix(extra.toLowerCase(Locale.ROOT)) + baseName);
            }
        }
        return new ArrayList<>(new LinkedHashSet<>(fnames));
    }

    private KeyFileLookup resolve(Path override, String baseName, List<String> defaults, String... names) {
        if (override != null) {
            if (!isUsable(override)) {
                logger.error("Could not access PEM key file {}", override);
                return KeyFileLookup.misconfigured(override);
            }
            return KeyFileLookup.found(override);
        }

        Optional<Path> directory = context.getDirectory();
        if (directory.isEmpty()) {
            return KeyFileLookup.notConfigured();
        }

        for (String fname : candidates(baseName, defaults, names)) {
            Path candidate = directory.get().resolve(fname);
            if (Files.isRegularFile(candidate)) {
                return KeyFileLookup.found(candidate);
            }
        }
        return KeyFileLookup.notConfigured();
    }

    private boolean isUsable(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            return false;
        }
        try {
            return Files.size(path) <= context.getMaxPemKeySize();
        } catch (IOException e) {
            return false;
        }
    }

    public Optional<PublicKey> readPublicKey(Path path) {
        Optional<byte[]> pem = readPem(path);
        if (pem.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(backend.parsePublicKey(pem.get()));
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            logger.debug("Could not parse PEM public key {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<PrivateKey> readPrivateKey(Path path) {
        Optional<byte[]> pem = readPem(path);
        if (pem.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(backend.parsePrivateKey(pem.get()));
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            logger.debug("Could not parse PEM private key {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<byte[]> readPem(Path path) {
        try {
            if (!Files.isRegularFile(path)) {
                logger.debug("PEM key file {} does not exist", path);
                return Optional.empty();
            }
            long size = Files.size(path);
            if (size > context.getMaxPemKeySize()) {
                logger.warn("PEM key file {} exceeds {} bytes ({} bytes), ignoring",
                    path, context.getMaxPemKeySize(), size);
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            logger.warn("Error reading PEM key file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes a key file through a temporary sibling and moves it into place.
     *
     * @param target final location
     * @param pem file content
     * @param secret whether the file should be restricted to its owner
     * @throws IOException if the file could not be written or moved
     */
    public void writeKeyFile(Path target, byte[] pem, boolean secret) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path tempFile = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            Files.write(tempFile, pem);
            if (secret) {
                setFilePermissions(tempFile, SECRET_FILE_PERMISSIONS);
            }
            try {
                Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    /**
     * Removes a file, logging instead of failing
     */
    public void deleteQuietly(Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                logger.debug("Removed {}", path);
            }
        } catch (IOException e) {
            logger.debug("Could not remove {}: {}", path, e.getMessage());
        }
    }

    private void setFilePermissions(Path path, Set<PosixFilePermission> permissions) {
        try {
            Files.setPosixFilePermissions(path, permissions);
        } catch (UnsupportedOperationException e) {
            logger.debug("POSIX permissions not supported for {}", path);
        } catch (IOException e) {
            logger.warn("Could not restrict permissions of {}: {}", path, e.getMessage());
        }
    }
}
