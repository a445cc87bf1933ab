package com.notifykit.pem.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.util.Optional;

/**
 * Creates a P-256 key pair and persists it as two PEM files.
 *
 * <p>The private key is written first, then the public key. If either write
 * fails, both files of the attempt are removed so that a context never holds
 * half a key pair.
 */
public class PemKeyGenerator {

    private static final Logger logger = LoggerFactory.getLogger(PemKeyGenerator.class);

    private final KeyFileStore store;
    private final PemBackend backend;

    public PemKeyGenerator(KeyFileStore store, PemBackend backend) {
        this.store = store;
        this.backend = backend;
    }

    /**
     * Generates and writes a key pair.
     *
     * @param name key name used as file prefix, or {@code null} for the context name
     * @param force replace existing files
     * @return the new key pair, or empty if nothing was generated
     */
    public Optional<KeyPair> generate(String name, boolean force) {
        KeyContext context = store.getContext();
        if (!context.isWritable()) {
            logger.debug("PEM keygen disabled for {}, reason=no-write-path", context);
            return Optional.empty();
        }

        String keyName = KeyContext.normalizeName(name);
        if (keyName == null) {
            keyName = context.getName().orElse(null);
        }
        String prefix = KeyContext.filePrefix(keyName);
        Path dir = context.getDirectory().get();
        Path publicPath = dir.resolve(prefix + KeyFileStore.PUBLIC_KEY_FILE);
        Path privatePath = dir.resolve(prefix + KeyFileStore.PRIVATE_KEY_FILE);

        if (!force) {
            if (Files.isRegularFile(publicPath)) {
                logger.debug("PEM generation skipped; public key already exists: {}", publicPath);
                return Optional.empty();
            }
            if (Files.isRegularFile(privatePath)) {
                logger.debug("PEM generation skipped; private key already exists: {}", privatePath);
                return Optional.empty();
            }
        }

        KeyPair keyPair;
        try {
            keyPair = backend.generateKeyPair();
        } catch (GeneralSecurityException e) {
            logger.warn("PEM key pair generation failed: {}", e.getMessage());
            return Optional.empty();
        }

        try {
            Files.createDirectories(dir);
            store.writeKeyFile(privatePath, backend.encodePem(keyPair.getPrivate()), true);
            store.writeKeyFile(publicPath, backend.encodePem(keyPair.getPublic()), false);
        } catch (IOException e) {
            logger.warn("Error writing PEM key pair to {}: {}", dir, e.getMessage());
            store.deleteQuietly(privatePath);
            store.deleteQuietly(publicPath);
            return Optional.empty();
        }

        store.pin(publicPath, privatePath);
        logger.info("Generated PEM key pair {} / {}", publicPath.getFileName(), privatePath.getFileName());
        return Optional.of(keyPair);
    }
}
