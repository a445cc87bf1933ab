package com.notifykit.pem.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifykit.pem.config.PemConfig;
import com.notifykit.pem.exception.PemUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Optional;

/**
 * Key management and encryption for one {@link KeyContext}.
 *
 * <p>Keys are resolved lazily: the first call to {@link #publicKey(String...)}
 * or {@link #privateKey(String...)} looks for PEM files, generates a pair when
 * none exists and policy permits, and caches the result for the lifetime of
 * the controller. {@link #keygen(String, boolean)} with {@code force} replaces
 * the pair, after which older envelopes can no longer be decrypted.
 *
 * <p>Every public method throws {@link PemUnavailableException} when the
 * runtime has no usable crypto backend. All other failures are reported as
 * an empty result or {@code false}; misuse such as an unsupported message
 * type raises {@link IllegalArgumentException}.
 *
 * <p>Methods are synchronized, so an instance may be shared between threads.
 * Separate controllers (or processes) working on the same directory are not
 * coordinated and may race when generating keys.
 *
 * <p>Example usage:
 * <pre>{@code
 * PemController pem = PemController.builder()
 *     .config(config)
 *     .name("webhook")
 *     .build();
 *
 * String envelope = pem.encrypt("hello").orElseThrow();
 * String message = pem.decrypt(envelope).orElse(null);
 * }</pre>
 */
public class PemController {

    private static final Logger logger = LoggerFactory.getLogger(PemController.class);

    private final PemBackend backend;
    private final KeyContext context;
    private final KeyFileStore store;
    private final PemKeyGenerator generator;
    private final HybridCipher hybridCipher;
    private final WebPushCipher webPushCipher;
    private final Signer signer;

    private PublicKey publicKey;
    private PrivateKey privateKey;

    private PemController(Builder builder) {
        PemConfig config = builder.config != null ? builder.config : PemConfig.defaults();
        this.backend = builder.backend != null ? builder.backend : PemBackends.detect();
        this.context = KeyContext.of(config, builder.directory, builder.name);
        this.store = new KeyFileStore(context, backend);
        this.generator = new PemKeyGenerator(store, backend);
        this.hybridCipher = new HybridCipher(backend, new ObjectMapper());
        this.webPushCipher = new WebPushCipher(backend, config.getWebPushRecordSize());
        this.signer = new Signer(backend);
    }

    public static Builder builder() {
        return new Builder();
    }

    public KeyContext getContext() {
        return context;
    }

    public PemBackend getBackend() {
        return backend;
    }

    // ---- key resolution ----

    /**
     * Public key of this context, loading or generating it on first use.
     *
     * @param names extra key names to look for
     */
    public synchronized Optional<PublicKey> publicKey(String... names) {
        return publicKey(null, true, names);
    }

    /**
     * @param autogen whether a missing pair may be generated; {@code null} follows the context policy
     * @param autodetect {@code false} returns the cached key only
     * @param names extra key names to look for
     */
    public synchronized Optional<PublicKey> publicKey(Boolean autogen, boolean autodetect, String... names) {
        backend.checkAvailable();
        if (publicKey != null || !autodetect) {
            return Optional.ofNullable(publicKey);
        }

        KeyFileLookup lookup = store.publicKeyfile(names);
        if (!lookup.isFound()) {
            if (!lookup.isMisconfigured() && generationPermitted(autogen)) {
                if (keygen(firstName(names), false) && store.publicKeyfile(names).isFound()) {
                    return publicKey(false, true);
                }
                logger.warn("No PEM public key could be loaded for {}", context);
            } else {
                logger.debug("No PEM public key available for {} ({})", context, lookup);
            }
            return Optional.empty();
        }

        if (loadPublicKeyFile(lookup.getPath().get())) {
            return Optional.of(publicKey);
        }
        // a private key is enough to recover the public half
        if (privateKey(autogen, true, names).isPresent()) {
            return Optional.ofNullable(publicKey);
        }
        return Optional.empty();
    }

    /**
     * Private key of this context, loading or generating it on first use.
     *
     * @param names extra key names to look for
     */
    public synchronized Optional<PrivateKey> privateKey(String... names) {
        return privateKey(null, true, names);
    }

    /**
     * @param autogen whether a missing pair may be generated; {@code null} follows the context policy
     * @param autodetect {@code false} returns the cached key only
     * @param names extra key names to look for
     */
    public synchronized Optional<PrivateKey> privateKey(Boolean autogen, boolean autodetect, String... names) {
        backend.checkAvailable();
        if (privateKey != null || !autodetect) {
            return Optional.ofNullable(privateKey);
        }

        KeyFileLookup lookup = store.privateKeyfile(names);
        if (!lookup.isFound()) {
            if (!lookup.isMisconfigured() && generationPermitted(autogen)) {
                if (keygen(firstName(names), false) && store.privateKeyfile(names).isFound()) {
                    return privateKey(false, true);
                }
                logger.warn("No PEM private key could be loaded for {}", context);
            } else {
                logger.debug("No PEM private key available for {} ({})", context, lookup);
            }
            return Optional.empty();
        }

        return loadPrivateKeyFile(lookup.getPath().get())
            ? Optional.of(privateKey)
            : Optional.empty();
    }

    /**
     * Loads a public key file.
     *
     * @param path key file to use from now on, or {@code null} to resolve one through the context
     * @param names extra key names used when {@code path} is {@code null}
     * @return whether a public key was loaded
     */
    public synchronized boolean loadPublicKey(Path path, String... names) {
        backend.checkAvailable();
        if (path == null) {
            KeyFileLookup lookup = store.publicKeyfile(names);
            return lookup.isFound() && loadPublicKeyFile(lookup.getPath().get());
        }

        store.setPublicOverride(path);
        store.setPrivateOverride(null);
        clearKeys();

        if (!store.publicKeyfile().isFound()) {
            return false;
        }
        return loadPublicKeyFile(path);
    }

    /**
     * Loads a private key file; its public key is derived from it.
     *
     * @param path key file to use from now on, or {@code null} to resolve one through the context
     * @param names extra key names used when {@code path} is {@code null}
     * @return whether a private key was loaded
     */
    public synchronized boolean loadPrivateKey(Path path, String... names) {
        backend.checkAvailable();
        if (path == null) {
            KeyFileLookup lookup = store.privateKeyfile(names);
            return lookup.isFound() && loadPrivateKeyFile(lookup.getPath().get());
        }

        store.setPrivateOverride(path);
        store.setPublicOverride(null);
        clearKeys();

        if (!store.privateKeyfile().isFound()) {
            return false;
        }
        return loadPrivateKeyFile(path);
    }

    private boolean loadPublicKeyFile(Path path) {
        Optional<PublicKey> loaded = store.readPublicKey(path);
        loaded.ifPresent(key -> this.publicKey = key);
        return loaded.isPresent();
    }

    private boolean loadPrivateKeyFile(Path path) {
        Optional<PrivateKey> loaded = store.readPrivateKey(path);
        if (loaded.isEmpty()) {
            return false;
        }
        try {
            PublicKey derived = backend.derivePublicKey(loaded.get());
            this.privateKey = loaded.get();
            this.publicKey = derived;
            return true;
        } catch (GeneralSecurityException e) {
            logger.debug("Could not derive public key from {}: {}", path, e.getMessage());
            return false;
        }
    }

    // ---- key generation ----

    /**
     * Generates a key pair for this context unless one already resolves.
     */
    public synchronized boolean keygen() {
        return keygen(null, false);
    }

    public synchronized boolean keygen(boolean force) {
        return keygen(null, force);
    }

    /**
     * Generates and persists a new key pair.
     *
     * @param name key name (file prefix); {@code null} uses the context name
     * @param force replace existing keys and files
     * @return whether a new pair was written
     */
    public synchronized boolean keygen(String name, boolean force) {
        backend.checkAvailable();
        if (!context.isWritable()) {
            logger.debug("PEM keygen disabled for {}, reason=no-write-path", context);
            return false;
        }

        if (!force && name == null) {
            boolean hasKey = privateKey(false, true).isPresent() || publicKey(false, true).isPresent();
            if (hasKey) {
                logger.debug("PEM keygen disabled for {}, reason=keyfile-defined", context);
                return false;
            }
        }

        if (force) {
            clearKeys();
        }

        Optional<KeyPair> generated = generator.generate(name, force);
        if (generated.isEmpty()) {
            return false;
        }
        this.privateKey = generated.get().getPrivate();
        this.publicKey = generated.get().getPublic();
        return true;
    }

    // ---- hybrid encryption ----

    public synchronized Optional<String> encrypt(String message) {
        return encrypt((Object) message, null, null);
    }

    public synchronized Optional<String> encrypt(byte[] message) {
        return encrypt((Object) message, null, null);
    }

    public synchronized Optional<String> encrypt(Object message) {
        return encrypt(message, null, null);
    }

    public synchronized Optional<String> encrypt(Object message, PublicKey recipient) {
        return encrypt(message, recipient, null);
    }

    /**
     * Encrypts a message into an envelope.
     *
     * @param message a {@code String} (encoded as UTF-8) or {@code byte[]}
     * @param recipient recipient key, or {@code null} for this context's public key
     * @param salt optional HKDF salt
     * @return the envelope, or empty when no public key is available
     * @throws IllegalArgumentException if the message is {@code null} or of another type
     */
    public synchronized Optional<String> encrypt(Object message, PublicKey recipient, byte[] salt) {
        backend.checkAvailable();
        byte[] plaintext = toBytes(message, "message");

        PublicKey key = recipient;
        if (key == null) {
            Optional<PublicKey> own = publicKey();
            if (own.isEmpty()) {
                logger.debug("No public key available for encryption");
                return Optional.empty();
            }
            key = own.get();
        }
        return hybridCipher.encrypt(plaintext, key, salt);
    }

    public synchronized Optional<String> decrypt(String content) {
        return decrypt((Object) content, null, null);
    }

    public synchronized Optional<String> decrypt(byte[] content) {
        return decrypt((Object) content, null, null);
    }

    public synchronized Optional<String> decrypt(Object content) {
        return decrypt(content, null, null);
    }

    public synchronized Optional<String> decrypt(Object content, PrivateKey recipient) {
        return decrypt(content, recipient, null);
    }

    /**
     * Decrypts an envelope produced by {@link #encrypt(Object, PublicKey, byte[])}.
     *
     * @param content the envelope as {@code String} or {@code byte[]}
     * @param recipient private key, or {@code null} for this context's private key
     * @param salt the salt used to encrypt, or {@code null}
     * @return the plaintext, or empty if the content is malformed or was not encrypted for this key
     * @throws IllegalArgumentException if the content is {@code null} or of another type
     */
    public synchronized Optional<String> decrypt(Object content, PrivateKey recipient, byte[] salt) {
        backend.checkAvailable();
        byte[] raw = toBytes(content, "content");

        Optional<HybridCipher.Envelope> envelope = hybridCipher.parse(raw);
        if (envelope.isEmpty()) {
            return Optional.empty();
        }

        PrivateKey key = recipient;
        if (key == null) {
            Optional<PrivateKey> own = privateKey();
            if (own.isEmpty()) {
                logger.debug("No private key available for decryption");
                return Optional.empty();
            }
            key = own.get();
        }
        return hybridCipher.open(envelope.get(), key, salt);
    }

    // ---- Web Push ----

    /**
     * Encrypts a Web Push message for a subscription.
     *
     * @param message a {@code String} or {@code byte[]}
     * @param userAgentPublicKey subscription {@code p256dh} key
     * @param authSecret subscription {@code auth} secret
     * @return the {@code aes128gcm} request body
     * @throws IllegalArgumentException for a bad message type, missing key material,
     *         or a message larger than one record
     */
    public synchronized byte[] encryptWebPush(Object message, PublicKey userAgentPublicKey, byte[] authSecret) {
        backend.checkAvailable();
        byte[] plaintext = toBytes(message, "message");
        if (userAgentPublicKey == null || authSecret == null) {
            throw new IllegalArgumentException("Web Push encryption requires a public key and auth secret");
        }
        return webPushCipher.encrypt(plaintext, userAgentPublicKey, authSecret);
    }

    // ---- signatures ----

    /**
     * Signs data with this context's private key (ES256, raw R||S).
     *
     * @return the 64 byte signature, or empty when no private key is available
     */
    public synchronized Optional<byte[]> sign(byte[] data) {
        backend.checkAvailable();
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        Optional<PrivateKey> key = privateKey();
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return signer.sign(key.get(), data);
    }

    public synchronized boolean verify(byte[] data, byte[] signature) {
        backend.checkAvailable();
        Optional<PublicKey> key = publicKey();
        return key.isPresent() && verify(data, signature, key.get());
    }

    public synchronized boolean verify(byte[] data, byte[] signature, PublicKey key) {
        backend.checkAvailable();
        if (data == null || key == null) {
            return false;
        }
        return signer.verify(key, data, signature);
    }

    // ---- introspection ----

    /**
     * Public key as a base64url encoded uncompressed point, or an empty string
     */
    public synchronized String x962Str() {
        backend.checkAvailable();
        Optional<PublicKey> key = publicKey();
        if (key.isEmpty()) {
            return "";
        }
        try {
            return Base64Url.encode(backend.encodePoint(key.get()));
        } catch (GeneralSecurityException e) {
            logger.debug("Could not encode public key: {}", e.getMessage());
            return "";
        }
    }

    /**
     * Whether at least one key of the pair can be resolved
     */
    public synchronized boolean hasKeys() {
        backend.checkAvailable();
        return privateKey().isPresent() || publicKey().isPresent();
    }

    public synchronized KeyFileLookup publicKeyfile(String... names) {
        backend.checkAvailable();
        return store.publicKeyfile(names);
    }

    public synchronized KeyFileLookup privateKeyfile(String... names) {
        backend.checkAvailable();
        return store.privateKeyfile(names);
    }

    /**
     * Explicitly configured public key file, if any
     */
    public synchronized Optional<Path> getPublicKeyfileOverride() {
        backend.checkAvailable();
        return Optional.ofNullable(store.getPublicOverride());
    }

    /**
     * Explicitly configured private key file, if any
     */
    public synchronized Optional<Path> getPrivateKeyfileOverride() {
        backend.checkAvailable();
        return Optional.ofNullable(store.getPrivateOverride());
    }

    private boolean generationPermitted(Boolean autogen) {
        boolean allowed = autogen != null ? autogen : context.isPemAutogen();
        return allowed && context.getStorageMode().isWritable();
    }

    private void clearKeys() {
        this.publicKey = null;
        this.privateKey = null;
    }

    private static String firstName(String... names) {
        return names != null && names.length > 0 ? names[0] : null;
    }

    private static byte[] toBytes(Object value, String what) {
        if (value instanceof String) {
            return ((String) value).getBytes(StandardCharsets.UTF_8);
        }
        if (value instanceof byte[]) {
            return (byte[]) value;
        }
        throw new IllegalArgumentException(what + " must be a String or byte[], got "
            + (value == null ? "null" : value.getClass().getName()));
    }

    /**
     * Builder for PemController
     */
    public static class Builder {
        private PemConfig config;
        private Path directory;
        private String name;
        private Path publicKeyFile;
        private Path privateKeyFile;
        private PemBackend backend;

        /**
         * Storage policy; defaults to {@link PemConfig#defaults()}
         */
        public Builder config(PemConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Key directory; overrides the configured storage path
         */
        public Builder directory(Path directory) {
            this.directory = directory;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder publicKeyFile(Path publicKeyFile) {
            this.publicKeyFile = publicKeyFile;
            return this;
        }

        public Builder privateKeyFile(Path privateKeyFile) {
            this.privateKeyFile = privateKeyFile;
            return this;
        }

        /**
         * Crypto backend; defaults to {@link PemBackends#detect()}
         */
        public Builder backend(PemBackend backend) {
            this.backend = backend;
            return this;
        }

        /**
         * Builds the controller. An explicit private key file is loaded right
         * away, otherwise an explicit public key file.
         */
        public PemController build() {
            PemController controller = new PemController(this);
            if (privateKeyFile != null) {
                controller.store.setPrivateOverride(privateKeyFile);
            } else if (publicKeyFile != null) {
                controller.store.setPublicOverride(publicKeyFile);
            }

            if (privateKeyFile != null || publicKeyFile != null) {
                try {
                    if (privateKeyFile != null) {
                        controller.loadPrivateKey(privateKeyFile);
                    } else {
                        controller.loadPublicKey(publicKeyFile);
                    }
                } catch (PemUnavailableException e) {
                    logger.warn("Explicit PEM key file not loaded: {}", e.getMessage());
                }
            }
            return controller;
        }
    }
}
