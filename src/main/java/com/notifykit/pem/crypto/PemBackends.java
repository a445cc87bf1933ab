package com.notifykit.pem.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;

/**
 * Chooses the crypto backend for this runtime.
 */
public final class PemBackends {

    private static final Logger logger = LoggerFactory.getLogger(PemBackends.class);

    private PemBackends() {
        // Utility class
    }

    /**
     * The shared backend: {@link JcaPemBackend} when the providers and
     * BouncyCastle are usable, {@link UnavailablePemBackend} otherwise.
     * Detection runs once per class loader.
     */
    public static PemBackend detect() {
        return Holder.DEFAULT;
    }

    /**
     * A backend that rejects every operation
     */
    public static PemBackend unavailable() {
        return new UnavailablePemBackend();
    }

    static PemBackend probe() {
        try {
            PemBackend backend = new JcaPemBackend();
            logger.debug("PEM backend {} selected", backend.getName());
            return backend;
        } catch (GeneralSecurityException e) {
            logger.warn("PEM support disabled, crypto provider lacks a required primitive: {}", e.getMessage());
            return new UnavailablePemBackend(e);
        } catch (LinkageError e) {
            logger.warn("PEM support disabled, BouncyCastle could not be loaded: {}", e.toString());
            return new UnavailablePemBackend(e);
        }
    }

    private static final class Holder {
        static final PemBackend DEFAULT = probe();
    }
}
