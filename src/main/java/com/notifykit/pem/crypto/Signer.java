package com.notifykit.pem.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Optional;

/**
 * ES256 signatures in raw {@code R || S} form, as JWS expects them.
 */
public class Signer {

    private static final Logger logger = LoggerFactory.getLogger(Signer.class);

    public static final int SIGNATURE_LENGTH = 64;

    private final PemBackend backend;

    public Signer(PemBackend backend) {
        this.backend = backend;
    }

    public Optional<byte[]> sign(PrivateKey privateKey, byte[] data) {
        try {
            return Optional.of(backend.sign(privateKey, data));
        } catch (GeneralSecurityException e) {
            logger.debug("Signing failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return whether the signature is a valid raw ES256 signature of the data
     */
    public boolean verify(PublicKey publicKey, byte[] data, byte[] signature) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        try {
            return backend.verify(publicKey, data, signature);
        } catch (GeneralSecurityException e) {
            logger.debug("Signature verification failed: {}", e.getMessage());
            return false;
        }
    }
}
