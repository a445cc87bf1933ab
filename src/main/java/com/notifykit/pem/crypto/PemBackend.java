package com.notifykit.pem.crypto;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Elliptic curve primitives behind the PEM controller.
 *
 * <p>Exactly two implementations exist: {@link JcaPemBackend}, bound to the
 * JCA providers and BouncyCastle, and {@link UnavailablePemBackend}, whose
 * every method throws {@link com.notifykit.pem.exception.PemUnavailableException}.
 * The choice is made once, when a controller is built (see {@link PemBackends}).
 *
 * <p>All keys are on P-256 (secp256r1). Checked exceptions report routine
 * failures such as a key on the wrong curve or a failed authentication tag.
 */
public interface PemBackend {

    /**
     * Human readable backend name, used in log output
     */
    String getName();

    /**
     * Returns normally when this backend can perform crypto operations.
     *
     * @throws com.notifykit.pem.exception.PemUnavailableException otherwise
     */
    void checkAvailable();

    KeyPair generateKeyPair() throws GeneralSecurityException;

    /**
     * Computes the public key belonging to a private key
     */
    PublicKey derivePublicKey(PrivateKey privateKey) throws GeneralSecurityException;

    /**
     * PEM armor for a key: {@code PUBLIC KEY} (SubjectPublicKeyInfo) or
     * {@code PRIVATE KEY} (unencrypted PKCS#8)
     */
    byte[] encodePem(Key key);

    PublicKey parsePublicKey(byte[] pem) throws IOException, GeneralSecurityException;

    PrivateKey parsePrivateKey(byte[] pem) throws IOException, GeneralSecurityException;

    /**
     * X9.62 uncompressed point: {@code 0x04 || X || Y}
     */
    byte[] encodePoint(PublicKey publicKey) throws GeneralSecurityException;

    PublicKey decodePoint(byte[] point) throws GeneralSecurityException;

    /**
     * Raw ECDH shared secret
     */
    byte[] agree(PrivateKey privateKey, PublicKey publicKey) throws GeneralSecurityException;

    /**
     * HKDF-SHA256 extract-and-expand; a {@code null} salt means a zero-filled salt
     */
    byte[] hkdf(byte[] salt, byte[] inputKeyMaterial, byte[] info, int length);

    /**
     * AES-GCM encryption with a 128-bit tag appended to the ciphertext
     */
    byte[] seal(byte[] key, byte[] nonce, byte[] plaintext) throws GeneralSecurityException;

    /**
     * AES-GCM decryption of ciphertext with its trailing 128-bit tag
     *
     * @throws javax.crypto.AEADBadTagException if authentication fails
     */
    byte[] open(byte[] key, byte[] nonce, byte[] ciphertext) throws GeneralSecurityException;

    /**
     * ES256 signature in raw {@code R || S} form (64 bytes)
     */
    byte[] sign(PrivateKey privateKey, byte[] data) throws GeneralSecurityException;

    boolean verify(PublicKey publicKey, byte[] data, byte[] signature) throws GeneralSecurityException;

    byte[] randomBytes(int length);
}
