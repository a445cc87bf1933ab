package com.notifykit.pem.crypto;

import com.notifykit.pem.exception.PemUnavailableException;

import java.security.Key;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Backend used when this runtime cannot do P-256 cryptography.
 * Every method throws {@link PemUnavailableException}.
 */
public final class UnavailablePemBackend implements PemBackend {

    private final Throwable reason;

    public UnavailablePemBackend() {
        this(null);
    }

    /**
     * @param reason the failure that made the real backend unusable, reported as the cause
     */
    public UnavailablePemBackend(Throwable reason) {
        this.reason = reason;
    }

    @Override
    public String getName() {
        return "unavailable";
    }

    @Override
    public void checkAvailable() {
        throw unavailable();
    }

    @Override
    public KeyPair generateKeyPair() {
        throw unavailable();
    }

    @Override
    public PublicKey derivePublicKey(PrivateKey privateKey) {
        throw unavailable();
    }

    @Override
    public byte[] encodePem(Key key) {
        throw unavailable();
    }

    @Override
    public PublicKey parsePublicKey(byte[] pem) {
        throw unavailable();
    }

    @Override
    public PrivateKey parsePrivateKey(byte[] pem) {
        throw unavailable();
    }

    @Override
    public byte[] encodePoint(PublicKey publicKey) {
        throw unavailable();
    }

    @Override
    public PublicKey decodePoint(byte[] point) {
        throw unavailable();
    }

    @Override
    public byte[] agree(PrivateKey privateKey, PublicKey publicKey) {
        throw unavailable();
    }

    @Override
    public byte[] hkdf(byte[] salt, byte[] inputKeyMaterial, byte[] info, int length) {
        throw unavailable();
    }

    @Override
    public byte[] seal(byte[] key, byte[] nonce, byte[] plaintext) {
        throw unavailable();
    }

    @Override
    public byte[] open(byte[] key, byte[] nonce, byte[] ciphertext) {
        throw unavailable();
    }

    @Override
    public byte[] sign(PrivateKey privateKey, byte[] data) {
        throw unavailable();
    }

    @Override
    public boolean verify(PublicKey publicKey, byte[] data, byte[] signature) {
        throw unavailable();
    }

    @Override
    public byte[] randomBytes(int length) {
        throw unavailable();
    }

    private PemUnavailableException unavailable() {
        if (reason == null) {
            return new PemUnavailableException();
        }
        return new PemUnavailableException(
            "PEM support unavailable: " + reason.getMessage(), reason);
    }
}
