package com.notifykit.pem.crypto;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Signer
 */
class SignerTest {

    private static PemBackend backend;
    private static KeyPair keyPair;

    @BeforeAll
    static void setUpKeys() throws GeneralSecurityException {
        backend = new JcaPemBackend();
        keyPair = backend.generateKeyPair();
    }

    @Test
    @DisplayName("should produce 64 byte signatures that verify")
    void shouldSignAndVerify() {
        Signer signer = new Signer(backend);
        byte[] data = "eyJhbGciOiJFUzI1NiJ9.e30".getBytes(StandardCharsets.US_ASCII);

        byte[] signature = signer.sign(keyPair.getPrivate(), data).orElseThrow();

        assertEquals(Signer.SIGNATURE_LENGTH, signature.length);
        assertTrue(signer.verify(keyPair.getPublic(), data, signature));
    }

    @Test
    @DisplayName("should reject altered data and signatures")
    void shouldRejectAltered() {
        Signer signer = new Signer(backend);
        byte[] data = {1, 2, 3};
        byte[] signature = signer.sign(keyPair.getPrivate(), data).orElseThrow();

        byte[] flipped = signature.clone();
        flipped[10] ^= 1;

        assertFalse(signer.verify(keyPair.getPublic(), new byte[] {1, 2, 4}, signature));
        assertFalse(signer.verify(keyPair.getPublic(), data, flipped));
        assertFalse(signer.verify(keyPair.getPublic(), data, new byte[70]));
        assertFalse(signer.verify(keyPair.getPublic(), data, null));
    }

    @Test
    @DisplayName("should refuse keys on other curves")
    void shouldRefuseOtherCurves() throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
        generator.initialize(new ECGenParameterSpec("secp384r1"));
        KeyPair other = generator.generateKeyPair();

        Signer signer = new Signer(backend);

        assertFalse(signer.sign(other.getPrivate(), new byte[] {1}).isPresent());
    }
}
