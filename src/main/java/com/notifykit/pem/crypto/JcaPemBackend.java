package com.notifykit.pem.crypto;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;

import javax.crypto.Cipher;
import javax.crypto.KeyAgreement;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;

/**
 * P-256 backend built on the installed JCA providers, with BouncyCastle for
 * PEM handling, point arithmetic and HKDF.
 *
 * <p>Construction probes every primitive it relies on, so a backend that
 * was created successfully is fully usable.
 */
public class JcaPemBackend implements PemBackend {

    public static final String CURVE_NAME = "secp256r1";

    private static final String KEY_ALGORITHM = "EC";
    private static final String AGREEMENT_ALGORITHM = "ECDH";
    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    private static final String SIGNATURE_ALGORITHM = "SHA256withECDSAinP1363Format";

    /** GCM authentication tag length in bits */
    private static final int GCM_TAG_LENGTH = 128;

    private static final String PEM_PUBLIC_KEY = "PUBLIC KEY";
    private static final String PEM_PRIVATE_KEY = "PRIVATE KEY";

    private final ECParameterSpec curveParams;
    private final ECNamedCurveParameterSpec namedCurve;
    private final SecureRandom random;

    /**
     * @throws GeneralSecurityException if P-256, ECDH, AES-GCM or ES256 is not available
     */
    public JcaPemBackend() throws GeneralSecurityException {
        this(new SecureRandom());
    }

    public JcaPemBackend(SecureRandom random) throws GeneralSecurityException {
        AlgorithmParameters parameters = AlgorithmParameters.getInstance(KEY_ALGORITHM);
        parameters.init(new ECGenParameterSpec(CURVE_NAME));
        this.curveParams = parameters.getParameterSpec(ECParameterSpec.class);

        this.namedCurve = ECNamedCurveTable.getParameterSpec(CURVE_NAME);
        if (namedCurve == null) {
            throw new NoSuchAlgorithmException("Curve " + CURVE_NAME + " is not known to BouncyCastle");
        }

        KeyPairGenerator.getInstance(KEY_ALGORITHM);
        KeyAgreement.getInstance(AGREEMENT_ALGORITHM);
        Cipher.getInstance(CIPHER_ALGORITHM);
        Signature.getInstance(SIGNATURE_ALGORITHM);

        this.random = random;
    }

    @Override
    public String getName() {
        return "jca/" + CURVE_NAME;
    }

    @Override
    public void checkAvailable() {
        // always usable once constructed
    }

    @Override
    public KeyPair generateKeyPair() throws GeneralSecurityException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
        generator.initialize(new ECGenParameterSpec(CURVE_NAME), random);
        return generator.generateKeyPair();
    }

    @Override
    public PublicKey derivePublicKey(PrivateKey privateKey) throws GeneralSecurityException {
        ECPrivateKey ecKey = requireCurve(privateKey);
        org.bouncycastle.math.ec.ECPoint q = namedCurve.getG().multiply(ecKey.getS()).normalize();
        return toPublicKey(q);
    }

    @Override
    public byte[] encodePem(Key key) {
        String type = key instanceof PrivateKey ? PEM_PRIVATE_KEY : PEM_PUBLIC_KEY;
        StringWriter out = new StringWriter();
        try (PemWriter writer = new PemWriter(out)) {
            writer.writeObject(new PemObject(type, key.getEncoded()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode " + type, e);
        }
        return out.toString().getBytes(StandardCharsets.US_ASCII);
    }

    @Override
    public PublicKey parsePublicKey(byte[] pem) throws IOException, GeneralSecurityException {
        try (PEMParser parser = newParser(pem)) {
            Object entry;
            while ((entry = parser.readObject()) != null) {
                if (entry instanceof SubjectPublicKeyInfo) {
                    return toPublicKey(((SubjectPublicKeyInfo) entry).getEncoded());
                }
                if (entry instanceof X509CertificateHolder) {
                    return toPublicKey(((X509CertificateHolder) entry).getSubjectPublicKeyInfo().getEncoded());
                }
            }
        }
        throw new InvalidKeySpecException("No public key found in PEM content");
    }

    @Override
    public PrivateKey parsePrivateKey(byte[] pem) throws IOException, GeneralSecurityException {
        try (PEMParser parser = newParser(pem)) {
            Object entry;
            while ((entry = parser.readObject()) != null) {
                // "PRIVATE KEY" (PKCS#8)
                if (entry instanceof PrivateKeyInfo) {
                    return toPrivateKey(((PrivateKeyInfo) entry).getEncoded());
                }
                // "EC PRIVATE KEY" (SEC1, as written by openssl ecparam)
                if (entry instanceof PEMKeyPair) {
                    return toPrivateKey(((PEMKeyPair) entry).getPrivateKeyInfo().getEncoded());
                }
            }
        }
        throw new InvalidKeySpecException("No private key found in PEM content");
    }

    @Override
    public byte[] encodePoint(PublicKey publicKey) throws GeneralSecurityException {
        ECPoint w = requireCurve(publicKey).getW();
        return namedCurve.getCurve()
            .createPoint(w.getAffineX(), w.getAffineY())
            .getEncoded(false);
    }

    @Override
    public PublicKey decodePoint(byte[] point) throws GeneralSecurityException {
        if (point == null || point.length == 0) {
            throw new InvalidKeyException("Empty " + CURVE_NAME + " point");
        }
        org.bouncycastle.math.ec.ECPoint q;
        try {
            q = namedCurve.getCurve().decodePoint(point).normalize();
        } catch (IllegalArgumentException | ArithmeticException | IndexOutOfBoundsException e) {
            throw new InvalidKeyException("Not a valid " + CURVE_NAME + " point", e);
        }
        if (q.isInfinity()) {
            throw new InvalidKeyException("Point at infinity is not a valid public key");
        }
        return toPublicKey(q);
    }

    @Override
    public byte[] agree(PrivateKey privateKey, PublicKey publicKey) throws GeneralSecurityException {
        KeyAgreement agreement = KeyAgreement.getInstance(AGREEMENT_ALGORITHM);
        agreement.init(requireCurve(privateKey));
        agreement.doPhase(requireCurve(publicKey), true);
        return agreement.generateSecret();
    }

    @Override
    public byte[] hkdf(byte[] salt, byte[] inputKeyMaterial, byte[] info, int length) {
        HKDFBytesGenerator generator = new HKDFBytesGenerator(new SHA256Digest());
        generator.init(new HKDFParameters(inputKeyMaterial, salt, info));
        byte[] out = new byte[length];
        generator.generateBytes(out, 0, length);
        return out;
    }

    @Override
    public byte[] seal(byte[] key, byte[] nonce, byte[] plaintext) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
        cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"),
            new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
        return cipher.doFinal(plaintext);
    }

    @Override
    public byte[] open(byte[] key, byte[] nonce, byte[] ciphertext) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
            new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
        return cipher.doFinal(ciphertext);
    }

    @Override
    public byte[] sign(PrivateKey privateKey, byte[] data) throws GeneralSecurityException {
        Signature signature = Signature.getInstance(SIGNATURE_ALGORITHM);
        signature.initSign(requireCurve(privateKey), random);
        signature.update(data);
        return signature.sign();
    }

    @Override
    public boolean verify(PublicKey publicKey, byte[] data, byte[] signature) throws GeneralSecurityException {
        Signature verifier = Signature.getInstance(SIGNATURE_ALGORITHM);
        verifier.initVerify(requireCurve(publicKey));
        verifier.update(data);
        return verifier.verify(signature);
    }

    @Override
    public byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return bytes;
    }

    private PEMParser newParser(byte[] pem) {
        return new PEMParser(new InputStreamReader(new ByteArrayInputStream(pem), StandardCharsets.US_ASCII));
    }

    private PublicKey toPublicKey(byte[] encoded) throws GeneralSecurityException {
        KeyFactory keyFactory = KeyFactory.getInstance(KEY_ALGORITHM);
        return requireCurve(keyFactory.generatePublic(new X509EncodedKeySpec(encoded)));
    }

    private PublicKey toPublicKey(org.bouncycastle.math.ec.ECPoint q) throws GeneralSecurityException {
        BigInteger x = q.getAffineXCoord().toBigInteger();
        BigInteger y = q.getAffineYCoord().toBigInteger();
        KeyFactory keyFactory = KeyFactory.getInstance(KEY_ALGORITHM);
        return keyFactory.generatePublic(new ECPublicKeySpec(new ECPoint(x, y), curveParams));
    }

    private PrivateKey toPrivateKey(byte[] encoded) throws GeneralSecurityException {
        KeyFactory keyFactory = KeyFactory.getInstance(KEY_ALGORITHM);
        return requireCurve(keyFactory.generatePrivate(new PKCS8EncodedKeySpec(encoded)));
    }

    private ECPublicKey requireCurve(PublicKey key) throws InvalidKeyException {
        if (!(key instanceof ECPublicKey) || !isP256(((ECPublicKey) key).getParams())) {
            throw new InvalidKeyException("Expected a " + CURVE_NAME + " public key");
        }
        return (ECPublicKey) key;
    }

    private ECPrivateKey requireCurve(PrivateKey key) throws InvalidKeyException {
        if (!(key instanceof ECPrivateKey) || !isP256(((ECPrivateKey) key).getParams())) {
            throw new InvalidKeyException("Expected a " + CURVE_NAME + " private key");
        }
        return (ECPrivateKey) key;
    }

    private boolean isP256(ECParameterSpec params) {
        return params != null
            && params.getOrder().equals(curveParams.getOrder())
            && params.getGenerator().equals(curveParams.getGenerator());
    }
}
