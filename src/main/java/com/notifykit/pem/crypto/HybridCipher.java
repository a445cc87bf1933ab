package com.notifykit.pem.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Base64;
import java.util.Optional;

/**
 * ECIES style hybrid encryption on P-256.
 *
 * <p>A fresh ephemeral key pair is agreed with the recipient key, the
 * shared secret is stretched with HKDF-SHA256 ({@code info="ecies-encryption"})
 * into an AES-256-GCM key, and the result is packed as
 * {@code Base64(JSON{ephemeral_pubkey, iv, tag, ciphertext})} with every
 * field base64url encoded without padding.
 */
public class HybridCipher {

    private static final Logger logger = LoggerFactory.getLogger(HybridCipher.class);

    private static final byte[] HKDF_INFO = "ecies-encryption".getBytes(StandardCharsets.US_ASCII);
    private static final int KEY_LENGTH = 32;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH = 16;

    static final String FIELD_EPHEMERAL_PUBKEY = "ephemeral_pubkey";
    static final String FIELD_IV = "iv";
    static final String FIELD_TAG = "tag";
    static final String FIELD_CIPHERTEXT = "ciphertext";

    private final PemBackend backend;
    private final ObjectMapper objectMapper;

    public HybridCipher(PemBackend backend, ObjectMapper objectMapper) {
        this.backend = backend;
        this.objectMapper = objectMapper;
    }

    /**
     * Decoded envelope fields
     */
    public static final class Envelope {
        private final byte[] ephemeralPublicKey;
        private final byte[] iv;
        private final byte[] tag;
        private final byte[] ciphertext;

        Envelope(byte[] ephemeralPublicKey, byte[] iv, byte[] tag, byte[] ciphertext) {
            this.ephemeralPublicKey = ephemeralPublicKey;
            this.iv = iv;
            this.tag = tag;
            this.ciphertext = ciphertext;
        }

        public byte[] getEphemeralPublicKey() { return ephemeralPublicKey.clone(); }
        public byte[] getIv() { return iv.clone(); }
        public byte[] getTag() { return tag.clone(); }
        public byte[] getCiphertext() { return ciphertext.clone(); }
    }

    /**
     * Encrypts a message for a recipient.
     *
     * @param message plaintext bytes
     * @param publicKey recipient key
     * @param salt optional HKDF salt, must be given again to decrypt
     * @return the encoded envelope, or empty if the key cannot be used
     */
    public Optional<String> encrypt(byte[] message, PublicKey publicKey, byte[] salt) {
        try {
            KeyPair ephemeral = backend.generateKeyPair();
            byte[] shared = backend.agree(ephemeral.getPrivate(), publicKey);
            byte[] key = backend.hkdf(salt, shared, HKDF_INFO, KEY_LENGTH);
            byte[] iv = backend.randomBytes(IV_LENGTH);

            byte[] sealed = backend.seal(key, iv, message);
            int split = sealed.length - TAG_LENGTH;
            byte[] ciphertext = new byte[split];
            byte[] tag = new byte[TAG_LENGTH];
            System.arraycopy(sealed, 0, ciphertext, 0, split);
            System.arraycopy(sealed, split, tag, 0, TAG_LENGTH);

            ObjectNode payload = objectMapper.createObjectNode();
            payload.put(FIELD_EPHEMERAL_PUBKEY, Base64Url.encode(backend.encodePoint(ephemeral.getPublic())));
            payload.put(FIELD_IV, Base64Url.encode(iv));
            payload.put(FIELD_TAG, Base64Url.encode(tag));
            payload.put(FIELD_CIPHERTEXT, Base64Url.encode(ciphertext));

            return Optional.of(Base64.getEncoder().encodeToString(objectMapper.writeValueAsBytes(payload)));
        } catch (GeneralSecurityException | JsonProcessingException e) {
            logger.debug("Encryption failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Decodes an envelope without decrypting it.
     *
     * @param content Base64 text of the envelope
     * @return the envelope, or empty if the content is not one
     */
    public Optional<Envelope> parse(byte[] content) {
        JsonNode payload;
        try {
            byte[] json = Base64.getDecoder().decode(stripWhitespace(content));
            payload = objectMapper.readTree(json);
        } catch (IllegalArgumentException | IOException e) {
            logger.debug("Unparseable encrypted content provided");
            return Optional.empty();
        }

        if (payload == null || !payload.isObject()) {
            logger.debug("Unparseable encrypted content provided");
            return Optional.empty();
        }

        try {
            return Optional.of(new Envelope(
                field(payload, FIELD_EPHEMERAL_PUBKEY),
                field(payload, FIELD_IV),
                field(payload, FIELD_TAG),
                field(payload, FIELD_CIPHERTEXT)));
        } catch (IllegalArgumentException e) {
            logger.debug("Malformed encrypted content: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Decrypts a parsed envelope.
     *
     * @param envelope the envelope
     * @param privateKey recipient key
     * @param salt the HKDF salt given at encryption, or {@code null}
     * @return the UTF-8 plaintext, or empty if the key, salt or content do not match
     */
    public Optional<String> open(Envelope envelope, PrivateKey privateKey, byte[] salt) {
        if (envelope.iv.length != IV_LENGTH || envelope.tag.length != TAG_LENGTH) {
            logger.debug("Malformed encrypted content: bad iv or tag length");
            return Optional.empty();
        }
        try {
            PublicKey ephemeral = backend.decodePoint(envelope.ephemeralPublicKey);
            byte[] shared = backend.agree(privateKey, ephemeral);
            byte[] key = backend.hkdf(salt, shared, HKDF_INFO, KEY_LENGTH);

            byte[] sealed = new byte[envelope.ciphertext.length + TAG_LENGTH];
            System.arraycopy(envelope.ciphertext, 0, sealed, 0, envelope.ciphertext.length);
            System.arraycopy(envelope.tag, 0, sealed, envelope.ciphertext.length, TAG_LENGTH);

            byte[] plaintext = backend.open(key, envelope.iv, sealed);
            return Optional.of(decodeUtf8(plaintext));
        } catch (CharacterCodingException e) {
            logger.debug("Decrypted content is not valid UTF-8");
            return Optional.empty();
        } catch (AEADBadTagException e) {
            // mismatched key or salt, or tampered content
            logger.debug("Decryption failed - authentication mismatch");
            return Optional.empty();
        } catch (GeneralSecurityException e) {
            logger.debug("Decryption failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String decodeUtf8(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }

    // line breaks and padding spaces are tolerated, nothing else outside the alphabet
    private static byte[] stripWhitespace(byte[] content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(content.length);
        for (byte b : content) {
            if (b != ' ' && b != '\t' && b != '\r' && b != '\n') {
                out.write(b);
            }
        }
        return out.toByteArray();
    }

    private static byte[] field(JsonNode payload, String name) {
        JsonNode node = payload.get(name);
        if (node == null || !node.isTextual()) {
            throw new IllegalArgumentException("missing field " + name);
        }
        return Base64Url.decode(node.asText());
    }
}
