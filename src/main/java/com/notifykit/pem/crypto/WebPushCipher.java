package com.notifykit.pem.crypto;

import com.notifykit.pem.exception.NotifyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.Optional;

/**
 * Web Push message encryption (RFC 8291) using the {@code aes128gcm}
 * content coding (RFC 8188), limited to a single record.
 *
 * <p>Output layout: {@code salt(16) || rs(uint32) || idlen(uint8) || keyid || record},
 * where keyid is the sender's ephemeral public key as an uncompressed point.
 */
public class WebPushCipher {

    private static final Logger logger = LoggerFactory.getLogger(WebPushCipher.class);

    public static final int SALT_LENGTH = 16;
    public static final int POINT_LENGTH = 65;
    public static final int HEADER_LENGTH = SALT_LENGTH + 4 + 1 + POINT_LENGTH;

    private static final int TAG_LENGTH = 16;
    private static final byte RECORD_DELIMITER = 0x02;

    private static final byte[] WEBPUSH_INFO = "WebPush: info\0".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] CEK_INFO = "Content-Encoding: aes128gcm\0".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NONCE_INFO = "Content-Encoding: nonce\0".getBytes(StandardCharsets.US_ASCII);

    private final PemBackend backend;
    private final int recordSize;

    public WebPushCipher(PemBackend backend, int recordSize) {
        this.backend = backend;
        this.recordSize = recordSize;
    }

    public int getRecordSize() {
        return recordSize;
    }

    /**
     * Encrypts a push message for a subscription.
     *
     * @param message plaintext
     * @param userAgentPublicKey the subscription's {@code p256dh} key
     * @param authSecret the subscription's {@code auth} secret
     * @return the encrypted request body
     * @throws IllegalArgumentException if the message does not fit one record
     * @throws NotifyException if the subscription key cannot be used
     */
    public byte[] encrypt(byte[] message, PublicKey userAgentPublicKey, byte[] authSecret) {
        if (message.length + 1 + TAG_LENGTH > recordSize) {
            throw new IllegalArgumentException(
                "Web Push message of " + message.length + " bytes does not fit a record of " + recordSize + " bytes");
        }

        try {
            KeyPair ephemeral = backend.generateKeyPair();
            byte[] senderPoint = backend.encodePoint(ephemeral.getPublic());
            byte[] receiverPoint = backend.encodePoint(userAgentPublicKey);
            byte[] salt = backend.randomBytes(SALT_LENGTH);

            byte[] shared = backend.agree(ephemeral.getPrivate(), userAgentPublicKey);
            byte[] ikm = backend.hkdf(authSecret, shared, keyInfo(receiverPoint, senderPoint), 32);
            byte[] cek = backend.hkdf(salt, ikm, CEK_INFO, 16);
            byte[] nonce = backend.hkdf(salt, ikm, NONCE_INFO, 12);

            byte[] padded = Arrays.copyOf(message, message.length + 1);
            padded[message.length] = RECORD_DELIMITER;
            byte[] record = backend.seal(cek, nonce, padded);

            return ByteBuffer.allocate(SALT_LENGTH + 5 + senderPoint.length + record.length)
                .put(salt)
                .putInt(recordSize)
                .put((byte) senderPoint.length)
                .put(senderPoint)
                .put(record)
                .array();
        } catch (GeneralSecurityException e) {
            throw new NotifyException("Web Push encryption failed: " + e.getMessage(), "WEBPUSH_ENCRYPT_ERROR", e);
        }
    }

    /**
     * Decrypts a push message on the user agent side.
     *
     * @param body encrypted request body
     * @param userAgentPrivateKey subscription private key
     * @param userAgentPublicKey subscription public key
     * @param authSecret subscription auth secret
     * @return the plaintext, or empty if the body is malformed or does not authenticate
     */
    public Optional<byte[]> decrypt(byte[] body, PrivateKey userAgentPrivateKey,
                                    PublicKey userAgentPublicKey, byte[] authSecret) {
        if (body == null || body.length < SALT_LENGTH + 5) {
            logger.debug("Web Push body too short");
            return Optional.empty();
        }

        ByteBuffer buffer = ByteBuffer.wrap(body);
        byte[] salt = new byte[SALT_LENGTH];
        buffer.get(salt);
        long rs = Integer.toUnsignedLong(buffer.getInt());
        int idlen = buffer.get() & 0xff;
        if (idlen != POINT_LENGTH || buffer.remaining() < idlen + TAG_LENGTH + 1) {
            logger.debug("Web Push header malformed, idlen={}", idlen);
            return Optional.empty();
        }
        byte[] senderPoint = new byte[idlen];
        buffer.get(senderPoint);
        byte[] record = new byte[buffer.remaining()];
        buffer.get(record);
        if (record.length > rs) {
            logger.debug("Web Push record of {} bytes exceeds declared size {}", record.length, rs);
            return Optional.empty();
        }

        try {
            PublicKey sender = backend.decodePoint(senderPoint);
            byte[] receiverPoint = backend.encodePoint(userAgentPublicKey);
            byte[] shared = backend.agree(userAgentPrivateKey, sender);
            byte[] ikm = backend.hkdf(authSecret, shared, keyInfo(receiverPoint, senderPoint), 32);
            byte[] cek = backend.hkdf(salt, ikm, CEK_INFO, 16);
            byte[] nonce = backend.hkdf(salt, ikm, NONCE_INFO, 12);

            byte[] padded = backend.open(cek, nonce, record);
            int end = padded.length;
            while (end > 0 && padded[end - 1] == 0) {
                end--;
            }
            if (end == 0 || padded[end - 1] != RECORD_DELIMITER) {
                logger.debug("Web Push record lacks final record delimiter");
                return Optional.empty();
            }
            return Optional.of(Arrays.copyOf(padded, end - 1));
        } catch (GeneralSecurityException e) {
            logger.debug("Web Push decryption failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static byte[] keyInfo(byte[] receiverPoint, byte[] senderPoint) {
        ByteArrayOutputStream info = new ByteArrayOutputStream();
        info.writeBytes(WEBPUSH_INFO);
        info.writeBytes(receiverPoint);
        info.writeBytes(senderPoint);
        return info.toByteArray();
    }
}
