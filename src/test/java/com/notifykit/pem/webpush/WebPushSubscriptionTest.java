package com.notifykit.pem.webpush;

import com.notifykit.pem.crypto.Base64Url;
import com.notifykit.pem.crypto.JcaPemBackend;
import com.notifykit.pem.crypto.PemBackend;
import com.notifykit.pem.exception.InvalidDataException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WebPushSubscription
 */
class WebPushSubscriptionTest {

    static final String ENDPOINT = "https://fcm.googleapis.com/fcm/send/abcdefghijklmnopqrstuvwxyz";

    private static PemBackend backend;
    private static KeyPair userAgent;
    private static String p256dh;
    private static String auth;

    @BeforeAll
    static void setUpKeys() throws GeneralSecurityException {
        backend = new JcaPemBackend();
        userAgent = backend.generateKeyPair();
        p256dh = Base64Url.encode(backend.encodePoint(userAgent.getPublic()));
        auth = Base64Url.encode(backend.randomBytes(16));
    }

    static String json(String endpoint, String p256dh, String auth) {
        return "{\"endpoint\": \"" + endpoint + "\", \"keys\": {\"p256dh\": \"" + p256dh
            + "\", \"auth\": \"" + auth + "\"}}";
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("should load a valid subscription")
        void shouldLoadSubscription() {
            WebPushSubscription subscription = WebPushSubscription.parse(json(ENDPOINT, p256dh, auth), backend);

            assertEquals(ENDPOINT, subscription.getEndpoint());
            assertEquals(p256dh, subscription.getP256dh());
            assertEquals(auth, subscription.getAuth());
            assertEquals(16, subscription.getAuthSecret().length);
            assertEquals(userAgent.getPublic(), subscription.getPublicKey());
        }

        @Test
        @DisplayName("should load from a map")
        void shouldLoadFromMap() {
            Map<String, Object> keys = new HashMap<>();
            keys.put("p256dh", p256dh);
            keys.put("auth", auth);
            Map<String, Object> content = new HashMap<>();
            content.put("endpoint", ENDPOINT);
            content.put("keys", keys);

            assertEquals(ENDPOINT, WebPushSubscription.parse(content, backend).getEndpoint());
        }

        @Test
        @DisplayName("should accept padded standard base64 auth secrets")
        void shouldAcceptPaddedAuth() {
            WebPushSubscription subscription =
                WebPushSubscription.parse(json(ENDPOINT, p256dh, "k9Xzm43nBGo="), backend);

            assertEquals(8, subscription.getAuthSecret().length);
        }

        @Test
        @DisplayName("should reject incomplete or invalid content")
        void shouldRejectInvalid() {
            assertThrows(InvalidDataException.class, () -> WebPushSubscription.parse("not json", backend));
            assertThrows(InvalidDataException.class, () -> WebPushSubscription.parse("[]", backend));
            assertThrows(InvalidDataException.class, () -> WebPushSubscription.parse((String) null, backend));
            assertThrows(InvalidDataException.class,
                () -> WebPushSubscription.parse("{\"endpoint\": 5, \"keys\": {}}", backend));
            assertThrows(InvalidDataException.class,
                () -> WebPushSubscription.parse("{\"endpoint\": \"" + ENDPOINT + "\"}", backend));
            assertThrows(InvalidDataException.class,
                () -> WebPushSubscription.parse(json(ENDPOINT, p256dh, ""), backend));
            assertThrows(InvalidDataException.class,
                () -> WebPushSubscription.parse(json(ENDPOINT, "BAAA", auth), backend));
        }
    }

    @Nested
    @DisplayName("output")
    class Output {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("should show the start of the subscription id")
        void shouldShowSubscriptionId() {
            WebPushSubscription subscription = WebPushSubscription.parse(json(ENDPOINT, p256dh, auth), backend);

            assertEquals("abcdefghijklmnop", subscription.toString());
        }

        @Test
        @DisplayName("should write JSON that parses back")
        void shouldWriteJson() throws Exception {
            WebPushSubscription subscription = WebPushSubscription.parse(json(ENDPOINT, p256dh, auth), backend);
            Path file = tempDir.resolve("subscription.json");

            subscription.write(file);
            WebPushSubscription reloaded = WebPushSubscription.parse(Files.readString(file), backend);

            assertEquals(subscription.getEndpoint(), reloaded.getEndpoint());
            assertEquals(subscription.getP256dh(), reloaded.getP256dh());
            assertTrue(subscription.toJson().contains("\"keys\""));
        }
    }
}
