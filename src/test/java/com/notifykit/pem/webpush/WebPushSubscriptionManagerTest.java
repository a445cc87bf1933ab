package com.notifykit.pem.webpush;

import com.notifykit.pem.crypto.Base64Url;
import com.notifykit.pem.crypto.JcaPemBackend;
import com.notifykit.pem.crypto.PemBackend;
import com.notifykit.pem.exception.InvalidDataException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WebPushSubscriptionManager
 */
class WebPushSubscriptionManagerTest {

    private static PemBackend backend;
    private static String valid;

    @TempDir
    Path tempDir;

    private WebPushSubscriptionManager manager;

    @BeforeAll
    static void setUpKeys() throws GeneralSecurityException {
        backend = new JcaPemBackend();
        String p256dh = Base64Url.encode(backend.encodePoint(backend.generateKeyPair().getPublic()));
        valid = WebPushSubscriptionTest.json(WebPushSubscriptionTest.ENDPOINT, p256dh,
            Base64Url.encode(backend.randomBytes(16)));
    }

    @BeforeEach
    void setUp() {
        manager = new WebPushSubscriptionManager(backend);
    }

    @Nested
    @DisplayName("entries")
    class Entries {

        @Test
        @DisplayName("should use case-insensitive names")
        void shouldIgnoreCase() {
            assertTrue(manager.add(valid, "Laptop"));

            assertTrue(manager.contains("LAPTOP"));
            assertTrue(manager.get("laptop").isPresent());
            assertEquals(1, manager.size());
        }

        @Test
        @DisplayName("should name entries after the endpoint by default")
        void shouldDefaultName() {
            assertTrue(manager.add(valid));

            assertTrue(manager.contains("abcdefghijklmnop"));
        }

        @Test
        @DisplayName("should reject invalid subscriptions")
        void shouldRejectInvalid() {
            assertFalse(manager.add("{}", "bad"));
            assertFalse(manager.add(42, "bad"));
            assertThrows(InvalidDataException.class, () -> manager.put("bad", "{}"));
            assertTrue(manager.isEmpty());
        }
    }

    @Nested
    @DisplayName("load and write")
    class LoadAndWrite {

        @Test
        @DisplayName("should load a single subscription")
        void shouldLoadSingle() throws IOException {
            Path file = tempDir.resolve("single.json");
            Files.writeString(file, valid);

            assertTrue(manager.load(file, 0));
            assertEquals(1, manager.size());
        }

        @Test
        @DisplayName("should load named subscriptions and write them back")
        void shouldLoadNamed() throws IOException {
            Path file = tempDir.resolve("named.json");
            Files.writeString(file, "{\"Phone\": " + valid + ", \"desk\": " + valid + "}");

            assertTrue(manager.load(file, 0));
            assertEquals(2, manager.size());
            assertTrue(manager.contains("phone"));

            Path copy = tempDir.resolve("copy.json");
            manager.write(copy);
            WebPushSubscriptionManager reloaded = new WebPushSubscriptionManager(backend);
            assertTrue(reloaded.load(copy, 0));
            assertEquals(manager.names(), reloaded.names());
        }

        @Test
        @DisplayName("should tolerate up to three bad entries")
        void shouldTolerateFewFailures() throws IOException {
            Path file = tempDir.resolve("some-bad.json");
            Files.writeString(file, "{\"a\": {}, \"b\": {}, \"c\": {}, \"good\": " + valid + "}");

            assertTrue(manager.load(file, 0));
            assertEquals(1, manager.size());
        }

        @Test
        @DisplayName("should reject a file with too many bad entries")
        void shouldRejectManyFailures() throws IOException {
            Path file = tempDir.resolve("all-bad.json");
            Files.writeString(file, "{\"good\": " + valid + ", \"a\": {}, \"b\": {}, \"c\": {}, \"d\": {}}");

            assertFalse(manager.load(file, 0));
            assertTrue(manager.isEmpty());
        }

        @Test
        @DisplayName("should honour the byte limit")
        void shouldHonourByteLimit() throws IOException {
            Path file = tempDir.resolve("single.json");
            Files.writeString(file, valid);

            assertFalse(manager.load(file, 10));
            assertFalse(manager.load(tempDir.resolve("missing.json"), 0));
        }
    }
}
