package com.notifykit.pem.crypto;

import com.notifykit.pem.config.PemConfig;
import com.notifykit.pem.config.StorageMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for KeyContext
 */
class KeyContextTest {

    @Test
    @DisplayName("should normalize names")
    void shouldNormalizeNames() {
        assertEquals("webhook", KeyContext.normalizeName(" -+WebHook!* "));
        assertEquals("a-b", KeyContext.normalizeName("/A-B/"));
        assertNull(KeyContext.normalizeName("\t$@#"));
        assertNull(KeyContext.normalizeName(null));
    }

    @Test
    @DisplayName("should use configuration when no directory is given")
    void shouldUseConfiguredPath() {
        PemConfig config = PemConfig.builder()
            .storagePath("/var/keys")
            .storageMode(StorageMode.MEMORY)
            .pemAutogen(false)
            .build();

        KeyContext context = KeyContext.of(config, null, "");

        assertEquals(Optional.of(Paths.get("/var/keys")), context.getDirectory());
        assertEquals(Optional.empty(), context.getName());
        assertFalse(context.isPemAutogen());
        assertFalse(context.isWritable());
    }

    @Test
    @DisplayName("should prefer an explicit directory")
    void shouldPreferExplicitDirectory() {
        Path dir = Paths.get("/tmp/other");
        KeyContext context = KeyContext.of(PemConfig.builder().storagePath("/var/keys").build(), dir, "x");

        assertEquals(Optional.of(dir), context.getDirectory());
        assertTrue(context.isWritable());
    }

    @Test
    @DisplayName("should compare by name and directory")
    void shouldCompareByIdentity() {
        Path dir = Paths.get("/keys");
        KeyContext a = new KeyContext("Mail", dir, StorageMode.AUTO, true, 8000);
        KeyContext b = new KeyContext("mail", dir, StorageMode.MEMORY, false, 1000);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new KeyContext(null, dir, StorageMode.AUTO, true, 8000));
    }
}
