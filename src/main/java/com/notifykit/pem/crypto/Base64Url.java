package com.notifykit.pem.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * URL-safe Base64 without padding, as used by Web Push and JWT.
 */
public final class Base64Url {

    private Base64Url() {
        // Utility class
    }

    public static String encode(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }

    public static String encode(String data) {
        return encode(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes base64url content. Padding is optional and the standard
     * alphabet ({@code +} and {@code /}) is accepted as well, since
     * browsers and push libraries are not consistent about either.
     *
     * @throws IllegalArgumentException if the value is not valid base64
     */
    public static byte[] decode(String value) {
        String normalized = value
            .replaceAll("\\s+", "")
            .replace('+', '-')
            .replace('/', '_');
        int end = normalized.length();
        while (end > 0 && normalized.charAt(end - 1) == '=') {
            end--;
        }
        return Base64.getUrlDecoder().decode(normalized.substring(0, end));
    }
}
