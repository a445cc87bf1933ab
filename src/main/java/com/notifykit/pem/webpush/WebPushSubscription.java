package com.notifykit.pem.webpush;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.notifykit.pem.crypto.Base64Url;
import com.notifykit.pem.crypto.PemBackend;
import com.notifykit.pem.crypto.PemBackends;
import com.notifykit.pem.exception.InvalidDataException;
import com.notifykit.pem.exception.NotifyException;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.Map;

/**
 * A browser push subscription: the push service endpoint plus the
 * subscription's {@code p256dh} public key and {@code auth} secret.
 *
 * <pre>{@code
 * {
 *   "endpoint": "https://fcm.googleapis.com/fcm/send/abc123...",
 *   "keys": {
 *     "p256dh": "BNcW4oA7zq5H9TKIrA3XfKclN2fX9P_7NR...",
 *     "auth": "k9Xzm43nBGo="
 *   }
 * }
 * }</pre>
 */
public final class WebPushSubscription {

    static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final String endpoint;
    private final String p256dh;
    private final String auth;
    private final byte[] authSecret;
    private final PublicKey publicKey;

    private WebPushSubscription(String endpoint, String p256dh, String auth,
                                byte[] authSecret, PublicKey publicKey) {
        this.endpoint = endpoint;
        this.p256dh = p256dh;
        this.auth = auth;
        this.authSecret = authSecret;
        this.publicKey = publicKey;
    }

    public static WebPushSubscription parse(String json) {
        return parse(json, PemBackends.detect());
    }

    /**
     * Parses a subscription from its JSON form.
     *
     * @throws InvalidDataException if the content is not a valid subscription
     */
    public static WebPushSubscription parse(String json, PemBackend backend) {
        if (json == null) {
            throw new InvalidDataException("Could not load subscription: no content");
        }
        JsonNode node;
        try {
            node = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidDataException("Could not load subscription: invalid JSON", e);
        }
        return parse(node, backend);
    }

    public static WebPushSubscription parse(Map<String, ?> content) {
        return parse(content, PemBackends.detect());
    }

    public static WebPushSubscription parse(Map<String, ?> content, PemBackend backend) {
        if (content == null) {
            throw new InvalidDataException("Could not load subscription: no content");
        }
        JsonNode node;
        try {
            node = MAPPER.valueToTree(content);
        } catch (IllegalArgumentException e) {
            throw new InvalidDataException("Could not load subscription: unsupported content", e);
        }
        return parse(node, backend);
    }

    static WebPushSubscription parse(JsonNode node, PemBackend backend) {
        if (node == null || !node.isObject()) {
            throw new InvalidDataException("Could not load subscription: expected a JSON object");
        }

        JsonNode endpoint = node.get("endpoint");
        if (endpoint == null || !endpoint.isTextual()) {
            throw new InvalidDataException("Could not load subscription: endpoint missing");
        }

        JsonNode keys = node.get("keys");
        JsonNode p256dh = keys != null ? keys.get("p256dh") : null;
        JsonNode auth = keys != null ? keys.get("auth") : null;
        if (p256dh == null || !p256dh.isTextual() || auth == null || !auth.isTextual()) {
            throw new InvalidDataException("Could not load subscription: keys.p256dh and keys.auth are required");
        }

        byte[] point;
        byte[] authSecret;
        try {
            point = Base64Url.decode(p256dh.asText());
            authSecret = Base64Url.decode(auth.asText());
        } catch (IllegalArgumentException e) {
            throw new InvalidDataException("Could not load subscription: keys are not base64", e);
        }
        if (point.length == 0 || authSecret.length == 0) {
            throw new InvalidDataException("Could not load subscription: empty key material");
        }

        PublicKey publicKey;
        try {
            publicKey = backend.decodePoint(point);
        } catch (GeneralSecurityException e) {
            throw new InvalidDataException("Could not load subscription: invalid p256dh key", e);
        }

        return new WebPushSubscription(endpoint.asText(), p256dh.asText(), auth.asText(), authSecret, publicKey);
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getP256dh() {
        return p256dh;
    }

    public String getAuth() {
        return auth;
    }

    public byte[] getAuthSecret() {
        return authSecret.clone();
    }

    public PublicKey getPublicKey() {
        return publicKey;
    }

    ObjectNode toNode() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("endpoint", endpoint);
        ObjectNode keys = node.putObject("keys");
        keys.put("p256dh", p256dh);
        keys.put("auth", auth);
        return node;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toNode());
        } catch (JsonProcessingException e) {
            throw new NotifyException("Failed to serialize subscription", "SUBSCRIPTION_WRITE_ERROR", e);
        }
    }

    /**
     * Writes this subscription as JSON.
     *
     * @throws NotifyException if the file cannot be written
     */
    public void write(Path path) {
        try {
            MAPPER.writeValue(path.toFile(), toNode());
        } catch (IOException e) {
            throw new NotifyException("Failed to write subscription to " + path + ": " + e.getMessage(),
                "SUBSCRIPTION_WRITE_ERROR", e);
        }
    }

    /**
     * First 16 characters of the subscription id at the end of the endpoint
     */
    @Override
    public String toString() {
        String id = endpoint.substring(endpoint.lastIndexOf('/') + 1);
        return id.length() > 16 ? id.substring(0, 16) : id;
    }
}
