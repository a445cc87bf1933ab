package com.notifykit.pem.webpush;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.notifykit.pem.crypto.Base64Url;
import com.notifykit.pem.crypto.PemController;
import com.notifykit.pem.exception.NotifyException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * VAPID (RFC 8292) application server identification: an ES256 JWT signed
 * with the controller's private key, sent together with its public key.
 */
public class VapidTokenBuilder {

    /** Token lifetime; push services reject more than 24 hours */
    public static final Duration DEFAULT_EXPIRATION = Duration.ofSeconds(43200);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PemController pem;
    private final String audience;
    private final String subscriber;
    private final Clock clock;
    private Duration expiration = DEFAULT_EXPIRATION;

    /**
     * @param pem controller holding the application server keys
     * @param audience origin of the push service, e.g. {@code https://fcm.googleapis.com}
     * @param subscriber contact email, with or without the {@code mailto:} scheme
     */
    public VapidTokenBuilder(PemController pem, String audience, String subscriber) {
        this(pem, audience, subscriber, Clock.systemUTC());
    }

    public VapidTokenBuilder(PemController pem, String audience, String subscriber, Clock clock) {
        this.pem = Objects.requireNonNull(pem, "pem");
        this.audience = Objects.requireNonNull(audience, "audience");
        this.subscriber = Objects.requireNonNull(subscriber, "subscriber");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public VapidTokenBuilder expiration(Duration expiration) {
        this.expiration = Objects.requireNonNull(expiration, "expiration");
        return this;
    }

    String subject() {
        if (subscriber.startsWith("mailto:") || subscriber.startsWith("https:")) {
            return subscriber;
        }
        return "mailto:" + subscriber;
    }

    /**
     * Signed JWT, or empty when no private key is available
     */
    public Optional<String> token() {
        ObjectNode header = objectMapper.createObjectNode();
        header.put("alg", "ES256");
        header.put("typ", "JWT");

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("aud", audience);
        payload.put("exp", clock.instant().plus(expiration).getEpochSecond());
        payload.put("sub", subject());

        String signingInput = segment(header) + "." + segment(payload);
        return pem.sign(signingInput.getBytes(StandardCharsets.US_ASCII))
            .map(signature -> signingInput + "." + Base64Url.encode(signature));
    }

    /**
     * {@code Authorization} header value, or empty when no key pair is available
     */
    public Optional<String> authorizationHeader() {
        Optional<String> token = token();
        String key = pem.x962Str();
        if (token.isEmpty() || key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("vapid t=" + token.get() + ", k=" + key);
    }

    private String segment(ObjectNode node) {
        try {
            return Base64Url.encode(objectMapper.writeValueAsBytes(node));
        } catch (JsonProcessingException e) {
            throw new NotifyException("Failed to encode JWT segment", "VAPID_ENCODE_ERROR", e);
        }
    }
}
