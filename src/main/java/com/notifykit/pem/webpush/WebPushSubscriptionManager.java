package com.notifykit.pem.webpush;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.notifykit.pem.crypto.PemBackend;
import com.notifykit.pem.crypto.PemBackends;
import com.notifykit.pem.exception.InvalidDataException;
import com.notifykit.pem.exception.NotifyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named collection of {@link WebPushSubscription}s. Names are case-insensitive.
 *
 * <p>Files hold either one subscription object or an object of named
 * subscriptions.
 */
public class WebPushSubscriptionManager {

    private static final Logger logger = LoggerFactory.getLogger(WebPushSubscriptionManager.class);

    /** Bad entries tolerated in one file before the whole file is rejected */
    public static final int MAX_LOAD_FAILURE_COUNT = 3;

    private final Map<String, WebPushSubscription> subscriptions = new LinkedHashMap<>();
    private final PemBackend backend;

    public WebPushSubscriptionManager() {
        this(PemBackends.detect());
    }

    public WebPushSubscriptionManager(PemBackend backend) {
        this.backend = backend;
    }

    /**
     * Adds a subscription under its endpoint id.
     *
     * @param subscription a {@link WebPushSubscription}, JSON string or map
     * @return whether the subscription was valid and added
     */
    public boolean add(Object subscription) {
        return add(subscription, null);
    }

    /**
     * @param subscription a {@link WebPushSubscription}, JSON string or map
     * @param name entry name, or {@code null} for the endpoint id
     * @return whether the subscription was valid and added
     */
    public boolean add(Object subscription, String name) {
        WebPushSubscription parsed;
        try {
            parsed = toSubscription(subscription);
        } catch (InvalidDataException e) {
            logger.debug("Rejected subscription {}: {}", name, e.getMessage());
            return false;
        }
        String key = name != null ? name : parsed.toString();
        subscriptions.put(key.toLowerCase(Locale.ROOT), parsed);
        return true;
    }

    /**
     * @throws InvalidDataException if the subscription is not valid
     */
    public void put(String name, Object subscription) {
        if (!add(subscription, name)) {
            throw new InvalidDataException("Invalid subscription provided");
        }
    }

    public Optional<WebPushSubscription> get(String name) {
        return Optional.ofNullable(subscriptions.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean contains(String name) {
        return subscriptions.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(subscriptions.keySet());
    }

    public int size() {
        return subscriptions.size();
    }

    public boolean isEmpty() {
        return subscriptions.isEmpty();
    }

    public void clear() {
        subscriptions.clear();
    }

    /**
     * Replaces the current entries with those of a JSON file.
     *
     * @param path subscription file
     * @param byteLimit maximum file size, or 0 for no limit
     * @return whether the file was loaded
     */
    public boolean load(Path path, long byteLimit) {
        clear();

        JsonNode content;
        try {
            if (!Files.isRegularFile(path)) {
                logger.debug("Subscription file {} does not exist", path);
                return false;
            }
            if (byteLimit > 0 && Files.size(path) > byteLimit) {
                logger.warn("Subscription file {} exceeds {} bytes, ignoring", path, byteLimit);
                return false;
            }
            content = WebPushSubscription.MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            logger.warn("Could not read subscription file {}: {}", path, e.getMessage());
            return false;
        }

        if (content == null || !content.isObject()) {
            return false;
        }

        if (content.has("endpoint") && content.has("keys")) {
            return add(content);
        }

        int errorCount = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = content.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!add(entry.getValue(), entry.getKey())) {
                errorCount++;
                if (errorCount > MAX_LOAD_FAILURE_COUNT) {
                    logger.warn("Too many invalid subscriptions in {}, rejecting file", path);
                    clear();
                    return false;
                }
            }
        }
        return true;
    }

    ObjectNode toNode() {
        ObjectNode node = WebPushSubscription.MAPPER.createObjectNode();
        subscriptions.forEach((name, subscription) -> node.set(name, subscription.toNode()));
        return node;
    }

    public String toJson() {
        try {
            return WebPushSubscription.MAPPER.writeValueAsString(toNode());
        } catch (JsonProcessingException e) {
            throw new NotifyException("Failed to serialize subscriptions", "SUBSCRIPTION_WRITE_ERROR", e);
        }
    }

    /**
     * Writes all entries as one JSON object keyed by name.
     *
     * @throws NotifyException if the file cannot be written
     */
    public void write(Path path) {
        try {
            WebPushSubscription.MAPPER.writeValue(path.toFile(), toNode());
        } catch (IOException e) {
            throw new NotifyException("Failed to write subscriptions to " + path + ": " + e.getMessage(),
                "SUBSCRIPTION_WRITE_ERROR", e);
        }
    }

    @SuppressWarnings("unchecked")
    private WebPushSubscription toSubscription(Object subscription) {
        if (subscription instanceof WebPushSubscription) {
            return (WebPushSubscription) subscription;
        }
        if (subscription instanceof JsonNode) {
            return WebPushSubscription.parse((JsonNode) subscription, backend);
        }
        if (subscription instanceof String) {
            return WebPushSubscription.parse((String) subscription, backend);
        }
        if (subscription instanceof Map) {
            return WebPushSubscription.parse((Map<String, ?>) subscription, backend);
        }
        throw new InvalidDataException("Unsupported subscription type: "
            + (subscription == null ? "null" : subscription.getClass().getName()));
    }
}
