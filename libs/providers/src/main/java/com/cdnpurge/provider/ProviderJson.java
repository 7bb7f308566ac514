package com.cdnpurge.provider;

import com.cdnpurge.invalidation.InvalidationSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * JSON encoding of purge payloads and decoding of provider responses.
 *
 * <p>Jackson escapes every string it writes, so paths with quotes, backslashes or non-ASCII
 * characters always produce well-formed JSON.
 */
public final class ProviderJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProviderJson() {
        // utility class
    }

    /**
     * Serializes a payload object.
     *
     * @throws InvalidationSerializationException if Jackson cannot encode it
     */
    public static String write(Object payload) {
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidationSerializationException("Failed to encode purge payload", e);
        }
    }

    /**
     * Parses a response body. Malformed or empty bodies yield a {@link MissingNode} so callers can
     * navigate with {@code path(...)} without null checks.
     */
    public static JsonNode read(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            return MissingNode.getInstance();
        }
    }

    public static ObjectMapper objectMapper() {
        return MAPPER;
    }
}
