package com.cdnpurge.provider;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An outbound HTTP call, independent of the client library that sends it.
 *
 * @param method  HTTP method
 * @param uri     absolute target URI
 * @param headers request headers (Host and Content-Length are set by the transport)
 * @param body    request body, empty string for none
 */
public record ProviderRequest(String method, URI uri, Map<String, String> headers, String body) {

    public ProviderRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method must not be null or blank");
        }
        if (uri == null) {
            throw new IllegalArgumentException("uri must not be null");
        }
        headers = headers == null ? Map.of() : Map.copyOf(new LinkedHashMap<>(headers));
        body = body == null ? "" : body;
    }

    public static ProviderRequest post(URI uri, Map<String, String> headers, String body) {
        return new ProviderRequest("POST", uri, headers, body);
    }

    /** Header value by case-insensitive name, or null. */
    public String header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }
}
