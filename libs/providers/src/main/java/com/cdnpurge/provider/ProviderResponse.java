package com.cdnpurge.provider;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An HTTP response as seen by an adapter.
 *
 * @param statusCode HTTP status
 * @param headers    response headers; lookups via {@link #header(String)} ignore case
 * @param body       response body, empty string for none
 */
public record ProviderResponse(int statusCode, Map<String, List<String>> headers, String body) {

    public ProviderResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? "" : body;
    }

    public static ProviderResponse of(int statusCode, String body) {
        return new ProviderResponse(statusCode, Map.of(), body);
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /** First value of the named header, ignoring case. */
    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }
}
