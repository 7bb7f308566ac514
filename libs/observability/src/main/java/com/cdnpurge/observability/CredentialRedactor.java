package com.cdnpurge.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks provider credentials before they reach a log line or a status response.
 *
 * <p>A field is sensitive when its name contains one of the configured fragments, ignoring case.
 * Defaults cover AWS keys, API tokens, API keys and client secrets.
 */
public final class CredentialRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_FRAGMENTS = Set.of(
            "secret", "token", "apikey", "api_key", "accesskey", "password",
            "authorization", "credential", "signature"
    );

    private final Set<String> fragments;
    private final Pattern pattern;

    public CredentialRedactor() {
        this(DEFAULT_FRAGMENTS);
    }

    public CredentialRedactor(Set<String> fragments) {
        this.fragments = Set.copyOf(fragments);
        this.pattern = Pattern.compile(
                String.join("|", this.fragments.stream().map(Pattern::quote).toList()),
                Pattern.CASE_INSENSITIVE);
    }

    /**
     * Copy of {@code fields} with sensitive values replaced by {@value #REDACTED}. Iteration order
     * is kept. Null or empty input gives an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(fields.size());
        fields.forEach((key, value) -> result.put(key, isSensitive(key) ? REDACTED : value));
        return result;
    }

    public boolean isSensitive(String fieldName) {
        return fieldName != null && pattern.matcher(fieldName).find();
    }

    public Set<String> fragments() {
        return fragments;
    }
}
