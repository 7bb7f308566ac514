package com.cdnpurge.provider;

import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.observability.CredentialRedactor;
import java.util.Map;

/**
 * Credentials and endpoint identifiers for one CDN provider.
 *
 * <p>Implementations are immutable records. One instance is shared read-only by every batch of a
 * request running concurrently; nothing may mutate it.
 */
public interface ProviderConfig {

    CredentialRedactor REDACTOR = new CredentialRedactor();

    /** Which provider this config addresses. */
    ProviderType type();

    /** Maximum paths one purge call may carry for this provider. */
    int maxBatchSize();

    /** All fields by name, secrets included. Never log this directly; use {@link #redacted()}. */
    Map<String, Object> fields();

    /** {@link #fields()} with secret values masked, safe for logs and status output. */
    default Map<String, Object> redacted() {
        return REDACTOR.redact(fields());
    }

    /** Fails with {@link IllegalArgumentException} naming the field when it is null or blank. */
    static String require(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required");
        }
        return value.strip();
    }

    /** {@code configured} when positive, otherwise the provider default. */
    static int batchSizeOrDefault(int configured, ProviderType type) {
        return configured > 0 ? configured : type.defaultMaxBatchSize();
    }
}
