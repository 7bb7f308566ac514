package com.cdnpurge.invalidation;

import java.util.Optional;

/**
 * The edge-CDN providers an invalidation can be dispatched to.
 *
 * <p>Each constant carries the canonical name used in configuration and the default maximum number
 * of paths a single purge call accepts. Only CloudFront's limit is fixed by the provider; the others
 * are plan-dependent and can be overridden per deployment.
 */
public enum ProviderType {

    CLOUDFRONT("CloudFront", 3000),
    CLOUDFLARE("Cloudflare", 30),
    AZURE_FRONT_DOOR("AzureFrontDoor", 100),
    SUCURI("Sucuri", 20),

    /** No CDN configured: purges succeed without any outbound call. */
    NONE("None", Integer.MAX_VALUE);

    private final String value;
    private final int defaultMaxBatchSize;

    ProviderType(String value, int defaultMaxBatchSize) {
        this.value = value;
        this.defaultMaxBatchSize = defaultMaxBatchSize;
    }

    /** The canonical name used in configuration (e.g. "CloudFront"). */
    public String value() {
        return value;
    }

    /** Maximum paths per purge call when no override is configured. */
    public int defaultMaxBatchSize() {
        return defaultMaxBatchSize;
    }

    /**
     * Looks up a provider by its canonical name or enum constant name, ignoring case.
     *
     * @param value e.g. "CloudFront", "cloudfront" or "AZURE_FRONT_DOOR"
     * @return the matching provider, or empty if none matches
     */
    public static Optional<ProviderType> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ProviderType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
