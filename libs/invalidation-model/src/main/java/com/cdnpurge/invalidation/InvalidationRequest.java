package com.cdnpurge.invalidation;

import java.time.Instant;
import java.util.List;

/**
 * One logical invalidation submitted by the publish pipeline.
 *
 * <p>Immutable. {@code paths} has already passed {@link PathValidator}: non-empty, every entry
 * starts with {@code /}, no duplicates, original order kept. {@code callerReference} is generated
 * once per logical request and reused by every retry of it.
 *
 * @param id              unique request id handed back to the caller
 * @param tenantId        tenant whose content changed
 * @param paths           validated paths to purge
 * @param callerReference idempotency token for the provider
 * @param providerType    provider resolved for the tenant at submission time
 * @param createdAt       creation time
 * @param fullPurge       true when the whole distribution/zone is purged ({@code paths} is {@code /*})
 */
public record InvalidationRequest(
        String id,
        String tenantId,
        List<String> paths,
        String callerReference,
        ProviderType providerType,
        Instant createdAt,
        boolean fullPurge) {

    /** Path used for full purges. */
    public static final String PURGE_ALL_PATH = "/*";

    public InvalidationRequest {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (callerReference == null || callerReference.isBlank()) {
            throw new IllegalArgumentException("callerReference must not be null or blank");
        }
        if (paths == null || paths.isEmpty()) {
            throw new IllegalArgumentException("paths must not be empty");
        }
        if (providerType == null) {
            throw new IllegalArgumentException("providerType must not be null");
        }
        paths = List.copyOf(paths);
    }

    /** Number of paths in this request. */
    public int pathCount() {
        return paths.size();
    }
}
