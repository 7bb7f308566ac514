package com.cdnpurge.invalidation;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Creates {@link InvalidationRequest}s with generated id, caller reference and timestamp.
 *
 * <p>Validation happens here, at the call boundary: invalid paths never produce a request. A path
 * list naming the site root ({@code /}) or the wildcard ({@code /*}) becomes a full purge, whatever
 * else it lists.
 */
public final class InvalidationRequestFactory {

    private static final Set<String> ROOT_PATHS = Set.of("/", InvalidationRequest.PURGE_ALL_PATH);

    private final Clock clock;

    public InvalidationRequestFactory(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    public InvalidationRequestFactory() {
        this(Clock.systemUTC());
    }

    /**
     * Validates {@code rawPaths} and, if they pass, creates a request for them.
     *
     * @return the validation outcome and, when valid, the request
     */
    public Creation create(String tenantId, List<String> rawPaths, ProviderType providerType) {
        PathValidationResult validation = PathValidator.validate(rawPaths);
        if (!validation.valid()) {
            return new Creation(null, validation.error().orElseThrow());
        }
        if (validation.paths().stream().anyMatch(ROOT_PATHS::contains)) {
            return new Creation(createFullPurge(tenantId, providerType), null);
        }
        return new Creation(newRequest(tenantId, validation.paths(), providerType, false), null);
    }

    /** Creates a request that purges everything cached for the tenant. */
    public InvalidationRequest createFullPurge(String tenantId, ProviderType providerType) {
        return newRequest(tenantId, List.of(InvalidationRequest.PURGE_ALL_PATH), providerType, true);
    }

    private InvalidationRequest newRequest(
            String tenantId, List<String> paths, ProviderType providerType, boolean fullPurge) {
        return new InvalidationRequest(
                UUID.randomUUID().toString(),
                tenantId,
                paths,
                CallerReferences.newReference(clock),
                providerType,
                clock.instant(),
                fullPurge);
    }

    /**
     * Either a created request or the validation error that prevented it.
     *
     * @param request the request, null when rejected
     * @param error   the rejection, null when created
     */
    public record Creation(InvalidationRequest request, ValidationError error) {

        public boolean isCreated() {
            return request != null;
        }
    }
}
