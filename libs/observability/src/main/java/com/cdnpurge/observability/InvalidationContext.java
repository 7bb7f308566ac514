package com.cdnpurge.observability;

/**
 * Identifiers of the invalidation work happening on the current thread.
 *
 * <p>Set by the dispatcher before it talks to a provider and mirrored into SLF4J MDC, so every log
 * line written during a purge can be tied back to its request and batch.
 *
 * @param requestId       invalidation request id
 * @param tenantId        tenant that owns the request (nullable)
 * @param provider        provider name, e.g. "CloudFront" (nullable)
 * @param batchIndex      batch sequence index (nullable outside batch work)
 * @param callerReference idempotency token sent to the provider (nullable)
 */
public record InvalidationContext(
        String requestId,
        String tenantId,
        String provider,
        Integer batchIndex,
        String callerReference
) {

    public static final String MDC_REQUEST_ID = "invalidationRequestId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_PROVIDER = "provider";
    public static final String MDC_BATCH_INDEX = "batchIndex";
    public static final String MDC_CALLER_REFERENCE = "callerReference";

    public InvalidationContext {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
    }

    /** Context for a request before it is split into batches. */
    public static InvalidationContext forRequest(String requestId, String tenantId, String provider) {
        return new InvalidationContext(requestId, tenantId, provider, null, null);
    }

    /** Narrows this context to one batch. */
    public InvalidationContext forBatch(int index, String batchCallerReference) {
        return new InvalidationContext(requestId, tenantId, provider, index, batchCallerReference);
    }
}
