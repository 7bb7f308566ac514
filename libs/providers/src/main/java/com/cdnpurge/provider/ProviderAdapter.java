package com.cdnpurge.provider;

import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.invalidation.InvalidationResult;
import com.cdnpurge.invalidation.InvalidationSerializationException;
import com.cdnpurge.invalidation.ProviderType;

/**
 * Translates one batch into a provider purge call.
 *
 * <p>An adapter serializes the batch into the provider's wire format, authenticates, sends it and
 * classifies the outcome. Transport and provider failures are returned as FAILED results carrying
 * an {@link com.cdnpurge.invalidation.ErrorKind}; they are never thrown. Implementations must be
 * safe for concurrent use.
 */
public interface ProviderAdapter {

    ProviderType type();

    /**
     * Submits one batch.
     *
     * @param batch           paths to purge, at most {@code maxBatchSize} of them
     * @param callerReference idempotency token for this batch; identical on retries
     * @return SUCCEEDED with the provider's reference, or FAILED with the error kind
     * @throws InvalidationSerializationException if the batch cannot be encoded (an upstream defect)
     */
    InvalidationResult submit(InvalidationBatch batch, String callerReference);
}
