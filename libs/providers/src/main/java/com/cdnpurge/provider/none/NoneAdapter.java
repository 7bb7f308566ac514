package com.cdnpurge.provider.none;

import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.invalidation.InvalidationResult;
import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.provider.ProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Accepts every batch without any network call. */
public class NoneAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(NoneAdapter.class);

    @Override
    public ProviderType type() {
        return ProviderType.NONE;
    }

    @Override
    public InvalidationResult submit(InvalidationBatch batch, String callerReference) {
        log.debug("No CDN configured; batch {} of request {} treated as purged",
                batch.sequenceIndex(), batch.requestId());
        return InvalidationResult.succeeded(batch, "");
    }
}
