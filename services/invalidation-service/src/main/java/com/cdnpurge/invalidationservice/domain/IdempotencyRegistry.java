package com.cdnpurge.invalidationservice.domain;

import com.cdnpurge.invalidation.InvalidationStatus;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks batch caller references already sent, so a resubmission with the same reference skips
 * batches that reached SUBMITTED or SUCCEEDED.
 */
public class IdempotencyRegistry {

    private final Map<String, InvalidationStatus> statuses = new ConcurrentHashMap<>();

    /**
     * Claims {@code callerReference} for sending.
     *
     * @return false if the reference is in flight or already succeeded
     */
    public boolean tryBegin(String callerReference) {
        boolean[] claimed = {false};
        statuses.compute(callerReference, (ref, current) -> {
            if (current == InvalidationStatus.SUBMITTED || current == InvalidationStatus.SUCCEEDED) {
                return current;
            }
            claimed[0] = true;
            return InvalidationStatus.SUBMITTED;
        });
        return claimed[0];
    }

    public void complete(String callerReference, InvalidationStatus status) {
        statuses.put(callerReference, status);
    }

    public Optional<InvalidationStatus> status(String callerReference) {
        return Optional.ofNullable(statuses.get(callerReference));
    }
}
