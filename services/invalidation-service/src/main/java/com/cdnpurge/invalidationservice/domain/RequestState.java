package com.cdnpurge.invalidationservice.domain;

import com.cdnpurge.invalidation.InvalidationResult;
import java.util.Collection;

/** Lifecycle of one invalidation request. */
public enum RequestState {
    CREATED,
    BATCHING,
    SUBMITTING,
    SUCCEEDED,
    PARTIAL_FAILURE,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == PARTIAL_FAILURE || this == FAILED;
    }

    /**
     * Final state for a set of terminal batch results: SUCCEEDED when all succeeded, FAILED when
     * none did, PARTIAL_FAILURE otherwise.
     */
    public static RequestState fromResults(Collection<InvalidationResult> results) {
        long succeeded = results.stream().filter(InvalidationResult::isSuccess).count();
        if (!results.isEmpty() && succeeded == results.size()) {
            return SUCCEEDED;
        }
        return succeeded == 0 ? FAILED : PARTIAL_FAILURE;
    }
}
