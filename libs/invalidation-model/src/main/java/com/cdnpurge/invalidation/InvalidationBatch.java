package com.cdnpurge.invalidation;

import java.util.List;

/**
 * A provider-sized slice of an {@link InvalidationRequest}'s paths.
 *
 * @param requestId     owning request
 * @param sequenceIndex zero-based position of this batch within the request
 * @param paths         the slice, in the request's original order
 * @param fullPurge     true when the batch stands for the whole distribution or zone; adapters use
 *                      the provider's purge-everything call instead of sending {@code paths}
 */
public record InvalidationBatch(String requestId, int sequenceIndex, List<String> paths, boolean fullPurge) {

    public InvalidationBatch {
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("sequenceIndex must be >= 0");
        }
        if (paths == null || paths.isEmpty()) {
            throw new IllegalArgumentException("paths must not be empty");
        }
        paths = List.copyOf(paths);
    }

    public InvalidationBatch(String requestId, int sequenceIndex, List<String> paths) {
        this(requestId, sequenceIndex, paths, false);
    }

    public int size() {
        return paths.size();
    }
}
