package com.cdnpurge.invalidation;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a request's paths into provider-sized {@link InvalidationBatch}es.
 *
 * <p>For {@code N} paths and a limit {@code L} the result has exactly {@code ceil(N / L)} batches;
 * every batch but the last holds {@code L} paths, order is preserved, and concatenating the batches
 * gives back the input.
 */
public final class BatchSplitter {

    private BatchSplitter() {
        // utility class
    }

    /**
     * Splits the request's paths using the given limit. A full purge is always one batch carrying
     * the request's {@code fullPurge} flag.
     *
     * @param request      the request to split
     * @param maxBatchSize maximum paths per batch, must be positive
     * @return the batches, in sequence order
     */
    public static List<InvalidationBatch> split(InvalidationRequest request, int maxBatchSize) {
        if (request.fullPurge()) {
            return List.of(new InvalidationBatch(request.id(), 0, request.paths(), true));
        }
        return split(request.id(), request.paths(), maxBatchSize);
    }

    /**
     * Splits {@code paths} into batches of at most {@code maxBatchSize}.
     *
     * @param requestId    id stamped on every batch
     * @param paths        validated paths
     * @param maxBatchSize maximum paths per batch, must be positive
     * @return the batches, in sequence order
     * @throws IllegalArgumentException if {@code paths} is empty or {@code maxBatchSize} is not positive
     */
    public static List<InvalidationBatch> split(String requestId, List<String> paths, int maxBatchSize) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive");
        }
        if (paths == null || paths.isEmpty()) {
            throw new IllegalArgumentException("paths must not be empty");
        }

        int batchCount = paths.size() / maxBatchSize + (paths.size() % maxBatchSize == 0 ? 0 : 1);
        var batches = new ArrayList<InvalidationBatch>(batchCount);
        for (int index = 0; index < batchCount; index++) {
            int from = index * maxBatchSize;
            int to = from + Math.min(maxBatchSize, paths.size() - from);
            batches.add(new InvalidationBatch(requestId, index, paths.subList(from, to)));
        }
        return List.copyOf(batches);
    }
}
