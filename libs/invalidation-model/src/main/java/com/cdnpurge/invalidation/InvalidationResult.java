package com.cdnpurge.invalidation;

import java.time.Instant;

/**
 * Outcome of submitting one {@link InvalidationBatch}.
 *
 * <p>Results are immutable snapshots; a batch moving through its lifecycle produces a new result
 * for every transition.
 *
 * @param requestId         owning request
 * @param batchIndex        sequence index of the batch
 * @param status            lifecycle status
 * @param providerReference provider-assigned id (e.g. a CloudFront invalidation id), empty if none
 * @param errorKind         failure classification, null unless {@code status} is FAILED
 * @param attemptCount      number of provider calls made for this batch so far
 * @param timestamp         when this snapshot was recorded; null until the reporter records it
 * @param message           human-readable detail, empty if none
 */
public record InvalidationResult(
        String requestId,
        int batchIndex,
        InvalidationStatus status,
        String providerReference,
        ErrorKind errorKind,
        int attemptCount,
        Instant timestamp,
        String message) {

    public InvalidationResult {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (status == InvalidationStatus.FAILED && errorKind == null) {
            throw new IllegalArgumentException("errorKind is required for FAILED results");
        }
        providerReference = providerReference == null ? "" : providerReference;
        message = message == null ? "" : message;
    }

    public static InvalidationResult pending(InvalidationBatch batch) {
        return new InvalidationResult(
                batch.requestId(), batch.sequenceIndex(), InvalidationStatus.PENDING,
                "", null, 0, null, "");
    }

    public static InvalidationResult submitted(InvalidationBatch batch, String providerReference) {
        return new InvalidationResult(
                batch.requestId(), batch.sequenceIndex(), InvalidationStatus.SUBMITTED,
                providerReference, null, 1, null, "");
    }

    public static InvalidationResult succeeded(InvalidationBatch batch, String providerReference) {
        return new InvalidationResult(
                batch.requestId(), batch.sequenceIndex(), InvalidationStatus.SUCCEEDED,
                providerReference, null, 1, null, "");
    }

    public static InvalidationResult failed(InvalidationBatch batch, ErrorKind kind, String message) {
        return new InvalidationResult(
                batch.requestId(), batch.sequenceIndex(), InvalidationStatus.FAILED,
                "", kind, 1, null, message);
    }

    /** Copy of this result stamped with {@code at}. */
    public InvalidationResult withTimestamp(Instant at) {
        return new InvalidationResult(
                requestId, batchIndex, status, providerReference, errorKind, attemptCount, at, message);
    }

    /** Copy of this result carrying the given attempt count. */
    public InvalidationResult withAttemptCount(int attempts) {
        return new InvalidationResult(
                requestId, batchIndex, status, providerReference, errorKind, attempts, timestamp, message);
    }

    public boolean isSuccess() {
        return status == InvalidationStatus.SUCCEEDED;
    }

    /** True when the result failed with a kind the retry policy may retry. */
    public boolean isRetryableFailure() {
        return status == InvalidationStatus.FAILED && errorKind.isRetryable();
    }
}
