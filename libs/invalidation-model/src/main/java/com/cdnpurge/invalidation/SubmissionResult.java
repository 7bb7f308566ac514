package com.cdnpurge.invalidation;

import java.util.Optional;

/**
 * What the caller gets back from submitting an invalidation: either the id of the accepted request
 * or the {@link ValidationError} that stopped it before any request was created.
 *
 * @param requestId id of the accepted request, null when rejected
 * @param error     the rejection, null when accepted
 */
public record SubmissionResult(String requestId, ValidationError error) {

    public SubmissionResult {
        if ((requestId == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of requestId and error must be set");
        }
    }

    public static SubmissionResult accepted(String requestId) {
        return new SubmissionResult(requestId, null);
    }

    public static SubmissionResult rejected(ValidationError error) {
        return new SubmissionResult(null, error);
    }

    public boolean isAccepted() {
        return requestId != null;
    }

    public Optional<String> acceptedRequestId() {
        return Optional.ofNullable(requestId);
    }

    public Optional<ValidationError> rejection() {
        return Optional.ofNullable(error);
    }
}
