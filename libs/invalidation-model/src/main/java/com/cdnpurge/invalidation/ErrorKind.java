package com.cdnpurge.invalidation;

/**
 * Classification of everything that can go wrong while invalidating.
 *
 * <p>The retryable flag drives the dispatcher's retry policy: retryable kinds are retried with
 * backoff up to the configured attempt ceiling, all others fail on first occurrence.
 */
public enum ErrorKind {

    /** Empty or malformed path input. Rejected before any request exists. */
    VALIDATION(false),

    /** The provider refused the credentials. */
    AUTHENTICATION(false),

    /** The provider throttled the call. */
    RATE_LIMIT(true),

    /** Timeout, connection failure or 5xx response. */
    TRANSIENT_NETWORK(true),

    /** Permanent provider-side rejection, e.g. unknown distribution or zone. */
    PROVIDER(false),

    /** A payload could not be built. Indicates a defect upstream of the adapter. */
    SERIALIZATION(false),

    /** The batch was abandoned before it was sent. */
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
