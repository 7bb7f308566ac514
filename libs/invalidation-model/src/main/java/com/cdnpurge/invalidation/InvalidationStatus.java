package com.cdnpurge.invalidation;

/**
 * Lifecycle of a single batch submission.
 *
 * <p>{@code PENDING → SUBMITTED → SUCCEEDED | FAILED}. A batch may skip {@code SUBMITTED} when the
 * provider answers synchronously.
 */
public enum InvalidationStatus {

    /** Created, not yet handed to a provider. */
    PENDING,

    /** In flight at the provider. */
    SUBMITTED,

    /** The provider accepted the purge. */
    SUCCEEDED,

    /** Rejected permanently, retries exhausted, or abandoned. */
    FAILED;

    /** True for {@link #SUCCEEDED} and {@link #FAILED}. */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
