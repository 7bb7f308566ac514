package com.cdnpurge.invalidationservice.domain;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle on a dispatched request. Callers may ignore it (fire-and-forget) or wait with a timeout.
 */
public final class InvalidationHandle {

    private final String requestId;
    private final CompletableFuture<InvalidationSummary> completion;

    InvalidationHandle(String requestId, CompletableFuture<InvalidationSummary> completion) {
        this.requestId = requestId;
        this.completion = completion;
    }

    public String requestId() {
        return requestId;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Waits for completion.
     *
     * @return the final summary, or empty if {@code timeout} elapsed first
     */
    public Optional<InvalidationSummary> await(Duration timeout) throws InterruptedException {
        try {
            return Optional.of(completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Invalidation " + requestId + " failed to complete", e.getCause());
        }
    }

    public CompletableFuture<InvalidationSummary> completion() {
        return completion;
    }
}
