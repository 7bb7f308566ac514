package com.cdnpurge.invalidationservice.domain;

/**
 * Notified when a request reaches a final state. Implementations must not block for long; they
 * run on the dispatcher's worker threads.
 */
@FunctionalInterface
public interface InvalidationCompletionListener {

    void onCompleted(InvalidationSummary summary);
}
