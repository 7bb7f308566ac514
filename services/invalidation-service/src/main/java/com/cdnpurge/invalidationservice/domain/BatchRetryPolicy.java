package com.cdnpurge.invalidationservice.domain;

import com.cdnpurge.invalidation.InvalidationResult;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;

/**
 * Retry rules for batch submission.
 *
 * <p>Adapters return failures as values, so retries are driven by the result: RATE_LIMIT and
 * TRANSIENT_NETWORK results are retried with exponential backoff, every other failure returns
 * immediately. Exceptions are never retried. When attempts run out the last result is returned.
 */
public class BatchRetryPolicy {

    private final RetryConfig config;

    public BatchRetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.config = RetryConfig.<InvalidationResult>custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryOnResult(InvalidationResult::isRetryableFailure)
                .retryOnException(e -> false)
                .failAfterMaxAttempts(false)
                .build();
    }

    /** A fresh retry instance for one batch. */
    public Retry newRetry(String name) {
        return Retry.of(name, config);
    }

    public int maxAttempts() {
        return config.getMaxAttempts();
    }
}
