package com.cdnpurge.invalidationservice.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Dispatcher tuning, bound from {@code cdnpurge.dispatch.*}.
 *
 * <pre>
 * cdnpurge:
 *   dispatch:
 *     worker-threads: 4
 *     max-attempts: 3
 *     initial-backoff: 500ms
 *     backoff-multiplier: 2.0
 *     request-timeout: 30s
 *     connect-timeout: 10s
 *     queue-capacity: 1000
 *     shutdown-timeout: 30s
 * </pre>
 *
 * <p>Zero or missing values fall back to the defaults shown.
 *
 * @param workerThreads     size of the pool submitting batches in parallel
 * @param maxAttempts       provider calls per batch, first attempt included
 * @param initialBackoff    wait before the first retry
 * @param backoffMultiplier growth factor of the wait between retries
 * @param requestTimeout    bound on one provider call
 * @param connectTimeout    bound on opening a connection
 * @param queueCapacity     batches waiting for a worker before new ones are refused
 * @param shutdownTimeout   how long shutdown waits for batches already with a worker
 */
@ConfigurationProperties(prefix = "cdnpurge.dispatch")
@Validated
public record DispatchProperties(
        @Min(0) @Max(64) int workerThreads,
        @Min(0) @Max(10) int maxAttempts,
        Duration initialBackoff,
        double backoffMultiplier,
        Duration requestTimeout,
        Duration connectTimeout,
        @Min(0) int queueCapacity,
        Duration shutdownTimeout) {

    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(500);
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    public DispatchProperties {
        if (workerThreads <= 0) {
            workerThreads = DEFAULT_WORKER_THREADS;
        }
        if (maxAttempts <= 0) {
            maxAttempts = DEFAULT_MAX_ATTEMPTS;
        }
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            initialBackoff = DEFAULT_INITIAL_BACKOFF;
        }
        if (backoffMultiplier < 1.0) {
            backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        }
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        }
        if (queueCapacity <= 0) {
            queueCapacity = DEFAULT_QUEUE_CAPACITY;
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        }
    }

    public static DispatchProperties defaults() {
        return new DispatchProperties(0, 0, null, 0, null, null, 0, null);
    }
}
