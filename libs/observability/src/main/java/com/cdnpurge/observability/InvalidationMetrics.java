package com.cdnpurge.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for invalidation traffic.
 *
 * <p>All meters carry a {@code service} tag; per-provider meters also carry {@code provider}.
 * Meters are looked up from the registry on every call, which Micrometer resolves to the same
 * instance for the same name and tags.
 */
public final class InvalidationMetrics {

    public static final String REQUESTS = "cdn.invalidation.requests";
    public static final String BATCHES = "cdn.invalidation.batches";
    public static final String ATTEMPTS = "cdn.invalidation.attempts";
    public static final String LATENCY = "cdn.invalidation.provider.latency";
    public static final String INFLIGHT = "cdn.invalidation.requests.inflight";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_PROVIDER = "provider";
    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_ERROR_KIND = "error_kind";

    private final MeterRegistry registry;
    private final String serviceName;
    private final AtomicLong inflight = new AtomicLong();

    /**
     * @param registry    the meter registry
     * @param serviceName logical service name used as the {@code service} tag
     */
    public InvalidationMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
        Gauge.builder(INFLIGHT, inflight, AtomicLong::doubleValue)
                .description("Invalidation requests not yet complete")
                .tags(Tags.of(TAG_SERVICE, serviceName))
                .register(registry);
    }

    /** Counts an accepted request and marks it in flight. */
    public void requestAccepted(String provider) {
        Counter.builder(REQUESTS)
                .description("Invalidation requests accepted")
                .tags(tags(provider))
                .register(registry)
                .increment();
        inflight.incrementAndGet();
    }

    /** Marks a request as no longer in flight. */
    public void requestCompleted() {
        inflight.updateAndGet(v -> v > 0 ? v - 1 : 0);
    }

    /**
     * Counts a batch reaching a terminal state.
     *
     * @param outcome e.g. "succeeded", "failed", "skipped"
     */
    public void batchCompleted(String provider, String outcome) {
        Counter.builder(BATCHES)
                .description("Invalidation batches by terminal outcome")
                .tags(tags(provider).and(TAG_OUTCOME, outcome))
                .register(registry)
                .increment();
    }

    /**
     * Counts one provider call.
     *
     * @param errorKind failure kind name, or "none" for a successful call
     */
    public void attempt(String provider, String errorKind) {
        Counter.builder(ATTEMPTS)
                .description("Provider purge calls")
                .tags(tags(provider).and(TAG_ERROR_KIND, errorKind))
                .register(registry)
                .increment();
    }

    /** Timer for provider call latency. */
    public Timer providerLatency(String provider) {
        return Timer.builder(LATENCY)
                .description("Latency of provider purge calls")
                .tags(tags(provider))
                .register(registry);
    }

    public long inflight() {
        return inflight.get();
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Tags tags(String provider) {
        return Tags.of(TAG_SERVICE, serviceName, TAG_PROVIDER, provider);
    }
}
