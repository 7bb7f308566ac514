package com.cdnpurge.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InvalidationMetrics")
class InvalidationMetricsTest {

    private SimpleMeterRegistry registry;
    private InvalidationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new InvalidationMetrics(registry, "invalidation-test");
    }

    @Test
    @DisplayName("rejects missing registry or service name")
    void construction() {
        assertThatThrownBy(() -> new InvalidationMetrics(null, "svc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registry");
        assertThatThrownBy(() -> new InvalidationMetrics(registry, " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("serviceName");
    }

    @Test
    @DisplayName("counts batches per provider and outcome")
    void batchCounter() {
        metrics.batchCompleted("CloudFront", "succeeded");
        metrics.batchCompleted("CloudFront", "succeeded");
        metrics.batchCompleted("CloudFront", "failed");

        assertThat(registry.get(InvalidationMetrics.BATCHES)
                .tag("provider", "CloudFront")
                .tag("outcome", "succeeded")
                .tag("service", "invalidation-test")
                .counter().count()).isEqualTo(2.0);
        assertThat(registry.get(InvalidationMetrics.BATCHES)
                .tag("outcome", "failed")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("counts attempts by error kind")
    void attemptCounter() {
        metrics.attempt("Cloudflare", "RATE_LIMIT");
        metrics.attempt("Cloudflare", "none");

        assertThat(registry.get(InvalidationMetrics.ATTEMPTS)
                .tag("error_kind", "RATE_LIMIT")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("tracks in-flight requests without going negative")
    void inflightGauge() {
        metrics.requestAccepted("None");
        metrics.requestAccepted("None");
        metrics.requestCompleted();

        assertThat(registry.get(InvalidationMetrics.INFLIGHT).gauge().value()).isEqualTo(1.0);

        metrics.requestCompleted();
        metrics.requestCompleted();
        assertThat(metrics.inflight()).isZero();
        assertThat(registry.get(InvalidationMetrics.REQUESTS).counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("latency timer is shared per provider")
    void latencyTimer() {
        metrics.providerLatency("Sucuri").record(Duration.ofMillis(120));
        metrics.providerLatency("Sucuri").record(Duration.ofMillis(80));

        assertThat(registry.get(InvalidationMetrics.LATENCY).tag("provider", "Sucuri").timer().count())
                .isEqualTo(2);
    }
}
