package com.cdnpurge.invalidationservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cdnpurge.invalidation.BatchSplitter;
import com.cdnpurge.invalidation.ErrorKind;
import com.cdnpurge.invalidation.InvalidationRequest;
import com.cdnpurge.invalidation.InvalidationRequestFactory;
import com.cdnpurge.invalidation.InvalidationResult;
import com.cdnpurge.invalidation.InvalidationStatus;
import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.invalidationservice.infrastructure.store.InMemoryInvalidationReportStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InvalidationReporter")
class InvalidationReporterTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-07-12T10:30:00Z"), ZoneOffset.UTC);
    private final InvalidationRequest request = new InvalidationRequestFactory(clock)
            .create("acme", List.of("/a", "/b", "/c"), ProviderType.CLOUDFRONT).request();
    private final List<InvalidationSummary> notified = new ArrayList<>();

    private InvalidationReporter reporter(InvalidationCompletionListener... extra) {
        List<InvalidationCompletionListener> listeners = new ArrayList<>(List.of(extra));
        listeners.add(notified::add);
        return new InvalidationReporter(new InMemoryInvalidationReportStore(10), listeners, clock);
    }

    @Test
    @DisplayName("a registered request starts CREATED with no results")
    void registers() {
        var reporter = reporter();

        reporter.register(request);

        var summary = reporter.summary(request.id()).orElseThrow();
        assertThat(summary.state()).isEqualTo(RequestState.CREATED);
        assertThat(summary.complete()).isFalse();
        assertThat(summary.results()).isEmpty();
        assertThat(summary.provider()).isEqualTo("CloudFront");
    }

    @Test
    @DisplayName("counts batches by outcome, separating cancelled from failed")
    void countsOutcomes() {
        var reporter = reporter();
        var batches = BatchSplitter.split(request, 1);
        reporter.register(request);
        reporter.recordBatches(request.id(), batches);

        reporter.record(InvalidationResult.succeeded(batches.get(0), "I1"));
        reporter.record(InvalidationResult.failed(batches.get(1), ErrorKind.PROVIDER, "no such distribution"));

        var summary = reporter.summary(request.id()).orElseThrow();
        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.pending()).isEqualTo(1);

        reporter.record(InvalidationResult.failed(batches.get(2), ErrorKind.CANCELLED, "abandoned"));
        var completed = reporter.complete(request.id());

        assertThat(completed.state()).isEqualTo(RequestState.PARTIAL_FAILURE);
        assertThat(completed.cancelled()).isEqualTo(1);
        assertThat(completed.pending()).isZero();
        assertThat(completed.complete()).isTrue();
        assertThat(completed.completedAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("keeps only the latest result per batch")
    void latestResultWins() {
        var reporter = reporter();
        var batch = BatchSplitter.split(request, 3).get(0);
        reporter.register(request);

        reporter.record(InvalidationResult.pending(batch));
        reporter.record(InvalidationResult.submitted(batch, ""));
        reporter.record(InvalidationResult.succeeded(batch, "I1"));

        var result = reporter.result(request.id(), 0).orElseThrow();
        assertThat(result.status()).isEqualTo(InvalidationStatus.SUCCEEDED);
        assertThat(reporter.summary(request.id()).orElseThrow().results()).hasSize(1);
    }

    @Test
    @DisplayName("stamps recorded results with its clock")
    void stampsResults() {
        var reporter = reporter();
        var batches = BatchSplitter.split(request, 2);
        reporter.register(request);
        reporter.recordBatches(request.id(), batches);

        reporter.record(InvalidationResult.succeeded(batches.get(0), "I1"));

        assertThat(reporter.result(request.id(), 0).orElseThrow().timestamp()).isEqualTo(clock.instant());
        assertThat(reporter.result(request.id(), 1).orElseThrow().timestamp()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("notifies listeners on completion even when one of them fails")
    void listenerFailureIsIsolated() {
        var reporter = reporter(summary -> {
            throw new IllegalStateException("audit sink down");
        });
        var batch = BatchSplitter.split(request, 3).get(0);
        reporter.register(request);
        reporter.record(InvalidationResult.succeeded(batch, "I1"));

        var summary = reporter.complete(request.id());

        assertThat(summary.state()).isEqualTo(RequestState.SUCCEEDED);
        assertThat(notified).containsExactly(summary);
    }

    @Test
    @DisplayName("completing an unknown request is an error")
    void unknownRequest() {
        assertThatThrownBy(() -> reporter().complete("missing"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing");
    }
}
