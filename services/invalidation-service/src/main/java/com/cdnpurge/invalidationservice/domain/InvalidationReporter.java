package com.cdnpurge.invalidationservice.domain;

import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.invalidation.InvalidationRequest;
import com.cdnpurge.invalidation.InvalidationResult;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records batch results and request transitions, and produces {@link InvalidationSummary}s.
 *
 * <p>The reporter only observes what the dispatcher tells it. Completion listeners are invoked once
 * per completed dispatch round; a failing listener is logged and does not affect the request or
 * the other listeners.
 */
public class InvalidationReporter {

    private static final Logger log = LoggerFactory.getLogger(InvalidationReporter.class);

    private final InvalidationReportStore store;
    private final List<InvalidationCompletionListener> listeners;
    private final Clock clock;

    public InvalidationReporter(InvalidationReportStore store, List<InvalidationCompletionListener> listeners,
                                Clock clock) {
        this.store = store;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
    }

    public void register(InvalidationRequest request) {
        store.save(InvalidationReport.created(request));
    }

    public void transition(String requestId, RequestState state) {
        store.update(requestId, report -> report.withState(state, clock.instant()));
    }

    /** Records a PENDING result for each batch. Results are stamped with the reporter's clock. */
    public void recordBatches(String requestId, List<InvalidationBatch> batches) {
        store.update(requestId, report -> {
            InvalidationReport updated = report;
            for (InvalidationBatch batch : batches) {
                updated = updated.withResult(InvalidationResult.pending(batch).withTimestamp(clock.instant()));
            }
            return updated;
        });
    }

    public void record(InvalidationResult result) {
        store.update(result.requestId(), report -> report.withResult(result.withTimestamp(clock.instant())));
    }

    /**
     * Moves the request to its final state, derived from the batch results, and notifies listeners.
     */
    public InvalidationSummary complete(String requestId) {
        InvalidationReport report = store.update(requestId,
                        r -> r.withState(RequestState.fromResults(r.results().values()), clock.instant()))
                .orElseThrow(() -> new IllegalStateException("Unknown invalidation request: " + requestId));
        InvalidationSummary summary = InvalidationSummary.of(report);
        for (InvalidationCompletionListener listener : listeners) {
            try {
                listener.onCompleted(summary);
            } catch (RuntimeException e) {
                log.warn("Completion listener {} failed for request {}",
                        listener.getClass().getSimpleName(), requestId, e);
            }
        }
        return summary;
    }

    public Optional<InvalidationSummary> summary(String requestId) {
        return store.find(requestId).map(InvalidationSummary::of);
    }

    public Optional<InvalidationResult> result(String requestId, int batchIndex) {
        return store.find(requestId).map(r -> r.results().get(batchIndex));
    }

    public List<InvalidationSummary> recentForTenant(String tenantId, int limit) {
        return store.recentForTenant(tenantId, limit).stream().map(InvalidationSummary::of).toList();
    }
}
