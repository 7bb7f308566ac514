package com.cdnpurge.invalidationservice.domain;

import com.cdnpurge.invalidation.BatchSplitter;
import com.cdnpurge.invalidation.CallerReferences;
import com.cdnpurge.invalidation.ErrorKind;
import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.invalidation.InvalidationRequest;
import com.cdnpurge.invalidation.InvalidationRequestFactory;
import com.cdnpurge.invalidation.InvalidationResult;
import com.cdnpurge.invalidation.InvalidationSerializationException;
import com.cdnpurge.invalidation.InvalidationStatus;
import com.cdnpurge.invalidation.SubmissionResult;
import com.cdnpurge.invalidation.ValidationError;
import com.cdnpurge.observability.InvalidationContext;
import com.cdnpurge.observability.InvalidationContextHolder;
import com.cdnpurge.observability.InvalidationMetrics;
import com.cdnpurge.provider.ProviderAdapter;
import com.cdnpurge.provider.ProviderConfig;
import io.github.resilience4j.retry.Retry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives invalidation requests from creation to a final state.
 *
 * <p>A request moves through {@code CREATED → BATCHING → SUBMITTING} and ends in
 * {@code SUCCEEDED}, {@code PARTIAL_FAILURE} or {@code FAILED}. Batches are handed to the tenant's
 * {@link ProviderAdapter} on a bounded executor and may complete in any order. Each batch is sent
 * with {@code <callerReference>-<index>}; the same value is used on every retry and every
 * resubmission, and batches already SUBMITTED or SUCCEEDED under it are not sent again.
 *
 * <p>Submission never throws for provider problems. Callers get a request id immediately and the
 * outcome through {@link InvalidationHandle} or {@link InvalidationReporter}.
 */
public class InvalidationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(InvalidationDispatcher.class);

    private final TenantProviders providers;
    private final InvalidationRequestFactory requestFactory;
    private final InvalidationReporter reporter;
    private final BatchRetryPolicy retryPolicy;
    private final IdempotencyRegistry idempotency;
    private final InvalidationMetrics metrics;
    private final Executor executor;
    private final Map<String, Dispatch> dispatches = new ConcurrentHashMap<>();

    public InvalidationDispatcher(
            TenantProviders providers,
            InvalidationRequestFactory requestFactory,
            InvalidationReporter reporter,
            BatchRetryPolicy retryPolicy,
            IdempotencyRegistry idempotency,
            InvalidationMetrics metrics,
            Executor executor) {
        this.providers = providers;
        this.requestFactory = requestFactory;
        this.reporter = reporter;
        this.retryPolicy = retryPolicy;
        this.idempotency = idempotency;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Validates {@code rawPaths} and starts purging them for {@code tenantId}.
     *
     * @return the new request id, or the validation errors; nothing is sent when rejected
     */
    public SubmissionResult submit(String tenantId, List<String> rawPaths) {
        ProviderConfig config = providers.config(tenantId);
        InvalidationRequestFactory.Creation creation;
        try {
            creation = requestFactory.create(tenantId, rawPaths, config.type());
        } catch (IllegalArgumentException e) {
            return SubmissionResult.rejected(ValidationError.of(e.getMessage()));
        }
        if (!creation.isCreated()) {
            log.warn("Rejected invalidation for tenant {}: {}", tenantId, creation.error().summary());
            return SubmissionResult.rejected(creation.error());
        }
        return SubmissionResult.accepted(dispatch(creation.request()).requestId());
    }

    /** Starts a purge of everything cached for {@code tenantId}. */
    public SubmissionResult submitFullPurge(String tenantId) {
        ProviderConfig config = providers.config(tenantId);
        InvalidationRequest request;
        try {
            request = requestFactory.createFullPurge(tenantId, config.type());
        } catch (IllegalArgumentException e) {
            return SubmissionResult.rejected(ValidationError.of(e.getMessage()));
        }
        return SubmissionResult.accepted(dispatch(request).requestId());
    }

    /**
     * Dispatches a request.
     *
     * <p>A request already in progress returns its current handle. A request that already completed
     * is resubmitted under its original caller reference, which sends only the batches that did not
     * succeed.
     *
     * @throws IllegalArgumentException if the request's provider is not the tenant's provider
     */
    public synchronized InvalidationHandle dispatch(InvalidationRequest request) {
        Dispatch existing = dispatches.get(request.id());
        if (existing != null) {
            return existing.handle.isDone() ? resubmit(existing, b -> true) : existing.handle;
        }

        ProviderConfig config = providers.config(request.tenantId());
        if (config.type() != request.providerType()) {
            throw new IllegalArgumentException("Request " + request.id() + " targets "
                    + request.providerType().value() + " but tenant " + request.tenantId()
                    + " uses " + config.type().value());
        }
        ProviderAdapter adapter = providers.adapter(request.tenantId());

        reporter.register(request);
        metrics.requestAccepted(adapter.type().value());
        log.info("Accepted invalidation {} for tenant {}: {} paths via {} (reference {})",
                request.id(), request.tenantId(), request.pathCount(), adapter.type().value(),
                request.callerReference());

        reporter.transition(request.id(), RequestState.BATCHING);
        List<InvalidationBatch> batches = BatchSplitter.split(request, config.maxBatchSize());
        reporter.recordBatches(request.id(), batches);

        Dispatch dispatch = new Dispatch(request, adapter, batches);
        InvalidationHandle handle = start(dispatch, batches);
        dispatches.put(request.id(), dispatch);
        return handle;
    }

    /**
     * Resends the batches of a completed request that ended FAILED, cancelled ones included.
     *
     * @return the new handle, or empty if the request is unknown
     * @throws IllegalStateException if the request is still in progress
     */
    public synchronized Optional<InvalidationHandle> retryFailed(String requestId) {
        Dispatch dispatch = dispatches.get(requestId);
        if (dispatch == null) {
            return Optional.empty();
        }
        if (!dispatch.handle.isDone()) {
            throw new IllegalStateException("Invalidation " + requestId + " is still in progress");
        }
        return Optional.of(resubmit(dispatch, batch -> reporter.result(requestId, batch.sequenceIndex())
                .map(r -> r.status() == InvalidationStatus.FAILED)
                .orElse(true)));
    }

    /**
     * Abandons the batches of a request that have not been sent yet. Batches already with the
     * provider run to completion.
     *
     * @return false if the request is unknown or already complete
     */
    public synchronized boolean cancel(String requestId) {
        Dispatch dispatch = dispatches.get(requestId);
        if (dispatch == null || dispatch.handle.isDone()) {
            return false;
        }
        dispatch.cancelled = true;
        log.info("Cancellation requested for invalidation {}", requestId);
        return true;
    }

    public Optional<InvalidationHandle> handle(String requestId) {
        return Optional.ofNullable(dispatches.get(requestId)).map(d -> d.handle);
    }

    private synchronized InvalidationHandle resubmit(Dispatch dispatch, Predicate<InvalidationBatch> selector) {
        if (!dispatch.handle.isDone()) {
            return dispatch.handle;
        }
        metrics.requestAccepted(dispatch.adapter.type().value());
        List<InvalidationBatch> selected = dispatch.batches.stream().filter(selector).toList();
        log.info("Resubmitting {} of {} batches of invalidation {}",
                selected.size(), dispatch.batches.size(), dispatch.request.id());
        dispatch.cancelled = false;
        for (InvalidationBatch batch : selected) {
            String reference = CallerReferences.forBatch(dispatch.request.callerReference(), batch.sequenceIndex());
            if (!idempotency.status(reference).map(s -> s == InvalidationStatus.SUCCEEDED).orElse(false)) {
                reporter.record(InvalidationResult.pending(batch));
            }
        }
        return start(dispatch, selected);
    }

    private InvalidationHandle start(Dispatch dispatch, List<InvalidationBatch> batches) {
        String requestId = dispatch.request.id();
        reporter.transition(requestId, RequestState.SUBMITTING);

        CompletableFuture<?>[] futures = batches.stream()
                .map(batch -> schedule(dispatch, batch))
                .toArray(CompletableFuture[]::new);

        CompletableFuture<InvalidationSummary> completion = CompletableFuture.allOf(futures)
                .handle((ignored, error) -> {
                    if (error != null) {
                        log.error("Invalidation {} ended abnormally", requestId, error);
                    }
                    metrics.requestCompleted();
                    InvalidationSummary summary = reporter.complete(requestId);
                    log.info("Invalidation {} finished {}: {} succeeded, {} failed, {} cancelled",
                            requestId, summary.state(), summary.succeeded(), summary.failed(), summary.cancelled());
                    return summary;
                });
        dispatch.handle = new InvalidationHandle(requestId, completion);
        return dispatch.handle;
    }

    private CompletableFuture<Void> schedule(Dispatch dispatch, InvalidationBatch batch) {
        try {
            return CompletableFuture.runAsync(() -> runBatch(dispatch, batch), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Worker queue full; batch {} of invalidation {} not scheduled",
                    batch.sequenceIndex(), dispatch.request.id());
            reporter.record(InvalidationResult.failed(batch, ErrorKind.RATE_LIMIT, "Worker queue full")
                    .withAttemptCount(0));
            metrics.batchCompleted(dispatch.adapter.type().value(), "rejected");
            return CompletableFuture.completedFuture(null);
        }
    }

    private void runBatch(Dispatch dispatch, InvalidationBatch batch) {
        InvalidationRequest request = dispatch.request;
        String provider = dispatch.adapter.type().value();
        String reference = CallerReferences.forBatch(request.callerReference(), batch.sequenceIndex());
        InvalidationContext context = InvalidationContext.forRequest(request.id(), request.tenantId(), provider)
                .forBatch(batch.sequenceIndex(), reference);

        InvalidationContextHolder.runWithContext(context, () -> {
            if (dispatch.cancelled) {
                log.info("Batch {} abandoned before submission", batch.sequenceIndex());
                reporter.record(InvalidationResult.failed(batch, ErrorKind.CANCELLED,
                        "Abandoned before submission").withAttemptCount(0));
                metrics.batchCompleted(provider, "cancelled");
                return;
            }
            if (!idempotency.tryBegin(reference)) {
                log.info("Batch {} already submitted under {}; skipping", batch.sequenceIndex(), reference);
                metrics.batchCompleted(provider, "skipped");
                return;
            }

            InvalidationStatus finalStatus = InvalidationStatus.FAILED;
            try {
                reporter.record(InvalidationResult.submitted(batch, "").withAttemptCount(0));
                InvalidationResult result = submitWithRetry(dispatch.adapter, batch, reference, provider);
                finalStatus = result.status();
                reporter.record(result);
                metrics.batchCompleted(provider, result.isSuccess() ? "succeeded" : "failed");
            } finally {
                idempotency.complete(reference, finalStatus);
            }
        });
    }

    private InvalidationResult submitWithRetry(ProviderAdapter adapter, InvalidationBatch batch,
                                               String reference, String provider) {
        AtomicInteger attempts = new AtomicInteger();
        Retry retry = retryPolicy.newRetry(reference);
        Supplier<InvalidationResult> call = () -> {
            int attempt = attempts.incrementAndGet();
            InvalidationResult result = metrics.providerLatency(provider)
                    .record(() -> adapter.submit(batch, reference));
            metrics.attempt(provider, result.isSuccess() ? "none" : result.errorKind().name());
            if (result.isRetryableFailure() && attempt < retryPolicy.maxAttempts()) {
                log.warn("Attempt {} of batch {} failed ({}); retrying", attempt, batch.sequenceIndex(),
                        result.errorKind());
            }
            return result;
        };

        try {
            return Retry.decorateSupplier(retry, call).get().withAttemptCount(attempts.get());
        } catch (InvalidationSerializationException e) {
            log.error("Batch {} of request {} could not be encoded", batch.sequenceIndex(), batch.requestId(), e);
            return InvalidationResult.failed(batch, e.errorKind(), e.getMessage()).withAttemptCount(attempts.get());
        } catch (RuntimeException e) {
            log.error("Batch {} of request {} failed unexpectedly", batch.sequenceIndex(), batch.requestId(), e);
            return InvalidationResult.failed(batch, ErrorKind.PROVIDER, "Unexpected error: " + e.getMessage())
                    .withAttemptCount(attempts.get());
        }
    }

    private static final class Dispatch {
        private final InvalidationRequest request;
        private final ProviderAdapter adapter;
        private final List<InvalidationBatch> batches;
        private volatile boolean cancelled;
        private volatile InvalidationHandle handle;

        private Dispatch(InvalidationRequest request, ProviderAdapter adapter, List<InvalidationBatch> batches) {
            this.request = request;
            this.adapter = adapter;
            this.batches = batches;
        }
    }
}
