package com.cdnpurge.invalidationservice.api;

import com.cdnpurge.invalidation.SubmissionResult;
import com.cdnpurge.invalidationservice.domain.InvalidationDispatcher;
import com.cdnpurge.invalidationservice.domain.InvalidationHandle;
import com.cdnpurge.invalidationservice.domain.InvalidationReporter;
import com.cdnpurge.invalidationservice.domain.InvalidationSummary;
import com.cdnpurge.invalidationservice.infrastructure.web.InvalidationNotFoundException;
import com.cdnpurge.invalidationservice.infrastructure.web.InvalidationRejectedException;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound surface used by the publish pipeline and operators.
 *
 * <p>Submissions return {@code 202 Accepted} with the request id as soon as the request is
 * validated; the purge runs in the background. Passing {@code awaitMillis} waits up to that long
 * and returns the final summary with {@code 200} when it completes in time.
 */
@RestController
@RequestMapping("/api/v1/invalidations")
public class InvalidationController {

    static final long MAX_AWAIT_MILLIS = 60_000;

    private final InvalidationDispatcher dispatcher;
    private final InvalidationReporter reporter;

    public InvalidationController(InvalidationDispatcher dispatcher, InvalidationReporter reporter) {
        this.dispatcher = dispatcher;
        this.reporter = reporter;
    }

    @PostMapping
    public ResponseEntity<?> submit(
            @Valid @RequestBody SubmitInvalidationRequest body,
            @RequestParam(name = "awaitMillis", defaultValue = "0") long awaitMillis) throws InterruptedException {
        return accepted(dispatcher.submit(body.tenantId(), body.paths()), awaitMillis);
    }

    @PostMapping("/full-purge")
    public ResponseEntity<?> fullPurge(
            @Valid @RequestBody FullPurgeRequest body,
            @RequestParam(name = "awaitMillis", defaultValue = "0") long awaitMillis) throws InterruptedException {
        return accepted(dispatcher.submitFullPurge(body.tenantId()), awaitMillis);
    }

    @GetMapping("/{requestId}")
    public InvalidationSummary get(@PathVariable String requestId) {
        return reporter.summary(requestId).orElseThrow(() -> new InvalidationNotFoundException(requestId));
    }

    @GetMapping
    public List<InvalidationSummary> recent(
            @RequestParam String tenantId,
            @RequestParam(defaultValue = "20") int limit) {
        return reporter.recentForTenant(tenantId, Math.max(1, Math.min(limit, 200)));
    }

    @PostMapping("/{requestId}/retry")
    public ResponseEntity<SubmissionResponse> retry(@PathVariable String requestId) {
        InvalidationHandle handle = dispatcher.retryFailed(requestId)
                .orElseThrow(() -> new InvalidationNotFoundException(requestId));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmissionResponse(handle.requestId()));
    }

    @PostMapping("/{requestId}/cancel")
    public ResponseEntity<SubmissionResponse> cancel(@PathVariable String requestId) {
        if (reporter.summary(requestId).isEmpty()) {
            throw new InvalidationNotFoundException(requestId);
        }
        if (!dispatcher.cancel(requestId)) {
            throw new IllegalStateException("Invalidation " + requestId + " is already complete");
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmissionResponse(requestId));
    }

    private ResponseEntity<?> accepted(SubmissionResult result, long awaitMillis) throws InterruptedException {
        String requestId = result.acceptedRequestId()
                .orElseThrow(() -> new InvalidationRejectedException(result.error()));
        if (awaitMillis > 0) {
            Optional<InvalidationSummary> summary = dispatcher.handle(requestId)
                    .orElseThrow(() -> new InvalidationNotFoundException(requestId))
                    .await(Duration.ofMillis(Math.min(awaitMillis, MAX_AWAIT_MILLIS)));
            if (summary.isPresent()) {
                return ResponseEntity.ok(summary.get());
            }
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new SubmissionResponse(requestId));
    }
}
