package com.cdnpurge.invalidationservice.domain;

import com.cdnpurge.invalidation.ErrorKind;
import com.cdnpurge.invalidation.InvalidationResult;
import com.cdnpurge.invalidation.InvalidationStatus;
import java.time.Instant;
import java.util.List;

/**
 * Request-level view over the batch results, as returned to the publish pipeline and operators.
 *
 * @param requestId   request id
 * @param tenantId    owning tenant
 * @param provider    provider name, e.g. "CloudFront"
 * @param state       lifecycle state
 * @param complete    true once every batch is SUCCEEDED or FAILED
 * @param succeeded   batches that succeeded
 * @param failed      batches that failed, cancelled ones excluded
 * @param pending     batches not yet finished
 * @param cancelled   batches abandoned before they were sent
 * @param createdAt   when the request was created
 * @param completedAt when the request reached a final state, null before that
 * @param results     latest result per batch, in batch order
 */
public record InvalidationSummary(
        String requestId,
        String tenantId,
        String provider,
        RequestState state,
        boolean complete,
        int succeeded,
        int failed,
        int pending,
        int cancelled,
        Instant createdAt,
        Instant completedAt,
        List<InvalidationResult> results) {

    public static InvalidationSummary of(InvalidationReport report) {
        int succeeded = 0;
        int failed = 0;
        int pending = 0;
        int cancelled = 0;
        for (InvalidationResult result : report.results().values()) {
            if (result.status() == InvalidationStatus.SUCCEEDED) {
                succeeded++;
            } else if (result.status() == InvalidationStatus.FAILED) {
                if (result.errorKind() == ErrorKind.CANCELLED) {
                    cancelled++;
                } else {
                    failed++;
                }
            } else {
                pending++;
            }
        }
        boolean complete = report.state().isTerminal() && pending == 0;
        return new InvalidationSummary(report.requestId(), report.tenantId(), report.provider().value(),
                report.state(), complete, succeeded, failed, pending, cancelled,
                report.createdAt(), report.completedAt(), List.copyOf(report.results().values()));
    }
}
