package com.cdnpurge.invalidationservice.domain;

import com.cdnpurge.invalidation.InvalidationRequest;
import com.cdnpurge.invalidation.InvalidationResult;
import com.cdnpurge.invalidation.ProviderType;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Recorded state of one request: its identity, lifecycle state and the latest result per batch.
 * Immutable; every change produces a new report.
 */
public record InvalidationReport(
        String requestId,
        String tenantId,
        ProviderType provider,
        String callerReference,
        boolean fullPurge,
        int pathCount,
        Instant createdAt,
        RequestState state,
        Map<Integer, InvalidationResult> results,
        Instant completedAt) {

    public InvalidationReport {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
        results = Collections.unmodifiableMap(new TreeMap<>(results == null ? Map.of() : results));
    }

    public static InvalidationReport created(InvalidationRequest request) {
        return new InvalidationReport(request.id(), request.tenantId(), request.providerType(),
                request.callerReference(), request.fullPurge(), request.pathCount(), request.createdAt(),
                RequestState.CREATED, Map.of(), null);
    }

    public InvalidationReport withState(RequestState newState, Instant at) {
        return new InvalidationReport(requestId, tenantId, provider, callerReference, fullPurge, pathCount,
                createdAt, newState, results, newState.isTerminal() ? at : null);
    }

    public InvalidationReport withResult(InvalidationResult result) {
        Map<Integer, InvalidationResult> updated = new TreeMap<>(results);
        updated.put(result.batchIndex(), result);
        return new InvalidationReport(requestId, tenantId, provider, callerReference, fullPurge, pathCount,
                createdAt, state, updated, completedAt);
    }
}
