package com.cdnpurge.invalidationservice.domain;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/** Persistence port for {@link InvalidationReport}s. */
public interface InvalidationReportStore {

    void save(InvalidationReport report);

    Optional<InvalidationReport> find(String requestId);

    /**
     * Atomically replaces the report with {@code change} applied to it.
     *
     * @return the updated report, or empty if none exists
     */
    Optional<InvalidationReport> update(String requestId, UnaryOperator<InvalidationReport> change);

    /** Most recently created reports of a tenant, newest first. */
    List<InvalidationReport> recentForTenant(String tenantId, int limit);
}
