package com.cdnpurge.invalidationservice.infrastructure.store;

import com.cdnpurge.invalidationservice.domain.InvalidationReport;
import com.cdnpurge.invalidationservice.domain.InvalidationReportStore;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link InvalidationReportStore} backed by a {@link ConcurrentHashMap}. Reports live for the
 * lifetime of the process; once {@code maxReports} is exceeded the oldest completed ones are
 * evicted.
 */
public class InMemoryInvalidationReportStore implements InvalidationReportStore {

    private final Map<String, InvalidationReport> reports = new ConcurrentHashMap<>();
    private final int maxReports;

    public InMemoryInvalidationReportStore(int maxReports) {
        if (maxReports <= 0) {
            throw new IllegalArgumentException("maxReports must be positive");
        }
        this.maxReports = maxReports;
    }

    @Override
    public void save(InvalidationReport report) {
        reports.put(report.requestId(), report);
        if (reports.size() > maxReports) {
            evictOldestCompleted();
        }
    }

    @Override
    public Optional<InvalidationReport> find(String requestId) {
        return Optional.ofNullable(reports.get(requestId));
    }

    @Override
    public Optional<InvalidationReport> update(String requestId, UnaryOperator<InvalidationReport> change) {
        return Optional.ofNullable(reports.computeIfPresent(requestId, (id, report) -> change.apply(report)));
    }

    @Override
    public List<InvalidationReport> recentForTenant(String tenantId, int limit) {
        return reports.values().stream()
                .filter(r -> r.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(InvalidationReport::createdAt).reversed())
                .limit(limit)
                .toList();
    }

    public int size() {
        return reports.size();
    }

    private void evictOldestCompleted() {
        reports.values().stream()
                .filter(r -> r.state().isTerminal())
                .min(Comparator.comparing(InvalidationReport::createdAt))
                .ifPresent(r -> reports.remove(r.requestId(), r));
    }
}
