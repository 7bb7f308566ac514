package com.cdnpurge.invalidationservice.infrastructure.audit;

import com.cdnpurge.invalidationservice.domain.InvalidationCompletionListener;
import com.cdnpurge.invalidationservice.domain.InvalidationSummary;
import com.cdnpurge.invalidationservice.domain.RequestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one audit line per completed request to the {@code cdnpurge.audit} logger. A failed
 * purge is logged at WARN; it never marks the publish that triggered it as failed.
 */
public class AuditLogCompletionListener implements InvalidationCompletionListener {

    private static final Logger audit = LoggerFactory.getLogger("cdnpurge.audit");

    @Override
    public void onCompleted(InvalidationSummary summary) {
        if (summary.state() == RequestState.SUCCEEDED) {
            audit.info("CDN invalidation {} for tenant {} via {} succeeded ({} batches)",
                    summary.requestId(), summary.tenantId(), summary.provider(), summary.succeeded());
        } else {
            audit.warn("CDN invalidation {} for tenant {} via {} ended {}: {} succeeded, {} failed, {} cancelled",
                    summary.requestId(), summary.tenantId(), summary.provider(), summary.state(),
                    summary.succeeded(), summary.failed(), summary.cancelled());
        }
    }
}
