/** Audit trail of completed invalidations, written to the {@code cdnpurge.audit} logger. */
package com.cdnpurge.invalidationservice.infrastructure.audit;
