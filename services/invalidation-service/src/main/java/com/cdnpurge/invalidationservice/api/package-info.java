/**
 * REST API under {@code /api/v1/invalidations}.
 *
 * <p>Submissions answer with the request id at once, or with the outcome when the caller waits
 * through {@code awaitMillis}. Outcomes are read back by id or per tenant.
 * Errors are rendered as RFC 7807 problem details by
 * {@link com.cdnpurge.invalidationservice.infrastructure.web.GlobalExceptionHandler}.
 */
package com.cdnpurge.invalidationservice.api;
