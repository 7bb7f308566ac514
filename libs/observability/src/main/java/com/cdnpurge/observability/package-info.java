/**
 * Logging context, metrics and tracing shared by the provider adapters and the service.
 *
 * <ul>
 *   <li>{@link com.cdnpurge.observability.InvalidationContextHolder} puts request, provider and
 *       batch into the SLF4J MDC while a batch is processed
 *   <li>{@link com.cdnpurge.observability.InvalidationMetrics} owns the Micrometer meters
 *   <li>{@link com.cdnpurge.observability.ProviderCallTracer} wraps provider calls in
 *       OpenTelemetry spans
 *   <li>{@link com.cdnpurge.observability.CredentialRedactor} masks secrets before they reach a
 *       log line
 * </ul>
 */
package com.cdnpurge.observability;
