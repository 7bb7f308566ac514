package com.cdnpurge.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.function.Supplier;

/**
 * Wraps outbound provider calls in OpenTelemetry {@code CLIENT} spans.
 *
 * <p>The span is named {@code cdn.purge <provider>} and carries the batch size plus whatever the
 * current {@link InvalidationContext} knows. Does not configure the SDK.
 */
public final class ProviderCallTracer {

    public static final String ATTR_PROVIDER = "cdn.provider";
    public static final String ATTR_BATCH_SIZE = "cdn.batch.size";
    public static final String ATTR_BATCH_INDEX = "cdn.batch.index";
    public static final String ATTR_REQUEST_ID = "cdn.request.id";
    public static final String ATTR_TENANT_ID = "tenant.id";

    private final Tracer tracer;

    public ProviderCallTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code call} inside a new client span.
     *
     * @param provider  provider name, e.g. "Cloudflare"
     * @param batchSize number of paths in the call
     * @param call      the provider call
     * @return whatever {@code call} returns
     */
    public <T> T trace(String provider, int batchSize, Supplier<T> call) {
        Span span = tracer.spanBuilder("cdn.purge " + provider)
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(ATTR_PROVIDER, provider)
                .setAttribute(ATTR_BATCH_SIZE, (long) batchSize)
                .startSpan();

        InvalidationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute(ATTR_REQUEST_ID, ctx.requestId());
            if (ctx.tenantId() != null) {
                span.setAttribute(ATTR_TENANT_ID, ctx.tenantId());
            }
            if (ctx.batchIndex() != null) {
                span.setAttribute(ATTR_BATCH_INDEX, ctx.batchIndex().longValue());
            }
        });

        // Status stays UNSET on success so markFailed() can still flag a failed call.
        try (Scope ignored = span.makeCurrent()) {
            return call.get();
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Marks the current span as failed without throwing, for calls that report errors as values. */
    public static void markFailed(String reason) {
        Span.current().setStatus(StatusCode.ERROR, reason);
    }
}
