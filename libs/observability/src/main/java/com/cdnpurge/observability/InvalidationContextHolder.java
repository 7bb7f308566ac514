package com.cdnpurge.observability;

import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link InvalidationContext}, bridged to SLF4J MDC.
 *
 * <p>Batches run on pool threads, so the context does not follow them automatically. Use
 * {@link #callWithContext(InvalidationContext, Supplier)} on the worker, which also restores
 * whatever the worker thread held before.
 */
public final class InvalidationContextHolder {

    private static final ThreadLocal<InvalidationContext> CONTEXT = new ThreadLocal<>();

    private InvalidationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(InvalidationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    public static Optional<InvalidationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Removes the context and its MDC keys from the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(InvalidationContext.MDC_REQUEST_ID);
        MDC.remove(InvalidationContext.MDC_TENANT_ID);
        MDC.remove(InvalidationContext.MDC_PROVIDER);
        MDC.remove(InvalidationContext.MDC_BATCH_INDEX);
        MDC.remove(InvalidationContext.MDC_CALLER_REFERENCE);
    }

    /**
     * Runs {@code work} with {@code context} installed, then restores the previous context (or
     * clears it if there was none).
     */
    public static <T> T callWithContext(InvalidationContext context, Supplier<T> work) {
        InvalidationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /** Void variant of {@link #callWithContext(InvalidationContext, Supplier)}. */
    public static void runWithContext(InvalidationContext context, Runnable work) {
        callWithContext(context, () -> {
            work.run();
            return null;
        });
    }

    private static void populateMdc(InvalidationContext ctx) {
        setMdc(InvalidationContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(InvalidationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(InvalidationContext.MDC_PROVIDER, ctx.provider());
        setMdc(InvalidationContext.MDC_BATCH_INDEX,
                ctx.batchIndex() != null ? ctx.batchIndex().toString() : null);
        setMdc(InvalidationContext.MDC_CALLER_REFERENCE, ctx.callerReference());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
