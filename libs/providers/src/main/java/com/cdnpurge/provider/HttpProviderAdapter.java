package com.cdnpurge.provider;

import com.cdnpurge.invalidation.ErrorKind;
import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.invalidation.InvalidationResult;
import com.cdnpurge.observability.ProviderCallTracer;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for adapters that talk HTTP.
 *
 * <p>Wraps every submission in a {@code cdn.purge <provider>} span, turns transport exceptions into
 * TRANSIENT_NETWORK failures and logs the outcome. Subclasses only build requests and interpret
 * responses.
 */
public abstract class HttpProviderAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpProviderAdapter.class);

    private final ProviderTransport transport;
    private final ProviderCallTracer tracer;

    protected HttpProviderAdapter(ProviderTransport transport, ProviderCallTracer tracer) {
        if (transport == null) {
            throw new IllegalArgumentException("transport must not be null");
        }
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.transport = transport;
        this.tracer = tracer;
    }

    @Override
    public final InvalidationResult submit(InvalidationBatch batch, String callerReference) {
        if (batch == null) {
            throw new IllegalArgumentException("batch must not be null");
        }
        if (callerReference == null || callerReference.isBlank()) {
            throw new IllegalArgumentException("callerReference must not be null or blank");
        }
        return tracer.trace(type().value(), batch.size(), () -> {
            InvalidationResult result;
            try {
                result = doSubmit(batch, callerReference);
            } catch (IOException e) {
                result = InvalidationResult.failed(
                        batch, HttpOutcomes.classifyTransport(e), HttpOutcomes.describeTransport(e));
            }
            logOutcome(batch, result);
            if (!result.isSuccess()) {
                ProviderCallTracer.markFailed(result.errorKind() + ": " + result.message());
            }
            return result;
        });
    }

    /**
     * Performs the provider call(s) for one batch.
     *
     * @throws IOException on transport failure; the base class reports it as TRANSIENT_NETWORK
     */
    protected abstract InvalidationResult doSubmit(InvalidationBatch batch, String callerReference)
            throws IOException;

    protected ProviderResponse send(ProviderRequest request) throws IOException {
        return transport.send(request);
    }

    /** FAILED result for a non-2xx response, using the default status mapping. */
    protected InvalidationResult httpFailure(InvalidationBatch batch, ProviderResponse response) {
        return httpFailure(batch, response, HttpOutcomes.classifyStatus(response.statusCode()));
    }

    protected InvalidationResult httpFailure(InvalidationBatch batch, ProviderResponse response, ErrorKind kind) {
        return InvalidationResult.failed(batch, kind,
                "HTTP " + response.statusCode() + ": " + HttpOutcomes.abbreviate(response.body()));
    }

    private void logOutcome(InvalidationBatch batch, InvalidationResult result) {
        if (result.isSuccess()) {
            log.info("{} purge accepted: batch={} paths={} reference={}",
                    type().value(), batch.sequenceIndex(), batch.size(), result.providerReference());
        } else {
            log.warn("{} purge failed: batch={} paths={} kind={} message={}",
                    type().value(), batch.sequenceIndex(), batch.size(), result.errorKind(), result.message());
        }
    }
}
