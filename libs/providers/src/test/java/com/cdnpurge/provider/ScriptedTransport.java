package com.cdnpurge.provider;

import com.cdnpurge.observability.ProviderCallTracer;
import io.opentelemetry.api.OpenTelemetry;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Test transport that records requests and replays queued responses or failures in order.
 */
public class ScriptedTransport implements ProviderTransport {

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<ProviderRequest> requests = new ArrayList<>();

    public static ProviderCallTracer noopTracer() {
        return new ProviderCallTracer(OpenTelemetry.noop().getTracer("test"));
    }

    public ScriptedTransport respond(int status, String body) {
        script.add(ProviderResponse.of(status, body));
        return this;
    }

    public ScriptedTransport respond(ProviderResponse response) {
        script.add(response);
        return this;
    }

    public ScriptedTransport fail(IOException failure) {
        script.add(failure);
        return this;
    }

    @Override
    public synchronized ProviderResponse send(ProviderRequest request) throws IOException {
        requests.add(request);
        Object next = script.poll();
        if (next == null) {
            throw new AssertionError("Unexpected request to " + request.uri());
        }
        if (next instanceof IOException e) {
            throw e;
        }
        return (ProviderResponse) next;
    }

    public List<ProviderRequest> requests() {
        return requests;
    }

    public ProviderRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
