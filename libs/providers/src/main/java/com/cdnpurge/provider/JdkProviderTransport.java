package com.cdnpurge.provider;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link ProviderTransport} on top of {@link java.net.http.HttpClient}.
 *
 * <p>One client is shared by every adapter; each request gets its own timeout.
 */
public final class JdkProviderTransport implements ProviderTransport {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient client;
    private final Duration requestTimeout;

    public JdkProviderTransport(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build(), requestTimeout);
    }

    public JdkProviderTransport(HttpClient client, Duration requestTimeout) {
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        this.client = client;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ProviderResponse send(ProviderRequest request) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .timeout(requestTimeout)
                .method(request.method(), request.body().isEmpty()
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8));
        request.headers().forEach(builder::header);

        try {
            HttpResponse<String> response =
                    client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new ProviderResponse(response.statusCode(), response.headers().map(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var interrupted = new InterruptedIOException("Interrupted calling " + request.uri().getHost());
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }
}
