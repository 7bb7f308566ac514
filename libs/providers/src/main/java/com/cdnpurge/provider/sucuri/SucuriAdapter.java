package com.cdnpurge.provider.sucuri;

import com.cdnpurge.invalidation.ErrorKind;
import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.invalidation.InvalidationResult;
import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.observability.ProviderCallTracer;
import com.cdnpurge.provider.HttpOutcomes;
import com.cdnpurge.provider.HttpProviderAdapter;
import com.cdnpurge.provider.ProviderJson;
import com.cdnpurge.provider.ProviderRequest;
import com.cdnpurge.provider.ProviderResponse;
import com.cdnpurge.provider.ProviderTransport;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Clears Sucuri WAF cache. The API takes one file per call, so a batch becomes one form-encoded
 * {@code clear_cache} call per path; a full purge is a single call without a file.
 *
 * <p>The batch fails on the first rejected path. Clearing a path twice is harmless, so a retry
 * replays the whole batch.
 */
public class SucuriAdapter extends HttpProviderAdapter {

    static final String DEFAULT_ENDPOINT = "https://waf.sucuri.net/api?v2";

    private final SucuriConfig config;
    private final URI endpoint;

    public SucuriAdapter(SucuriConfig config, ProviderTransport transport, ProviderCallTracer tracer) {
        this(config, transport, tracer, DEFAULT_ENDPOINT);
    }

    SucuriAdapter(SucuriConfig config, ProviderTransport transport, ProviderCallTracer tracer, String endpoint) {
        super(transport, tracer);
        this.config = config;
        this.endpoint = URI.create(endpoint);
    }

    @Override
    public ProviderType type() {
        return ProviderType.SUCURI;
    }

    @Override
    protected InvalidationResult doSubmit(InvalidationBatch batch, String callerReference) throws IOException {
        if (batch.fullPurge()) {
            return clear(batch, null);
        }
        for (String path : batch.paths()) {
            InvalidationResult result = clear(batch, path);
            if (!result.isSuccess()) {
                return result;
            }
        }
        return InvalidationResult.succeeded(batch, "");
    }

    private InvalidationResult clear(InvalidationBatch batch, String path) throws IOException {
        ProviderResponse response = send(ProviderRequest.post(endpoint,
                Map.of("Content-Type", "application/x-www-form-urlencoded"), form(path)));
        if (!response.isSuccessful()) {
            return httpFailure(batch, response);
        }

        JsonNode json = ProviderJson.read(response.body());
        if (json.path("status").asInt(0) == 1) {
            return InvalidationResult.succeeded(batch, "");
        }
        String messages = json.path("messages").toString();
        ErrorKind kind = messages.toLowerCase().contains("key") ? ErrorKind.AUTHENTICATION : ErrorKind.PROVIDER;
        return InvalidationResult.failed(batch, kind,
                "Sucuri rejected " + (path == null ? "full purge" : path) + " on " + config.domain()
                        + ": " + HttpOutcomes.abbreviate(messages));
    }

    String form(String path) {
        StringBuilder form = new StringBuilder()
                .append("k=").append(encode(config.apiKey()))
                .append("&s=").append(encode(config.apiSecret()))
                .append("&a=clear_cache");
        if (path != null) {
            form.append("&file=").append(encode(path));
        }
        return form.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
