package com.cdnpurge.provider.cloudflare;

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
import java.util.Map;
import java.util.Set;

/**
 * Purges Cloudflare zone cache via the v4 API with a bearer token.
 */
public class CloudflareAdapter extends HttpProviderAdapter {

    static final String DEFAULT_ENDPOINT = "https://api.cloudflare.com/client/v4";

    // 10000: authentication error, 9109: invalid access token
    private static final Set<Integer> AUTH_ERROR_CODES = Set.of(10000, 9109);
    // 971: please wait and consider throttling your request speed
    private static final Set<Integer> RATE_LIMIT_CODES = Set.of(971, 10429);

    private final CloudflareConfig config;
    private final String endpoint;

    public CloudflareAdapter(CloudflareConfig config, ProviderTransport transport, ProviderCallTracer tracer) {
        this(config, transport, tracer, DEFAULT_ENDPOINT);
    }

    CloudflareAdapter(CloudflareConfig config, ProviderTransport transport, ProviderCallTracer tracer,
                      String endpoint) {
        super(transport, tracer);
        this.config = config;
        this.endpoint = endpoint;
    }

    @Override
    public ProviderType type() {
        return ProviderType.CLOUDFLARE;
    }

    @Override
    protected InvalidationResult doSubmit(InvalidationBatch batch, String callerReference) throws IOException {
        String body = CloudflarePayload.toJson(batch, config.siteUrl());
        URI uri = URI.create(endpoint + "/zones/" + config.zoneId() + "/purge_cache");
        ProviderResponse response = send(ProviderRequest.post(uri, Map.of(
                "Authorization", "Bearer " + config.apiToken(),
                "Content-Type", "application/json"), body));

        JsonNode json = ProviderJson.read(response.body());
        if (response.isSuccessful() && json.path("success").asBoolean(false)) {
            return InvalidationResult.succeeded(batch, json.path("result").path("id").asText(""));
        }
        return httpFailure(batch, response, classify(response.statusCode(), json));
    }

    static ErrorKind classify(int status, JsonNode json) {
        for (JsonNode error : json.path("errors")) {
            int code = error.path("code").asInt(-1);
            if (AUTH_ERROR_CODES.contains(code)) {
                return ErrorKind.AUTHENTICATION;
            }
            if (RATE_LIMIT_CODES.contains(code)) {
                return ErrorKind.RATE_LIMIT;
            }
        }
        // 200 with success=false is a rejected purge
        return status >= 200 && status < 300 ? ErrorKind.PROVIDER : HttpOutcomes.classifyStatus(status);
    }
}
