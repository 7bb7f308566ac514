package com.cdnpurge.provider.azure;

import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.invalidation.InvalidationResult;
import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.observability.ProviderCallTracer;
import com.cdnpurge.provider.HttpProviderAdapter;
import com.cdnpurge.provider.ProviderCallException;
import com.cdnpurge.provider.ProviderJson;
import com.cdnpurge.provider.ProviderRequest;
import com.cdnpurge.provider.ProviderResponse;
import com.cdnpurge.provider.ProviderTransport;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.Map;

/**
 * Purges content paths on an Azure Front Door or classic CDN endpoint through Azure Resource
 * Manager. ARM answers 202 Accepted and completes the purge asynchronously.
 */
public class AzureFrontDoorAdapter extends HttpProviderAdapter {

    static final String DEFAULT_MANAGEMENT_ENDPOINT = "https://management.azure.com";
    static final String API_VERSION = "2024-02-01";

    private final AzureFrontDoorConfig config;
    private final AzureTokenProvider tokens;
    private final String managementEndpoint;

    public AzureFrontDoorAdapter(AzureFrontDoorConfig config, ProviderTransport transport,
                                 ProviderCallTracer tracer, Clock clock) {
        this(config, transport, tracer,
                new AzureTokenProvider(config, transport, clock, AzureTokenProvider.DEFAULT_LOGIN_ENDPOINT),
                DEFAULT_MANAGEMENT_ENDPOINT);
    }

    AzureFrontDoorAdapter(AzureFrontDoorConfig config, ProviderTransport transport, ProviderCallTracer tracer,
                          AzureTokenProvider tokens, String managementEndpoint) {
        super(transport, tracer);
        this.config = config;
        this.tokens = tokens;
        this.managementEndpoint = managementEndpoint;
    }

    @Override
    public ProviderType type() {
        return ProviderType.AZURE_FRONT_DOOR;
    }

    @Override
    protected InvalidationResult doSubmit(InvalidationBatch batch, String callerReference) throws IOException {
        String token;
        try {
            token = tokens.accessToken();
        } catch (ProviderCallException e) {
            return InvalidationResult.failed(batch, e.errorKind(), e.getMessage());
        }

        URI uri = URI.create(managementEndpoint + config.endpointResourcePath() + "/purge?api-version=" + API_VERSION);
        String body = ProviderJson.write(Map.of("contentPaths", batch.paths()));
        ProviderResponse response = send(ProviderRequest.post(uri, Map.of(
                "Authorization", "Bearer " + token,
                "Content-Type", "application/json"), body));

        if (response.isSuccessful()) {
            String reference = response.header("x-ms-request-id")
                    .or(() -> response.header("Azure-AsyncOperation"))
                    .orElse("");
            return InvalidationResult.succeeded(batch, reference);
        }
        if (response.statusCode() == 401) {
            tokens.invalidate();
        }
        return httpFailure(batch, response);
    }
}
