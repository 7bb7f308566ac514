package com.cdnpurge.provider;

import com.cdnpurge.observability.ProviderCallTracer;
import com.cdnpurge.provider.azure.AzureFrontDoorAdapter;
import com.cdnpurge.provider.azure.AzureFrontDoorConfig;
import com.cdnpurge.provider.cloudflare.CloudflareAdapter;
import com.cdnpurge.provider.cloudflare.CloudflareConfig;
import com.cdnpurge.provider.cloudfront.CloudFrontAdapter;
import com.cdnpurge.provider.cloudfront.CloudFrontConfig;
import com.cdnpurge.provider.none.NoneAdapter;
import com.cdnpurge.provider.none.NoneConfig;
import com.cdnpurge.provider.sucuri.SucuriAdapter;
import com.cdnpurge.provider.sucuri.SucuriConfig;
import java.time.Clock;

/**
 * Builds the adapter matching a {@link ProviderConfig}.
 */
public final class ProviderAdapters {

    private final ProviderTransport transport;
    private final ProviderCallTracer tracer;
    private final Clock clock;

    public ProviderAdapters(ProviderTransport transport, ProviderCallTracer tracer, Clock clock) {
        if (transport == null || tracer == null || clock == null) {
            throw new IllegalArgumentException("transport, tracer and clock must not be null");
        }
        this.transport = transport;
        this.tracer = tracer;
        this.clock = clock;
    }

    public ProviderAdapter create(ProviderConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (config instanceof CloudFrontConfig c) {
            return new CloudFrontAdapter(c, transport, tracer, clock);
        }
        if (config instanceof CloudflareConfig c) {
            return new CloudflareAdapter(c, transport, tracer);
        }
        if (config instanceof AzureFrontDoorConfig c) {
            return new AzureFrontDoorAdapter(c, transport, tracer, clock);
        }
        if (config instanceof SucuriConfig c) {
            return new SucuriAdapter(c, transport, tracer);
        }
        if (config instanceof NoneConfig) {
            return new NoneAdapter();
        }
        throw new IllegalArgumentException("Unsupported provider config: " + config.type());
    }
}
