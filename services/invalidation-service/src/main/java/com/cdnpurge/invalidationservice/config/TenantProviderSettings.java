package com.cdnpurge.invalidationservice.config;

import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.provider.ProviderConfig;
import com.cdnpurge.provider.azure.AzureFrontDoorConfig;
import com.cdnpurge.provider.cloudflare.CloudflareConfig;
import com.cdnpurge.provider.cloudfront.CloudFrontConfig;
import com.cdnpurge.provider.none.NoneConfig;
import com.cdnpurge.provider.sucuri.SucuriConfig;

/**
 * Provider settings of one tenant as bound from {@code cdnpurge.tenants.<tenantId>.*}.
 *
 * <p>Only the fields of the selected {@code provider} are read. {@link #toProviderConfig()} builds
 * the typed config, which rejects missing required fields.
 */
public record TenantProviderSettings(
        String provider,
        // CloudFront
        String distributionId,
        String accessKeyId,
        String secretAccessKey,
        String region,
        // Cloudflare
        String zoneId,
        String apiToken,
        String siteUrl,
        // Azure Front Door / CDN
        String subscriptionId,
        String resourceGroup,
        String profileName,
        String endpointName,
        String directoryTenantId,
        String clientId,
        String clientSecret,
        Boolean frontDoor,
        // Sucuri
        String domain,
        String apiKey,
        String apiSecret,
        // any provider
        Integer maxBatchSize) {

    public ProviderType providerType() {
        if (provider == null || provider.isBlank()) {
            return ProviderType.NONE;
        }
        return ProviderType.fromString(provider)
                .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + provider));
    }

    public ProviderConfig toProviderConfig() {
        int batchSize = maxBatchSize == null ? 0 : maxBatchSize;
        return switch (providerType()) {
            case CLOUDFRONT -> new CloudFrontConfig(distributionId, accessKeyId, secretAccessKey, region);
            case CLOUDFLARE -> new CloudflareConfig(zoneId, apiToken, siteUrl, batchSize);
            case AZURE_FRONT_DOOR -> new AzureFrontDoorConfig(subscriptionId, resourceGroup, profileName,
                    endpointName, directoryTenantId, clientId, clientSecret,
                    frontDoor == null || frontDoor, batchSize);
            case SUCURI -> new SucuriConfig(domain, apiKey, apiSecret, batchSize);
            case NONE -> NoneConfig.INSTANCE;
        };
    }
}
