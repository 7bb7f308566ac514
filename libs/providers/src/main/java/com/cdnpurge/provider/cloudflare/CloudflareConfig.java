package com.cdnpurge.provider.cloudflare;

import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.provider.ProviderConfig;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cloudflare zone and API token.
 *
 * @param zoneId       zone whose cache is purged
 * @param apiToken     token with the Cache Purge permission
 * @param siteUrl      optional scheme and host prepended to each path, e.g. {@code https://www.example.com};
 *                     Cloudflare purges by full URL
 * @param maxBatchSize files per call; the provider default when zero
 */
public record CloudflareConfig(
        String zoneId,
        String apiToken,
        String siteUrl,
        int maxBatchSize) implements ProviderConfig {

    public CloudflareConfig {
        zoneId = ProviderConfig.require(zoneId, "zoneId");
        apiToken = ProviderConfig.require(apiToken, "apiToken");
        siteUrl = siteUrl == null ? "" : stripTrailingSlash(siteUrl.strip());
        maxBatchSize = ProviderConfig.batchSizeOrDefault(maxBatchSize, ProviderType.CLOUDFLARE);
    }

    public CloudflareConfig(String zoneId, String apiToken) {
        this(zoneId, apiToken, "", 0);
    }

    @Override
    public ProviderType type() {
        return ProviderType.CLOUDFLARE;
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("zoneId", zoneId);
        fields.put("apiToken", apiToken);
        fields.put("siteUrl", siteUrl);
        fields.put("maxBatchSize", maxBatchSize);
        return fields;
    }

    @Override
    public String toString() {
        return "CloudflareConfig" + redacted();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
