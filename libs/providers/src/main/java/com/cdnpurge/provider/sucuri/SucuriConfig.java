package com.cdnpurge.provider.sucuri;

import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.provider.ProviderConfig;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sucuri WAF site credentials.
 *
 * @param domain       protected site, used for logging and status output
 * @param apiKey       site API key
 * @param apiSecret    site API secret
 * @param maxBatchSize paths per batch; the provider default when zero
 */
public record SucuriConfig(
        String domain,
        String apiKey,
        String apiSecret,
        int maxBatchSize) implements ProviderConfig {

    public SucuriConfig {
        domain = ProviderConfig.require(domain, "domain");
        apiKey = ProviderConfig.require(apiKey, "apiKey");
        apiSecret = ProviderConfig.require(apiSecret, "apiSecret");
        maxBatchSize = ProviderConfig.batchSizeOrDefault(maxBatchSize, ProviderType.SUCURI);
    }

    @Override
    public ProviderType type() {
        return ProviderType.SUCURI;
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("domain", domain);
        fields.put("apiKey", apiKey);
        fields.put("apiSecret", apiSecret);
        fields.put("maxBatchSize", maxBatchSize);
        return fields;
    }

    @Override
    public String toString() {
        return "SucuriConfig" + redacted();
    }
}
