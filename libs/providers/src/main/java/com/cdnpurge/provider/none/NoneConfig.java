package com.cdnpurge.provider.none;

import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.provider.ProviderConfig;
import java.util.Map;

/** Config for tenants without a CDN. Carries no fields. */
public record NoneConfig() implements ProviderConfig {

    public static final NoneConfig INSTANCE = new NoneConfig();

    @Override
    public ProviderType type() {
        return ProviderType.NONE;
    }

    @Override
    public int maxBatchSize() {
        return ProviderType.NONE.defaultMaxBatchSize();
    }

    @Override
    public Map<String, Object> fields() {
        return Map.of();
    }
}
