package com.cdnpurge.invalidationservice.domain;

import com.cdnpurge.provider.ProviderAdapter;
import com.cdnpurge.provider.ProviderConfig;
import com.cdnpurge.provider.none.NoneAdapter;
import com.cdnpurge.provider.none.NoneConfig;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the provider config and adapter of a tenant.
 *
 * <p>Configs are immutable and built once. Adapters are cached per tenant so state such as an
 * Azure access token is shared between requests. Tenants without configuration get the None
 * provider.
 */
public class TenantProviders {

    private static final Logger log = LoggerFactory.getLogger(TenantProviders.class);

    private final Map<String, ProviderConfig> configs;
    private final Function<ProviderConfig, ProviderAdapter> adapterFactory;
    private final Map<String, ProviderAdapter> adapterCache = new ConcurrentHashMap<>();
    private final ProviderAdapter none = new NoneAdapter();

    /**
     * @param configs        provider config per tenant id
     * @param adapterFactory builds the adapter for a config, normally
     *                       {@link com.cdnpurge.provider.ProviderAdapters#create(ProviderConfig)}
     */
    public TenantProviders(Map<String, ProviderConfig> configs,
                           Function<ProviderConfig, ProviderAdapter> adapterFactory) {
        this.configs = Map.copyOf(configs);
        this.adapterFactory = adapterFactory;
        this.configs.forEach((tenant, config) ->
                log.info("Tenant {} uses provider {} {}", tenant, config.type().value(), config.redacted()));
    }

    public ProviderConfig config(String tenantId) {
        return Optional.ofNullable(lookup(tenantId)).orElse(NoneConfig.INSTANCE);
    }

    public ProviderAdapter adapter(String tenantId) {
        ProviderConfig config = lookup(tenantId);
        if (config == null) {
            return none;
        }
        return adapterCache.computeIfAbsent(tenantId, t -> adapterFactory.apply(config));
    }

    public boolean isConfigured(String tenantId) {
        return lookup(tenantId) != null;
    }

    private ProviderConfig lookup(String tenantId) {
        return tenantId == null ? null : configs.get(tenantId);
    }
}
