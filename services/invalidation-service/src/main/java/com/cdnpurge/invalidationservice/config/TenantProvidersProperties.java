package com.cdnpurge.invalidationservice.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-tenant CDN settings, bound from {@code cdnpurge.tenants}.
 *
 * <pre>
 * cdnpurge:
 *   tenants:
 *     acme:
 *       provider: CloudFront
 *       distribution-id: E2QWRUHEXAMPLE
 *       access-key-id: ${ACME_AWS_KEY}
 *       secret-access-key: ${ACME_AWS_SECRET}
 *     globex:
 *       provider: Cloudflare
 *       zone-id: 023e105f4ecef8ad9ca31a8372d0c353
 *       api-token: ${GLOBEX_CF_TOKEN}
 * </pre>
 */
@ConfigurationProperties(prefix = "cdnpurge")
public record TenantProvidersProperties(Map<String, TenantProviderSettings> tenants) {

    public TenantProvidersProperties {
        tenants = tenants == null ? Map.of() : Map.copyOf(tenants);
    }
}
