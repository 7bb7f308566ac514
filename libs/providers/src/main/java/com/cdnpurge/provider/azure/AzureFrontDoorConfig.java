package com.cdnpurge.provider.azure;

import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.provider.ProviderConfig;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Azure Front Door (or classic Azure CDN) endpoint and service principal.
 *
 * @param subscriptionId subscription holding the profile
 * @param resourceGroup  resource group holding the profile
 * @param profileName    CDN / Front Door profile
 * @param endpointName   endpoint whose content is purged
 * @param tenantId       Entra ID tenant of the service principal
 * @param clientId       service principal application id
 * @param clientSecret   service principal secret
 * @param frontDoor      true for Front Door Standard/Premium ({@code afdEndpoints}), false for classic CDN
 * @param maxBatchSize   content paths per call; the provider default when zero
 */
public record AzureFrontDoorConfig(
        String subscriptionId,
        String resourceGroup,
        String profileName,
        String endpointName,
        String tenantId,
        String clientId,
        String clientSecret,
        boolean frontDoor,
        int maxBatchSize) implements ProviderConfig {

    public AzureFrontDoorConfig {
        subscriptionId = ProviderConfig.require(subscriptionId, "subscriptionId");
        resourceGroup = ProviderConfig.require(resourceGroup, "resourceGroup");
        profileName = ProviderConfig.require(profileName, "profileName");
        endpointName = ProviderConfig.require(endpointName, "endpointName");
        tenantId = ProviderConfig.require(tenantId, "tenantId");
        clientId = ProviderConfig.require(clientId, "clientId");
        clientSecret = ProviderConfig.require(clientSecret, "clientSecret");
        maxBatchSize = ProviderConfig.batchSizeOrDefault(maxBatchSize, ProviderType.AZURE_FRONT_DOOR);
    }

    @Override
    public ProviderType type() {
        return ProviderType.AZURE_FRONT_DOOR;
    }

    /** ARM path of the endpoint, without host or api-version. */
    public String endpointResourcePath() {
        return "/subscriptions/" + subscriptionId
                + "/resourceGroups/" + resourceGroup
                + "/providers/Microsoft.Cdn/profiles/" + profileName
                + (frontDoor ? "/afdEndpoints/" : "/endpoints/") + endpointName;
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("subscriptionId", subscriptionId);
        fields.put("resourceGroup", resourceGroup);
        fields.put("profileName", profileName);
        fields.put("endpointName", endpointName);
        fields.put("tenantId", tenantId);
        fields.put("clientId", clientId);
        fields.put("clientSecret", clientSecret);
        fields.put("frontDoor", frontDoor);
        fields.put("maxBatchSize", maxBatchSize);
        return fields;
    }

    @Override
    public String toString() {
        return "AzureFrontDoorConfig" + redacted();
    }
}
