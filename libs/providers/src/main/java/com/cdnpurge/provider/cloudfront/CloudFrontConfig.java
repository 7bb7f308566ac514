package com.cdnpurge.provider.cloudfront;

import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.provider.ProviderConfig;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Amazon CloudFront distribution and IAM credentials.
 *
 * @param distributionId  distribution to invalidate
 * @param accessKeyId     IAM access key id
 * @param secretAccessKey IAM secret access key
 * @param region          signing region, {@code us-east-1} when blank
 */
public record CloudFrontConfig(
        String distributionId,
        String accessKeyId,
        String secretAccessKey,
        String region) implements ProviderConfig {

    public static final String DEFAULT_REGION = "us-east-1";

    public CloudFrontConfig {
        distributionId = ProviderConfig.require(distributionId, "distributionId");
        accessKeyId = ProviderConfig.require(accessKeyId, "accessKeyId");
        secretAccessKey = ProviderConfig.require(secretAccessKey, "secretAccessKey");
        region = region == null || region.isBlank() ? DEFAULT_REGION : region.strip();
    }

    @Override
    public ProviderType type() {
        return ProviderType.CLOUDFRONT;
    }

    /** CloudFront's own per-request path limit; not configurable. */
    @Override
    public int maxBatchSize() {
        return ProviderType.CLOUDFRONT.defaultMaxBatchSize();
    }

    @Override
    public Map<String, Object> fields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("distributionId", distributionId);
        fields.put("accessKeyId", accessKeyId);
        fields.put("secretAccessKey", secretAccessKey);
        fields.put("region", region);
        return fields;
    }

    @Override
    public String toString() {
        return "CloudFrontConfig" + redacted();
    }
}
