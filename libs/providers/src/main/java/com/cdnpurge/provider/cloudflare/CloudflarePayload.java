package com.cdnpurge.provider.cloudflare;

import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.provider.ProviderJson;
import java.util.List;
import java.util.Map;

/** JSON body for {@code POST /zones/{zone}/purge_cache}. */
public final class CloudflarePayload {

    private CloudflarePayload() {
        // utility class
    }

    /**
     * {@code {"purge_everything":true}} for a full purge, otherwise {@code {"files":[...]}} with
     * {@code siteUrl} prefixed to each path when set.
     */
    public static String toJson(InvalidationBatch batch, String siteUrl) {
        if (batch.fullPurge()) {
            return ProviderJson.write(Map.of("purge_everything", true));
        }
        String prefix = siteUrl == null ? "" : siteUrl;
        List<String> files = batch.paths().stream().map(p -> prefix + p).toList();
        return ProviderJson.write(Map.of("files", files));
    }
}
