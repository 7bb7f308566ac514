package com.cdnpurge.provider.cloudfront;

import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import software.amazon.awssdk.http.ContentStreamProvider;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.http.SdkHttpRequest;
import software.amazon.awssdk.http.auth.aws.signer.AwsV4HttpSigner;
import software.amazon.awssdk.http.auth.spi.signer.HttpSigner;
import software.amazon.awssdk.http.auth.spi.signer.SignedRequest;
import software.amazon.awssdk.identity.spi.AwsCredentialsIdentity;

/**
 * Signs CloudFront API calls with the AWS SDK's SigV4 signer.
 *
 * <p>The body is built by the adapter and signed as is. Host is left out of the returned headers;
 * the transport sets it from the URI.
 */
final class CloudFrontRequestSigner {

    static final String SIGNING_NAME = "cloudfront";

    private final AwsV4HttpSigner signer = AwsV4HttpSigner.create();
    private final AwsCredentialsIdentity credentials;
    private final String region;
    private final Clock clock;

    CloudFrontRequestSigner(String accessKeyId, String secretAccessKey, String region, Clock clock) {
        this.credentials = AwsCredentialsIdentity.create(accessKeyId, secretAccessKey);
        this.region = region;
        this.clock = clock;
    }

    /** Returns {@code headers} plus the date and authorization headers for a POST of {@code body}. */
    Map<String, String> signPost(URI uri, Map<String, String> headers, String body) {
        SdkHttpRequest.Builder unsigned = SdkHttpRequest.builder()
                .method(SdkHttpMethod.POST)
                .uri(uri);
        headers.forEach(unsigned::putHeader);
        SdkHttpRequest request = unsigned.build();

        SignedRequest signed = signer.sign(r -> r
                .identity(credentials)
                .request(request)
                .payload(ContentStreamProvider.fromUtf8String(body))
                .putProperty(AwsV4HttpSigner.SERVICE_SIGNING_NAME, SIGNING_NAME)
                .putProperty(AwsV4HttpSigner.REGION_NAME, region)
                .putProperty(HttpSigner.SIGNING_CLOCK, clock));

        Map<String, String> result = new LinkedHashMap<>();
        signed.request().headers().forEach((name, values) -> {
            if (!"Host".equalsIgnoreCase(name)) {
                result.put(name, String.join(",", values));
            }
        });
        return result;
    }
}
