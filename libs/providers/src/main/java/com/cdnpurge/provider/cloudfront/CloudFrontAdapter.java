package com.cdnpurge.provider.cloudfront;

import com.cdnpurge.invalidation.ErrorKind;
import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.invalidation.InvalidationResult;
import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.observability.ProviderCallTracer;
import com.cdnpurge.provider.HttpOutcomes;
import com.cdnpurge.provider.HttpProviderAdapter;
import com.cdnpurge.provider.ProviderRequest;
import com.cdnpurge.provider.ProviderResponse;
import com.cdnpurge.provider.ProviderTransport;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Creates CloudFront invalidations through the 2020-05-31 REST API, signed with SigV4.
 *
 * <p>The caller reference goes into the XML body, so CloudFront itself rejects a second
 * invalidation with the same reference and different paths.
 */
public class CloudFrontAdapter extends HttpProviderAdapter {

    static final String DEFAULT_ENDPOINT = "https://cloudfront.amazonaws.com";
    static final String CONTENT_TYPE = "application/xml; charset=utf-8";

    private static final Pattern ID = Pattern.compile("<Id>([^<]*)</Id>");
    private static final Pattern CODE = Pattern.compile("<Code>([^<]*)</Code>");
    private static final Set<String> THROTTLING_CODES =
            Set.of("TooManyInvalidationsInProgress", "Throttling", "ThrottlingException");
    private static final Set<String> AUTH_CODES =
            Set.of("AccessDenied", "InvalidClientTokenId", "SignatureDoesNotMatch", "MissingAuthenticationToken");

    private final CloudFrontConfig config;
    private final CloudFrontRequestSigner signer;
    private final String endpoint;

    public CloudFrontAdapter(CloudFrontConfig config, ProviderTransport transport, ProviderCallTracer tracer, Clock clock) {
        this(config, transport, tracer, clock, DEFAULT_ENDPOINT);
    }

    CloudFrontAdapter(CloudFrontConfig config, ProviderTransport transport, ProviderCallTracer tracer,
                      Clock clock, String endpoint) {
        super(transport, tracer);
        this.config = config;
        this.endpoint = endpoint;
        this.signer = new CloudFrontRequestSigner(
                config.accessKeyId(), config.secretAccessKey(), config.region(), clock);
    }

    @Override
    public ProviderType type() {
        return ProviderType.CLOUDFRONT;
    }

    @Override
    protected InvalidationResult doSubmit(InvalidationBatch batch, String callerReference) throws IOException {
        String body = CloudFrontPayload.toXml(batch.paths(), callerReference);
        URI uri = URI.create(endpoint + "/2020-05-31/distribution/" + config.distributionId() + "/invalidation");

        Map<String, String> headers = signer.signPost(uri, Map.of("Content-Type", CONTENT_TYPE), body);

        ProviderResponse response = send(ProviderRequest.post(uri, headers, body));
        if (response.isSuccessful()) {
            String id = firstMatch(ID, response.body()).orElse("");
            return InvalidationResult.succeeded(batch, id);
        }
        return httpFailure(batch, response, classify(response));
    }

    static ErrorKind classify(ProviderResponse response) {
        Optional<String> code = firstMatch(CODE, response.body());
        if (code.filter(THROTTLING_CODES::contains).isPresent()) {
            return ErrorKind.RATE_LIMIT;
        }
        if (code.filter(AUTH_CODES::contains).isPresent()) {
            return ErrorKind.AUTHENTICATION;
        }
        return HttpOutcomes.classifyStatus(response.statusCode());
    }

    private static Optional<String> firstMatch(Pattern pattern, String body) {
        Matcher m = pattern.matcher(body);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }
}
