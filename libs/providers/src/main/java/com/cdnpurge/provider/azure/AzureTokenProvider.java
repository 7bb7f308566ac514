package com.cdnpurge.provider.azure;

import com.cdnpurge.invalidation.ErrorKind;
import com.cdnpurge.provider.HttpOutcomes;
import com.cdnpurge.provider.ProviderCallException;
import com.cdnpurge.provider.ProviderJson;
import com.cdnpurge.provider.ProviderRequest;
import com.cdnpurge.provider.ProviderResponse;
import com.cdnpurge.provider.ProviderTransport;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client-credentials token for Azure Resource Manager, cached until shortly before it expires.
 *
 * <p>Batches of one request share the token; concurrent callers wait for a single refresh.
 */
public class AzureTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(AzureTokenProvider.class);

    static final String DEFAULT_LOGIN_ENDPOINT = "https://login.microsoftonline.com";
    static final String SCOPE = "https://management.azure.com/.default";
    static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

    private final AzureFrontDoorConfig config;
    private final ProviderTransport transport;
    private final Clock clock;
    private final String loginEndpoint;

    private String token;
    private Instant expiresAt = Instant.MIN;

    public AzureTokenProvider(AzureFrontDoorConfig config, ProviderTransport transport, Clock clock,
                              String loginEndpoint) {
        this.config = config;
        this.transport = transport;
        this.clock = clock;
        this.loginEndpoint = loginEndpoint;
    }

    /**
     * Returns a valid access token, fetching a new one when needed.
     *
     * @throws ProviderCallException if the token endpoint rejects the credentials
     * @throws IOException           on transport failure
     */
    public synchronized String accessToken() throws IOException {
        Instant now = clock.instant();
        if (token != null && now.isBefore(expiresAt)) {
            return token;
        }

        URI uri = URI.create(loginEndpoint + "/" + config.tenantId() + "/oauth2/v2.0/token");
        String form = "grant_type=client_credentials"
                + "&client_id=" + encode(config.clientId())
                + "&client_secret=" + encode(config.clientSecret())
                + "&scope=" + encode(SCOPE);
        ProviderResponse response = transport.send(ProviderRequest.post(uri,
                Map.of("Content-Type", "application/x-www-form-urlencoded"), form));

        JsonNode json = ProviderJson.read(response.body());
        String accessToken = json.path("access_token").asText("");
        if (!response.isSuccessful() || accessToken.isEmpty()) {
            ErrorKind kind = classifyTokenFailure(response);
            throw new ProviderCallException(kind, "Token request failed: HTTP " + response.statusCode()
                    + " " + json.path("error").asText(HttpOutcomes.abbreviate(response.body())));
        }

        long expiresIn = json.path("expires_in").asLong(3600);
        token = accessToken;
        expiresAt = now.plusSeconds(expiresIn).minus(EXPIRY_SKEW);
        log.debug("Acquired Azure management token for tenant {} valid until {}", config.tenantId(), expiresAt);
        return token;
    }

    /** Drops the cached token, e.g. after the management API answered 401. */
    public synchronized void invalidate() {
        token = null;
        expiresAt = Instant.MIN;
    }

    /** The token endpoint answers bad credentials with 400 or 401; throttling and outages are transient. */
    static ErrorKind classifyTokenFailure(ProviderResponse response) {
        int status = response.statusCode();
        if (response.isSuccessful() || status == 400 || status == 401 || status == 403) {
            return ErrorKind.AUTHENTICATION;
        }
        return HttpOutcomes.classifyStatus(status);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
