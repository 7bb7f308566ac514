package com.cdnpurge.provider.cloudflare;

import static org.assertj.core.api.Assertions.assertThat;

import com.cdnpurge.invalidation.ErrorKind;
import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.invalidation.InvalidationRequest;
import com.cdnpurge.invalidation.InvalidationStatus;
import com.cdnpurge.provider.ProviderJson;
import com.cdnpurge.provider.ScriptedTransport;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CloudflareAdapter")
class CloudflareAdapterTest {

    private static final String OK = "{\"success\":true,\"errors\":[],\"messages\":[],\"result\":{\"id\":\"9a7806061c88ada191ed06f989cc3dac\"}}";

    private final ScriptedTransport transport = new ScriptedTransport();
    private final CloudflareAdapter adapter = new CloudflareAdapter(
            new CloudflareConfig("023e105f4ecef8ad9ca31a8372d0c353", "cf-token", "https://www.example.com/", 0),
            transport, ScriptedTransport.noopTracer());

    @Nested
    @DisplayName("payload")
    class Payload {

        @Test
        @DisplayName("sends well-formed JSON with full URLs for awkward paths")
        void wellFormedJson() throws Exception {
            transport.respond(200, OK);
            var paths = List.of("/a\"quote\".html", "/back\\slash.html", "/café.html");

            adapter.submit(new InvalidationBatch("req-1", 0, paths), "ref");

            JsonNode body = ProviderJson.objectMapper().readTree(transport.lastRequest().body());
            assertThat(body.path("files").size()).isEqualTo(3);
            assertThat(body.path("files").get(0).asText()).isEqualTo("https://www.example.com/a\"quote\".html");
            assertThat(body.path("files").get(1).asText()).isEqualTo("https://www.example.com/back\\slash.html");
            assertThat(body.path("files").get(2).asText()).isEqualTo("https://www.example.com/café.html");
        }

        @Test
        @DisplayName("a full purge sends purge_everything")
        void fullPurge() throws Exception {
            transport.respond(200, OK);
            var batch = new InvalidationBatch("req-1", 0, List.of(InvalidationRequest.PURGE_ALL_PATH), true);

            adapter.submit(batch, "ref");

            JsonNode body = ProviderJson.objectMapper().readTree(transport.lastRequest().body());
            assertThat(body.path("purge_everything").asBoolean()).isTrue();
            assertThat(body.has("files")).isFalse();
        }

        @Test
        @DisplayName("an unflagged batch is sent as files whatever its paths")
        void unflaggedBatchSendsFiles() throws Exception {
            transport.respond(200, OK);

            adapter.submit(new InvalidationBatch("req-1", 0, List.of(InvalidationRequest.PURGE_ALL_PATH)), "ref");

            JsonNode body = ProviderJson.objectMapper().readTree(transport.lastRequest().body());
            assertThat(body.has("purge_everything")).isFalse();
            assertThat(body.path("files").size()).isEqualTo(1);
        }

        @Test
        @DisplayName("authenticates with a bearer token against the zone endpoint")
        void bearerToken() {
            transport.respond(200, OK);

            var result = adapter.submit(new InvalidationBatch("req-1", 0, List.of("/x")), "ref");

            assertThat(result.status()).isEqualTo(InvalidationStatus.SUCCEEDED);
            assertThat(result.providerReference()).isEqualTo("9a7806061c88ada191ed06f989cc3dac");
            assertThat(transport.lastRequest().header("Authorization")).isEqualTo("Bearer cf-token");
            assertThat(transport.lastRequest().uri().toString()).isEqualTo(
                    "https://api.cloudflare.com/client/v4/zones/023e105f4ecef8ad9ca31a8372d0c353/purge_cache");
        }
    }

    @Nested
    @DisplayName("failure classification")
    class Failures {

        private final InvalidationBatch batch = new InvalidationBatch("req-1", 0, List.of("/x"));

        @Test
        @DisplayName("HTTP 429 is rate limiting")
        void tooManyRequests() {
            transport.respond(429, "{\"success\":false,\"errors\":[{\"code\":971,\"message\":\"throttled\"}]}");

            assertThat(adapter.submit(batch, "ref").errorKind()).isEqualTo(ErrorKind.RATE_LIMIT);
        }

        @Test
        @DisplayName("error code 10000 is an authentication failure")
        void authError() {
            transport.respond(400, "{\"success\":false,\"errors\":[{\"code\":10000,\"message\":\"Authentication error\"}]}");

            assertThat(adapter.submit(batch, "ref").errorKind()).isEqualTo(ErrorKind.AUTHENTICATION);
        }

        @Test
        @DisplayName("success=false on HTTP 200 is a provider error")
        void rejectedOnOk() {
            transport.respond(200, "{\"success\":false,\"errors\":[{\"code\":1012,\"message\":\"Request must contain one of files\"}]}");

            var result = adapter.submit(batch, "ref");

            assertThat(result.status()).isEqualTo(InvalidationStatus.FAILED);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.PROVIDER);
        }
    }
}
