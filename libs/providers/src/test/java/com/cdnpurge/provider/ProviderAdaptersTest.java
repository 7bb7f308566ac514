package com.cdnpurge.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cdnpurge.invalidation.InvalidationBatch;
import com.cdnpurge.invalidation.InvalidationStatus;
import com.cdnpurge.invalidation.ProviderType;
import com.cdnpurge.provider.azure.AzureFrontDoorConfig;
import com.cdnpurge.provider.cloudflare.CloudflareConfig;
import com.cdnpurge.provider.cloudfront.CloudFrontConfig;
import com.cdnpurge.provider.none.NoneConfig;
import com.cdnpurge.provider.sucuri.SucuriConfig;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ProviderAdapters")
class ProviderAdaptersTest {

    private final ScriptedTransport transport = new ScriptedTransport();
    private final ProviderAdapters adapters =
            new ProviderAdapters(transport, ScriptedTransport.noopTracer(), Clock.systemUTC());

    @Test
    @DisplayName("creates the adapter matching each config")
    void createsMatchingAdapter() {
        assertThat(adapters.create(new CloudFrontConfig("E123", "AKID", "secret", null)).type())
                .isEqualTo(ProviderType.CLOUDFRONT);
        assertThat(adapters.create(new CloudflareConfig("zone", "token")).type())
                .isEqualTo(ProviderType.CLOUDFLARE);
        assertThat(adapters.create(new AzureFrontDoorConfig(
                "sub", "rg", "profile", "endpoint", "tenant", "client", "secret", true, 0)).type())
                .isEqualTo(ProviderType.AZURE_FRONT_DOOR);
        assertThat(adapters.create(new SucuriConfig("example.com", "key", "secret", 0)).type())
                .isEqualTo(ProviderType.SUCURI);
        assertThat(adapters.create(NoneConfig.INSTANCE).type()).isEqualTo(ProviderType.NONE);
    }

    @Test
    @DisplayName("None adapter succeeds without any outbound call")
    void noneMakesNoCall() {
        var adapter = adapters.create(NoneConfig.INSTANCE);
        var batch = new InvalidationBatch("req-1", 0, List.of("/a.html", "/b.html"));

        var result = adapter.submit(batch, "ref-0");

        assertThat(result.status()).isEqualTo(InvalidationStatus.SUCCEEDED);
        assertThat(result.errorKind()).isNull();
        assertThat(transport.requests()).isEmpty();
    }

    @Test
    @DisplayName("rejects a null config")
    void rejectsNull() {
        assertThatThrownBy(() -> adapters.create(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("config validation")
    class ConfigValidation {

        @Test
        @DisplayName("names the missing field")
        void namesMissingField() {
            assertThatThrownBy(() -> new CloudFrontConfig("E123", "AKID", " ", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("secretAccessKey");
            assertThatThrownBy(() -> new CloudflareConfig(null, "token"))
                    .hasMessageContaining("zoneId");
            assertThatThrownBy(() -> new AzureFrontDoorConfig(
                    "sub", "rg", "profile", "endpoint", "tenant", "", "secret", true, 0))
                    .hasMessageContaining("clientId");
            assertThatThrownBy(() -> new SucuriConfig("example.com", "key", null, 0))
                    .hasMessageContaining("apiSecret");
        }

        @Test
        @DisplayName("toString never shows secrets")
        void redactsSecrets() {
            var config = new CloudFrontConfig("E123", "AKIDEXAMPLE", "super-secret-value", null);

            assertThat(config.toString())
                    .contains("E123")
                    .doesNotContain("super-secret-value")
                    .doesNotContain("AKIDEXAMPLE");
        }

        @Test
        @DisplayName("applies provider defaults")
        void appliesDefaults() {
            assertThat(new CloudFrontConfig("E123", "AKID", "secret", "").region()).isEqualTo("us-east-1");
            assertThat(new CloudflareConfig("zone", "token").maxBatchSize()).isEqualTo(30);
            assertThat(new SucuriConfig("example.com", "key", "secret", 5).maxBatchSize()).isEqualTo(5);
        }
    }
}
