package com.cdnpurge.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CredentialRedactor")
class CredentialRedactorTest {

    private final CredentialRedactor redactor = new CredentialRedactor();

    @Test
    @DisplayName("masks provider secrets and keeps identifiers")
    void masksSecrets() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("distributionId", "E2QWRUHAPOMQZL");
        fields.put("accessKeyId", "AKIDEXAMPLE");
        fields.put("secretAccessKey", "wJalrXUtnFEMI");
        fields.put("apiToken", "cf-token");
        fields.put("apiKey", "sucuri-key");
        fields.put("clientSecret", "aad-secret");

        var redacted = redactor.redact(fields);

        assertThat(redacted).containsEntry("distributionId", "E2QWRUHAPOMQZL");
        assertThat(redacted).containsEntry("accessKeyId", CredentialRedactor.REDACTED);
        assertThat(redacted).containsEntry("secretAccessKey", CredentialRedactor.REDACTED);
        assertThat(redacted).containsEntry("apiToken", CredentialRedactor.REDACTED);
        assertThat(redacted).containsEntry("apiKey", CredentialRedactor.REDACTED);
        assertThat(redacted).containsEntry("clientSecret", CredentialRedactor.REDACTED);
        assertThat(redacted.keySet()).containsExactlyElementsOf(fields.keySet());
    }

    @Test
    @DisplayName("null or empty input gives an empty map")
    void emptyInput() {
        assertThat(redactor.redact(null)).isEmpty();
        assertThat(redactor.redact(Map.of())).isEmpty();
    }

    @Test
    @DisplayName("custom fragments replace the defaults")
    void customFragments() {
        var custom = new CredentialRedactor(Set.of("zone"));

        assertThat(custom.isSensitive("zoneId")).isTrue();
        assertThat(custom.isSensitive("apiToken")).isFalse();
        assertThat(custom.isSensitive(null)).isFalse();
    }
}
