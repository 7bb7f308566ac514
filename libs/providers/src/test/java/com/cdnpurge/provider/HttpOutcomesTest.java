package com.cdnpurge.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.cdnpurge.invalidation.ErrorKind;
import java.net.http.HttpTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("HttpOutcomes")
class HttpOutcomesTest {

    @ParameterizedTest(name = "HTTP {0} -> {1}")
    @CsvSource({
            "401, AUTHENTICATION",
            "403, AUTHENTICATION",
            "408, TRANSIENT_NETWORK",
            "429, RATE_LIMIT",
            "500, TRANSIENT_NETWORK",
            "503, TRANSIENT_NETWORK",
            "400, PROVIDER",
            "404, PROVIDER",
            "409, PROVIDER"
    })
    void classifiesStatus(int status, ErrorKind expected) {
        assertThat(HttpOutcomes.classifyStatus(status)).isEqualTo(expected);
    }

    @Test
    @DisplayName("timeouts are transient and described as such")
    void timeoutIsTransient() {
        var timeout = new HttpTimeoutException("request timed out");

        assertThat(HttpOutcomes.classifyTransport(timeout)).isEqualTo(ErrorKind.TRANSIENT_NETWORK);
        assertThat(HttpOutcomes.describeTransport(timeout)).startsWith("Request timed out");
    }

    @Test
    @DisplayName("abbreviates long bodies")
    void abbreviates() {
        assertThat(HttpOutcomes.abbreviate("x".repeat(1000))).hasSize(303).endsWith("...");
        assertThat(HttpOutcomes.abbreviate(null)).isEmpty();
    }
}
