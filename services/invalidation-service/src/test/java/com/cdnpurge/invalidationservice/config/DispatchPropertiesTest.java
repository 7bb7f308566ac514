package com.cdnpurge.invalidationservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DispatchProperties")
class DispatchPropertiesTest {

    @Test
    @DisplayName("falls back to defaults for unset values")
    void defaults() {
        var props = DispatchProperties.defaults();

        assertThat(props.workerThreads()).isEqualTo(4);
        assertThat(props.maxAttempts()).isEqualTo(3);
        assertThat(props.initialBackoff()).isEqualTo(Duration.ofMillis(500));
        assertThat(props.backoffMultiplier()).isEqualTo(2.0);
        assertThat(props.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.connectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.queueCapacity()).isEqualTo(1000);
        assertThat(props.shutdownTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("keeps explicit values")
    void explicit() {
        var props = new DispatchProperties(8, 5, Duration.ofSeconds(1), 3.0, Duration.ofSeconds(5), Duration.ofSeconds(2),
                50, Duration.ZERO);

        assertThat(props.workerThreads()).isEqualTo(8);
        assertThat(props.maxAttempts()).isEqualTo(5);
        assertThat(props.backoffMultiplier()).isEqualTo(3.0);
        assertThat(props.requestTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.queueCapacity()).isEqualTo(50);
        assertThat(props.shutdownTimeout()).isZero();
    }

    @Test
    @DisplayName("replaces a multiplier below one")
    void shrinkingBackoff() {
        var props = new DispatchProperties(1, 1, null, 0.5, null, null, 0, null);

        assertThat(props.backoffMultiplier()).isEqualTo(2.0);
    }
}
