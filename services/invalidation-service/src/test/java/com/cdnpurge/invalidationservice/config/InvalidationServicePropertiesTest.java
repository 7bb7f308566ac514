package com.cdnpurge.invalidationservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InvalidationServiceProperties")
class InvalidationServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new InvalidationServiceProperties("invalidation-service", "production");
        assertThat(props.name()).isEqualTo("invalidation-service");
        assertThat(props.environment()).isEqualTo("production");
    }

    @Test
    @DisplayName("defaults environment to 'development' when missing")
    void defaultsEnvironment() {
        assertThat(new InvalidationServiceProperties("svc", null).environment()).isEqualTo("development");
        assertThat(new InvalidationServiceProperties("svc", " ").environment()).isEqualTo("development");
    }
}
