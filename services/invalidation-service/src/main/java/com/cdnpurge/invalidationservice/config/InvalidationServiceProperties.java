package com.cdnpurge.invalidationservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity of this service instance, bound from {@code cdnpurge.service.*}.
 *
 * @param name        service name used as the {@code service} metric tag and in logs. Required.
 * @param environment deployment environment, {@code development} when unset
 */
@ConfigurationProperties(prefix = "cdnpurge.service")
@Validated
public record InvalidationServiceProperties(@NotBlank String name, String environment) {

    public InvalidationServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
