package com.cdnpurge.invalidationservice.api;

import jakarta.validation.constraints.NotBlank;

/** Body of {@code POST /api/v1/invalidations/full-purge}. */
public record FullPurgeRequest(@NotBlank String tenantId) {}
