package com.cdnpurge.invalidationservice.api;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * Body of {@code POST /api/v1/invalidations}. Path rules are enforced by the path validator so
 * that every malformed path is reported, not only the first.
 */
public record SubmitInvalidationRequest(@NotBlank String tenantId, List<String> paths) {}
