package com.cdnpurge.invalidation;

import java.util.List;
import java.util.Optional;

/**
 * Result of {@link PathValidator#validate(List)}.
 *
 * @param valid  true if every path was acceptable
 * @param paths  normalized, deduplicated paths in original order (empty when invalid)
 * @param errors human-readable error messages (empty when valid)
 */
public record PathValidationResult(boolean valid, List<String> paths, List<String> errors) {

    public static PathValidationResult ok(List<String> paths) {
        return new PathValidationResult(true, List.copyOf(paths), List.of());
    }

    public static PathValidationResult fail(List<String> errors) {
        return new PathValidationResult(false, List.of(), List.copyOf(errors));
    }

    /** The rejection as a {@link ValidationError}, empty when valid. */
    public Optional<ValidationError> error() {
        return valid ? Optional.empty() : Optional.of(new ValidationError(errors));
    }
}
