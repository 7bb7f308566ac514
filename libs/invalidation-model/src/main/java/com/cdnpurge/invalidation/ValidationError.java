package com.cdnpurge.invalidation;

import java.util.List;

/**
 * Why a set of paths was rejected. A value, not an exception: callers receive it inside
 * {@link PathValidationResult} or {@link SubmissionResult}.
 *
 * @param messages one message per offending path (never empty)
 */
public record ValidationError(List<String> messages) {

    public ValidationError {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        messages = List.copyOf(messages);
    }

    public static ValidationError of(String message) {
        return new ValidationError(List.of(message));
    }

    /** Messages joined with {@code "; "}. */
    public String summary() {
        return String.join("; ", messages);
    }
}
