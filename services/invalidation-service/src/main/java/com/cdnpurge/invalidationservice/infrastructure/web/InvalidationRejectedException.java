package com.cdnpurge.invalidationservice.infrastructure.web;

import com.cdnpurge.invalidation.ValidationError;
import java.util.List;

/** A submission failed path validation; carries every error found. */
public class InvalidationRejectedException extends RuntimeException {

    private final ValidationError error;

    public InvalidationRejectedException(ValidationError error) {
        super(error.summary());
        this.error = error;
    }

    public List<String> errors() {
        return error.messages();
    }
}
