package com.cdnpurge.provider;

import com.cdnpurge.invalidation.ErrorKind;

/**
 * A classified failure raised inside an adapter before the purge call itself, such as a rejected
 * token request. Adapters convert it into a FAILED result.
 */
public class ProviderCallException extends RuntimeException {

    private final ErrorKind errorKind;

    public ProviderCallException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }
}
