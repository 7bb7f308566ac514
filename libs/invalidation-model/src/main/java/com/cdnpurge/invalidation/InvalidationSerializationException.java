package com.cdnpurge.invalidation;

/**
 * Thrown when a batch cannot be turned into a provider payload.
 *
 * <p>Should be unreachable once paths went through {@link PathValidator} and {@link BatchSplitter};
 * seeing one means a defect upstream. Never retried.
 */
public class InvalidationSerializationException extends RuntimeException {

    public InvalidationSerializationException(String message) {
        super(message);
    }

    public InvalidationSerializationException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorKind errorKind() {
        return ErrorKind.SERIALIZATION;
    }
}
