package com.cdnpurge.invalidationservice.infrastructure.web;

/** No invalidation request with the given id is known. */
public class InvalidationNotFoundException extends RuntimeException {

    public InvalidationNotFoundException(String requestId) {
        super("Invalidation request not found: " + requestId);
    }
}
