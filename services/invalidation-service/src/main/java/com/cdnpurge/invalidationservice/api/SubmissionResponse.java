package com.cdnpurge.invalidationservice.api;

/** Id of an accepted invalidation request. */
public record SubmissionResponse(String requestId) {}
