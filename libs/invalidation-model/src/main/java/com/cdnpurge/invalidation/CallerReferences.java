package com.cdnpurge.invalidation;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Generates idempotency tokens.
 *
 * <p>A request reference looks like {@code cdnpurge-20250712T103000Z-<uuid>}. Batches of one request
 * are sent as {@code <reference>-<sequenceIndex>} so sibling batches never collide at a provider
 * that deduplicates on the token, while a retry of the same batch sends the same value again.
 */
public final class CallerReferences {

    public static final String PREFIX = "cdnpurge";

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private CallerReferences() {
        // utility class
    }

    /** A fresh reference for a new logical request. Never returns the same value twice. */
    public static String newReference(Clock clock) {
        return PREFIX + "-" + STAMP.format(clock.instant()) + "-" + UUID.randomUUID();
    }

    /** The reference sent for one batch of a request. */
    public static String forBatch(String callerReference, int sequenceIndex) {
        return callerReference + "-" + sequenceIndex;
    }
}
