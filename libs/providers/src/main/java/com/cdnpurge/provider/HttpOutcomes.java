package com.cdnpurge.provider;

import com.cdnpurge.invalidation.ErrorKind;
import java.io.IOException;
import java.net.http.HttpTimeoutException;

/**
 * Default mapping from HTTP and transport outcomes to {@link ErrorKind}. Adapters refine it with
 * provider-specific error codes.
 */
public final class HttpOutcomes {

    private HttpOutcomes() {
        // utility class
    }

    /**
     * Classifies a non-2xx status.
     *
     * <ul>
     *   <li>401, 403 → AUTHENTICATION
     *   <li>408 → TRANSIENT_NETWORK
     *   <li>429 → RATE_LIMIT
     *   <li>5xx → TRANSIENT_NETWORK
     *   <li>any other 4xx → PROVIDER
     * </ul>
     */
    public static ErrorKind classifyStatus(int status) {
        if (status == 401 || status == 403) {
            return ErrorKind.AUTHENTICATION;
        }
        if (status == 408) {
            return ErrorKind.TRANSIENT_NETWORK;
        }
        if (status == 429) {
            return ErrorKind.RATE_LIMIT;
        }
        if (status >= 500) {
            return ErrorKind.TRANSIENT_NETWORK;
        }
        return ErrorKind.PROVIDER;
    }

    /** Every transport failure, timeouts included, is transient. */
    public static ErrorKind classifyTransport(IOException e) {
        return ErrorKind.TRANSIENT_NETWORK;
    }

    /** Short description for result messages and logs. */
    public static String describeTransport(IOException e) {
        if (e instanceof HttpTimeoutException) {
            return "Request timed out: " + e.getMessage();
        }
        return "Network error: " + e.getClass().getSimpleName()
                + (e.getMessage() != null ? " - " + e.getMessage() : "");
    }

    /** Truncates a response body for inclusion in a result message. */
    public static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        String flat = body.strip().replaceAll("\\s+", " ");
        return flat.length() <= 300 ? flat : flat.substring(0, 300) + "...";
    }
}
