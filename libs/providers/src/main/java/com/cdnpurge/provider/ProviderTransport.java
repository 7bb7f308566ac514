package com.cdnpurge.provider;

import java.io.IOException;

/**
 * Sends {@link ProviderRequest}s. Implementations bound every call with a timeout and report it
 * as {@link java.net.http.HttpTimeoutException}.
 */
@FunctionalInterface
public interface ProviderTransport {

    /**
     * @throws IOException on connection failure, timeout or interruption
     */
    ProviderResponse send(ProviderRequest request) throws IOException;
}
