/**
 * CDN provider adapters.
 *
 * <p>Every provider implements {@link com.cdnpurge.provider.ProviderAdapter}. HTTP providers extend
 * {@link com.cdnpurge.provider.HttpProviderAdapter}, which sends through a
 * {@link com.cdnpurge.provider.ProviderTransport} and turns transport failures into classified
 * results. Adapters never throw for provider problems; failures come back as FAILED results with an
 * {@link com.cdnpurge.invalidation.ErrorKind}.
 *
 * @see com.cdnpurge.provider.ProviderAdapters
 */
package com.cdnpurge.provider;
