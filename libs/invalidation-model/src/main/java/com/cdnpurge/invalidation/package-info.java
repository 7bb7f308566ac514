/**
 * Provider-neutral invalidation model.
 *
 * <p>Requests are created through {@link com.cdnpurge.invalidation.InvalidationRequestFactory},
 * which validates and deduplicates the raw paths and assigns the id and caller reference. A path
 * list naming the site root is escalated to a full purge. Requests are cut into provider-sized
 * {@link com.cdnpurge.invalidation.InvalidationBatch}es by
 * {@link com.cdnpurge.invalidation.BatchSplitter}; each batch produces
 * {@link com.cdnpurge.invalidation.InvalidationResult} snapshots as it moves through its lifecycle.
 *
 * <p>Nothing here performs I/O or depends on a framework.
 */
package com.cdnpurge.invalidation;
