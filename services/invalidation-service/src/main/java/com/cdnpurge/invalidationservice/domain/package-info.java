/**
 * Dispatch of invalidation requests and reporting of their outcome.
 *
 * <p>The domain does not depend on the api or infrastructure packages:
 *
 * <ul>
 *   <li>{@link com.cdnpurge.invalidationservice.domain.InvalidationDispatcher} splits, submits,
 *       retries and cancels
 *   <li>{@link com.cdnpurge.invalidationservice.domain.InvalidationReporter} records results and
 *       derives the request state
 *   <li>{@link com.cdnpurge.invalidationservice.domain.InvalidationReportStore} and
 *       {@link com.cdnpurge.invalidationservice.domain.InvalidationCompletionListener} are the
 *       ports implemented under {@code infrastructure}
 * </ul>
 */
package com.cdnpurge.invalidationservice.domain;
