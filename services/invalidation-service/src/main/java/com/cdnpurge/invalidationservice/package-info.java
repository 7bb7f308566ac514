/**
 * Invalidation service: accepts purge requests over HTTP and dispatches them to each tenant's CDN.
 */
package com.cdnpurge.invalidationservice;
