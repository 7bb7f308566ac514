/** In-memory report store with bounded retention. */
package com.cdnpurge.invalidationservice.infrastructure.store;
