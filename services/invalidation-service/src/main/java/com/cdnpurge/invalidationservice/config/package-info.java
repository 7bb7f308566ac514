/**
 * Spring configuration: {@code cdnpurge.*} properties and the dispatcher wiring.
 */
package com.cdnpurge.invalidationservice.config;
