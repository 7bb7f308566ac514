/**
 * Cloudflare zone purges, by file list or purge everything.
 */
package com.cdnpurge.provider.cloudflare;
