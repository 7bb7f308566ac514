/** The provider for tenants without a CDN. */
package com.cdnpurge.provider.none;
