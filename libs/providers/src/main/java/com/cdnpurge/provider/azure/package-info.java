/**
 * Azure Front Door and classic Azure CDN endpoint purges.
 *
 * <p>Calls are authorized with a client-credentials token from Microsoft Entra ID, cached by
 * {@link com.cdnpurge.provider.azure.AzureTokenProvider}.
 */
package com.cdnpurge.provider.azure;
