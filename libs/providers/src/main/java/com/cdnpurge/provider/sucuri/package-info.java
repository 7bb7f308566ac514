/** Sucuri firewall cache clearing. */
package com.cdnpurge.provider.sucuri;
