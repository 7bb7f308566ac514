/**
 * Amazon CloudFront invalidations over the 2020-05-31 REST API, signed with the AWS SDK's SigV4
 * signer.
 */
package com.cdnpurge.provider.cloudfront;
