/**
 * Servlet plumbing: correlation ids and problem-detail error responses.
 */
package com.cdnpurge.invalidationservice.infrastructure.web;
