/**
 * Credential hashing behind the {@link com.ryuqq.entityservice.application.security.CredentialHasher} seam.
 *
 * @since 1.0.0
 */
package com.ryuqq.entityservice.application.security;
