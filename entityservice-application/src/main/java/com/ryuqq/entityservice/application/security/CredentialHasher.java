package com.ryuqq.entityservice.application.security;

/**
 * One-way, salted credential hashing.
 *
 * <p>Implementations never store or log the plaintext, and compare in time that
 * does not depend on where the inputs first differ.</p>
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public interface CredentialHasher {

    /**
     * Hashes a plaintext credential with a fresh salt.
     *
     * @param raw plaintext credential
     * @return encoded hash (includes the salt)
     * @throws IllegalArgumentException if raw is null
     */
    String hash(String raw);

    /**
     * Checks a plaintext credential against an encoded hash.
     *
     * @param raw plaintext credential
     * @param encoded stored hash (a malformed or null hash never matches)
     * @return true if the credential matches
     */
    boolean matches(String raw, String encoded);
}
