package com.ryuqq.entityservice.application.security;

import com.ryuqq.entityservice.application.config.EntityServiceConfig;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * {@link CredentialHasher} backed by Spring Security's BCrypt encoder.
 *
 * @author Entity Service Team
 * @since 1.0.0
 */
public final class BCryptCredentialHasher implements CredentialHasher {

    private final BCryptPasswordEncoder encoder;

    public BCryptCredentialHasher(EntityServiceConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.encoder = new BCryptPasswordEncoder(config.passwordHashStrength());
    }

    @Override
    public String hash(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("raw cannot be null");
        }
        return encoder.encode(raw);
    }

    @Override
    public boolean matches(String raw, String encoded) {
        if (raw == null || encoded == null || encoded.isEmpty()) {
            return false;
        }
        return encoder.matches(raw, encoded);
    }
}
