package com.webauth.backend.modules.auth.application;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Argon2id hashing through the configured {@link PasswordEncoder}.
 * The encoded form embeds salt and cost parameters and is treated as opaque.
 */
@Component
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
    }

    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    public void verify(String hashed, String plaintext) {
        if (!passwordEncoder.matches(plaintext, hashed)) {
            throw new AuthException(AuthError.INCORRECT_PASSWORD);
        }
    }
}
