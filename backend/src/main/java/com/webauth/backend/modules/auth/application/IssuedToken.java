package com.webauth.backend.modules.auth.application;

import java.time.OffsetDateTime;

import com.webauth.backend.modules.auth.domain.TokenKind;

/**
 * Plaintext token handed to the caller exactly once, with its absolute expiry.
 */
public record IssuedToken(TokenKind kind, String value, OffsetDateTime expires) {

    public static IssuedToken empty(TokenKind kind) {
        return new IssuedToken(kind, "", null);
    }

    public boolean isEmpty() {
        return value == null || value.isEmpty();
    }
}
