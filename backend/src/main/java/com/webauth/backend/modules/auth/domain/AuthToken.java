package com.webauth.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import com.webauth.backend.global.jpa.AbstractAssignedIdEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * Persisted form of an issued token. Only the hex SHA-256 digest of the plaintext is stored.
 */
@Entity
@Table(name = "tokens")
public class AuthToken extends AbstractAssignedIdEntity<String> {

    @Id
    @Column(name = "hashed_value", nullable = false, updatable = false, length = 64)
    private String hashedValue;

    @Column(name = "expires", nullable = false)
    private OffsetDateTime expires;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 16)
    private TokenKind kind;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "username", nullable = false)
    private AppUser user;

    protected AuthToken() {
    }

    public AuthToken(String hashedValue, TokenKind kind, OffsetDateTime expires, AppUser user) {
        this.hashedValue = hashedValue;
        this.kind = kind;
        this.expires = expires;
        this.user = user;
    }

    @Override
    public String getId() {
        return hashedValue;
    }

    public String getHashedValue() {
        return hashedValue;
    }

    public OffsetDateTime getExpires() {
        return expires;
    }

    public TokenKind getKind() {
        return kind;
    }

    public AppUser getUser() {
        return user;
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return !expires.isAfter(now);
    }
}
