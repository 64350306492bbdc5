package com.webauth.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.webauth.backend.global.config.WebAuthProperties;
import com.webauth.backend.modules.auth.domain.AppUser;
import com.webauth.backend.modules.auth.domain.AuthToken;
import com.webauth.backend.modules.auth.domain.TokenKind;
import com.webauth.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.webauth.backend.modules.auth.infrastructure.persistence.AuthTokenRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues, resolves and revokes opaque tokens. Plaintext values leave this class once and are
 * never persisted; lookups go through the full SHA-256 digest.
 */
@Service
@Transactional(noRollbackFor = AuthException.class)
public class TokenService {

    private final AuthTokenRepository authTokenRepository;
    private final AppUserRepository appUserRepository;
    private final WebAuthProperties properties;
    private final Clock clock;

    public TokenService(
            AuthTokenRepository authTokenRepository,
            AppUserRepository appUserRepository,
            WebAuthProperties properties,
            Clock clock
    ) {
        this.authTokenRepository = authTokenRepository;
        this.appUserRepository = appUserRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Issues a token using the configured size and lifetime for {@code kind}.
     */
    public IssuedToken issue(TokenKind kind, String username) {
        return create(kind, username, sizeOf(kind), ttlOf(kind));
    }

    /**
     * An empty username is a successful no-op so that unregistered addresses follow the same path.
     */
    public IssuedToken create(TokenKind kind, String username, int size, Duration ttl) {
        if (size <= 0) {
            throw new IllegalArgumentException("token size must be positive: " + size);
        }
        if (username == null || username.isEmpty()) {
            return IssuedToken.empty(kind);
        }
        if (!appUserRepository.existsById(username)) {
            throw new AuthException(AuthError.USER_NOT_FOUND);
        }
        AppUser owner = appUserRepository.getReferenceById(username);

        String plaintext = TokenDigest.randomUrlSafe(size);
        OffsetDateTime expires = OffsetDateTime.now(clock).plus(ttl);
        authTokenRepository.save(new AuthToken(TokenDigest.sha256Hex(plaintext), kind, expires, owner));
        return new IssuedToken(kind, plaintext, expires);
    }

    public String lookupUsername(TokenKind kind, String plaintext) {
        return resolve(kind, plaintext, AuthError.USER_NOT_FOUND).getUser().getUsername();
    }

    /**
     * Resolves a single-use token and deletes it in the same transaction. Of several concurrent
     * callers only the one whose delete hits the row gets the username; the rest see {@code TOKEN_NOT_FOUND}.
     */
    public String consume(TokenKind kind, String plaintext) {
        AuthToken token = resolve(kind, plaintext, AuthError.USER_NOT_FOUND);
        String username = token.getUser().getUsername();
        if (authTokenRepository.deleteByHashedValueAndKind(token.getHashedValue(), kind) != 1) {
            throw new AuthException(AuthError.TOKEN_NOT_FOUND);
        }
        return username;
    }

    public void remove(TokenKind kind, String plaintext) {
        int deleted = authTokenRepository.deleteByHashedValueAndKind(TokenDigest.sha256Hex(plaintext), kind);
        if (deleted != 1) {
            throw new AuthException(AuthError.TOKEN_NOT_FOUND);
        }
    }

    /**
     * Loads a live token with its owner. An expired row is deleted before the kind's expiry error is thrown.
     */
    public AuthToken resolve(TokenKind kind, String plaintext, AuthError whenMissing) {
        String hashedValue = TokenDigest.sha256Hex(plaintext);
        AuthToken token = authTokenRepository.findWithUser(hashedValue, kind)
                .orElseThrow(() -> new AuthException(whenMissing));
        if (token.isExpiredAt(OffsetDateTime.now(clock))) {
            authTokenRepository.deleteByHashedValueAndKind(hashedValue, kind);
            throw new AuthException(expiredError(kind));
        }
        return token;
    }

    public int sizeOf(TokenKind kind) {
        Integer configured = switch (kind) {
            case SESSION -> properties.session().tokenSize();
            case RESET -> properties.tokens().resetSize();
            case CONFIRM -> properties.tokens().confirmSize();
        };
        return configured != null ? configured : kind.defaultSize();
    }

    public Duration ttlOf(TokenKind kind) {
        Duration configured = switch (kind) {
            case SESSION -> properties.session().expires();
            case RESET -> properties.tokens().resetExpires();
            case CONFIRM -> properties.tokens().confirmExpires();
        };
        return configured != null ? configured : kind.defaultTtl();
    }

    static AuthError expiredError(TokenKind kind) {
        return switch (kind) {
            case SESSION -> AuthError.USER_SESSION_EXPIRED;
            case RESET -> AuthError.RESET_TOKEN_EXPIRED;
            case CONFIRM -> AuthError.CONFIRM_TOKEN_EXPIRED;
        };
    }
}
