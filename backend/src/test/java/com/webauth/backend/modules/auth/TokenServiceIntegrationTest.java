package com.webauth.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.OffsetDateTime;

import com.webauth.backend.modules.auth.application.AuthError;
import com.webauth.backend.modules.auth.application.AuthException;
import com.webauth.backend.modules.auth.application.IssuedToken;
import com.webauth.backend.modules.auth.application.TokenDigest;
import com.webauth.backend.modules.auth.application.TokenService;
import com.webauth.backend.modules.auth.domain.TokenKind;
import com.webauth.backend.modules.auth.infrastructure.persistence.AuthTokenRepository;
import com.webauth.backend.support.AbstractPostgresIntegrationTest;
import com.webauth.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class TokenServiceIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    TokenService tokenService;

    @Autowired
    AuthTokenRepository authTokenRepository;

    @Autowired
    TestUserFactory testUserFactory;

    @BeforeEach
    void setUp() {
        testUserFactory.createUser("alice", "pw");
    }

    @Test
    void storesOnlyTheDigestOfIssuedTokens() {
        IssuedToken token = tokenService.create(TokenKind.RESET, "alice", 12, Duration.ofMinutes(5));

        assertThat(token.value()).hasSize(16).doesNotContain("=", "+", "/");
        assertThat(authTokenRepository.findById(TokenDigest.sha256Hex(token.value()))).isPresent();
        assertThat(authTokenRepository.findById(token.value())).isEmpty();
        assertThat(jdbcTemplate.queryForList("select hashed_value from tokens", String.class))
                .noneMatch(stored -> stored.contains(token.value()));
    }

    @Test
    void defaultSizesFollowTokenKind() {
        assertThat(tokenService.sizeOf(TokenKind.SESSION)).isEqualTo(32);
        assertThat(tokenService.sizeOf(TokenKind.RESET)).isEqualTo(12);
        assertThat(tokenService.ttlOf(TokenKind.CONFIRM)).isEqualTo(Duration.ofMinutes(5));
        assertThat(tokenService.ttlOf(TokenKind.SESSION)).isEqualTo(Duration.ofHours(24));
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThatThrownBy(() -> tokenService.create(TokenKind.RESET, "alice", 0, Duration.ofMinutes(5)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyUsernameIsANoOp() {
        IssuedToken token = tokenService.issue(TokenKind.RESET, "");

        assertThat(token.isEmpty()).isTrue();
        assertThat(countRows("tokens")).isZero();
    }

    @Test
    void unknownOwnerIsRejected() {
        assertThatThrownBy(() -> tokenService.issue(TokenKind.CONFIRM, "nobody"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.USER_NOT_FOUND));
        assertThat(countRows("tokens")).isZero();
    }

    @Test
    void lookupThenRemoveConsumesToken() {
        IssuedToken token = tokenService.issue(TokenKind.RESET, "alice");

        assertThat(tokenService.lookupUsername(TokenKind.RESET, token.value())).isEqualTo("alice");
        tokenService.remove(TokenKind.RESET, token.value());

        assertThat(countRows("tokens")).isZero();
        assertThatThrownBy(() -> tokenService.remove(TokenKind.RESET, token.value()))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.TOKEN_NOT_FOUND));
    }

    @Test
    void consumeHandsOutUsernameOnlyOnce() {
        IssuedToken token = tokenService.issue(TokenKind.CONFIRM, "alice");

        assertThat(tokenService.consume(TokenKind.CONFIRM, token.value())).isEqualTo("alice");

        assertThat(authTokenRepository.countByKind(TokenKind.CONFIRM)).isZero();
        assertThatThrownBy(() -> tokenService.consume(TokenKind.CONFIRM, token.value()))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.USER_NOT_FOUND));
    }

    @Test
    void consumeOfExpiredTokenDeletesItAndFails() {
        testUserFactory.insertToken("reset-stale", TokenKind.RESET, "alice", OffsetDateTime.now().minusSeconds(1));

        assertThatThrownBy(() -> tokenService.consume(TokenKind.RESET, "reset-stale"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.RESET_TOKEN_EXPIRED));
        assertThat(countRows("tokens")).isZero();
    }

    @Test
    void lookupIsScopedToKind() {
        IssuedToken token = tokenService.issue(TokenKind.CONFIRM, "alice");

        assertThatThrownBy(() -> tokenService.lookupUsername(TokenKind.RESET, token.value()))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.USER_NOT_FOUND));
    }

    @Test
    void expiredTokenFailsWithKindSpecificErrorAndIsDeleted() {
        OffsetDateTime past = OffsetDateTime.now().minusSeconds(1);
        testUserFactory.insertToken("reset-old", TokenKind.RESET, "alice", past);
        testUserFactory.insertToken("confirm-old", TokenKind.CONFIRM, "alice", past);

        assertThatThrownBy(() -> tokenService.lookupUsername(TokenKind.RESET, "reset-old"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.RESET_TOKEN_EXPIRED));
        assertThatThrownBy(() -> tokenService.lookupUsername(TokenKind.CONFIRM, "confirm-old"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.CONFIRM_TOKEN_EXPIRED));

        assertThat(countRows("tokens")).isZero();
    }

    @Test
    void tokenExpiringNowIsAlreadyInvalid() {
        IssuedToken token = tokenService.create(TokenKind.RESET, "alice", 12, Duration.ofNanos(1));

        assertThatThrownBy(() -> tokenService.lookupUsername(TokenKind.RESET, token.value()))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.RESET_TOKEN_EXPIRED));
    }
}
