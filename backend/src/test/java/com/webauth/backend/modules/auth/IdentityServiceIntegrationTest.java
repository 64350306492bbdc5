package com.webauth.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;

import com.webauth.backend.modules.audit.application.EventJournal;
import com.webauth.backend.modules.audit.domain.EventName;
import com.webauth.backend.modules.auth.application.AuthError;
import com.webauth.backend.modules.auth.application.AuthException;
import com.webauth.backend.modules.auth.application.IdentityService;
import com.webauth.backend.modules.auth.application.IssuedToken;
import com.webauth.backend.modules.auth.application.TokenDigest;
import com.webauth.backend.modules.auth.application.TokenService;
import com.webauth.backend.modules.auth.domain.LastLogin;
import com.webauth.backend.modules.auth.domain.TokenKind;
import com.webauth.backend.modules.auth.domain.UserProfile;
import com.webauth.backend.modules.auth.infrastructure.persistence.AuthTokenRepository;
import com.webauth.backend.support.AbstractPostgresIntegrationTest;
import com.webauth.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;

@SpringBootTest
class IdentityServiceIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    IdentityService identityService;

    @Autowired
    TokenService tokenService;

    @Autowired
    EventJournal eventJournal;

    @Autowired
    AuthTokenRepository authTokenRepository;

    @Autowired
    TestUserFactory testUserFactory;

    @Test
    void registeredCredentialsAuthenticate() {
        identityService.register("alice", "Alice A", "alice@example.com", "pw");

        assertThat(identityService.existsByUsername("alice")).isTrue();
        assertThat(identityService.existsByUsername("Alice")).isFalse();
        assertThat(identityService.existsByEmail("alice@example.com")).isTrue();
        assertThatCode(() -> identityService.authenticate("alice", "pw")).doesNotThrowAnyException();
        assertThatThrownBy(() -> identityService.authenticate("alice", "pw "))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.INCORRECT_PASSWORD));
        assertThatThrownBy(() -> identityService.authenticate("bob", "pw"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.USER_NOT_FOUND));
    }

    @Test
    void duplicateRegistrationFailsAtStorage() {
        identityService.register("alice", "Alice A", "alice@example.com", "pw");

        assertThatThrownBy(() -> identityService.register("alice2", "Alice B", "alice@example.com", "pw"))
                .isInstanceOf(DataAccessException.class);
        assertThat(countRows("users")).isEqualTo(1);
    }

    @Test
    void confirmUserOnlySucceedsOnce() {
        testUserFactory.createUser("alice", "pw");

        identityService.confirmUser("alice");

        assertThat(identityService.userByName("alice").confirmed()).isTrue();
        assertThatThrownBy(() -> identityService.confirmUser("alice"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.USER_ALREADY_CONFIRMED));
        assertThatThrownBy(() -> identityService.confirmUser("bob"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.USER_NOT_FOUND));
    }

    @Test
    void updatePasswordReplacesHash() {
        testUserFactory.createUser("alice", "pw");

        identityService.updatePassword("alice", "newpw");

        assertThatCode(() -> identityService.authenticate("alice", "newpw")).doesNotThrowAnyException();
        assertThatThrownBy(() -> identityService.updatePassword("bob", "x"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.USER_NOT_FOUND));
    }

    @Test
    void usernameByEmailIsExact() {
        testUserFactory.createUser("alice", "pw");

        assertThat(identityService.usernameByEmail("alice@example.com")).isEqualTo("alice");
        assertThatThrownBy(() -> identityService.usernameByEmail("ALICE@example.com"))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void sessionTokenResolvesUserWithPreviousLogin() {
        testUserFactory.createUser("alice", "pw");
        eventJournal.write(EventName.LOGIN, false, "alice", "incorrect password");
        eventJournal.write(EventName.LOGIN, true, "alice", "logged in");
        IssuedToken session = tokenService.issue(TokenKind.SESSION, "alice");

        UserProfile user = identityService.userBySessionToken(session.value());

        assertThat(user.username()).isEqualTo("alice");
        assertThat(user.lastLogin().isPresent()).isTrue();
        assertThat(user.lastLogin().result()).isEqualTo("failure");
    }

    @Test
    void lastLoginIsEmptyWithoutPreviousAttempt() {
        testUserFactory.createUser("alice", "pw");
        eventJournal.write(EventName.LOGIN, true, "alice", "logged in");

        assertThat(identityService.lastLogin("alice")).isEqualTo(LastLogin.NONE);
    }

    @Test
    void expiredSessionIsRemovedOnDetection() {
        testUserFactory.createUser("alice", "pw");
        testUserFactory.insertToken("old-session", TokenKind.SESSION, "alice", OffsetDateTime.now().minusMinutes(1));

        assertThatThrownBy(() -> identityService.userBySessionToken("old-session"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.USER_SESSION_EXPIRED));
        assertThat(authTokenRepository.findById(TokenDigest.sha256Hex("old-session"))).isEmpty();

        assertThatThrownBy(() -> identityService.userBySessionToken("old-session"))
                .isInstanceOfSatisfying(AuthException.class,
                        ex -> assertThat(ex.getError()).isEqualTo(AuthError.USER_SESSION_NOT_FOUND));
    }

    @Test
    void listUsersIsOrderedByUsername() {
        testUserFactory.createUser("carol", "pw");
        testUserFactory.createUser("alice", "pw");

        assertThat(identityService.listUsers())
                .extracting(UserProfile::username)
                .containsExactly("alice", "carol");
    }
}
