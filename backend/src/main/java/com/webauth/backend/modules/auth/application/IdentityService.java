package com.webauth.backend.modules.auth.application;

import java.util.List;

import com.webauth.backend.modules.audit.domain.AuthEvent;
import com.webauth.backend.modules.audit.domain.EventName;
import com.webauth.backend.modules.audit.infrastructure.AuthEventRepository;
import com.webauth.backend.modules.auth.domain.AppUser;
import com.webauth.backend.modules.auth.domain.AuthToken;
import com.webauth.backend.modules.auth.domain.LastLogin;
import com.webauth.backend.modules.auth.domain.TokenKind;
import com.webauth.backend.modules.auth.domain.UserProfile;
import com.webauth.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns user records. Inputs are compared exactly as given; callers trim form values beforehand.
 */
@Service
@Transactional(noRollbackFor = AuthException.class)
public class IdentityService {

    private static final String RESULT_SUCCESS = "success";
    private static final String RESULT_FAILURE = "failure";

    private final AppUserRepository appUserRepository;
    private final AuthEventRepository authEventRepository;
    private final TokenService tokenService;
    private final PasswordHasher passwordHasher;

    public IdentityService(
            AppUserRepository appUserRepository,
            AuthEventRepository authEventRepository,
            TokenService tokenService,
            PasswordHasher passwordHasher
    ) {
        this.appUserRepository = appUserRepository;
        this.authEventRepository = authEventRepository;
        this.tokenService = tokenService;
        this.passwordHasher = passwordHasher;
    }

    /**
     * Inserts a new account. Duplicate username or email fails at the storage layer.
     */
    public void register(String username, String fullName, String email, String plaintextPassword) {
        AppUser user = new AppUser(username, fullName, email, passwordHasher.hash(plaintextPassword));
        appUserRepository.saveAndFlush(user);
    }

    @Transactional(readOnly = true)
    public boolean existsByUsername(String username) {
        return appUserRepository.existsById(username);
    }

    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return appUserRepository.existsByEmail(email);
    }

    @Transactional(readOnly = true)
    public void authenticate(String username, String plaintextPassword) {
        AppUser user = appUserRepository.findById(username)
                .orElseThrow(() -> new AuthException(AuthError.USER_NOT_FOUND));
        passwordHasher.verify(user.getHashedPassword(), plaintextPassword);
    }

    @Transactional(readOnly = true)
    public UserProfile userByName(String username) {
        return appUserRepository.findById(username)
                .map(user -> UserProfile.of(user, LastLogin.NONE))
                .orElseThrow(() -> new AuthException(AuthError.USER_NOT_FOUND));
    }

    /**
     * Resolves a session cookie value. An expired session row is removed when it is detected.
     */
    public UserProfile userBySessionToken(String plaintext) {
        AuthToken session = tokenService.resolve(TokenKind.SESSION, plaintext, AuthError.USER_SESSION_NOT_FOUND);
        AppUser user = session.getUser();
        return UserProfile.of(user, lastLogin(user.getUsername()));
    }

    @Transactional(readOnly = true)
    public String usernameByEmail(String email) {
        return appUserRepository.findByEmail(email)
                .map(AppUser::getUsername)
                .orElseThrow(() -> new AuthException(AuthError.USER_NOT_FOUND));
    }

    public void confirmUser(String username) {
        AppUser user = appUserRepository.findById(username)
                .orElseThrow(() -> new AuthException(AuthError.USER_NOT_FOUND));
        if (user.isConfirmed()) {
            throw new AuthException(AuthError.USER_ALREADY_CONFIRMED);
        }
        user.setConfirmed(true);
    }

    public void updatePassword(String username, String plaintextPassword) {
        int updated = appUserRepository.updateHashedPassword(username, passwordHasher.hash(plaintextPassword));
        if (updated == 0) {
            throw new AuthException(AuthError.USER_NOT_FOUND);
        }
    }

    /**
     * The most recent login event is the current one, so the previous attempt is the second row.
     */
    @Transactional(readOnly = true)
    public LastLogin lastLogin(String username) {
        List<AuthEvent> previous = authEventRepository.findByUsernameAndNameOrderByCreatedDescIdDesc(
                username, EventName.LOGIN, PageRequest.of(1, 1));
        if (previous.isEmpty()) {
            return LastLogin.NONE;
        }
        AuthEvent event = previous.get(0);
        return new LastLogin(event.getCreated(), event.isSuccess() ? RESULT_SUCCESS : RESULT_FAILURE);
    }

    @Transactional(readOnly = true)
    public List<UserProfile> listUsers() {
        return appUserRepository.findAllByOrderByUsernameAsc().stream()
                .map(user -> UserProfile.of(user, LastLogin.NONE))
                .toList();
    }
}
