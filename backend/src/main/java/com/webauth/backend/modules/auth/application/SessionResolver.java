package com.webauth.backend.modules.auth.application;

import com.webauth.backend.modules.auth.domain.UserProfile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the session cookie value into the current user. A missing cookie is anonymous;
 * an unknown or expired session is anonymous and asks the caller to delete the cookie.
 * Storage failures propagate.
 */
@Component
public class SessionResolver {

    public static final String CURRENT_USER_ATTRIBUTE = "com.webauth.backend.modules.auth.application.SessionResolver.CURRENT_USER";

    private static final Logger log = LoggerFactory.getLogger(SessionResolver.class);

    private final IdentityService identityService;

    public SessionResolver(IdentityService identityService) {
        this.identityService = identityService;
    }

    public Resolution resolve(String cookieValue) {
        if (cookieValue == null || cookieValue.isEmpty()) {
            return Resolution.ANONYMOUS;
        }
        try {
            return new Resolution(identityService.userBySessionToken(cookieValue), false);
        } catch (AuthException ex) {
            if (ex.is(AuthError.USER_SESSION_NOT_FOUND) || ex.is(AuthError.USER_SESSION_EXPIRED)) {
                log.debug("discarding session cookie: {}", ex.getCode());
                return Resolution.DISCARD;
            }
            throw ex;
        }
    }

    public record Resolution(UserProfile user, boolean clearCookie) {

        static final Resolution ANONYMOUS = new Resolution(UserProfile.EMPTY, false);
        static final Resolution DISCARD = new Resolution(UserProfile.EMPTY, true);
    }
}
