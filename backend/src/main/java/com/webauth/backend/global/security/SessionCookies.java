package com.webauth.backend.global.security;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.webauth.backend.global.config.WebAuthProperties;
import com.webauth.backend.modules.auth.application.IssuedToken;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

/**
 * Reads and writes the session cookie. Every variant is Secure, HttpOnly and SameSite=Strict.
 */
@Component
public class SessionCookies {

    private static final String SAME_SITE = "Strict";

    private final String cookieName;
    private final Clock clock;

    public SessionCookies(WebAuthProperties properties, Clock clock) {
        this.cookieName = properties.session().cookieName();
        this.clock = clock;
    }

    public String name() {
        return cookieName;
    }

    public String read(HttpServletRequest request) {
        Cookie cookie = WebUtils.getCookie(request, cookieName);
        return cookie != null ? cookie.getValue() : "";
    }

    /**
     * Without {@code remember} the cookie carries no expiry and ends with the browser session.
     */
    public ResponseCookie issue(IssuedToken token, boolean remember) {
        ResponseCookie.ResponseCookieBuilder builder = base(token.value());
        if (remember) {
            Duration remaining = Duration.between(OffsetDateTime.now(clock), token.expires());
            builder.maxAge(remaining.isNegative() ? Duration.ZERO : remaining);
        }
        return builder.build();
    }

    public ResponseCookie clear() {
        return base("").maxAge(Duration.ZERO).build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(cookieName, value)
                .path("/")
                .secure(true)
                .httpOnly(true)
                .sameSite(SAME_SITE);
    }
}
