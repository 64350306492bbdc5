package com.webauth.backend.modules.auth.domain;

import java.time.OffsetDateTime;

/**
 * Public view of an account. Never carries the password hash.
 */
public record UserProfile(
        String username,
        String fullName,
        String email,
        boolean admin,
        boolean confirmed,
        OffsetDateTime created,
        LastLogin lastLogin
) {

    public static final UserProfile EMPTY = new UserProfile("", "", "", false, false, null, LastLogin.NONE);

    public static UserProfile of(AppUser user, LastLogin lastLogin) {
        return new UserProfile(
                user.getUsername(),
                user.getFullName(),
                user.getEmail(),
                user.isAdmin(),
                user.isConfirmed(),
                user.getCreated(),
                lastLogin
        );
    }

    public boolean isEmpty() {
        return username == null || username.isEmpty();
    }
}
