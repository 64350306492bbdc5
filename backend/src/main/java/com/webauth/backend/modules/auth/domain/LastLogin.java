package com.webauth.backend.modules.auth.domain;

import java.time.OffsetDateTime;

/**
 * The login before the current one. {@link #NONE} when the user has no earlier attempt.
 */
public record LastLogin(OffsetDateTime time, String result) {

    public static final LastLogin NONE = new LastLogin(null, "");

    public boolean isPresent() {
        return time != null;
    }
}
