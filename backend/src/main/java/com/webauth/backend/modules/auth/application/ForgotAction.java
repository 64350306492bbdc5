package com.webauth.backend.modules.auth.application;

import java.util.Optional;

/**
 * What a forgot request asks for: a username reminder or a password reset link.
 */
public enum ForgotAction {
    USER("user"),
    PASSWORD("password");

    private final String value;

    ForgotAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ForgotAction> parse(String value) {
        for (ForgotAction action : values()) {
            if (action.value.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
