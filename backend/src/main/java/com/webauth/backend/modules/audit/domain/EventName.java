package com.webauth.backend.modules.audit.domain;

/**
 * Kinds of security-relevant decisions recorded in the journal. Stored names fit in 10 characters.
 */
public enum EventName {
    LOGIN,
    LOGOUT,
    REGISTER,
    SAVE_TOKEN,
    RESET_PASS,
    CONFIRMED;

    public String value() {
        return name().toLowerCase();
    }
}
