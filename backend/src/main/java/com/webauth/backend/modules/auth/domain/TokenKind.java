package com.webauth.backend.modules.auth.domain;

import java.time.Duration;

/**
 * Closed set of opaque token kinds with their default entropy and lifetime.
 * Session lifetime comes from configuration, so it has no default here.
 */
public enum TokenKind {

    SESSION("session", 32, null),
    RESET("reset", 12, Duration.ofMinutes(5)),
    CONFIRM("confirm", 12, Duration.ofMinutes(5));

    private final String value;
    private final int defaultSize;
    private final Duration defaultTtl;

    TokenKind(String value, int defaultSize, Duration defaultTtl) {
        this.value = value;
        this.defaultSize = defaultSize;
        this.defaultTtl = defaultTtl;
    }

    public String value() {
        return value;
    }

    public int defaultSize() {
        return defaultSize;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }
}
