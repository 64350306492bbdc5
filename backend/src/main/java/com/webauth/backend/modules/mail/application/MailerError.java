package com.webauth.backend.modules.mail.application;

public enum MailerError {
    INVALID_CONFIG("invalid SMTP configuration"),
    INVALID_FROM("invalid from address"),
    NO_RECIPIENTS("no recipients"),
    INVALID_RECIPIENT("invalid recipient address"),
    SEND_FAILED("failed to send message");

    private final String message;

    MailerError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
