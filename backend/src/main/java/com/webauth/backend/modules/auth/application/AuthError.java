package com.webauth.backend.modules.auth.application;

import org.springframework.http.HttpStatus;

public enum AuthError {

    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "user not found"),
    INCORRECT_PASSWORD(HttpStatus.UNAUTHORIZED, "incorrect password"),
    USER_SESSION_NOT_FOUND(HttpStatus.UNAUTHORIZED, "user session not found"),
    USER_SESSION_EXPIRED(HttpStatus.UNAUTHORIZED, "user session expired"),
    RESET_TOKEN_EXPIRED(HttpStatus.GONE, "reset token expired"),
    CONFIRM_TOKEN_EXPIRED(HttpStatus.GONE, "confirm token expired"),
    TOKEN_NOT_FOUND(HttpStatus.NOT_FOUND, "token not found"),
    USER_ALREADY_CONFIRMED(HttpStatus.CONFLICT, "user already confirmed");

    private final HttpStatus status;
    private final String message;

    AuthError(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus status() {
        return status;
    }

    public String message() {
        return message;
    }
}
