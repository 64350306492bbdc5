package com.webauth.backend.modules.auth.presentation;

/**
 * User-facing form messages.
 */
final class AuthMessages {

    static final String MISSING_REQUIRED = "Please provide all the required values";
    static final String INVALID_EMAIL = "Please provide a valid email address.";
    static final String PASSWORD_MISMATCH = "Password values do not match.";
    static final String USERNAME_EXISTS = "User Name already exists.";
    static final String EMAIL_EXISTS = "Email Address already registered.";

    static final String MISSING_USERNAME_AND_PASSWORD = "Missing username and password";
    static final String MISSING_USERNAME = "Missing username";
    static final String MISSING_PASSWORD = "Missing password";
    static final String LOGIN_FAILED = "Login failed.";
    static final String LOGGED_OUT = "You have been logged out.";

    static final String MISSING_EMAIL = "Please provide your email.";
    static final String MISSING_ACTION = "Please provide an action.";
    static final String INVALID_ACTION = "Please provide a valid action.";
    static final String FORGOT_SENT = "If the email address is registered, a message with further instructions has been sent.";
    static final String CONFIRM_REQUEST_SENT = "If the email address is registered, a message with a confirmation link has been sent.";

    static final String INVALID_RESET_TOKEN = "Please provide a valid Reset Token";
    static final String EXPIRED_RESET_TOKEN = "Request password request expired. Please request again.";

    static final String MISSING_CONFIRM_TOKEN = "Please provide a token.";
    static final String INVALID_CONFIRM_TOKEN = "Token is invalid. Request a new token below.";
    static final String EXPIRED_CONFIRM_TOKEN = "Token is expired. Request a new token below.";
    static final String ALREADY_CONFIRMED = "User already confirmed.";

    private AuthMessages() {
    }
}
