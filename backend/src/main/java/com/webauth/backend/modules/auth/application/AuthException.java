package com.webauth.backend.modules.auth.application;

import com.webauth.backend.global.error.ProblemException;

public class AuthException extends ProblemException {

    private final AuthError error;

    public AuthException(AuthError error) {
        super(error.status(), error.name(), error.message());
        this.error = error;
    }

    public AuthError getError() {
        return error;
    }

    public boolean is(AuthError candidate) {
        return error == candidate;
    }
}
