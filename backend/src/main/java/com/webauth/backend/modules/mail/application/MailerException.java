package com.webauth.backend.modules.mail.application;

import com.webauth.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class MailerException extends ProblemException {

    private final MailerError error;

    public MailerException(MailerError error, String detail, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, error.name(),
                detail != null ? error.message() + ": " + detail : error.message(), cause);
        this.error = error;
    }

    public MailerException(MailerError error) {
        this(error, null, null);
    }

    public MailerError getError() {
        return error;
    }
}
