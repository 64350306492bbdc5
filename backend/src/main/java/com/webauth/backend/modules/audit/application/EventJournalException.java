package com.webauth.backend.modules.audit.application;

import com.webauth.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class EventJournalException extends ProblemException {

    public static final String WRITE_EVENT_DB_NIL = "WRITE_EVENT_DB_NIL";
    public static final String WRITE_EVENT_FAILED = "WRITE_EVENT_FAILED";

    public EventJournalException(String code, String detail, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, code, detail, cause);
    }
}
