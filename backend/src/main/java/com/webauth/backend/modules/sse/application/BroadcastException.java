package com.webauth.backend.modules.sse.application;

import com.webauth.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class BroadcastException extends ProblemException {

    public static final String EVENT_NOT_REGISTERED = "EVENT_NOT_REGISTERED";
    public static final String STREAMING_NOT_SUPPORTED = "STREAMING_NOT_SUPPORTED";

    private BroadcastException(HttpStatus status, String code, String detail) {
        super(status, code, detail);
    }

    public static BroadcastException eventNotRegistered(String event) {
        return new BroadcastException(HttpStatus.BAD_REQUEST, EVENT_NOT_REGISTERED, "event not registered: " + event);
    }

    public static BroadcastException streamingNotSupported() {
        return new BroadcastException(HttpStatus.INTERNAL_SERVER_ERROR, STREAMING_NOT_SUPPORTED, "streaming not supported");
    }
}
