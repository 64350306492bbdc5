package com.webauth.backend.modules.sse.domain;

/**
 * One server-sent event. An empty {@code event} is the default event; {@code id} and
 * {@code retry} (milliseconds) are optional.
 */
public record SseMessage(String event, String data, String id, Integer retry) {

    public SseMessage {
        event = event != null ? event : "";
        data = data != null ? data : "";
        id = id != null ? id : "";
    }

    public static SseMessage of(String event, String data) {
        return new SseMessage(event, data, null, null);
    }
}
