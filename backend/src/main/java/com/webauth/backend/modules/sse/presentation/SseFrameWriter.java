package com.webauth.backend.modules.sse.presentation;

import com.webauth.backend.modules.sse.domain.SseMessage;

/**
 * Text framing for one server-sent event: optional {@code event:}, one {@code data:} line per
 * line of data, optional {@code id:} and {@code retry:}, then a blank line.
 */
public final class SseFrameWriter {

    /**
     * A comment-only frame; clients ignore it.
     */
    public static final String HEARTBEAT = ":\n\n";

    private SseFrameWriter() {
    }

    public static String frame(SseMessage message) {
        StringBuilder frame = new StringBuilder();
        if (!message.event().isEmpty()) {
            field(frame, "event", message.event());
        }
        if (!message.data().isEmpty()) {
            for (String line : message.data().split("\r\n|\r|\n", -1)) {
                field(frame, "data", line);
            }
        }
        if (!message.id().isEmpty()) {
            field(frame, "id", message.id());
        }
        if (message.retry() != null && message.retry() > 0) {
            field(frame, "retry", String.valueOf(message.retry()));
        }
        return frame.append('\n').toString();
    }

    private static void field(StringBuilder frame, String name, String value) {
        frame.append(name).append(": ").append(value).append('\n');
    }
}
