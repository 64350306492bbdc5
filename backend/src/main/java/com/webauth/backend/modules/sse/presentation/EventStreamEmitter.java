package com.webauth.backend.modules.sse.presentation;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.webauth.backend.modules.sse.domain.SseMessage;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/**
 * Writes pre-framed events; every send is flushed to the client.
 */
public class EventStreamEmitter extends ResponseBodyEmitter {

    static final MediaType TEXT_EVENT_STREAM_UTF8 = new MediaType(MediaType.TEXT_EVENT_STREAM, StandardCharsets.UTF_8);

    private static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    public void send(SseMessage message) throws IOException {
        send(SseFrameWriter.frame(message), TEXT_PLAIN_UTF8);
    }

    public void sendHeartbeat() throws IOException {
        send(SseFrameWriter.HEARTBEAT, TEXT_PLAIN_UTF8);
    }

    @Override
    protected void extendResponse(ServerHttpResponse outputMessage) {
        super.extendResponse(outputMessage);
        HttpHeaders headers = outputMessage.getHeaders();
        if (headers.getContentType() == null) {
            headers.setContentType(TEXT_EVENT_STREAM_UTF8);
        }
    }
}
