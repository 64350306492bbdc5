package com.webauth.backend.modules.sse.presentation;

import java.time.Duration;

import com.webauth.backend.global.config.AsyncConfig;
import com.webauth.backend.global.config.WebAuthProperties;
import com.webauth.backend.global.error.ProblemException;
import com.webauth.backend.global.web.RequestIdFilter;
import com.webauth.backend.modules.sse.application.BroadcastException;
import com.webauth.backend.modules.sse.application.EventBroadcaster;
import com.webauth.backend.modules.sse.domain.SseMessage;
import com.webauth.backend.modules.sse.domain.Subscriber;
import com.webauth.backend.modules.sse.domain.SubscriberState;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EventStreamController {

    private static final Logger log = LoggerFactory.getLogger(EventStreamController.class);
    private static final Duration POLL_INTERVAL = Duration.ofMillis(500);

    private final EventBroadcaster broadcaster;
    private final TaskExecutor streamExecutor;
    private final String allowOrigin;
    private final Duration heartbeat;

    public EventStreamController(
            EventBroadcaster broadcaster,
            @Qualifier(AsyncConfig.EVENT_STREAM_EXECUTOR) TaskExecutor streamExecutor,
            WebAuthProperties properties
    ) {
        this.broadcaster = broadcaster;
        this.streamExecutor = streamExecutor;
        this.allowOrigin = properties.sse().allowOrigin();
        this.heartbeat = properties.sse().heartbeat();
    }

    @GetMapping("/event")
    public ResponseEntity<EventStreamEmitter> stream(
            @RequestParam(name = "event", defaultValue = "") String event,
            HttpServletRequest request
    ) {
        if (!request.isAsyncSupported()) {
            log.error("event stream requested on a request without async support");
            throw BroadcastException.streamingNotSupported();
        }
        Subscriber subscriber = broadcaster.subscribe(RequestIdFilter.requestIdOf(request), event);
        EventStreamEmitter emitter = new EventStreamEmitter();
        emitter.onCompletion(() -> release(subscriber));
        emitter.onTimeout(() -> release(subscriber));
        emitter.onError(ex -> release(subscriber));
        try {
            streamExecutor.execute(new EventStreamPump(subscriber, emitter, POLL_INTERVAL, heartbeat, this::release));
        } catch (TaskRejectedException ex) {
            release(subscriber);
            throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "EVENT_STREAMS_EXHAUSTED",
                    "too many open event streams", ex);
        }
        log.info("client subscribed id={} event={}", subscriber.getId(), event);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(EventStreamEmitter.TEXT_EVENT_STREAM_UTF8);
        headers.setCacheControl("no-cache");
        headers.setConnection("keep-alive");
        if (StringUtils.hasText(allowOrigin)) {
            headers.setAccessControlAllowOrigin(allowOrigin);
        }
        return ResponseEntity.ok().headers(headers).body(emitter);
    }

    @PostMapping("/event/send")
    public ResponseEntity<Void> send(
            @RequestParam(name = "event", defaultValue = "") String event,
            @RequestParam(name = "data", defaultValue = "") String data,
            @RequestParam(name = "id", defaultValue = "") String id,
            @RequestParam(name = "retry", defaultValue = "") String retry
    ) {
        Integer retryMillis = null;
        if (!retry.isEmpty()) {
            try {
                retryMillis = Integer.valueOf(retry);
            } catch (NumberFormatException ex) {
                log.warn("rejected message with invalid retry={}", retry);
                throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_RETRY", "retry must be an integer");
            }
        }
        try {
            broadcaster.publish(new SseMessage(event, data, id, retryMillis));
        } catch (BroadcastException ex) {
            if (!BroadcastException.EVENT_NOT_REGISTERED.equals(ex.getCode())) {
                throw ex;
            }
            log.warn("rejected message for unregistered event={}", event);
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, ex.getCode(), ex.getDetailMessage(), ex);
        }
        return ResponseEntity.noContent().build();
    }

    private void release(Subscriber subscriber) {
        if (subscriber.getState() == SubscriberState.REMOVED) {
            return;
        }
        broadcaster.unsubscribe(subscriber.getEvent(), subscriber);
    }
}
