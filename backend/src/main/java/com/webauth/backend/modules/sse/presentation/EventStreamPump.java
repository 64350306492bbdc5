package com.webauth.backend.modules.sse.presentation;

import java.io.IOException;
import java.time.Duration;
import java.util.function.Consumer;

import com.webauth.backend.modules.sse.domain.SseMessage;
import com.webauth.backend.modules.sse.domain.Subscriber;
import com.webauth.backend.modules.sse.domain.SubscriberState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains one subscriber queue into its stream. While the event is quiet a comment line is written
 * every heartbeat interval; the servlet container only reports a closed connection on a failed write.
 */
class EventStreamPump implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(EventStreamPump.class);

    private final Subscriber subscriber;
    private final EventStreamEmitter emitter;
    private final Duration pollInterval;
    private final Duration heartbeat;
    private final Consumer<Subscriber> release;

    EventStreamPump(Subscriber subscriber, EventStreamEmitter emitter, Duration pollInterval, Duration heartbeat,
                    Consumer<Subscriber> release) {
        this.subscriber = subscriber;
        this.emitter = emitter;
        this.pollInterval = pollInterval.compareTo(heartbeat) < 0 ? pollInterval : heartbeat;
        this.heartbeat = heartbeat;
        this.release = release;
    }

    @Override
    public void run() {
        long lastWrite = System.nanoTime();
        try {
            while (subscriber.isSubscribed()) {
                SseMessage message = subscriber.poll(pollInterval);
                if (message != null) {
                    emitter.send(message);
                    lastWrite = System.nanoTime();
                } else if (System.nanoTime() - lastWrite >= heartbeat.toNanos()) {
                    emitter.sendHeartbeat();
                    lastWrite = System.nanoTime();
                }
            }
            if (subscriber.getState() == SubscriberState.REMOVED) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException ex) {
            log.info("client disconnected id={} event={}", subscriber.getId(), subscriber.getEvent());
            release.accept(subscriber);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            release.accept(subscriber);
            emitter.complete();
        }
    }
}
