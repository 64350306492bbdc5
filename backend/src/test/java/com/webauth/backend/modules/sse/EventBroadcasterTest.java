package com.webauth.backend.modules.sse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeout;

import java.time.Duration;
import java.util.List;

import com.webauth.backend.global.config.WebAuthProperties;
import com.webauth.backend.modules.sse.application.BroadcastException;
import com.webauth.backend.modules.sse.application.EventBroadcaster;
import com.webauth.backend.modules.sse.domain.SseMessage;
import com.webauth.backend.modules.sse.domain.Subscriber;
import com.webauth.backend.modules.sse.domain.SubscriberState;
import com.webauth.backend.modules.sse.presentation.SseFrameWriter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventBroadcasterTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    private EventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        WebAuthProperties properties = new WebAuthProperties("Test", "http://localhost", null, null, null, null,
                new WebAuthProperties.Sse("*", 1, Duration.ofMillis(50), null, null, List.of("event1")));
        broadcaster = new EventBroadcaster(properties);
        broadcaster.start();
    }

    @AfterEach
    void tearDown() {
        broadcaster.stop();
    }

    @Test
    void defaultAndConfiguredEventsAreRegistered() {
        assertThat(broadcaster.isRunning()).isTrue();
        assertThat(broadcaster.snapshot()).containsOnlyKeys(EventBroadcaster.DEFAULT_EVENT, "event1");
    }

    @Test
    void publishedMessageReachesSubscriberUntilUnsubscribed() throws Exception {
        Subscriber subscriber = broadcaster.subscribe("A", "event1");
        assertThat(broadcaster.snapshot().get("event1")).containsExactly("A");

        broadcaster.publish(SseMessage.of("event1", "x"));

        SseMessage received = subscriber.poll(WAIT);
        assertThat(received).isNotNull();
        assertThat(SseFrameWriter.frame(received)).isEqualTo("event: event1\ndata: x\n\n");

        broadcaster.unsubscribe("event1", subscriber);

        assertThat(subscriber.getState()).isEqualTo(SubscriberState.REMOVED);
        assertThat(broadcaster.snapshot().get("event1")).isEmpty();
        assertTimeout(Duration.ofSeconds(1), () -> broadcaster.publish(SseMessage.of("event1", "y")));
        assertThat(subscriber.pending()).isZero();
    }

    @Test
    void messagesOnlyReachSubscribersOfTheirEvent() throws Exception {
        Subscriber onDefault = broadcaster.subscribe("A", "");
        Subscriber onEvent1 = broadcaster.subscribe("B", "event1");

        broadcaster.publish(SseMessage.of("", "plain"));

        assertThat(onDefault.poll(WAIT)).isEqualTo(SseMessage.of("", "plain"));
        assertThat(onEvent1.pending()).isZero();
    }

    @Test
    void unregisteredEventIsRejected() {
        assertThatThrownBy(() -> broadcaster.subscribe("A", "nope"))
                .isInstanceOfSatisfying(BroadcastException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(BroadcastException.EVENT_NOT_REGISTERED));
        assertThatThrownBy(() -> broadcaster.publish(SseMessage.of("nope", "x")))
                .isInstanceOf(BroadcastException.class);
        assertThatThrownBy(() -> broadcaster.subscribe("A", " event1"))
                .isInstanceOf(BroadcastException.class);
    }

    @Test
    void registerEventIsIdempotent() {
        broadcaster.registerEvent("event2");
        Subscriber subscriber = broadcaster.subscribe("A", "event2");
        broadcaster.registerEvent("event2");

        assertThat(broadcaster.snapshot())
                .containsOnlyKeys(EventBroadcaster.DEFAULT_EVENT, "event1", "event2")
                .containsEntry("event2", List.of("A"));
        assertThat(subscriber.isSubscribed()).isTrue();
    }

    @Test
    void subscriberWithFullQueueIsDisconnected() {
        Subscriber slow = broadcaster.subscribe("slow", "event1");

        broadcaster.publish(SseMessage.of("event1", "first"));
        broadcaster.publish(SseMessage.of("event1", "second"));

        assertThat(slow.getState()).isEqualTo(SubscriberState.REMOVED);
        assertThat(broadcaster.snapshot().get("event1")).isEmpty();
    }

    @Test
    void stopClosesSubscribersAndRejectsFurtherCommands() {
        Subscriber subscriber = broadcaster.subscribe("A", "event1");

        broadcaster.stop();

        assertThat(broadcaster.isRunning()).isFalse();
        assertThat(subscriber.getState()).isEqualTo(SubscriberState.REMOVED);
        assertThatThrownBy(() -> broadcaster.publish(SseMessage.of("event1", "x")))
                .isInstanceOf(IllegalStateException.class);
        broadcaster.unsubscribe("event1", subscriber);
    }
}
