package com.webauth.backend.modules.sse.domain;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A client listening to one event, with its bounded delivery queue.
 * State only moves forward: SUBSCRIBED, DRAINING, REMOVED.
 */
public class Subscriber {

    private final String id;
    private final String event;
    private final BlockingQueue<SseMessage> queue;
    private final AtomicReference<SubscriberState> state = new AtomicReference<>(SubscriberState.SUBSCRIBED);

    public Subscriber(String id, String event, int capacity) {
        this.id = id;
        this.event = event;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public String getId() {
        return id;
    }

    public String getEvent() {
        return event;
    }

    public SubscriberState getState() {
        return state.get();
    }

    public boolean isSubscribed() {
        return state.get() == SubscriberState.SUBSCRIBED;
    }

    /**
     * Waits up to {@code timeout} for free space. Returns false when the queue stayed full.
     */
    public boolean offer(SseMessage message, Duration timeout) throws InterruptedException {
        return queue.offer(message, timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public SseMessage poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public int pending() {
        return queue.size();
    }

    /**
     * The client went away; no further messages are delivered.
     */
    public void markDraining() {
        state.compareAndSet(SubscriberState.SUBSCRIBED, SubscriberState.DRAINING);
    }

    public void close() {
        state.set(SubscriberState.REMOVED);
        queue.clear();
    }

    @Override
    public String toString() {
        return "Subscriber[id=" + id + ", event=" + event + ", state=" + state.get() + "]";
    }
}
