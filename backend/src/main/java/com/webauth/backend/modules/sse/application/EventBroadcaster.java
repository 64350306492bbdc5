package com.webauth.backend.modules.sse.application;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;

import com.webauth.backend.global.config.WebAuthProperties;
import com.webauth.backend.modules.sse.domain.SseMessage;
import com.webauth.backend.modules.sse.domain.Subscriber;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Fans published messages out to the subscribers of each event.
 * <p>
 * The subscriber map is owned by a single thread that applies register, subscribe, unsubscribe
 * and publish commands in arrival order, so callers never share it. A publish returns once every
 * subscriber queue has accepted the message. A subscriber whose queue stays full for longer than
 * the configured send timeout is disconnected instead of stalling the fan-out.
 */
@Component
public class EventBroadcaster implements SmartLifecycle {

    public static final String DEFAULT_EVENT = "";

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(5);

    private final BlockingQueue<Command> commands = new LinkedBlockingQueue<>();
    private final Object lifecycleMonitor = new Object();
    private final Map<String, List<Subscriber>> subscribers = new LinkedHashMap<>();
    private final int queueCapacity;
    private final Duration sendTimeout;

    private boolean accepting;
    private volatile Thread owner;

    public EventBroadcaster(WebAuthProperties properties) {
        WebAuthProperties.Sse sse = properties.sse();
        this.queueCapacity = sse.queueCapacity();
        this.sendTimeout = sse.sendTimeout();
        subscribers.put(DEFAULT_EVENT, new ArrayList<>());
        for (String event : sse.events()) {
            subscribers.putIfAbsent(normalize(event), new ArrayList<>());
        }
    }

    /**
     * Declares an event name as permitted. Registering a known name again has no effect.
     */
    public void registerEvent(String event) {
        CompletableFuture<Void> reply = new CompletableFuture<>();
        submit(new RegisterEvent(normalize(event), reply), reply);
    }

    public Subscriber subscribe(String id, String event) {
        CompletableFuture<Subscriber> reply = new CompletableFuture<>();
        return submit(new Subscribe(id, normalize(event), reply), reply);
    }

    public void publish(SseMessage message) {
        CompletableFuture<Void> reply = new CompletableFuture<>();
        submit(new Publish(message, reply), reply);
    }

    /**
     * Removes the subscriber from its event. Safe to call more than once and after shutdown.
     */
    public void unsubscribe(String event, Subscriber subscriber) {
        subscriber.markDraining();
        CompletableFuture<Void> reply = new CompletableFuture<>();
        if (!enqueue(new Unsubscribe(normalize(event), subscriber, reply))) {
            subscriber.close();
            return;
        }
        await(reply);
    }

    /**
     * Subscriber ids per registered event, in subscription order.
     */
    public Map<String, List<String>> snapshot() {
        CompletableFuture<Map<String, List<String>>> reply = new CompletableFuture<>();
        return submit(new Snapshot(reply), reply);
    }

    /**
     * Runs the owner loop on the calling thread until {@link #stop()} is called or the thread is interrupted.
     */
    public void run() {
        synchronized (lifecycleMonitor) {
            accepting = true;
        }
        log.info("event broadcaster started events={}", subscribers.keySet());
        Command current = null;
        try {
            while (true) {
                current = commands.take();
                if (current instanceof Shutdown) {
                    break;
                }
                apply(current);
                current = null;
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            if (current != null) {
                current.reply().completeExceptionally(new IllegalStateException("event broadcaster interrupted"));
            }
        } finally {
            shutDown(current);
        }
    }

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (owner != null) {
                return;
            }
            accepting = true;
            Thread thread = new Thread(this::run, "sse-broadcaster");
            thread.setDaemon(true);
            owner = thread;
            thread.start();
        }
    }

    @Override
    public void stop() {
        Thread thread = owner;
        if (thread == null) {
            return;
        }
        CompletableFuture<Void> reply = new CompletableFuture<>();
        if (enqueue(new Shutdown(reply))) {
            try {
                thread.join(STOP_TIMEOUT.toMillis());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        if (thread.isAlive()) {
            log.warn("event broadcaster did not stop within {}, interrupting", STOP_TIMEOUT);
            thread.interrupt();
        }
        owner = null;
    }

    @Override
    public boolean isRunning() {
        Thread thread = owner;
        return thread != null && thread.isAlive();
    }

    private void apply(Command command) throws InterruptedException {
        if (command instanceof RegisterEvent register) {
            if (subscribers.putIfAbsent(register.event(), new ArrayList<>()) == null) {
                log.info("registered event={}", register.event());
            }
            register.reply().complete(null);
        } else if (command instanceof Subscribe subscribe) {
            List<Subscriber> targets = subscribers.get(subscribe.event());
            if (targets == null) {
                subscribe.reply().completeExceptionally(BroadcastException.eventNotRegistered(subscribe.event()));
                return;
            }
            Subscriber subscriber = new Subscriber(subscribe.id(), subscribe.event(), queueCapacity);
            targets.add(subscriber);
            log.debug("added subscriber id={} event={}", subscriber.getId(), subscriber.getEvent());
            subscribe.reply().complete(subscriber);
        } else if (command instanceof Unsubscribe unsubscribe) {
            List<Subscriber> targets = subscribers.get(unsubscribe.event());
            if (targets != null && targets.remove(unsubscribe.subscriber())) {
                log.debug("removed subscriber id={} event={}", unsubscribe.subscriber().getId(), unsubscribe.event());
            }
            unsubscribe.subscriber().close();
            unsubscribe.reply().complete(null);
        } else if (command instanceof Publish publish) {
            fanOut(publish);
        } else if (command instanceof Snapshot snapshot) {
            Map<String, List<String>> view = new LinkedHashMap<>();
            subscribers.forEach((event, targets) ->
                    view.put(event, targets.stream().map(Subscriber::getId).toList()));
            snapshot.reply().complete(view);
        }
    }

    private void fanOut(Publish publish) throws InterruptedException {
        SseMessage message = publish.message();
        List<Subscriber> targets = subscribers.get(message.event());
        if (targets == null) {
            publish.reply().completeExceptionally(BroadcastException.eventNotRegistered(message.event()));
            return;
        }
        log.debug("start broadcast event={} subscribers={}", message.event(), targets.size());
        Iterator<Subscriber> it = targets.iterator();
        while (it.hasNext()) {
            Subscriber subscriber = it.next();
            if (!subscriber.isSubscribed()) {
                it.remove();
                subscriber.close();
                continue;
            }
            if (!subscriber.offer(message, sendTimeout)) {
                log.warn("disconnecting slow subscriber id={} event={} pending={}",
                        subscriber.getId(), message.event(), subscriber.pending());
                it.remove();
                subscriber.close();
            }
        }
        publish.reply().complete(null);
    }

    private void shutDown(Command interrupted) {
        List<Command> pending = new ArrayList<>();
        synchronized (lifecycleMonitor) {
            accepting = false;
            commands.drainTo(pending);
        }
        for (Command command : pending) {
            if (command != interrupted) {
                command.reply().completeExceptionally(new IllegalStateException("event broadcaster stopped"));
            }
        }
        subscribers.values().forEach(targets -> {
            targets.forEach(Subscriber::close);
            targets.clear();
        });
        if (interrupted instanceof Shutdown shutdown) {
            shutdown.reply().complete(null);
        }
        log.info("event broadcaster stopped");
    }

    private boolean enqueue(Command command) {
        synchronized (lifecycleMonitor) {
            if (!accepting) {
                return false;
            }
            commands.add(command);
            return true;
        }
    }

    private <T> T submit(Command command, CompletableFuture<T> reply) {
        if (!enqueue(command)) {
            throw new IllegalStateException("event broadcaster is not running");
        }
        return await(reply);
    }

    private static <T> T await(CompletableFuture<T> reply) {
        try {
            return reply.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }

    private static String normalize(String event) {
        return event != null ? event : DEFAULT_EVENT;
    }

    private interface Command {
        CompletableFuture<?> reply();
    }

    private record RegisterEvent(String event, CompletableFuture<Void> reply) implements Command {
    }

    private record Subscribe(String id, String event, CompletableFuture<Subscriber> reply) implements Command {
    }

    private record Unsubscribe(String event, Subscriber subscriber, CompletableFuture<Void> reply) implements Command {
    }

    private record Publish(SseMessage message, CompletableFuture<Void> reply) implements Command {
    }

    private record Snapshot(CompletableFuture<Map<String, List<String>>> reply) implements Command {
    }

    private record Shutdown(CompletableFuture<Void> reply) implements Command {
    }
}
