package com.webauth.backend.modules.sse.infrastructure;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.webauth.backend.modules.sse.application.EventBroadcaster;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class BroadcasterHealthIndicator implements HealthIndicator {

    private final EventBroadcaster broadcaster;

    public BroadcasterHealthIndicator(EventBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @Override
    public Health health() {
        if (!broadcaster.isRunning()) {
            return Health.down().withDetail("reason", "Broadcaster loop is not running").build();
        }
        Map<String, Integer> subscribers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : broadcaster.snapshot().entrySet()) {
            subscribers.put(entry.getKey(), entry.getValue().size());
        }
        return Health.up().withDetail("subscribers", subscribers).build();
    }
}
