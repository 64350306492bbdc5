package com.webauth.backend.modules.sse.domain;

public enum SubscriberState {
    SUBSCRIBED,
    DRAINING,
    REMOVED
}
