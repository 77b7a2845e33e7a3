package com.ewsmon.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Customer-registered endpoint receiving signed availability events.
 *
 * @param events comma separated event names, e.g. {@code "up,down,incident"}
 */
public record WebhookSubscription(long id, String url, String secret, String events, boolean active) {

    public WebhookSubscription {
        Objects.requireNonNull(url, "url");
    }

    public boolean subscribesTo(String eventType) {
        if (events == null || eventType == null) {
            return false;
        }
        return Arrays.stream(events.split(","))
                .map(String::trim)
                .filter(e -> !e.isEmpty())
                .anyMatch(eventType::equals);
    }

    public boolean subscribesTo(AlertEventType type) {
        return type != null && subscribesTo(type.wireValue());
    }
}
