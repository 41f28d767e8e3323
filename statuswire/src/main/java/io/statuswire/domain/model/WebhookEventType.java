package io.statuswire.domain.model;

import java.util.Optional;

/**
 * Event names delivered to webhook subscribers.
 */
public enum WebhookEventType {
    STATUS_CREATED("status.created"),
    STATUS_DELETED("status.deleted"),
    STATUS_CLEARED("status.cleared");

    private final String wireName;

    WebhookEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<WebhookEventType> fromWire(String name) {
        for (WebhookEventType type : values()) {
            if (type.wireName.equalsIgnoreCase(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
