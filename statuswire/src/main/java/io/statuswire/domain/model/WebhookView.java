package io.statuswire.domain.model;

import java.time.Instant;

/**
 * Subscription as shown back to its owner, secret masked.
 */
public record WebhookView(
        String id,
        String url,
        String maskedSecret,
        String events,
        boolean active,
        Instant createdAt,
        Instant updatedAt,
        Instant lastDeliveryAt) {

    public static WebhookView of(WebhookSubscription sub) {
        return new WebhookView(sub.id(), sub.url(), sub.maskedSecret(), sub.events(), sub.active(),
            sub.createdAt(), sub.updatedAt(), sub.lastDeliveryAt());
    }
}
