package io.statuswire.domain.model;

import io.statuswire.security.WebhookSecrets;

import java.time.Instant;

/**
 * Owner-scoped webhook subscription. {@code secret} is plaintext and never leaves the service unmasked
 * except on create and rotate.
 */
public record WebhookSubscription(
        String id,
        String ownerDid,
        String url,
        String secret,
        String events,          // "*" or comma separated event names
        boolean active,
        Instant createdAt,
        Instant updatedAt,
        Instant lastDeliveryAt) {

    public String maskedSecret() {
        return WebhookSecrets.mask(secret);
    }

    public WebhookSubscription withSecret(String newSecret, Instant now) {
        return new WebhookSubscription(id, ownerDid, url, newSecret, events, active, createdAt, now, lastDeliveryAt);
    }

    public WebhookSubscription withChanges(String newUrl, String newEvents, boolean newActive, Instant now) {
        return new WebhookSubscription(id, ownerDid, newUrl, secret, newEvents, newActive, createdAt, now, lastDeliveryAt);
    }
}
