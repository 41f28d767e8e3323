package io.statuswire.application.port.output;

import io.statuswire.domain.model.WebhookSubscription;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Webhook subscriptions. Ownership checks live in the service, not here.
 */
public interface WebhookSubscriptionRepository {

    void insert(WebhookSubscription subscription);

    void update(WebhookSubscription subscription);

    Optional<WebhookSubscription> findById(String id);

    /**
     * All subscriptions of an owner, newest first.
     */
    List<WebhookSubscription> findByOwner(String ownerDid);

    boolean delete(String id);

    void touchLastDelivery(String id, Instant deliveredAt);
}
