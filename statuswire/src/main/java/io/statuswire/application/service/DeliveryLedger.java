package io.statuswire.application.service;

import io.statuswire.application.port.output.DeliveryAttemptRepository;
import io.statuswire.domain.model.DeliveryAttempt;
import io.statuswire.domain.model.DeliveryStatus;
import io.statuswire.domain.model.WebhookEvent;
import io.statuswire.domain.model.WebhookSubscription;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Audit trail of webhook deliveries.
 *
 * An attempt is written PENDING before the POST and completed exactly once afterwards:
 * DELIVERED for a 2xx answer, FAILED for anything else including network errors (status 0).
 */
public final class DeliveryLedger {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final DeliveryAttemptRepository attemptRepo;
    private final WebhookRegistry registry;
    private final Clock clock;

    public DeliveryLedger(DeliveryAttemptRepository attemptRepo, WebhookRegistry registry, Clock clock) {
        this.attemptRepo = attemptRepo;
        this.registry = registry;
        this.clock = clock;
    }

    public DeliveryAttempt open(WebhookSubscription subscription, WebhookEvent event, String payload) {
        DeliveryAttempt attempt = DeliveryAttempt.pending(
            UUID.randomUUID().toString(), subscription.id(), event.eventId(), event.type(), payload, clock.instant());
        attemptRepo.insert(attempt);
        return attempt;
    }

    public DeliveryAttempt complete(DeliveryAttempt attempt, int httpStatus, String responseBody) {
        DeliveryStatus status = httpStatus >= 200 && httpStatus < 300 ? DeliveryStatus.DELIVERED : DeliveryStatus.FAILED;
        return finish(attempt, status, httpStatus, responseBody);
    }

    /**
     * Network failure, timeout or any error before a response arrived.
     */
    public DeliveryAttempt fail(DeliveryAttempt attempt, String error) {
        return finish(attempt, DeliveryStatus.FAILED, 0, error);
    }

    /**
     * Most recent attempts for one owned subscription.
     *
     * @param limit null for the default of 20; clamped to [1, 100]
     * @throws WebhookNotFoundException if the subscription is missing or not owned
     */
    public List<DeliveryAttempt> recent(String ownerDid, String subscriptionId, Integer limit) {
        WebhookSubscription subscription = registry.requireOwned(ownerDid, subscriptionId);
        return attemptRepo.findBySubscription(subscription.id(), clampLimit(limit));
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    private DeliveryAttempt finish(DeliveryAttempt attempt, DeliveryStatus status, int httpStatus, String body) {
        if (attempt.status().isTerminal()) {
            throw new IllegalStateException("Delivery attempt " + attempt.id() + " already " + attempt.status());
        }
        DeliveryAttempt done = attempt.completed(status, httpStatus, body, clock.instant());
        if (!attemptRepo.complete(done)) {
            throw new IllegalStateException("Delivery attempt " + attempt.id() + " was already completed");
        }
        return done;
    }
}
