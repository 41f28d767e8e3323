package io.statuswire.application.service;

import io.statuswire.application.port.output.WebhookSubscriptionRepository;
import io.statuswire.application.service.WebhookValidationException.Reason;
import io.statuswire.domain.model.CreatedWebhook;
import io.statuswire.domain.model.WebhookSubscription;
import io.statuswire.domain.model.WebhookView;
import io.statuswire.security.WebhookSecrets;
import io.statuswire.security.WebhookUrlValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Owner-scoped management of webhook subscriptions.
 *
 * Every operation is checked against the caller's DID. A subscription owned by someone else is
 * reported exactly like a missing one, so ids cannot be probed.
 */
public final class WebhookRegistry {
    private static final Logger log = LoggerFactory.getLogger(WebhookRegistry.class);

    private final WebhookSubscriptionRepository subscriptionRepo;
    private final WebhookUrlValidator urlValidator;
    private final Clock clock;

    public WebhookRegistry(WebhookSubscriptionRepository subscriptionRepo, WebhookUrlValidator urlValidator,
                           Clock clock) {
        this.subscriptionRepo = subscriptionRepo;
        this.urlValidator = urlValidator;
        this.clock = clock;
    }

    /**
     * @param secret      optional; generated when null or blank
     * @param eventFilter optional; all events when null or blank
     * @return id and the plaintext secret, shown to the owner only now
     */
    public CreatedWebhook create(String ownerDid, String url, String secret, String eventFilter) {
        requireOwner(ownerDid);
        String validUrl = urlValidator.validate(url).toString();
        String events = EventFilter.parse(eventFilter);
        String plaintext = resolveSecret(secret);

        Instant now = clock.instant();
        WebhookSubscription subscription = new WebhookSubscription(
            UUID.randomUUID().toString(), ownerDid, validUrl, plaintext, events, true, now, now, null);
        subscriptionRepo.insert(subscription);

        log.info("[WEBHOOK] Created {} for {} (events={})", subscription.id(), ownerDid, events);
        return new CreatedWebhook(subscription.id(), plaintext);
    }

    /**
     * Applies the non-null fields.
     */
    public WebhookView update(String ownerDid, String id, String url, String eventFilter, Boolean active) {
        WebhookSubscription existing = requireOwned(ownerDid, id);

        String newUrl = url != null ? urlValidator.validate(url).toString() : existing.url();
        String newEvents = eventFilter != null ? EventFilter.parse(eventFilter) : existing.events();
        boolean newActive = active != null ? active : existing.active();

        WebhookSubscription updated = existing.withChanges(newUrl, newEvents, newActive, clock.instant());
        subscriptionRepo.update(updated);

        log.info("[WEBHOOK] Updated {} (events={}, active={})", id, newEvents, newActive);
        return WebhookView.of(updated);
    }

    /**
     * Replaces the signing secret. Deliveries from now on are signed with the new one.
     */
    public CreatedWebhook rotateSecret(String ownerDid, String id) {
        WebhookSubscription existing = requireOwned(ownerDid, id);
        String secret = WebhookSecrets.generate();
        subscriptionRepo.update(existing.withSecret(secret, clock.instant()));

        log.info("[WEBHOOK] Rotated secret for {}", id);
        return new CreatedWebhook(id, secret);
    }

    /**
     * Idempotent. Deleting a missing or foreign id succeeds without effect.
     */
    public void delete(String ownerDid, String id) {
        requireOwner(ownerDid);
        subscriptionRepo.findById(id)
            .filter(sub -> sub.ownerDid().equals(ownerDid))
            .ifPresent(sub -> {
                subscriptionRepo.delete(sub.id());
                log.info("[WEBHOOK] Deleted {} for {}", sub.id(), ownerDid);
            });
    }

    /**
     * Owner's subscriptions, secrets masked, newest first.
     */
    public List<WebhookView> list(String ownerDid) {
        return subscriptionsOf(ownerDid).stream()
            .map(WebhookView::of)
            .toList();
    }

    public WebhookView find(String ownerDid, String id) {
        return WebhookView.of(requireOwned(ownerDid, id));
    }

    /**
     * Full subscriptions including secrets, newest first. For delivery only.
     */
    public List<WebhookSubscription> subscriptionsOf(String ownerDid) {
        requireOwner(ownerDid);
        return subscriptionRepo.findByOwner(ownerDid).stream()
            .sorted(Comparator.comparing(WebhookSubscription::createdAt).reversed())
            .toList();
    }

    /**
     * @throws WebhookNotFoundException if missing or not owned by {@code ownerDid}
     */
    public WebhookSubscription requireOwned(String ownerDid, String id) {
        requireOwner(ownerDid);
        if (id == null) {
            throw new WebhookNotFoundException(null);
        }
        return subscriptionRepo.findById(id)
            .filter(sub -> sub.ownerDid().equals(ownerDid))
            .orElseThrow(() -> new WebhookNotFoundException(id));
    }

    void recordDelivery(String id, Instant deliveredAt) {
        subscriptionRepo.touchLastDelivery(id, deliveredAt);
    }

    private static String resolveSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            return WebhookSecrets.generate();
        }
        if (secret.length() < WebhookSecrets.MIN_SECRET_LENGTH) {
            throw new WebhookValidationException(Reason.SECRET_TOO_SHORT,
                "Secret must be at least " + WebhookSecrets.MIN_SECRET_LENGTH + " characters");
        }
        return secret;
    }

    private static void requireOwner(String ownerDid) {
        if (ownerDid == null || ownerDid.isBlank()) {
            throw new IllegalArgumentException("Owner DID is required");
        }
    }
}
