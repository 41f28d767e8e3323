package io.statuswire.testing;

import io.statuswire.application.port.output.WebhookSubscriptionRepository;
import io.statuswire.domain.model.WebhookSubscription;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryWebhookSubscriptionRepository implements WebhookSubscriptionRepository {

    private final Map<String, WebhookSubscription> rows = new ConcurrentHashMap<>();

    @Override
    public void insert(WebhookSubscription subscription) {
        if (rows.putIfAbsent(subscription.id(), subscription) != null) {
            throw new IllegalStateException("duplicate id " + subscription.id());
        }
    }

    @Override
    public void update(WebhookSubscription subscription) {
        rows.computeIfPresent(subscription.id(), (id, existing) -> subscription);
    }

    @Override
    public Optional<WebhookSubscription> findById(String id) {
        return Optional.ofNullable(rows.get(id));
    }

    @Override
    public List<WebhookSubscription> findByOwner(String ownerDid) {
        return rows.values().stream()
            .filter(s -> s.ownerDid().equals(ownerDid))
            .sorted(Comparator.comparing(WebhookSubscription::createdAt).reversed())
            .toList();
    }

    @Override
    public boolean delete(String id) {
        return rows.remove(id) != null;
    }

    @Override
    public void touchLastDelivery(String id, Instant deliveredAt) {
        rows.computeIfPresent(id, (key, s) -> new WebhookSubscription(s.id(), s.ownerDid(), s.url(), s.secret(),
            s.events(), s.active(), s.createdAt(), s.updatedAt(), deliveredAt));
    }
}
