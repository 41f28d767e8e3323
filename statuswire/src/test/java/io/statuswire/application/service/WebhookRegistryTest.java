package io.statuswire.application.service;

import io.statuswire.application.service.WebhookValidationException.Reason;
import io.statuswire.domain.model.CreatedWebhook;
import io.statuswire.domain.model.WebhookSubscription;
import io.statuswire.domain.model.WebhookView;
import io.statuswire.security.WebhookUrlValidator;
import io.statuswire.testing.InMemoryWebhookSubscriptionRepository;
import io.statuswire.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WebhookRegistryTest {

    private static final String ALICE = "did:plc:alice";
    private static final String BOB = "did:plc:bob";
    private static final String URL = "https://hooks.example.com/status";

    private InMemoryWebhookSubscriptionRepository repo;
    private MutableClock clock;
    private WebhookRegistry registry;

    @BeforeEach
    void setUp() {
        repo = new InMemoryWebhookSubscriptionRepository();
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        registry = new WebhookRegistry(repo, new WebhookUrlValidator(true), clock);
    }

    @Test
    void createGeneratesSecretAndDefaultsToAllEvents() {
        CreatedWebhook created = registry.create(ALICE, URL, null, null);

        assertEquals(64, created.secret().length());
        WebhookSubscription stored = repo.findById(created.id()).orElseThrow();
        assertEquals(ALICE, stored.ownerDid());
        assertEquals(created.secret(), stored.secret());
        assertEquals(EventFilter.ALL, stored.events());
        assertTrue(stored.active());
        assertNull(stored.lastDeliveryAt());
    }

    @Test
    void createKeepsProvidedSecretAndNormalizesFilter() {
        CreatedWebhook created = registry.create(ALICE, URL, "my-own-secret-123456", " Status.Created , status.created ");

        WebhookSubscription stored = repo.findById(created.id()).orElseThrow();
        assertEquals("my-own-secret-123456", stored.secret());
        assertEquals("status.created", stored.events());
    }

    @Test
    void shortSecretIsRejected() {
        WebhookValidationException e = assertThrows(WebhookValidationException.class,
            () -> registry.create(ALICE, URL, "short", null));

        assertEquals(Reason.SECRET_TOO_SHORT, e.reason());
        assertTrue(registry.list(ALICE).isEmpty());
    }

    @Test
    void invalidTargetsAreRejectedWithReason() {
        assertEquals(Reason.HTTPS_REQUIRED, assertThrows(WebhookValidationException.class,
            () -> registry.create(ALICE, "http://hooks.example.com/status", null, null)).reason());
        assertEquals(Reason.PRIVATE_HOST, assertThrows(WebhookValidationException.class,
            () -> registry.create(ALICE, "https://10.0.0.5/hook", null, null)).reason());
        assertEquals(Reason.UNSUPPORTED_EVENT, assertThrows(WebhookValidationException.class,
            () -> registry.create(ALICE, URL, null, "status.updated")).reason());
    }

    @Test
    void listMasksSecretsAndShowsNewestFirst() {
        CreatedWebhook first = registry.create(ALICE, URL, null, null);
        clock.advance(Duration.ofMinutes(1));
        CreatedWebhook second = registry.create(ALICE, "https://other.example.com/hook", null, null);

        List<WebhookView> views = registry.list(ALICE);

        assertEquals(List.of(second.id(), first.id()), views.stream().map(WebhookView::id).toList());
        WebhookView view = views.get(1);
        assertEquals("****" + first.secret().substring(60), view.maskedSecret());
        assertFalse(view.maskedSecret().contains(first.secret()));
    }

    @Test
    void ownersAreIsolated() {
        CreatedWebhook alices = registry.create(ALICE, URL, null, null);

        assertTrue(registry.list(BOB).isEmpty());
        assertThrows(WebhookNotFoundException.class, () -> registry.find(BOB, alices.id()));
        assertThrows(WebhookNotFoundException.class, () -> registry.update(BOB, alices.id(), null, null, false));
        assertThrows(WebhookNotFoundException.class, () -> registry.rotateSecret(BOB, alices.id()));

        registry.delete(BOB, alices.id());
        assertTrue(repo.findById(alices.id()).isPresent());
    }

    @Test
    void updateAppliesOnlyGivenFields() {
        CreatedWebhook created = registry.create(ALICE, URL, null, "status.created");
        clock.advance(Duration.ofSeconds(30));

        WebhookView view = registry.update(ALICE, created.id(), null, null, false);

        assertEquals(URL, view.url());
        assertEquals("status.created", view.events());
        assertFalse(view.active());
        assertEquals(Instant.parse("2025-03-01T10:00:30Z"), view.updatedAt());
        assertEquals(created.secret(), repo.findById(created.id()).orElseThrow().secret());
    }

    @Test
    void rotateReplacesSecret() {
        CreatedWebhook created = registry.create(ALICE, URL, null, null);

        CreatedWebhook rotated = registry.rotateSecret(ALICE, created.id());

        assertEquals(created.id(), rotated.id());
        assertNotEquals(created.secret(), rotated.secret());
        assertEquals(rotated.secret(), repo.findById(created.id()).orElseThrow().secret());
    }

    @Test
    void deleteIsIdempotent() {
        CreatedWebhook created = registry.create(ALICE, URL, null, null);

        registry.delete(ALICE, created.id());
        registry.delete(ALICE, created.id());
        registry.delete(ALICE, "no-such-id");

        assertTrue(registry.list(ALICE).isEmpty());
    }

    @Test
    void blankOwnerIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.create(" ", URL, null, null));
        assertThrows(IllegalArgumentException.class, () -> registry.list(null));
    }
}
