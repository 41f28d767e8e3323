package io.statuswire.application.service;

import io.statuswire.domain.model.StatusChange;
import io.statuswire.domain.model.StatusRecord;
import io.statuswire.domain.model.WebhookEventType;
import io.statuswire.testing.InMemoryStatusRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StatusWriteServiceTest {

    private static final String ALICE = "did:plc:alice";
    private static final String URI = "at://did:plc:alice/io.zzstoatzz.status.record/3k2x9";

    @Mock
    private EventDispatcher dispatcher;

    @Captor
    private ArgumentCaptor<StatusChange> change;

    private InMemoryStatusRepository store;
    private StatusWriteService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryStatusRepository();
        service = new StatusWriteService(store, dispatcher);
    }

    @Test
    void createdStatusIsStoredAndAnnounced() {
        StatusRecord record = record(URI, "🚀", Instant.parse("2025-03-01T10:00:00Z"));

        service.statusCreated(record, "alice.example.com");

        assertEquals(record, store.findByUri(URI).orElseThrow());
        verify(dispatcher).dispatch(eq(ALICE), change.capture());
        assertEquals(WebhookEventType.STATUS_CREATED, change.getValue().type());
        assertEquals("🚀", change.getValue().emoji());
        assertEquals("alice.example.com", change.getValue().handle());
        assertEquals(URI, change.getValue().statusUri());
    }

    @Test
    void deleteAnnouncesEvenWhenAlreadyGone() {
        service.statusDeleted(ALICE, URI);

        verify(dispatcher).dispatch(eq(ALICE), change.capture());
        assertEquals(WebhookEventType.STATUS_DELETED, change.getValue().type());
        assertNull(change.getValue().emoji());
    }

    @Test
    void deletingSomeoneElsesStatusIsRejected() {
        store.upsert(record(URI, "🚀", Instant.now()));

        assertThrows(IllegalArgumentException.class, () -> service.statusDeleted("did:plc:mallory", URI));

        assertTrue(store.findByUri(URI).isPresent());
        verify(dispatcher, never()).dispatch(anyString(), any());
    }

    @Test
    void clearRemovesNewestStatusAndAnnouncesIt() {
        store.upsert(record("at://did:plc:alice/io.zzstoatzz.status.record/old", "😴", Instant.parse("2025-03-01T08:00:00Z")));
        store.upsert(record(URI, "🚀", Instant.parse("2025-03-01T10:00:00Z")));

        Optional<StatusRecord> cleared = service.clearStatus(ALICE);

        assertEquals(URI, cleared.orElseThrow().uri());
        assertTrue(store.findByUri(URI).isEmpty());
        verify(dispatcher).dispatch(eq(ALICE), change.capture());
        assertEquals(WebhookEventType.STATUS_CLEARED, change.getValue().type());
        assertEquals("🚀", change.getValue().emoji());
    }

    @Test
    void clearWithoutStatusDoesNothing() {
        assertTrue(service.clearStatus(ALICE).isEmpty());
        verify(dispatcher, never()).dispatch(anyString(), any());
    }

    private static StatusRecord record(String uri, String emoji, Instant startedAt) {
        return new StatusRecord(uri, ALICE, emoji, null, startedAt, null, startedAt, false);
    }
}
