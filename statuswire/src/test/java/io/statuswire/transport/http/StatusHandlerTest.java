package io.statuswire.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.statuswire.application.service.EventDispatcher;
import io.statuswire.application.service.StatusWriteService;
import io.statuswire.domain.model.StatusChange;
import io.statuswire.domain.model.StatusRecord;
import io.statuswire.domain.model.WebhookEventType;
import io.statuswire.testing.InMemoryStatusRepository;
import io.statuswire.testing.MutableClock;
import io.statuswire.util.JsonMapper;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class StatusHandlerTest {

    private static final String ALICE = "did:plc:alice";
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");
    private static final String URI_3K2X9 = "at://did:plc:alice/io.zzstoatzz.status.record/3k2x9";

    private final ObjectMapper mapper = JsonMapper.create();
    private final HttpClient httpClient = HttpClient.newHttpClient();

    private InMemoryStatusRepository store;
    private EventDispatcher dispatcher;
    private Undertow server;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        store = new InMemoryStatusRepository();
        dispatcher = mock(EventDispatcher.class);
        StatusHandler status = new StatusHandler(new StatusWriteService(store, dispatcher),
            WebhookHandler.headerOwnerResolver(), mapper, new MutableClock(NOW));

        server = Undertow.builder()
            .addHttpListener(0, "127.0.0.1")
            .setHandler(new BlockingHandler(Handlers.routing()
                .post("/api/status", status::create)
                .post("/api/status/clear", status::clear)
                .delete("/api/status/{rkey}", status::delete)))
            .build();
        server.start();
        baseUrl = "http://127.0.0.1:" + ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    void createStoresStatusAndAnnouncesIt() throws Exception {
        HttpResponse<String> response = send("POST", "/api/status", ALICE,
            "{\"rkey\":\"3k2x9\",\"emoji\":\"🚀\",\"text\":\"shipping\",\"expires\":\"1h\",\"handle\":\"alice.example.com\"}");

        assertEquals(201, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertEquals(URI_3K2X9, body.get("uri").asText());
        assertEquals("2025-03-01T11:00:00Z", body.get("expiresAt").asText());

        StatusRecord stored = store.findByUri(URI_3K2X9).orElseThrow();
        assertEquals("shipping", stored.text());
        assertEquals(NOW, stored.startedAt());

        ArgumentCaptor<StatusChange> change = ArgumentCaptor.forClass(StatusChange.class);
        verify(dispatcher).dispatch(eq(ALICE), change.capture());
        assertEquals(WebhookEventType.STATUS_CREATED, change.getValue().type());
        assertEquals("alice.example.com", change.getValue().handle());
    }

    @Test
    void badInputIsRejectedBeforeAnythingIsWritten() throws Exception {
        assertEquals(401, send("POST", "/api/status", null, "{\"rkey\":\"a\",\"emoji\":\"🚀\"}").statusCode());
        assertEquals(400, send("POST", "/api/status", ALICE, "{\"rkey\":\"a\"}").statusCode());
        assertEquals(400, send("POST", "/api/status", ALICE, "{\"rkey\":\"a\",\"emoji\":\"🚀\",\"expires\":\"soon\"}").statusCode());
        assertEquals(400, send("POST", "/api/status", ALICE, "{\"rkey\":\"a\",\"emoji\":\"🚀\",\"expires\":\"99999999999999w\"}").statusCode());
        assertEquals(400, send("POST", "/api/status", ALICE, "{rkey:").statusCode());

        assertEquals(0, store.size());
        verify(dispatcher, never()).dispatch(anyString(), any());
    }

    @Test
    void deleteAndClear() throws Exception {
        store.upsert(new StatusRecord(URI_3K2X9, ALICE, "🚀", null, NOW, null, NOW, false));

        HttpResponse<String> cleared = send("POST", "/api/status/clear", ALICE, null);
        assertEquals(200, cleared.statusCode());
        assertTrue(mapper.readTree(cleared.body()).get("cleared").asBoolean());
        assertEquals(0, store.size());

        HttpResponse<String> again = send("POST", "/api/status/clear", ALICE, null);
        assertFalse(mapper.readTree(again.body()).get("cleared").asBoolean());

        assertEquals(204, send("DELETE", "/api/status/3k2x9", ALICE, null).statusCode());
        ArgumentCaptor<StatusChange> change = ArgumentCaptor.forClass(StatusChange.class);
        verify(dispatcher, times(2)).dispatch(eq(ALICE), change.capture());
        assertEquals(WebhookEventType.STATUS_CLEARED, change.getAllValues().get(0).type());
        assertEquals(WebhookEventType.STATUS_DELETED, change.getAllValues().get(1).type());
    }

    private HttpResponse<String> send(String method, String path, String owner, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(Duration.ofSeconds(10))
            .method(method, body != null
                ? HttpRequest.BodyPublishers.ofString(body)
                : HttpRequest.BodyPublishers.noBody());
        if (owner != null) {
            builder.header(WebhookHandler.OWNER_HEADER, owner);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }
}
