package io.statuswire.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.statuswire.application.service.RecordIngestor;
import io.statuswire.infrastructure.firehose.FirehoseConsumer;
import io.statuswire.infrastructure.firehose.FirehoseMessageDecoder;
import io.statuswire.infrastructure.firehose.FirehoseSettings;
import io.statuswire.infrastructure.firehose.ReconnectionPolicy;
import io.statuswire.infrastructure.metrics.PipelineMetrics;
import io.statuswire.testing.InMemoryStatusRepository;
import io.statuswire.testing.MutableClock;
import io.statuswire.util.JsonMapper;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HealthHandlerTest {

    private final ObjectMapper mapper = JsonMapper.create();
    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
    private Undertow server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void reportsDisabledFirehose() throws Exception {
        JsonNode health = get(new HealthHandler(null, mapper, clock));

        assertEquals("ok", health.get("status").asText());
        assertEquals("2025-03-01T10:00:00Z", health.get("ts").asText());
        assertFalse(health.get("firehose").get("enabled").asBoolean());
    }

    @Test
    void reportsFirehoseCursorAndConnection() throws Exception {
        PipelineMetrics metrics = new PipelineMetrics(new CollectorRegistry());
        FirehoseConsumer firehose = new FirehoseConsumer(
            new FirehoseSettings(FirehoseSettings.DEFAULT_ENDPOINT, List.of(FirehoseSettings.STATUS_COLLECTION), 8,
                Duration.ofSeconds(1)),
            new RecordIngestor(new InMemoryStatusRepository(), mapper, clock, metrics),
            new FirehoseMessageDecoder(mapper), metrics, HttpClient.newHttpClient(),
            ReconnectionPolicy.forFirehose(1), e -> { });
        firehose.getCursor().advance(1725911162329308L);

        JsonNode feed = get(new HealthHandler(firehose, mapper, clock)).get("firehose");

        assertTrue(feed.get("enabled").asBoolean());
        assertFalse(feed.get("connected").asBoolean());
        assertEquals(0, feed.get("queued").asInt());
        assertEquals(1725911162329308L, feed.get("cursor").asLong());
    }

    private JsonNode get(HttpHandler handler) throws Exception {
        server = Undertow.builder().addHttpListener(0, "127.0.0.1").setHandler(handler).build();
        server.start();
        int port = ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
        HttpResponse<String> response = HttpClient.newHttpClient().send(
            HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/api/health")).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        assertEquals(200, response.statusCode());
        return mapper.readTree(response.body());
    }
}
