package io.statuswire.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.statuswire.infrastructure.firehose.FirehoseConsumer;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.time.Clock;
import java.util.OptionalLong;

/**
 * GET /api/health
 */
public final class HealthHandler implements HttpHandler {

    private final FirehoseConsumer firehose; // null when the firehose is disabled
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HealthHandler(FirehoseConsumer firehose, ObjectMapper objectMapper, Clock clock) {
        this.firehose = firehose;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        ObjectNode health = objectMapper.createObjectNode();
        health.put("status", "ok");
        health.put("ts", clock.instant().toString());

        ObjectNode feed = health.putObject("firehose");
        feed.put("enabled", firehose != null);
        if (firehose != null) {
            feed.put("connected", firehose.isConnected());
            feed.put("queued", firehose.getQueuedFrames());
            OptionalLong cursor = firehose.getCursor().current();
            if (cursor.isPresent()) {
                feed.put("cursor", cursor.getAsLong());
            } else {
                feed.putNull("cursor");
            }
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(objectMapper.writeValueAsString(health));
    }
}
