package io.statuswire.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.statuswire.application.service.ExpiryParser;
import io.statuswire.application.service.StatusWriteService;
import io.statuswire.domain.model.StatusRecord;
import io.statuswire.domain.model.StatusUri;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Local status write hooks, called by the front end after it has written the record to the
 * user's repository.
 *
 * POST   /api/status          {rkey, emoji, text?, expires?}   expires: 30m | 1h | 2d | 1w
 * DELETE /api/status/{rkey}
 * POST   /api/status/clear
 */
public final class StatusHandler {
    private static final Logger log = LoggerFactory.getLogger(StatusHandler.class);

    private final StatusWriteService statusWrites;
    private final Function<HttpServerExchange, String> ownerResolver;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StatusHandler(StatusWriteService statusWrites,
                         Function<HttpServerExchange, String> ownerResolver,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.statusWrites = statusWrites;
        this.ownerResolver = ownerResolver;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void create(HttpServerExchange exchange) {
        String owner = ownerResolver.apply(exchange);
        if (owner == null) {
            sendError(exchange, StatusCodes.UNAUTHORIZED, "unauthorized");
            return;
        }

        exchange.getRequestReceiver().receiveFullBytes((ex, data) -> {
            try {
                JsonNode body = objectMapper.readTree(data);
                String rkey = body.path("rkey").asText(null);
                String emoji = body.path("emoji").asText(null);
                if (rkey == null || rkey.isBlank() || emoji == null || emoji.isBlank()) {
                    sendError(ex, StatusCodes.BAD_REQUEST, "rkey and emoji are required");
                    return;
                }

                Instant now = clock.instant();
                Instant expiresAt = null;
                String expires = body.path("expires").asText(null);
                if (expires != null && !expires.isBlank()) {
                    Optional<Duration> ttl = ExpiryParser.parse(expires);
                    if (ttl.isEmpty()) {
                        sendError(ex, StatusCodes.BAD_REQUEST, "expires must look like 30m, 1h, 2d or 1w");
                        return;
                    }
                    expiresAt = now.plus(ttl.get());
                }

                String uri = StatusUri.of(owner, StatusRecord.COLLECTION, rkey).value();
                StatusRecord record = new StatusRecord(uri, owner, emoji, body.path("text").asText(null),
                    now, expiresAt, now, false);
                statusWrites.statusCreated(record, body.path("handle").asText(null));

                Map<String, Object> response = new LinkedHashMap<>();
                response.put("uri", uri);
                response.put("emoji", emoji);
                response.put("expiresAt", expiresAt);
                sendJson(ex, StatusCodes.CREATED, response);
            } catch (Exception e) {
                handleFailure(ex, e);
            }
        });
    }

    public void delete(HttpServerExchange exchange) {
        String owner = ownerResolver.apply(exchange);
        if (owner == null) {
            sendError(exchange, StatusCodes.UNAUTHORIZED, "unauthorized");
            return;
        }

        try {
            Deque<String> rkey = exchange.getQueryParameters().get("rkey");
            String uri = StatusUri.of(owner, StatusRecord.COLLECTION, rkey != null ? rkey.peekFirst() : null).value();
            statusWrites.statusDeleted(owner, uri);
            exchange.setStatusCode(StatusCodes.NO_CONTENT);
            exchange.endExchange();
        } catch (Exception e) {
            handleFailure(exchange, e);
        }
    }

    public void clear(HttpServerExchange exchange) {
        String owner = ownerResolver.apply(exchange);
        if (owner == null) {
            sendError(exchange, StatusCodes.UNAUTHORIZED, "unauthorized");
            return;
        }

        try {
            Optional<StatusRecord> cleared = statusWrites.clearStatus(owner);
            sendJson(exchange, StatusCodes.OK, Map.of("cleared", cleared.isPresent()));
        } catch (Exception e) {
            handleFailure(exchange, e);
        }
    }

    private void handleFailure(HttpServerExchange exchange, Exception e) {
        if (e instanceof IllegalArgumentException) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } else if (e instanceof IOException) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "request body must be a JSON object");
        } else {
            log.error("Status write failed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "internal_error");
        }
    }

    private void sendJson(HttpServerExchange exchange, int status, Object data) throws Exception {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(objectMapper.writeValueAsString(data));
    }

    private void sendError(HttpServerExchange exchange, int status, String message) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(objectMapper.createObjectNode().put("error", message).toString());
    }
}
