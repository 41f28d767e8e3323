package io.statuswire.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.statuswire.application.service.DeliveryLedger;
import io.statuswire.application.service.EventDispatcher;
import io.statuswire.application.service.WebhookNotFoundException;
import io.statuswire.application.service.WebhookRegistry;
import io.statuswire.application.service.WebhookValidationException;
import io.statuswire.domain.model.CreatedWebhook;
import io.statuswire.domain.model.DeliveryAttempt;
import io.statuswire.domain.model.WebhookView;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * HTTP handler for webhook management under {@code /api/webhooks}.
 *
 * The caller's DID comes from {@code ownerResolver}; a null result is answered with 401.
 * Handlers block on the store and, for {@code /test}, on the remote endpoint, so routes are
 * expected to run on worker threads.
 */
public final class WebhookHandler {
    private static final Logger log = LoggerFactory.getLogger(WebhookHandler.class);

    public static final String OWNER_HEADER = "X-Owner-Did";

    private final WebhookRegistry registry;
    private final DeliveryLedger ledger;
    private final EventDispatcher dispatcher;
    private final Function<HttpServerExchange, String> ownerResolver;
    private final ObjectMapper objectMapper;

    public WebhookHandler(WebhookRegistry registry,
                          DeliveryLedger ledger,
                          EventDispatcher dispatcher,
                          Function<HttpServerExchange, String> ownerResolver,
                          ObjectMapper objectMapper) {
        this.registry = registry;
        this.ledger = ledger;
        this.dispatcher = dispatcher;
        this.ownerResolver = ownerResolver;
        this.objectMapper = objectMapper;
    }

    /**
     * Owner taken from the {@code X-Owner-Did} header set by the authenticating front end.
     */
    public static Function<HttpServerExchange, String> headerOwnerResolver() {
        return exchange -> {
            String did = exchange.getRequestHeaders().getFirst(OWNER_HEADER);
            return did != null && !did.isBlank() ? did.trim() : null;
        };
    }

    /**
     * GET /api/webhooks
     */
    public void list(HttpServerExchange exchange) {
        String owner = ownerResolver.apply(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        try {
            List<WebhookView> views = registry.list(owner);
            sendJson(exchange, StatusCodes.OK, Map.of("webhooks", views));
        } catch (Exception e) {
            handleFailure(exchange, "list webhooks", e);
        }
    }

    /**
     * POST /api/webhooks {url, secret?, events?}
     */
    public void create(HttpServerExchange exchange) {
        String owner = ownerResolver.apply(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        exchange.getRequestReceiver().receiveFullBytes((ex, data) -> {
            try {
                JsonNode body = readBody(data);
                CreatedWebhook created = registry.create(owner,
                    text(body, "url"), text(body, "secret"), text(body, "events"));
                sendJson(ex, StatusCodes.CREATED, secretResponse(created));
            } catch (Exception e) {
                handleFailure(ex, "create webhook", e);
            }
        });
    }

    /**
     * PUT /api/webhooks/{id} {url?, events?, active?}
     */
    public void update(HttpServerExchange exchange) {
        String owner = ownerResolver.apply(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }
        String id = pathParam(exchange, "id");

        exchange.getRequestReceiver().receiveFullBytes((ex, data) -> {
            try {
                JsonNode body = readBody(data);
                JsonNode activeNode = body.get("active");
                Boolean active = activeNode != null && activeNode.isBoolean() ? activeNode.booleanValue() : null;
                WebhookView view = registry.update(owner, id, text(body, "url"), text(body, "events"), active);
                sendJson(ex, StatusCodes.OK, view);
            } catch (Exception e) {
                handleFailure(ex, "update webhook", e);
            }
        });
    }

    /**
     * POST /api/webhooks/{id}/rotate
     */
    public void rotate(HttpServerExchange exchange) {
        String owner = ownerResolver.apply(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        try {
            CreatedWebhook rotated = registry.rotateSecret(owner, pathParam(exchange, "id"));
            sendJson(exchange, StatusCodes.OK, secretResponse(rotated));
        } catch (Exception e) {
            handleFailure(exchange, "rotate webhook secret", e);
        }
    }

    /**
     * DELETE /api/webhooks/{id}
     */
    public void delete(HttpServerExchange exchange) {
        String owner = ownerResolver.apply(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        try {
            registry.delete(owner, pathParam(exchange, "id"));
            exchange.setStatusCode(StatusCodes.NO_CONTENT);
            exchange.endExchange();
        } catch (Exception e) {
            handleFailure(exchange, "delete webhook", e);
        }
    }

    /**
     * POST /api/webhooks/{id}/test
     */
    public void test(HttpServerExchange exchange) {
        String owner = ownerResolver.apply(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        try {
            DeliveryAttempt attempt = dispatcher.sendTest(owner, pathParam(exchange, "id"));
            sendJson(exchange, StatusCodes.OK, attemptResponse(attempt));
        } catch (Exception e) {
            handleFailure(exchange, "send test webhook", e);
        }
    }

    /**
     * GET /api/webhooks/{id}/deliveries?limit=
     */
    public void deliveries(HttpServerExchange exchange) {
        String owner = ownerResolver.apply(exchange);
        if (owner == null) {
            sendUnauthorized(exchange);
            return;
        }

        try {
            Integer limit = intParam(exchange, "limit");
            List<Map<String, Object>> attempts = ledger.recent(owner, pathParam(exchange, "id"), limit).stream()
                .map(WebhookHandler::attemptResponse)
                .toList();
            sendJson(exchange, StatusCodes.OK, Map.of("deliveries", attempts));
        } catch (Exception e) {
            handleFailure(exchange, "list deliveries", e);
        }
    }

    private JsonNode readBody(byte[] data) throws IOException {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Request body is required");
        }
        JsonNode node = objectMapper.readTree(data);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        return node;
    }

    private static String text(JsonNode body, String field) {
        JsonNode value = body.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String pathParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values != null ? values.peekFirst() : null;
    }

    private static Integer intParam(HttpServerExchange exchange, String name) {
        String value = pathParam(exchange, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }

    private static Map<String, Object> secretResponse(CreatedWebhook created) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", created.id());
        map.put("secret", created.secret());
        return map;
    }

    static Map<String, Object> attemptResponse(DeliveryAttempt attempt) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", attempt.id());
        map.put("subscriptionId", attempt.subscriptionId());
        map.put("eventId", attempt.eventId());
        map.put("eventType", attempt.eventType());
        map.put("attemptedAt", attempt.attemptedAt());
        map.put("status", attempt.status().name());
        map.put("success", attempt.success());
        map.put("responseStatus", attempt.responseStatus());
        map.put("responseBody", attempt.responseBody());
        map.put("completedAt", attempt.completedAt());
        return map;
    }

    private void handleFailure(HttpServerExchange exchange, String action, Exception e) {
        if (e instanceof WebhookValidationException ve) {
            sendJson(exchange, StatusCodes.BAD_REQUEST, errorBody(ve.reason().code(), ve.getMessage()));
        } else if (e instanceof WebhookNotFoundException) {
            sendJson(exchange, StatusCodes.NOT_FOUND, Map.of("error", "not_found"));
        } else if (e instanceof IllegalArgumentException || e instanceof IOException) {
            sendJson(exchange, StatusCodes.BAD_REQUEST, errorBody("invalid_request", e.getMessage()));
        } else {
            log.error("Failed to {}: {}", action, e.getMessage(), e);
            sendJson(exchange, StatusCodes.INTERNAL_SERVER_ERROR, Map.of("error", "internal_error"));
        }
    }

    private static Map<String, Object> errorBody(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return body;
    }

    private void sendJson(HttpServerExchange exchange, int status, Object data) {
        try {
            String json = objectMapper.writeValueAsString(data);
            exchange.setStatusCode(status);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
            exchange.getResponseSender().send(json);
        } catch (Exception e) {
            log.error("Failed to send JSON response: {}", e.getMessage());
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("{\"error\":\"internal_error\"}");
        }
    }

    private void sendUnauthorized(HttpServerExchange exchange) {
        exchange.setStatusCode(StatusCodes.UNAUTHORIZED);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send("{\"error\":\"unauthorized\"}");
    }
}
