package io.statuswire.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Webhook payload. Field order is part of the wire format because the signature covers the raw body.
 */
@JsonPropertyOrder({"type", "did", "handle", "emoji", "text", "expires_at", "status_uri",
    "timestamp", "event_id", "schema"})
public record WebhookEvent(
        @JsonProperty("type") String type,
        @JsonProperty("did") String did,
        @JsonProperty("handle") String handle,
        @JsonProperty("emoji") String emoji,
        @JsonProperty("text") String text,
        @JsonProperty("expires_at") String expiresAt,
        @JsonProperty("status_uri") String statusUri,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("event_id") String eventId,
        @JsonProperty("schema") String schema) {

    public static final String SCHEMA = "status-webhook.v1";

    public static WebhookEvent from(StatusChange change, Instant now) {
        return new WebhookEvent(
            change.type().wireName(),
            change.did(),
            change.handle(),
            change.emoji(),
            change.text(),
            change.expiresAt() != null ? DateTimeFormatter.ISO_INSTANT.format(change.expiresAt()) : null,
            change.statusUri(),
            DateTimeFormatter.ISO_INSTANT.format(now),
            UUID.randomUUID().toString(),
            SCHEMA);
    }
}
