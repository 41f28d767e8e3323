package io.statuswire.domain.model;

import java.time.Instant;

/**
 * A locally confirmed status change that webhook subscribers should hear about.
 */
public record StatusChange(
        WebhookEventType type,
        String did,
        String handle,      // nullable
        String emoji,       // nullable for deletes
        String text,        // nullable
        Instant expiresAt,  // nullable
        String statusUri) {

    public static StatusChange created(StatusRecord record, String handle) {
        return new StatusChange(WebhookEventType.STATUS_CREATED, record.authorDid(), handle,
            record.emoji(), record.text(), record.expiresAt(), record.uri());
    }

    public static StatusChange deleted(String did, String statusUri) {
        return new StatusChange(WebhookEventType.STATUS_DELETED, did, null, null, null, null, statusUri);
    }

    public static StatusChange cleared(StatusRecord previous) {
        return new StatusChange(WebhookEventType.STATUS_CLEARED, previous.authorDid(), null,
            previous.emoji(), previous.text(), previous.expiresAt(), previous.uri());
    }
}
