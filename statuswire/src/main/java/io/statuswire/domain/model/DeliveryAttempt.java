package io.statuswire.domain.model;

import java.time.Instant;

/**
 * Audit row for one webhook POST.
 */
public record DeliveryAttempt(
        String id,
        String subscriptionId,
        String eventId,
        String eventType,
        String payload,
        Instant attemptedAt,
        Integer responseStatus,   // null while pending, 0 for network failure
        String responseBody,      // truncated
        DeliveryStatus status,
        int retryCount,
        Instant nextRetryAt,      // reserved for retry scheduling
        Instant completedAt) {

    public static final int MAX_RESPONSE_BODY = 2048;

    public static DeliveryAttempt pending(String id, String subscriptionId, String eventId, String eventType,
                                          String payload, Instant attemptedAt) {
        return new DeliveryAttempt(id, subscriptionId, eventId, eventType, payload, attemptedAt,
            null, null, DeliveryStatus.PENDING, 0, null, null);
    }

    public boolean success() {
        return status == DeliveryStatus.DELIVERED;
    }

    public DeliveryAttempt completed(DeliveryStatus newStatus, int httpStatus, String body, Instant now) {
        return new DeliveryAttempt(id, subscriptionId, eventId, eventType, payload, attemptedAt,
            httpStatus, truncate(body), newStatus, retryCount, nextRetryAt, now);
    }

    static String truncate(String body) {
        if (body == null || body.length() <= MAX_RESPONSE_BODY) {
            return body;
        }
        return body.substring(0, MAX_RESPONSE_BODY);
    }
}
