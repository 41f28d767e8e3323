package io.statuswire.infrastructure.firehose;

import io.statuswire.domain.model.StatusRecord;

import java.time.Duration;
import java.util.List;

/**
 * Connection settings for {@link FirehoseConsumer}.
 */
public record FirehoseSettings(
        String endpoint,
        List<String> wantedCollections,
        int queueCapacity,
        Duration connectTimeout) {

    public static final String DEFAULT_ENDPOINT = "wss://jetstream2.us-east.bsky.network/subscribe";
    public static final String STATUS_COLLECTION = StatusRecord.COLLECTION;

    public FirehoseSettings {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Firehose endpoint is required");
        }
        if (wantedCollections == null || wantedCollections.isEmpty()) {
            throw new IllegalArgumentException("At least one collection is required");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive");
        }
        wantedCollections = List.copyOf(wantedCollections);
    }
}
