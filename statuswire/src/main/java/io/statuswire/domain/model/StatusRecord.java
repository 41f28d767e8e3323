package io.statuswire.domain.model;

import java.time.Instant;

/**
 * Locally materialized status, keyed by its record URI.
 */
public record StatusRecord(
        String uri,
        String authorDid,
        String emoji,
        String text,        // nullable
        Instant startedAt,
        Instant expiresAt,  // nullable, no expiry
        Instant indexedAt,
        boolean hidden) {

    /** Lexicon collection status records are published under. */
    public static final String COLLECTION = "io.zzstoatzz.status.record";

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
