package io.statuswire.application.port.output;

import io.statuswire.domain.model.StatusRecord;

import java.util.Optional;

/**
 * Local materialized view of statuses, keyed by record URI.
 */
public interface StatusRepository {
    /**
     * Insert or fully replace the row with the same URI. Atomic per URI.
     */
    void upsert(StatusRecord record);

    /**
     * Delete by URI.
     *
     * @return true if a row was removed
     */
    boolean deleteByUri(String uri);

    Optional<StatusRecord> findByUri(String uri);

    /**
     * Most recently started, non-hidden status of an author.
     */
    Optional<StatusRecord> findCurrentByAuthor(String authorDid);
}
