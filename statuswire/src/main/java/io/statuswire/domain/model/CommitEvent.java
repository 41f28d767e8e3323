package io.statuswire.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One repository commit from the firehose, flattened.
 *
 * {@code record} and {@code cid} are absent for deletes.
 */
public record CommitEvent(
        String did,
        long timeUs,
        String rev,
        CommitOperation operation,
        String collection,
        String rkey,
        JsonNode record,
        String cid) {

    public StatusUri uri() {
        return StatusUri.of(did, collection, rkey);
    }
}
