package io.statuswire.domain.model;

/**
 * Decoded firehose frame. {@code commit} is null for identity and account frames.
 */
public record FirehoseMessage(
        String did,
        long timeUs,
        String kind,
        CommitEvent commit) {

    public boolean isCommit() {
        return commit != null;
    }
}
