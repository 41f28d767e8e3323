package io.statuswire.infrastructure.firehose;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.statuswire.domain.model.CommitEvent;
import io.statuswire.domain.model.CommitOperation;
import io.statuswire.domain.model.FirehoseMessage;

/**
 * Decodes Jetstream JSON frames.
 *
 * <pre>
 * {"did":"did:plc:abc","time_us":1725911162329308,"kind":"commit",
 *  "commit":{"rev":"...","operation":"create","collection":"io.zzstoatzz.status.record",
 *            "rkey":"3k2x9","record":{...},"cid":"bafy..."}}
 * </pre>
 *
 * Frames of other kinds (identity, account) decode to a message without a commit.
 */
public final class FirehoseMessageDecoder {
    private static final String KIND_COMMIT = "commit";

    private final ObjectMapper objectMapper;

    public FirehoseMessageDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FirehoseMessage decode(String frame) throws FirehoseDecodeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new FirehoseDecodeException("Frame is not valid JSON: " + e.getOriginalMessage(), -1L, e);
        }
        if (root == null || !root.isObject()) {
            throw new FirehoseDecodeException("Frame is not a JSON object");
        }

        long timeUs = root.path("time_us").asLong(-1L);
        if (timeUs < 0) {
            throw new FirehoseDecodeException("Frame has no time_us");
        }

        String did = text(root, "did");
        if (did == null) {
            throw new FirehoseDecodeException("Frame has no did", timeUs);
        }

        String kind = text(root, "kind");
        JsonNode commitNode = root.get("commit");
        if (!KIND_COMMIT.equals(kind) || commitNode == null || !commitNode.isObject()) {
            return new FirehoseMessage(did, timeUs, kind, null);
        }

        return new FirehoseMessage(did, timeUs, kind, decodeCommit(did, timeUs, commitNode));
    }

    private static CommitEvent decodeCommit(String did, long timeUs, JsonNode commit) throws FirehoseDecodeException {
        String opName = text(commit, "operation");
        CommitOperation operation = CommitOperation.fromWire(opName);
        if (operation == null) {
            throw new FirehoseDecodeException("Unknown commit operation: " + opName, timeUs);
        }

        String collection = text(commit, "collection");
        String rkey = text(commit, "rkey");
        if (collection == null || rkey == null) {
            throw new FirehoseDecodeException("Commit is missing collection or rkey", timeUs);
        }

        JsonNode record = commit.get("record");
        if (record != null && record.isNull()) {
            record = null;
        }

        return new CommitEvent(did, timeUs, text(commit, "rev"), operation, collection, rkey,
            record, text(commit, "cid"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            return null;
        }
        return value.asText();
    }
}
