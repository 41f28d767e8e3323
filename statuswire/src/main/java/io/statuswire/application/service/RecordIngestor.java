package io.statuswire.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.statuswire.application.port.output.StatusRepository;
import io.statuswire.domain.model.CommitEvent;
import io.statuswire.domain.model.StatusRecord;
import io.statuswire.domain.model.StatusRecordBody;
import io.statuswire.infrastructure.firehose.FirehoseDecodeException;
import io.statuswire.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Applies firehose commits to the local status view.
 *
 * The firehose is at-least-once and may replay or reorder, so every operation is idempotent:
 * create and update are a full upsert by URI, delete of a missing URI is a no-op.
 *
 * Remote commits are never announced to webhooks. A user's own status already went out through
 * {@link StatusWriteService} when it was written locally; re-announcing the firehose echo would
 * double-notify.
 */
public final class RecordIngestor {
    private static final Logger log = LoggerFactory.getLogger(RecordIngestor.class);

    public enum Outcome { UPSERTED, DELETED, SKIPPED }

    private final StatusRepository statusRepo;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PipelineMetrics metrics;

    public RecordIngestor(StatusRepository statusRepo, ObjectMapper objectMapper, Clock clock,
                          PipelineMetrics metrics) {
        this.statusRepo = statusRepo;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * @throws FirehoseDecodeException if a create/update carries a record that is not a valid status
     */
    public Outcome ingest(CommitEvent commit) throws FirehoseDecodeException {
        String uri = commit.uri().value();

        switch (commit.operation()) {
            case CREATE, UPDATE -> {
                if (commit.cid() == null) {
                    log.debug("[INGEST] Skipping {} without cid: {}", commit.operation().wireName(), uri);
                    metrics.recordIngestError("missing_cid");
                    return Outcome.SKIPPED;
                }
                StatusRecord record = toStatusRecord(commit, uri);
                statusRepo.upsert(record);
                metrics.recordIngested(commit.operation().wireName());
                log.debug("[INGEST] Upserted {} ({} {})", uri, record.emoji(), commit.operation().wireName());
                return Outcome.UPSERTED;
            }
            case DELETE -> {
                boolean removed = statusRepo.deleteByUri(uri);
                metrics.recordIngested(commit.operation().wireName());
                log.debug("[INGEST] Deleted {} (present={})", uri, removed);
                return Outcome.DELETED;
            }
            default -> throw new IllegalStateException("Unhandled operation " + commit.operation());
        }
    }

    private StatusRecord toStatusRecord(CommitEvent commit, String uri) throws FirehoseDecodeException {
        if (commit.record() == null) {
            metrics.recordIngestError("missing_record");
            throw new FirehoseDecodeException("Commit has no record body: " + uri, commit.timeUs());
        }

        StatusRecordBody body;
        try {
            body = objectMapper.treeToValue(commit.record(), StatusRecordBody.class);
        } catch (JsonProcessingException e) {
            metrics.recordIngestError("invalid_record");
            throw new FirehoseDecodeException("Record is not a status: " + uri, commit.timeUs(), e);
        }

        if (body.emoji() == null || body.emoji().isBlank()) {
            metrics.recordIngestError("invalid_record");
            throw new FirehoseDecodeException("Status has no emoji: " + uri, commit.timeUs());
        }

        if (body.createdAt() == null) {
            metrics.recordIngestError("invalid_record");
            throw new FirehoseDecodeException("Status has no createdAt: " + uri, commit.timeUs());
        }

        Instant startedAt;
        try {
            startedAt = parseTimestamp(body.createdAt());
        } catch (DateTimeParseException e) {
            metrics.recordIngestError("invalid_record");
            throw new FirehoseDecodeException("Status has an invalid createdAt: " + uri, commit.timeUs(), e);
        }

        Instant now = clock.instant();
        Instant expiresAt = null;
        if (body.expires() != null) {
            try {
                expiresAt = parseTimestamp(body.expires());
            } catch (DateTimeParseException e) {
                // Unreadable expiry: treat as already expired
                log.debug("[INGEST] Unparseable expiry '{}' on {}, using ingestion time", body.expires(), uri);
                expiresAt = now;
            }
        }

        return new StatusRecord(uri, commit.did(), body.emoji(), body.text(), startedAt, expiresAt, now, false);
    }

    static Instant parseTimestamp(String value) {
        return OffsetDateTime.parse(value).toInstant();
    }
}
