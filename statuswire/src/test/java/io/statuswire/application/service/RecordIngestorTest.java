package io.statuswire.application.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.statuswire.domain.model.CommitEvent;
import io.statuswire.domain.model.CommitOperation;
import io.statuswire.domain.model.StatusRecord;
import io.statuswire.infrastructure.firehose.FirehoseDecodeException;
import io.statuswire.infrastructure.metrics.PipelineMetrics;
import io.statuswire.testing.InMemoryStatusRepository;
import io.statuswire.testing.MutableClock;
import io.statuswire.util.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RecordIngestorTest {

    private static final String DID = "did:plc:abc";
    private static final String COLLECTION = "io.zzstoatzz.status.record";
    private static final String URI = "at://did:plc:abc/io.zzstoatzz.status.record/3k2x9";
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final ObjectMapper mapper = JsonMapper.create();
    private InMemoryStatusRepository store;
    private MutableClock clock;
    private RecordIngestor ingestor;

    @BeforeEach
    void setUp() {
        store = new InMemoryStatusRepository();
        clock = new MutableClock(NOW);
        ingestor = new RecordIngestor(store, mapper, clock, new PipelineMetrics(new CollectorRegistry()));
    }

    @Test
    void createUpsertsRecordUnderReconstructedUri() throws Exception {
        RecordIngestor.Outcome outcome = ingestor.ingest(commit(CommitOperation.CREATE, "🚀", "shipping", null, "bafy1"));

        assertEquals(RecordIngestor.Outcome.UPSERTED, outcome);
        StatusRecord stored = store.findByUri(URI).orElseThrow();
        assertEquals(DID, stored.authorDid());
        assertEquals("🚀", stored.emoji());
        assertEquals("shipping", stored.text());
        assertEquals(Instant.parse("2025-03-01T09:59:00Z"), stored.startedAt());
        assertNull(stored.expiresAt());
        assertEquals(NOW, stored.indexedAt());
        assertFalse(stored.hidden());
    }

    @Test
    void replayedCreateLeavesSingleRow() throws Exception {
        CommitEvent create = commit(CommitOperation.CREATE, "🚀", "shipping", null, "bafy1");

        ingestor.ingest(create);
        clock.advance(Duration.ofSeconds(5));
        ingestor.ingest(create);

        assertEquals(1, store.size());
        assertEquals("🚀", store.findByUri(URI).orElseThrow().emoji());
    }

    @Test
    void updateFullyReplacesRow() throws Exception {
        ingestor.ingest(commit(CommitOperation.CREATE, "🚀", "shipping", "2025-03-02T00:00:00Z", "bafy1"));
        ingestor.ingest(commit(CommitOperation.UPDATE, "😴", null, null, "bafy2"));

        StatusRecord stored = store.findByUri(URI).orElseThrow();
        assertEquals("😴", stored.emoji());
        assertNull(stored.text(), "update is a replace, not a merge");
        assertNull(stored.expiresAt());
    }

    @Test
    void deleteRemovesRowAndIsNoOpWhenAbsent() throws Exception {
        ingestor.ingest(commit(CommitOperation.CREATE, "🚀", "shipping", null, "bafy1"));

        assertEquals(RecordIngestor.Outcome.DELETED, ingestor.ingest(delete()));
        assertTrue(store.findByUri(URI).isEmpty());

        assertEquals(RecordIngestor.Outcome.DELETED, ingestor.ingest(delete()));
        assertEquals(0, store.size());
    }

    @Test
    void createWithoutCidIsSkipped() throws Exception {
        assertEquals(RecordIngestor.Outcome.SKIPPED,
            ingestor.ingest(commit(CommitOperation.CREATE, "🚀", "shipping", null, null)));
        assertEquals(0, store.size());
    }

    @Test
    void unparseableExpiryBecomesIngestionTime() throws Exception {
        ingestor.ingest(commit(CommitOperation.CREATE, "🚀", "shipping", "next tuesday", "bafy1"));

        StatusRecord stored = store.findByUri(URI).orElseThrow();
        assertEquals(NOW, stored.expiresAt());
        assertTrue(stored.isExpired(NOW));
    }

    @Test
    void parsesExpiryWithOffset() throws Exception {
        ingestor.ingest(commit(CommitOperation.CREATE, "🚀", null, "2025-03-01T12:00:00+02:00", "bafy1"));

        assertEquals(Instant.parse("2025-03-01T10:00:00Z"), store.findByUri(URI).orElseThrow().expiresAt());
    }

    @Test
    void recordWithoutEmojiIsDecodeError() {
        FirehoseDecodeException e = assertThrows(FirehoseDecodeException.class,
            () -> ingestor.ingest(commit(CommitOperation.CREATE, null, "no emoji", null, "bafy1")));
        assertEquals(1725911162329308L, e.getTimeUs());
        assertEquals(0, store.size());
    }

    @Test
    void createWithoutRecordBodyIsDecodeError() {
        CommitEvent bare = new CommitEvent(DID, 1L, "rev", CommitOperation.CREATE, COLLECTION, "3k2x9", null, "bafy1");

        assertThrows(FirehoseDecodeException.class, () -> ingestor.ingest(bare));
    }

    @Test
    void recordWithBadCreatedAtIsDecodeError() throws Exception {
        CommitEvent commit = new CommitEvent(DID, 1L, "rev", CommitOperation.CREATE, COLLECTION, "3k2x9",
            mapper.readTree("{\"emoji\":\"🚀\",\"createdAt\":\"yesterday\"}"), "bafy1");

        assertThrows(FirehoseDecodeException.class, () -> ingestor.ingest(commit));
    }

    private CommitEvent commit(CommitOperation op, String emoji, String text, String expires, String cid) {
        var record = mapper.createObjectNode();
        record.put("$type", COLLECTION);
        if (emoji != null) record.put("emoji", emoji);
        if (text != null) record.put("text", text);
        record.put("createdAt", "2025-03-01T09:59:00.000Z");
        if (expires != null) record.put("expires", expires);
        return new CommitEvent(DID, 1725911162329308L, "rev1", op, COLLECTION, "3k2x9", record, cid);
    }

    private CommitEvent delete() {
        return new CommitEvent(DID, 1725911162329400L, "rev2", CommitOperation.DELETE, COLLECTION, "3k2x9", null, null);
    }
}
