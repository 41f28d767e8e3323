package io.statuswire.infrastructure.persistence;

import io.statuswire.application.port.output.StatusRepository;
import io.statuswire.domain.model.StatusRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Optional;

import static io.statuswire.infrastructure.persistence.JdbcTimestamps.getInstant;
import static io.statuswire.infrastructure.persistence.JdbcTimestamps.setTimestampOrNull;

/**
 * PostgreSQL implementation of StatusRepository.
 *
 * Upsert is a single {@code INSERT ... ON CONFLICT (uri) DO UPDATE}, so concurrent or replayed
 * writes for one URI never leave a partial row.
 */
public final class PostgresStatusRepository implements StatusRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresStatusRepository.class);

    private final DataSource dataSource;

    public PostgresStatusRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void upsert(StatusRecord record) {
        String sql = """
                INSERT INTO status (
                    uri, author_did, emoji, text, started_at, expires_at, indexed_at, hidden
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (uri) DO UPDATE SET
                    author_did = EXCLUDED.author_did,
                    emoji = EXCLUDED.emoji,
                    text = EXCLUDED.text,
                    started_at = EXCLUDED.started_at,
                    expires_at = EXCLUDED.expires_at,
                    indexed_at = EXCLUDED.indexed_at,
                    hidden = EXCLUDED.hidden
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.uri());
            ps.setString(2, record.authorDid());
            ps.setString(3, record.emoji());
            ps.setString(4, record.text());
            ps.setTimestamp(5, Timestamp.from(record.startedAt()));
            setTimestampOrNull(ps, 6, record.expiresAt());
            ps.setTimestamp(7, Timestamp.from(record.indexedAt()));
            ps.setBoolean(8, record.hidden());

            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to upsert status {}: {}", record.uri(), e.getMessage());
            throw new RuntimeException("Failed to upsert status", e);
        }
    }

    @Override
    public boolean deleteByUri(String uri) {
        String sql = "DELETE FROM status WHERE uri = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, uri);
            return ps.executeUpdate() > 0;
        } catch (Exception e) {
            log.error("Failed to delete status {}: {}", uri, e.getMessage());
            throw new RuntimeException("Failed to delete status", e);
        }
    }

    @Override
    public Optional<StatusRecord> findByUri(String uri) {
        String sql = "SELECT * FROM status WHERE uri = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, uri);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find status {}: {}", uri, e.getMessage());
            throw new RuntimeException("Failed to find status", e);
        }
        return Optional.empty();
    }

    @Override
    public Optional<StatusRecord> findCurrentByAuthor(String authorDid) {
        String sql = """
                SELECT * FROM status
                WHERE author_did = ? AND hidden = FALSE
                ORDER BY started_at DESC
                LIMIT 1
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, authorDid);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find current status for {}: {}", authorDid, e.getMessage());
            throw new RuntimeException("Failed to find current status", e);
        }
        return Optional.empty();
    }

    private StatusRecord mapRow(ResultSet rs) throws SQLException {
        return new StatusRecord(
                rs.getString("uri"),
                rs.getString("author_did"),
                rs.getString("emoji"),
                rs.getString("text"),
                getInstant(rs, "started_at"),
                getInstant(rs, "expires_at"),
                getInstant(rs, "indexed_at"),
                rs.getBoolean("hidden"));
    }
}
