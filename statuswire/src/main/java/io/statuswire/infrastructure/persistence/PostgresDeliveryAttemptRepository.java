package io.statuswire.infrastructure.persistence;

import io.statuswire.application.port.output.DeliveryAttemptRepository;
import io.statuswire.domain.model.DeliveryAttempt;
import io.statuswire.domain.model.DeliveryStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.statuswire.infrastructure.persistence.JdbcTimestamps.getInstant;
import static io.statuswire.infrastructure.persistence.JdbcTimestamps.setTimestampOrNull;

/**
 * PostgreSQL implementation of DeliveryAttemptRepository.
 *
 * Completion is conditional on the row still being PENDING, so an attempt reaches a terminal
 * state at most once even if two writers race.
 */
public final class PostgresDeliveryAttemptRepository implements DeliveryAttemptRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresDeliveryAttemptRepository.class);

    private final DataSource dataSource;

    public PostgresDeliveryAttemptRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(DeliveryAttempt attempt) {
        String sql = """
                INSERT INTO webhook_delivery (
                    id, subscription_id, event_id, event_type, payload, attempted_at,
                    response_status, response_body, status, retry_count, next_retry_at, completed_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, attempt.id());
            ps.setString(2, attempt.subscriptionId());
            ps.setString(3, attempt.eventId());
            ps.setString(4, attempt.eventType());
            ps.setString(5, attempt.payload());
            ps.setTimestamp(6, Timestamp.from(attempt.attemptedAt()));
            setIntOrNull(ps, 7, attempt.responseStatus());
            ps.setString(8, attempt.responseBody());
            ps.setString(9, attempt.status().name());
            ps.setInt(10, attempt.retryCount());
            setTimestampOrNull(ps, 11, attempt.nextRetryAt());
            setTimestampOrNull(ps, 12, attempt.completedAt());

            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to insert delivery attempt for {}: {}", attempt.subscriptionId(), e.getMessage());
            throw new RuntimeException("Failed to insert delivery attempt", e);
        }
    }

    @Override
    public boolean complete(DeliveryAttempt attempt) {
        String sql = """
                UPDATE webhook_delivery
                SET status = ?, response_status = ?, response_body = ?, completed_at = ?
                WHERE id = ? AND status = 'PENDING'
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, attempt.status().name());
            setIntOrNull(ps, 2, attempt.responseStatus());
            ps.setString(3, attempt.responseBody());
            setTimestampOrNull(ps, 4, attempt.completedAt());
            ps.setString(5, attempt.id());

            int updated = ps.executeUpdate();
            if (updated == 0) {
                log.warn("Delivery attempt {} was not PENDING, outcome {} ignored", attempt.id(), attempt.status());
            }
            return updated > 0;
        } catch (Exception e) {
            log.error("Failed to complete delivery attempt {}: {}", attempt.id(), e.getMessage());
            throw new RuntimeException("Failed to complete delivery attempt", e);
        }
    }

    @Override
    public Optional<DeliveryAttempt> findById(String id) {
        String sql = "SELECT * FROM webhook_delivery WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find delivery attempt {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to find delivery attempt", e);
        }
        return Optional.empty();
    }

    @Override
    public List<DeliveryAttempt> findBySubscription(String subscriptionId, int limit) {
        String sql = """
                SELECT * FROM webhook_delivery
                WHERE subscription_id = ?
                ORDER BY attempted_at DESC
                LIMIT ?
                """;

        List<DeliveryAttempt> attempts = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, subscriptionId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    attempts.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find delivery attempts for {}: {}", subscriptionId, e.getMessage());
            throw new RuntimeException("Failed to find delivery attempts", e);
        }
        return attempts;
    }

    private static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    private DeliveryAttempt mapRow(ResultSet rs) throws SQLException {
        int responseStatus = rs.getInt("response_status");
        Integer status = rs.wasNull() ? null : responseStatus;

        return new DeliveryAttempt(
                rs.getString("id"),
                rs.getString("subscription_id"),
                rs.getString("event_id"),
                rs.getString("event_type"),
                rs.getString("payload"),
                getInstant(rs, "attempted_at"),
                status,
                rs.getString("response_body"),
                DeliveryStatus.valueOf(rs.getString("status")),
                rs.getInt("retry_count"),
                getInstant(rs, "next_retry_at"),
                getInstant(rs, "completed_at"));
    }
}
