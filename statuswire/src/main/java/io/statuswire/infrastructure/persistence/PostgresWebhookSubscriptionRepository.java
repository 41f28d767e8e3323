package io.statuswire.infrastructure.persistence;

import io.statuswire.application.port.output.WebhookSubscriptionRepository;
import io.statuswire.domain.model.WebhookSubscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.statuswire.infrastructure.persistence.JdbcTimestamps.getInstant;
import static io.statuswire.infrastructure.persistence.JdbcTimestamps.setTimestampOrNull;

/**
 * PostgreSQL implementation of WebhookSubscriptionRepository.
 */
public final class PostgresWebhookSubscriptionRepository implements WebhookSubscriptionRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresWebhookSubscriptionRepository.class);

    private final DataSource dataSource;

    public PostgresWebhookSubscriptionRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(WebhookSubscription sub) {
        String sql = """
                INSERT INTO webhook_subscription (
                    id, owner_did, url, secret, events, active,
                    created_at, updated_at, last_delivery_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sub.id());
            ps.setString(2, sub.ownerDid());
            ps.setString(3, sub.url());
            ps.setString(4, sub.secret());
            ps.setString(5, sub.events());
            ps.setBoolean(6, sub.active());
            ps.setTimestamp(7, Timestamp.from(sub.createdAt()));
            ps.setTimestamp(8, Timestamp.from(sub.updatedAt()));
            setTimestampOrNull(ps, 9, sub.lastDeliveryAt());

            ps.executeUpdate();
            log.debug("Webhook subscription inserted: {} for {}", sub.id(), sub.ownerDid());
        } catch (Exception e) {
            log.error("Failed to insert webhook subscription: {}", e.getMessage());
            throw new RuntimeException("Failed to insert webhook subscription", e);
        }
    }

    @Override
    public void update(WebhookSubscription sub) {
        String sql = """
                UPDATE webhook_subscription
                SET url = ?, secret = ?, events = ?, active = ?, updated_at = ?
                WHERE id = ?
                """;

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sub.url());
            ps.setString(2, sub.secret());
            ps.setString(3, sub.events());
            ps.setBoolean(4, sub.active());
            ps.setTimestamp(5, Timestamp.from(sub.updatedAt()));
            ps.setString(6, sub.id());

            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to update webhook subscription {}: {}", sub.id(), e.getMessage());
            throw new RuntimeException("Failed to update webhook subscription", e);
        }
    }

    @Override
    public Optional<WebhookSubscription> findById(String id) {
        String sql = "SELECT * FROM webhook_subscription WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find webhook subscription {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to find webhook subscription", e);
        }
        return Optional.empty();
    }

    @Override
    public List<WebhookSubscription> findByOwner(String ownerDid) {
        String sql = """
                SELECT * FROM webhook_subscription
                WHERE owner_did = ?
                ORDER BY created_at DESC
                """;

        List<WebhookSubscription> subs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ownerDid);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    subs.add(mapRow(rs));
                }
            }
        } catch (Exception e) {
            log.error("Failed to find webhook subscriptions for {}: {}", ownerDid, e.getMessage());
            throw new RuntimeException("Failed to find webhook subscriptions", e);
        }
        return subs;
    }

    @Override
    public boolean delete(String id) {
        String sql = "DELETE FROM webhook_subscription WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            return ps.executeUpdate() > 0;
        } catch (Exception e) {
            log.error("Failed to delete webhook subscription {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to delete webhook subscription", e);
        }
    }

    @Override
    public void touchLastDelivery(String id, Instant deliveredAt) {
        String sql = "UPDATE webhook_subscription SET last_delivery_at = ? WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(deliveredAt));
            ps.setString(2, id);
            ps.executeUpdate();
        } catch (Exception e) {
            log.error("Failed to touch last delivery for {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to update last delivery", e);
        }
    }

    private WebhookSubscription mapRow(ResultSet rs) throws SQLException {
        return new WebhookSubscription(
                rs.getString("id"),
                rs.getString("owner_did"),
                rs.getString("url"),
                rs.getString("secret"),
                rs.getString("events"),
                rs.getBoolean("active"),
                getInstant(rs, "created_at"),
                getInstant(rs, "updated_at"),
                getInstant(rs, "last_delivery_at"));
    }
}
