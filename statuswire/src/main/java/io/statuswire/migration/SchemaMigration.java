package io.statuswire.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the status, webhook_subscription and webhook_delivery tables on startup if absent.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[MIGRATION] Checking schema");

        try (Connection conn = dataSource.getConnection()) {
            createIfMissing(conn, "status", """
                CREATE TABLE status (
                    uri         TEXT PRIMARY KEY,
                    author_did  TEXT NOT NULL,
                    emoji       TEXT NOT NULL,
                    text        TEXT,
                    started_at  TIMESTAMPTZ NOT NULL,
                    expires_at  TIMESTAMPTZ,
                    indexed_at  TIMESTAMPTZ NOT NULL,
                    hidden      BOOLEAN NOT NULL DEFAULT FALSE
                )
                """,
                "CREATE INDEX idx_status_author_started ON status (author_did, started_at DESC)");

            createIfMissing(conn, "webhook_subscription", """
                CREATE TABLE webhook_subscription (
                    id                TEXT PRIMARY KEY,
                    owner_did         TEXT NOT NULL,
                    url               TEXT NOT NULL,
                    secret            TEXT NOT NULL,
                    events            TEXT NOT NULL DEFAULT '*',
                    active            BOOLEAN NOT NULL DEFAULT TRUE,
                    created_at        TIMESTAMPTZ NOT NULL,
                    updated_at        TIMESTAMPTZ NOT NULL,
                    last_delivery_at  TIMESTAMPTZ
                )
                """,
                "CREATE INDEX idx_webhook_subscription_owner ON webhook_subscription (owner_did)");

            createIfMissing(conn, "webhook_delivery", """
                CREATE TABLE webhook_delivery (
                    id               TEXT PRIMARY KEY,
                    subscription_id  TEXT NOT NULL REFERENCES webhook_subscription (id) ON DELETE CASCADE,
                    event_id         TEXT NOT NULL,
                    event_type       TEXT NOT NULL,
                    payload          TEXT NOT NULL,
                    attempted_at     TIMESTAMPTZ NOT NULL,
                    response_status  INT,
                    response_body    TEXT,
                    status           VARCHAR(16) NOT NULL DEFAULT 'PENDING',
                    retry_count      INT NOT NULL DEFAULT 0,
                    next_retry_at    TIMESTAMPTZ,
                    completed_at     TIMESTAMPTZ
                )
                """,
                "CREATE INDEX idx_webhook_delivery_sub_attempted ON webhook_delivery (subscription_id, attempted_at DESC)");

            log.info("[MIGRATION] Schema ready");
        } catch (Exception e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private void createIfMissing(Connection conn, String table, String createSql, String indexSql) throws SQLException {
        if (tableExists(conn, table)) {
            log.info("[MIGRATION] {} already exists", table);
            return;
        }
        log.info("[MIGRATION] Creating {} table...", table);
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(createSql);
            stmt.execute(indexSql);
        }
        log.info("[MIGRATION] ✓ {} created", table);
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
