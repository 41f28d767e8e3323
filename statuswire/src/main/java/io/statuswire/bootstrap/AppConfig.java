package io.statuswire.bootstrap;

import io.statuswire.infrastructure.firehose.FirehoseSettings;
import io.statuswire.util.Env;

import java.util.List;

/**
 * Process configuration, read once from the environment.
 */
public record AppConfig(
        int port,
        String dbUrl,
        String dbUser,
        String dbPass,
        int dbPoolSize,
        boolean productionMode,
        boolean firehoseEnabled,
        String firehoseUrl,
        List<String> firehoseCollections,
        int firehoseQueueCapacity,
        int firehoseMaxReconnects,
        int webhookTimeoutSeconds,
        int webhookDispatchThreads,
        int webhookDispatchQueue,
        int webhookDeliveryThreads,
        int shutdownGraceSeconds) {

    public static final String DEFAULT_DB_PASS = "postgres";

    public static AppConfig fromEnv() {
        return new AppConfig(
            Env.getInt("PORT", 8080),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/statuswire"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASS", DEFAULT_DB_PASS),
            Env.getInt("DB_POOL_SIZE", 10),
            !"development".equalsIgnoreCase(Env.get("APP_ENV", "production")),
            Env.getBool("ENABLE_FIREHOSE", true),
            Env.get("FIREHOSE_URL", FirehoseSettings.DEFAULT_ENDPOINT),
            Env.getList("FIREHOSE_COLLECTIONS", List.of(FirehoseSettings.STATUS_COLLECTION)),
            Env.getInt("FIREHOSE_QUEUE_CAPACITY", 1024),
            Env.getInt("FIREHOSE_MAX_RECONNECTS", 10),
            Env.getInt("WEBHOOK_TIMEOUT_SECONDS", 10),
            Env.getInt("WEBHOOK_DISPATCH_THREADS", 2),
            Env.getInt("WEBHOOK_DISPATCH_QUEUE", 256),
            Env.getInt("WEBHOOK_DELIVERY_THREADS", 8),
            Env.getInt("SHUTDOWN_GRACE_SECONDS", 10));
    }
}
