package io.statuswire.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;

/**
 * Checks configuration before anything is started.
 *
 * Throws IllegalStateException on invalid configuration; App exits with status 1.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    public static void validate(AppConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Production mode: {}", config.productionMode());

        requireRange("PORT", config.port(), 1, 65535);
        requireRange("DB_POOL_SIZE", config.dbPoolSize(), 1, 200);
        requirePositive("WEBHOOK_DISPATCH_THREADS", config.webhookDispatchThreads());
        requirePositive("WEBHOOK_DISPATCH_QUEUE", config.webhookDispatchQueue());
        requirePositive("WEBHOOK_DELIVERY_THREADS", config.webhookDeliveryThreads());
        requirePositive("SHUTDOWN_GRACE_SECONDS", config.shutdownGraceSeconds());

        if (config.webhookTimeoutSeconds() < 5 || config.webhookTimeoutSeconds() > 30) {
            log.warn("⚠️  WEBHOOK_TIMEOUT_SECONDS={} outside [5, 30], will be clamped", config.webhookTimeoutSeconds());
        }

        if (config.firehoseEnabled()) {
            validateFirehose(config);
        } else {
            log.warn("⚠️  Firehose disabled (ENABLE_FIREHOSE=false), local view will not follow remote changes");
        }

        if (config.productionMode()) {
            if (AppConfig.DEFAULT_DB_PASS.equals(config.dbPass())) {
                throw new IllegalStateException(
                    "❌ INVALID CONFIG: production requires a non-default DB_PASS\n" +
                    "System refuses to start.\n" +
                    "Either:\n" +
                    "  1. Set DB_PASS\n" +
                    "  2. Set APP_ENV=development for local runs"
                );
            }
            log.info("✓ Database credentials set");
        } else {
            log.warn("⚠️  DEVELOPMENT MODE: http and private webhook targets are accepted");
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateFirehose(AppConfig config) {
        String scheme;
        try {
            scheme = URI.create(config.firehoseUrl()).getScheme();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("❌ INVALID CONFIG: FIREHOSE_URL is not a URI: " + config.firehoseUrl(), e);
        }
        if (!"wss".equalsIgnoreCase(scheme) && !"ws".equalsIgnoreCase(scheme)) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: FIREHOSE_URL must be ws:// or wss://, got " + config.firehoseUrl());
        }
        if (config.firehoseCollections().isEmpty()) {
            throw new IllegalStateException("❌ INVALID CONFIG: FIREHOSE_COLLECTIONS is empty");
        }
        requirePositive("FIREHOSE_QUEUE_CAPACITY", config.firehoseQueueCapacity());
        requirePositive("FIREHOSE_MAX_RECONNECTS", config.firehoseMaxReconnects());
        log.info("✓ Firehose {} collections={}", config.firehoseUrl(), config.firehoseCollections());
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new IllegalStateException("❌ INVALID CONFIG: " + key + " must be positive, got " + value);
        }
    }

    private static void requireRange(String key, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: " + key + " must be in [" + min + ", " + max + "], got " + value);
        }
    }

    private StartupConfigValidator() {
        // Utility class - no instantiation
    }
}
