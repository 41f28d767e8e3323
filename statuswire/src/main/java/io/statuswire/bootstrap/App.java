package io.statuswire.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.statuswire.application.port.output.DeliveryAttemptRepository;
import io.statuswire.application.port.output.StatusRepository;
import io.statuswire.application.port.output.WebhookSubscriptionRepository;
import io.statuswire.application.service.DeliveryLedger;
import io.statuswire.application.service.DispatcherSettings;
import io.statuswire.application.service.EventDispatcher;
import io.statuswire.application.service.RecordIngestor;
import io.statuswire.application.service.StatusWriteService;
import io.statuswire.application.service.WebhookRegistry;
import io.statuswire.infrastructure.firehose.FirehoseConnectException;
import io.statuswire.infrastructure.firehose.FirehoseConsumer;
import io.statuswire.infrastructure.firehose.FirehoseMessageDecoder;
import io.statuswire.infrastructure.firehose.FirehoseSettings;
import io.statuswire.infrastructure.firehose.ReconnectionPolicy;
import io.statuswire.infrastructure.metrics.PipelineMetrics;
import io.statuswire.infrastructure.metrics.PrometheusMetricsHandler;
import io.statuswire.infrastructure.persistence.PostgresDeliveryAttemptRepository;
import io.statuswire.infrastructure.persistence.PostgresStatusRepository;
import io.statuswire.infrastructure.persistence.PostgresWebhookSubscriptionRepository;
import io.statuswire.infrastructure.webhook.HttpClientWebhookTransport;
import io.statuswire.migration.SchemaMigration;
import io.statuswire.security.WebhookUrlValidator;
import io.statuswire.transport.http.HealthHandler;
import io.statuswire.transport.http.StatusHandler;
import io.statuswire.transport.http.WebhookHandler;
import io.statuswire.util.JsonMapper;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Process entry point (no DI container).
 *
 * Wires the two halves of the pipeline:
 * - firehose → RecordIngestor → status table
 * - local status writes → EventDispatcher → signed webhook POSTs → delivery ledger
 * and serves the webhook management API, health and metrics.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== statuswire starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        AppConfig config = AppConfig.fromEnv();
        try {
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
        }

        Clock clock = Clock.systemUTC();
        ObjectMapper objectMapper = JsonMapper.create();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        HikariDataSource dataSource = createDataSource(config);
        new SchemaMigration(dataSource).migrate();

        StatusRepository statusRepo = new PostgresStatusRepository(dataSource);
        WebhookSubscriptionRepository subscriptionRepo = new PostgresWebhookSubscriptionRepository(dataSource);
        DeliveryAttemptRepository attemptRepo = new PostgresDeliveryAttemptRepository(dataSource);

        PipelineMetrics metrics = new PipelineMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Webhooks
        // ═══════════════════════════════════════════════════════════════
        WebhookRegistry registry = new WebhookRegistry(subscriptionRepo,
            new WebhookUrlValidator(config.productionMode()), clock);
        DeliveryLedger ledger = new DeliveryLedger(attemptRepo, registry, clock);
        DispatcherSettings dispatcherSettings = new DispatcherSettings(
            config.webhookDispatchThreads(),
            config.webhookDispatchQueue(),
            config.webhookDeliveryThreads(),
            Duration.ofSeconds(config.webhookTimeoutSeconds()));
        EventDispatcher dispatcher = new EventDispatcher(registry, ledger,
            new HttpClientWebhookTransport(Duration.ofSeconds(5)), objectMapper, clock, metrics, dispatcherSettings);

        StatusWriteService statusWrites = new StatusWriteService(statusRepo, dispatcher);

        // ═══════════════════════════════════════════════════════════════
        // Firehose
        // ═══════════════════════════════════════════════════════════════
        FirehoseConsumer firehose = null;
        if (config.firehoseEnabled()) {
            RecordIngestor ingestor = new RecordIngestor(statusRepo, objectMapper, clock, metrics);
            FirehoseSettings firehoseSettings = new FirehoseSettings(
                config.firehoseUrl(),
                config.firehoseCollections(),
                config.firehoseQueueCapacity(),
                Duration.ofSeconds(10));
            firehose = new FirehoseConsumer(
                firehoseSettings,
                ingestor,
                new FirehoseMessageDecoder(objectMapper),
                metrics,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                ReconnectionPolicy.forFirehose(config.firehoseMaxReconnects()),
                App::onFirehoseFatal);
            firehose.start();
        } else {
            log.info("[FIREHOSE] ⏭️ Skipping firehose consumer (ENABLE_FIREHOSE=false)");
        }

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        WebhookHandler webhooks = new WebhookHandler(registry, ledger, dispatcher,
            WebhookHandler.headerOwnerResolver(), objectMapper);
        StatusHandler status = new StatusHandler(statusWrites, WebhookHandler.headerOwnerResolver(),
            objectMapper, clock);

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/api/health", new HealthHandler(firehose, objectMapper, clock))
            .get("/api/webhooks", webhooks::list)
            .post("/api/webhooks", webhooks::create)
            .put("/api/webhooks/{id}", webhooks::update)
            .delete("/api/webhooks/{id}", webhooks::delete)
            .post("/api/webhooks/{id}/rotate", webhooks::rotate)
            .post("/api/webhooks/{id}/test", webhooks::test)
            .get("/api/webhooks/{id}/deliveries", webhooks::deliveries)
            .post("/api/status", status::create)
            .post("/api/status/clear", status::clear)
            .delete("/api/status/{rkey}", status::delete);

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(new BlockingHandler(routes))
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", config.port());

        Duration grace = Duration.ofSeconds(config.shutdownGraceSeconds());
        FirehoseConsumer firehoseRef = firehose;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down (grace {}s)...", grace.toSeconds());
            server.stop();
            if (firehoseRef != null) {
                firehoseRef.stop(grace);
            }
            dispatcher.shutdown(grace);
            dataSource.close();
            log.info("Shutdown complete");
        }, "shutdown"));
    }

    private static void onFirehoseFatal(FirehoseConnectException e) {
        log.error("[FIREHOSE] ❌ Giving up: {}", e.getMessage(), e);
        System.exit(1);
    }

    private static HikariDataSource createDataSource(AppConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(Math.min(2, config.dbPoolSize()));
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("statuswire-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {}
}
