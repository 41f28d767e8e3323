package io.statuswire.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus metrics for the firehose ingest path and webhook delivery path.
 *
 * Key Metrics:
 * - firehose_messages_total{kind} - Frames received, by frame kind
 * - firehose_decode_errors_total - Frames that could not be decoded
 * - firehose_reconnects_total - Reconnect attempts
 * - firehose_connected - 1 while the socket is open
 * - ingested_records_total{operation} - Applied create/update/delete
 * - ingest_errors_total{reason} - Commits skipped or rejected
 * - webhook_deliveries_total{outcome} - delivered | failed | error
 * - webhook_delivery_latency_seconds - POST round trip
 * - webhook_dispatch_rejected_total - Events dropped because the dispatch queue was full
 *
 * Pass a fresh {@link CollectorRegistry} per instance in tests to avoid duplicate registration.
 */
public class PipelineMetrics {

    private final CollectorRegistry registry;

    private final Counter firehoseMessages;
    private final Counter firehoseDecodeErrors;
    private final Counter firehoseReconnects;
    private final Gauge firehoseConnected;

    private final Counter ingested;
    private final Counter ingestErrors;

    private final Counter deliveries;
    private final Histogram deliveryLatency;
    private final Counter dispatchRejected;

    public PipelineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PipelineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.firehoseMessages = Counter.build()
            .name("firehose_messages_total")
            .help("Firehose frames received")
            .labelNames("kind")
            .register(registry);

        this.firehoseDecodeErrors = Counter.build()
            .name("firehose_decode_errors_total")
            .help("Firehose frames that failed to decode")
            .register(registry);

        this.firehoseReconnects = Counter.build()
            .name("firehose_reconnects_total")
            .help("Firehose reconnect attempts")
            .register(registry);

        this.firehoseConnected = Gauge.build()
            .name("firehose_connected")
            .help("Firehose connection state (1=connected, 0=disconnected)")
            .register(registry);

        this.ingested = Counter.build()
            .name("ingested_records_total")
            .help("Status records applied to the local store")
            .labelNames("operation")
            .register(registry);

        this.ingestErrors = Counter.build()
            .name("ingest_errors_total")
            .help("Commits skipped or rejected during ingest")
            .labelNames("reason")
            .register(registry);

        this.deliveries = Counter.build()
            .name("webhook_deliveries_total")
            .help("Webhook delivery attempts by outcome")
            .labelNames("outcome")
            .register(registry);

        this.deliveryLatency = Histogram.build()
            .name("webhook_delivery_latency_seconds")
            .help("Webhook POST latency in seconds")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, 30.0)
            .register(registry);

        this.dispatchRejected = Counter.build()
            .name("webhook_dispatch_rejected_total")
            .help("Status events dropped because the dispatch queue was full")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    public void recordFirehoseMessage(String kind) {
        firehoseMessages.labels(kind != null ? kind : "unknown").inc();
    }

    public void recordDecodeError() {
        firehoseDecodeErrors.inc();
    }

    public void recordReconnect() {
        firehoseReconnects.inc();
    }

    public void setFirehoseConnected(boolean connected) {
        firehoseConnected.set(connected ? 1 : 0);
    }

    public void recordIngested(String operation) {
        ingested.labels(operation).inc();
    }

    public void recordIngestError(String reason) {
        ingestErrors.labels(reason).inc();
    }

    public void recordDelivery(String outcome, Duration latency) {
        deliveries.labels(outcome).inc();
        if (latency != null) {
            deliveryLatency.observe(latency.toMillis() / 1000.0);
        }
    }

    public void recordDispatchRejected() {
        dispatchRejected.inc();
    }

    double ingestedCount(String operation) {
        return ingested.labels(operation).get();
    }

    double dispatchRejectedCount() {
        return dispatchRejected.get();
    }
}
