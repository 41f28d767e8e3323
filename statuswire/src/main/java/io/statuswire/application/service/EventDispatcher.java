package io.statuswire.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.statuswire.application.port.output.WebhookTransport;
import io.statuswire.application.port.output.WebhookTransport.WebhookRequest;
import io.statuswire.application.port.output.WebhookTransport.WebhookResponse;
import io.statuswire.domain.model.DeliveryAttempt;
import io.statuswire.domain.model.StatusChange;
import io.statuswire.domain.model.StatusRecord;
import io.statuswire.domain.model.StatusUri;
import io.statuswire.domain.model.WebhookEvent;
import io.statuswire.domain.model.WebhookEventType;
import io.statuswire.domain.model.WebhookSubscription;
import io.statuswire.infrastructure.metrics.PipelineMetrics;
import io.statuswire.security.WebhookSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans a status change out to the owner's webhook subscriptions.
 *
 * Threading:
 *   caller → dispatch pool ("webhook-dispatch-N", bounded queue) → delivery pool ("webhook-delivery-N")
 *
 * {@link #dispatch} only enqueues. When the dispatch queue is full the event is dropped and counted;
 * the status write that triggered it is never slowed down or failed by webhook delivery.
 *
 * Each subscription is delivered independently: one slow, refusing or erroring endpoint only
 * produces a FAILED attempt for itself.
 */
public final class EventDispatcher {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    public static final String USER_AGENT = "statuswire-webhooks/1.0";
    public static final String HEADER_TIMESTAMP = "X-Timestamp";
    public static final String HEADER_EVENT_ID = "X-Event-Id";
    public static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";
    public static final String HEADER_SIGNATURE = "X-Signature";

    static final String TEST_EMOJI = "🧪";

    private final WebhookRegistry registry;
    private final DeliveryLedger ledger;
    private final WebhookTransport transport;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final PipelineMetrics metrics;
    private final Duration deliveryTimeout;

    private final ThreadPoolExecutor dispatchExecutor;
    private final ThreadPoolExecutor deliveryExecutor;

    public EventDispatcher(WebhookRegistry registry,
                           DeliveryLedger ledger,
                           WebhookTransport transport,
                           ObjectMapper objectMapper,
                           Clock clock,
                           PipelineMetrics metrics,
                           DispatcherSettings settings) {
        this.registry = registry;
        this.ledger = ledger;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
        this.deliveryTimeout = settings.deliveryTimeout();

        this.dispatchExecutor = new ThreadPoolExecutor(
            settings.dispatchThreads(), settings.dispatchThreads(),
            0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(settings.dispatchQueueCapacity()),
            namedDaemon("webhook-dispatch-"),
            new ThreadPoolExecutor.AbortPolicy());

        // Overflow runs on the submitting dispatch thread
        this.deliveryExecutor = new ThreadPoolExecutor(
            settings.deliveryThreads(), settings.deliveryThreads(),
            0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(settings.deliveryThreads() * 16),
            namedDaemon("webhook-delivery-"),
            new ThreadPoolExecutor.CallerRunsPolicy());

        log.info("[WEBHOOK] Dispatcher ready (dispatch={}x{}, delivery={}, timeout={}s)",
            settings.dispatchThreads(), settings.dispatchQueueCapacity(), settings.deliveryThreads(),
            deliveryTimeout.toSeconds());
    }

    /**
     * Schedules delivery of {@code change} to the owner's matching subscriptions and returns at once.
     * Never throws; a full queue drops the event with a warning.
     */
    public void dispatch(String ownerDid, StatusChange change) {
        try {
            dispatchExecutor.execute(() -> runDispatch(ownerDid, change));
        } catch (RejectedExecutionException e) {
            metrics.recordDispatchRejected();
            log.warn("[WEBHOOK] Dispatch queue full, dropped {} for {}", change.type(), ownerDid);
        }
    }

    /**
     * Synchronously sends a {@code status.created} test event to one owned subscription,
     * ignoring its filter and active flag.
     *
     * @throws WebhookNotFoundException if the subscription is missing or not owned
     */
    public DeliveryAttempt sendTest(String ownerDid, String subscriptionId) {
        WebhookSubscription subscription = registry.requireOwned(ownerDid, subscriptionId);
        StatusChange change = new StatusChange(
            WebhookEventType.STATUS_CREATED, ownerDid, null, TEST_EMOJI, "webhook test", null,
            StatusUri.of(ownerDid, StatusRecord.COLLECTION, "test").value());

        WebhookEvent event = WebhookEvent.from(change, clock.instant());
        String payload = serialize(event);
        log.info("[WEBHOOK] Test delivery to {} for {}", subscription.id(), ownerDid);
        return deliver(subscription, event, payload);
    }

    /**
     * Stops accepting events and waits up to {@code grace} for queued and in-flight deliveries.
     */
    public void shutdown(Duration grace) {
        long deadline = System.nanoTime() + grace.toNanos();
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS)) {
                log.warn("[WEBHOOK] Dispatch jobs still running after {}, abandoning", grace);
                dispatchExecutor.shutdownNow();
            }
            deliveryExecutor.shutdown();
            if (!deliveryExecutor.awaitTermination(remaining(deadline), TimeUnit.NANOSECONDS)) {
                log.warn("[WEBHOOK] Deliveries still in flight after {}, abandoning", grace);
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatchExecutor.shutdownNow();
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[WEBHOOK] Dispatcher stopped");
    }

    private void runDispatch(String ownerDid, StatusChange change) {
        try {
            List<WebhookSubscription> targets = registry.subscriptionsOf(ownerDid).stream()
                .filter(sub -> EventFilter.shouldSend(sub, change.type()))
                .toList();
            if (targets.isEmpty()) {
                log.debug("[WEBHOOK] No subscriptions for {} on {}", change.type(), ownerDid);
                return;
            }

            WebhookEvent event = WebhookEvent.from(change, clock.instant());
            String payload = serialize(event);

            List<Future<DeliveryAttempt>> futures = new ArrayList<>(targets.size());
            for (WebhookSubscription sub : targets) {
                futures.add(deliveryExecutor.submit(() -> deliver(sub, event, payload)));
            }

            long waitMs = deliveryTimeout.toMillis() + 5_000;
            for (int i = 0; i < futures.size(); i++) {
                awaitDelivery(targets.get(i), futures.get(i), waitMs);
            }
            log.debug("[WEBHOOK] {} {} fanned out to {} subscriptions", change.type(), event.eventId(), targets.size());
        } catch (Exception e) {
            log.error("[WEBHOOK] Dispatch of {} for {} failed: {}", change.type(), ownerDid, e.getMessage(), e);
        }
    }

    private void awaitDelivery(WebhookSubscription sub, Future<DeliveryAttempt> future, long waitMs)
            throws InterruptedException {
        try {
            future.get(waitMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[WEBHOOK] Delivery to {} still running after {}ms", sub.id(), waitMs);
        } catch (ExecutionException e) {
            log.warn("[WEBHOOK] Delivery to {} could not be recorded: {}", sub.id(), e.getCause().getMessage());
        }
    }

    DeliveryAttempt deliver(WebhookSubscription sub, WebhookEvent event, String payload) {
        DeliveryAttempt attempt = ledger.open(sub, event, payload);

        long timestamp = clock.instant().getEpochSecond();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("User-Agent", USER_AGENT);
        headers.put(HEADER_TIMESTAMP, Long.toString(timestamp));
        headers.put(HEADER_EVENT_ID, event.eventId());
        headers.put(HEADER_IDEMPOTENCY_KEY, event.eventId());
        headers.put(HEADER_SIGNATURE, WebhookSigner.sign(sub.secret(), timestamp, payload));

        long start = System.nanoTime();
        DeliveryAttempt done;
        try {
            WebhookResponse response = transport.post(new WebhookRequest(sub.url(), headers, payload, deliveryTimeout));
            done = ledger.complete(attempt, response.statusCode(), response.body());
            metrics.recordDelivery(done.success() ? "delivered" : "failed", Duration.ofNanos(System.nanoTime() - start));
            if (done.success()) {
                log.info("[WEBHOOK] Delivered {} {} to {} ({})", event.type(), event.eventId(), sub.id(), response.statusCode());
            } else {
                log.warn("[WEBHOOK] {} rejected {} {} with {}", sub.id(), event.type(), event.eventId(), response.statusCode());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            done = ledger.fail(attempt, "interrupted");
            metrics.recordDelivery("error", null);
        } catch (Exception e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            done = ledger.fail(attempt, reason);
            metrics.recordDelivery("error", Duration.ofNanos(System.nanoTime() - start));
            log.warn("[WEBHOOK] Delivery of {} to {} failed: {}", event.eventId(), sub.id(), reason);
        }

        try {
            registry.recordDelivery(sub.id(), clock.instant());
        } catch (Exception e) {
            log.warn("[WEBHOOK] Could not update last delivery for {}: {}", sub.id(), e.getMessage());
        }
        return done;
    }

    private String serialize(WebhookEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize webhook event", e);
        }
    }

    private static long remaining(long deadlineNanos) {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
