package io.statuswire.infrastructure.firehose;

import io.statuswire.application.service.RecordIngestor;
import io.statuswire.domain.model.FirehoseMessage;
import io.statuswire.infrastructure.metrics.PipelineMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Tails the firehose and feeds status commits to the {@link RecordIngestor}.
 *
 * Threading:
 *   WebSocket listener (HttpClient executor) → bounded frame queue → "firehose-ingest" worker
 *
 * The socket is paced with {@code request(1)}: the next frame is only requested once the current
 * one is queued. When the queue is full the frame is parked and the worker requests more after it
 * makes room, so a slow store slows the socket instead of growing memory.
 *
 * Frames are handled strictly in arrival order by a single worker. After each frame the cursor
 * moves to its {@code time_us}, whether it applied, was skipped or failed, and reconnects resume
 * from there.
 */
public final class FirehoseConsumer {
    private static final Logger log = LoggerFactory.getLogger(FirehoseConsumer.class);

    private static final long MAX_FRAME_SILENCE_MS = 5 * 60 * 1000; // 5 minutes
    private static final long POLL_INTERVAL_MS = 250;

    private final FirehoseSettings settings;
    private final RecordIngestor ingestor;
    private final FirehoseMessageDecoder decoder;
    private final PipelineMetrics metrics;
    private final HttpClient httpClient;
    private final ReconnectionPolicy reconnectionPolicy;
    private final Consumer<FirehoseConnectException> fatalHandler;

    private final FirehoseCursor cursor = new FirehoseCursor();
    private final BlockingQueue<String> frames;
    private final AtomicReference<WebSocket> wsRef = new AtomicReference<>(null);
    private final ScheduledExecutorService reconnectScheduler;

    private final Object stallLock = new Object();
    private String stalledFrame;
    private WebSocket stalledSocket;

    private volatile Thread worker;
    private volatile boolean running = false;
    private volatile boolean connected = false;
    private volatile long lastFrameAt = 0L;
    private volatile Throwable lastError;

    public FirehoseConsumer(FirehoseSettings settings,
                            RecordIngestor ingestor,
                            FirehoseMessageDecoder decoder,
                            PipelineMetrics metrics,
                            HttpClient httpClient,
                            ReconnectionPolicy reconnectionPolicy,
                            Consumer<FirehoseConnectException> fatalHandler) {
        this.settings = settings;
        this.ingestor = ingestor;
        this.decoder = decoder;
        this.metrics = metrics;
        this.httpClient = httpClient;
        this.reconnectionPolicy = reconnectionPolicy;
        this.fatalHandler = fatalHandler;
        this.frames = new LinkedBlockingQueue<>(settings.queueCapacity());
        this.reconnectScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "firehose-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the ingest worker and opens the socket. Returns without waiting for the connection.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;

        Thread t = new Thread(this::drainLoop, "firehose-ingest");
        t.setDaemon(true);
        t.start();
        worker = t;

        log.info("[FIREHOSE] Starting consumer for {} (collections={}, queue={})",
            maskUrl(settings.endpoint()), settings.wantedCollections(), settings.queueCapacity());
        connect();
    }

    /**
     * Closes the socket, lets the worker finish queued frames for up to {@code grace}, then interrupts it.
     */
    public void stop(Duration grace) {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        reconnectScheduler.shutdownNow();

        WebSocket ws = wsRef.getAndSet(null);
        connected = false;
        metrics.setFirehoseConnected(false);
        if (ws != null) {
            try {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown");
            } catch (Exception e) {
                log.debug("[FIREHOSE] Close handshake failed: {}", e.getMessage());
            }
        }

        Thread t = worker;
        if (t != null) {
            try {
                t.join(grace.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("[FIREHOSE] Worker did not drain within {}, {} frames dropped", grace, frames.size());
                t.interrupt();
            }
        }
        log.info("[FIREHOSE] Stopped at cursor {}", cursor.current());
    }

    /**
     * @return false when the socket is closed or has been silent for more than 5 minutes
     */
    public boolean isConnected() {
        if (connected && lastFrameAt > 0) {
            long silence = System.currentTimeMillis() - lastFrameAt;
            if (silence > MAX_FRAME_SILENCE_MS) {
                log.warn("[FIREHOSE] Stale stream: no frames for {}ms", silence);
                return false;
            }
        }
        return connected;
    }

    public FirehoseCursor getCursor() {
        return cursor;
    }

    public int getQueuedFrames() {
        return frames.size();
    }

    URI buildSubscribeUri() {
        StringBuilder url = new StringBuilder(settings.endpoint());
        char sep = settings.endpoint().contains("?") ? '&' : '?';
        for (String collection : settings.wantedCollections()) {
            url.append(sep).append("wantedCollections=").append(URLEncoder.encode(collection, StandardCharsets.UTF_8));
            sep = '&';
        }
        OptionalLong position = cursor.current();
        if (position.isPresent()) {
            url.append(sep).append("cursor=").append(position.getAsLong());
        }
        return URI.create(url.toString());
    }

    private void connect() {
        if (!running) {
            return;
        }
        URI uri = buildSubscribeUri();
        log.info("[FIREHOSE] Connecting to {}", maskUrl(uri.toString()));

        AtomicBoolean ended = new AtomicBoolean(false);
        httpClient.newWebSocketBuilder()
            .connectTimeout(settings.connectTimeout())
            .buildAsync(uri, new Listener(ended))
            .whenComplete((ws, error) -> {
                if (error != null) {
                    log.warn("[FIREHOSE] Connect failed: {}", error.getMessage());
                    onConnectionEnded(ended, error);
                }
            });
    }

    private void onConnectionEnded(AtomicBoolean ended, Throwable cause) {
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        connected = false;
        wsRef.set(null);
        metrics.setFirehoseConnected(false);
        if (cause != null) {
            lastError = cause;
        }
        if (!running) {
            return;
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!reconnectionPolicy.canAttempt()) {
            int attempts = reconnectionPolicy.failures();
            log.error("[FIREHOSE] Reconnection budget exhausted after {} attempts", attempts);
            running = false;
            fatalHandler.accept(new FirehoseConnectException(maskUrl(settings.endpoint()), attempts, lastError));
            return;
        }

        Duration delay = reconnectionPolicy.nextDelay();
        reconnectionPolicy.onConnectFailed();
        metrics.recordReconnect();
        log.info("[FIREHOSE] Reconnecting in {}ms (attempt {}/{}, cursor={})", delay.toMillis(),
            reconnectionPolicy.failures(), reconnectionPolicy.budget(), cursor.current());

        try {
            reconnectScheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[FIREHOSE] Reconnect not scheduled, consumer stopping");
        }
    }

    private void enqueue(WebSocket ws, String frame) {
        synchronized (stallLock) {
            if (frames.offer(frame)) {
                ws.request(1);
                return;
            }
            stalledFrame = frame;
            stalledSocket = ws;
        }
        log.debug("[FIREHOSE] Frame queue full ({}), pausing socket", settings.queueCapacity());
    }

    private void releaseStalled() {
        WebSocket resume = null;
        synchronized (stallLock) {
            if (stalledFrame != null && frames.offer(stalledFrame)) {
                resume = stalledSocket;
                stalledFrame = null;
                stalledSocket = null;
            }
        }
        if (resume != null) {
            resume.request(1);
        }
    }

    private void drainLoop() {
        log.info("[FIREHOSE] Ingest worker started");
        while (true) {
            String frame;
            try {
                frame = frames.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (frame == null) {
                if (!running) {
                    break;
                }
                continue;
            }
            releaseStalled();
            process(frame);
        }
        log.info("[FIREHOSE] Ingest worker exited");
    }

    void process(String frame) {
        FirehoseMessage message;
        try {
            message = decoder.decode(frame);
        } catch (FirehoseDecodeException e) {
            metrics.recordDecodeError();
            log.warn("[FIREHOSE] Skipping undecodable frame: {}", e.getMessage());
            if (e.hasTimeUs()) {
                cursor.advance(e.getTimeUs());
            }
            return;
        }

        metrics.recordFirehoseMessage(message.kind());
        try {
            if (!message.isCommit()) {
                log.debug("[FIREHOSE] Skipping {} frame for {}", message.kind(), message.did());
            } else if (!settings.wantedCollections().contains(message.commit().collection())) {
                log.debug("[FIREHOSE] Skipping unwanted collection {}", message.commit().collection());
            } else {
                ingestor.ingest(message.commit());
            }
        } catch (FirehoseDecodeException e) {
            metrics.recordDecodeError();
            log.warn("[FIREHOSE] Skipping invalid record from {}: {}", message.did(), e.getMessage());
        } catch (Exception e) {
            log.error("[FIREHOSE] Failed to apply commit from {} at {}: {}",
                message.did(), message.timeUs(), e.getMessage(), e);
        } finally {
            cursor.advance(message.timeUs());
        }
    }

    private final class Listener implements WebSocket.Listener {
        private final StringBuilder buf = new StringBuilder();
        private final AtomicBoolean ended;

        Listener(AtomicBoolean ended) {
            this.ended = ended;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            wsRef.set(webSocket);
            connected = true;
            lastFrameAt = System.currentTimeMillis();
            reconnectionPolicy.onConnected();
            metrics.setFirehoseConnected(true);
            log.info("[FIREHOSE] Connected (cursor={})", cursor.current());
            if (!running) {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown");
                return;
            }
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (!last) {
                webSocket.request(1);
                return CompletableFuture.completedFuture(null);
            }
            String frame = buf.toString();
            buf.setLength(0);
            lastFrameAt = System.currentTimeMillis();
            if (running) {
                enqueue(webSocket, frame);
            }
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.warn("[FIREHOSE] Disconnected: {} {}", statusCode, reason);
            onConnectionEnded(ended, null);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.error("[FIREHOSE] WebSocket error: {}", error.getMessage(), error);
            onConnectionEnded(ended, error);
        }
    }

    private static String maskUrl(String url) {
        if (url == null) return "null";
        int tokenIdx = url.indexOf("token=");
        if (tokenIdx < 0) return url;
        int endIdx = url.indexOf("&", tokenIdx);
        if (endIdx < 0) endIdx = url.length();
        return url.substring(0, tokenIdx + 6) + "***" + url.substring(endIdx);
    }
}
