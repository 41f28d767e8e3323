package io.statuswire.infrastructure.webhook;

import io.statuswire.application.port.output.WebhookTransport;
import io.statuswire.domain.model.DeliveryAttempt;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Webhook POSTs over the JDK {@link HttpClient}. Redirects are not followed.
 *
 * The request timeout bounds the whole exchange, body included. Only the first
 * {@link #MAX_BODY_BYTES} bytes of the response are kept.
 */
public final class HttpClientWebhookTransport implements WebhookTransport {

    // Enough bytes for MAX_RESPONSE_BODY chars of any UTF-8 text.
    static final int MAX_BODY_BYTES = DeliveryAttempt.MAX_RESPONSE_BODY * 4;

    private final HttpClient httpClient;

    public HttpClientWebhookTransport(Duration connectTimeout) {
        this(HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .build());
    }

    public HttpClientWebhookTransport(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public WebhookResponse post(WebhookRequest request) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(request.url()))
            .timeout(request.timeout())
            .POST(HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8));
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }

        CompletableFuture<HttpResponse<String>> exchange =
            httpClient.sendAsync(builder.build(), info -> new CappedBodySubscriber(MAX_BODY_BYTES));
        try {
            HttpResponse<String> response = exchange.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
            return new WebhookResponse(response.statusCode(), response.body());
        } catch (TimeoutException e) {
            exchange.cancel(true);
            throw new HttpTimeoutException("No complete response within " + request.timeout().toMillis() + "ms");
        } catch (InterruptedException e) {
            exchange.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException(cause != null ? cause.getMessage() : "Webhook request failed", cause);
        }
    }

    /**
     * Collects the body until it ends or {@code limit} bytes have arrived, then stops reading.
     */
    static final class CappedBodySubscriber implements HttpResponse.BodySubscriber<String> {

        private final int limit;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final CompletableFuture<String> body = new CompletableFuture<>();
        private Flow.Subscription subscription;

        CappedBodySubscriber(int limit) {
            this.limit = limit;
        }

        @Override
        public CompletionStage<String> getBody() {
            return body;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            if (body.isDone()) {
                return;
            }
            for (ByteBuffer item : items) {
                int take = Math.min(item.remaining(), limit - buffer.size());
                byte[] chunk = new byte[take];
                item.get(chunk);
                buffer.write(chunk, 0, take);
                if (buffer.size() >= limit) {
                    subscription.cancel();
                    finish();
                    return;
                }
            }
        }

        @Override
        public void onError(Throwable throwable) {
            body.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            finish();
        }

        private void finish() {
            body.complete(buffer.toString(StandardCharsets.UTF_8));
        }
    }
}
