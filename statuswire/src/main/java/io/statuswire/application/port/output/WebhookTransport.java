package io.statuswire.application.port.output;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Outbound POST of a signed webhook body.
 */
public interface WebhookTransport {

    WebhookResponse post(WebhookRequest request) throws IOException, InterruptedException;

    record WebhookRequest(String url, Map<String, String> headers, String body, Duration timeout) {
    }

    record WebhookResponse(int statusCode, String body) {
        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
