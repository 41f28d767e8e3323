package io.statuswire.application.service;

/**
 * Subscription does not exist or belongs to someone else. Both cases read the same.
 */
public class WebhookNotFoundException extends RuntimeException {

    public WebhookNotFoundException(String webhookId) {
        super("Webhook not found: " + webhookId);
    }
}
