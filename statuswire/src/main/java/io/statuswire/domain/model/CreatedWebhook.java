package io.statuswire.domain.model;

/**
 * Result of creating a subscription or rotating its secret: the only time the plaintext secret is returned.
 */
public record CreatedWebhook(String id, String secret) {
}
