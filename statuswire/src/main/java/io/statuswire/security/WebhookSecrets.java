package io.statuswire.security;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Signing secret generation and masking.
 */
public final class WebhookSecrets {

    public static final int MIN_SECRET_LENGTH = 16;
    private static final int SECRET_BYTES = 32;
    private static final String MASK = "****";

    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * @return 64 lowercase hex characters
     */
    public static String generate() {
        byte[] bytes = new byte[SECRET_BYTES];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Masks all but the last four characters. Short secrets are masked entirely.
     */
    public static String mask(String secret) {
        if (secret == null || secret.length() <= 4) {
            return MASK;
        }
        return MASK + secret.substring(secret.length() - 4);
    }

    private WebhookSecrets() {}
}
