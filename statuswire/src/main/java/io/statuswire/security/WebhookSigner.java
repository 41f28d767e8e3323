package io.statuswire.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 webhook signatures.
 *
 * The signed string is {@code v0:<unix-seconds>:<raw body>} and the header value is
 * {@code v1=<lowercase hex>}. Receivers recompute it over the exact bytes they received.
 */
public final class WebhookSigner {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String VERSION_PREFIX = "v1=";

    public static String sign(String secret, long timestamp, String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] hash = mac.doFinal(signedContent(timestamp, payload).getBytes(StandardCharsets.UTF_8));
            return VERSION_PREFIX + HexFormat.of().formatHex(hash);
        } catch (Exception e) {
            throw new RuntimeException("Failed to sign webhook payload", e);
        }
    }

    /**
     * Constant-time check of a received signature header.
     */
    public static boolean verify(String secret, long timestamp, String payload, String signatureHeader) {
        if (signatureHeader == null) {
            return false;
        }
        String expected = sign(secret, timestamp, payload);
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            signatureHeader.getBytes(StandardCharsets.UTF_8));
    }

    static String signedContent(long timestamp, String payload) {
        return "v0:" + timestamp + ":" + payload;
    }

    private WebhookSigner() {}
}
