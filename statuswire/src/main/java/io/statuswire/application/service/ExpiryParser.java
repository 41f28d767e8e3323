package io.statuswire.application.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Parses the short expiry strings offered when setting a status: {@code 30m}, {@code 1h}, {@code 2d}, {@code 1w}.
 * Anything longer than {@link #MAX_EXPIRY} is rejected.
 */
public final class ExpiryParser {

    public static final Duration MAX_EXPIRY = Duration.ofDays(3650);

    public static Optional<Duration> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String s = value.trim();
        if (s.length() < 2) {
            return Optional.empty();
        }

        long amount;
        try {
            amount = Long.parseLong(s.substring(0, s.length() - 1));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (amount <= 0) {
            return Optional.empty();
        }

        Duration ttl;
        try {
            ttl = switch (s.charAt(s.length() - 1)) {
                case 'm' -> Duration.ofMinutes(amount);
                case 'h' -> Duration.ofHours(amount);
                case 'd' -> Duration.ofDays(amount);
                case 'w' -> Duration.ofDays(Math.multiplyExact(amount, 7L));
                default -> null;
            };
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
        if (ttl == null || ttl.compareTo(MAX_EXPIRY) > 0) {
            return Optional.empty();
        }
        return Optional.of(ttl);
    }

    private ExpiryParser() {}
}
