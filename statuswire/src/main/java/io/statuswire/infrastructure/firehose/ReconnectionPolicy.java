package io.statuswire.infrastructure.firehose;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Exponential backoff for the firehose socket.
 *
 * Every failed connect multiplies the wait before the next one, capped at {@code ceiling}.
 * After {@code budget} consecutive failures the policy is exhausted and {@link #canAttempt()} stays
 * false until the next {@link #onConnected()}.
 *
 * <pre>
 * if (policy.canAttempt()) {
 *     Duration wait = policy.nextDelay();
 *     policy.onConnectFailed();
 *     scheduler.schedule(this::connect, wait.toMillis(), TimeUnit.MILLISECONDS);
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration floor;
    private final Duration ceiling;
    private final double factor;
    private final int budget;
    private final Clock clock;

    private int failures;
    private Duration delay;
    private Instant lastFailureAt;

    public ReconnectionPolicy(Duration floor, Duration ceiling, double factor, int budget, Clock clock) {
        if (floor == null || floor.isNegative() || floor.isZero()) {
            throw new IllegalArgumentException("Initial delay must be positive: " + floor);
        }
        if (ceiling == null || ceiling.compareTo(floor) < 0) {
            throw new IllegalArgumentException("Max delay must be at least the initial delay: " + ceiling);
        }
        if (factor <= 1.0) {
            throw new IllegalArgumentException("Backoff factor must be above 1.0: " + factor);
        }
        if (budget <= 0) {
            throw new IllegalArgumentException("Attempt budget must be positive: " + budget);
        }
        this.floor = floor;
        this.ceiling = ceiling;
        this.factor = factor;
        this.budget = budget;
        this.clock = clock;
        this.delay = floor;
    }

    /**
     * 1s initial, 60s cap, doubling.
     */
    public static ReconnectionPolicy forFirehose(int budget) {
        return forFirehose(budget, Clock.systemUTC());
    }

    public static ReconnectionPolicy forFirehose(int budget, Clock clock) {
        return new ReconnectionPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 2.0, budget, clock);
    }

    public synchronized boolean canAttempt() {
        return failures < budget;
    }

    public synchronized boolean isExhausted() {
        return failures >= budget;
    }

    /**
     * Wait before the next attempt.
     */
    public synchronized Duration nextDelay() {
        return delay;
    }

    public synchronized void onConnectFailed() {
        failures++;
        lastFailureAt = clock.instant();
        long grownMs = (long) (delay.toMillis() * factor);
        delay = grownMs >= ceiling.toMillis() ? ceiling : Duration.ofMillis(grownMs);
    }

    /**
     * Socket open: budget restored, delay back to the initial value.
     */
    public synchronized void onConnected() {
        failures = 0;
        delay = floor;
        lastFailureAt = null;
    }

    public synchronized int failures() {
        return failures;
    }

    public int budget() {
        return budget;
    }

    public synchronized Instant lastFailureAt() {
        return lastFailureAt;
    }
}
