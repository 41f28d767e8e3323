package io.statuswire.application.service;

import java.time.Duration;

/**
 * Pool sizes and timeout for {@link EventDispatcher}.
 */
public record DispatcherSettings(
        int dispatchThreads,
        int dispatchQueueCapacity,
        int deliveryThreads,
        Duration deliveryTimeout) {

    public static final Duration MIN_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration MAX_TIMEOUT = Duration.ofSeconds(30);

    public DispatcherSettings {
        if (dispatchThreads <= 0 || deliveryThreads <= 0) {
            throw new IllegalArgumentException("Thread counts must be positive");
        }
        if (dispatchQueueCapacity <= 0) {
            throw new IllegalArgumentException("Dispatch queue capacity must be positive");
        }
        deliveryTimeout = clampTimeout(deliveryTimeout);
    }

    public static DispatcherSettings defaults() {
        return new DispatcherSettings(2, 256, 8, Duration.ofSeconds(10));
    }

    static Duration clampTimeout(Duration timeout) {
        if (timeout == null || timeout.compareTo(MIN_TIMEOUT) < 0) {
            return MIN_TIMEOUT;
        }
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            return MAX_TIMEOUT;
        }
        return timeout;
    }
}
