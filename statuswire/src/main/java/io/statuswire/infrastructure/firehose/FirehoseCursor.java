package io.statuswire.infrastructure.firehose;

import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Position in the firehose, in the stream's microsecond event time. Process lifetime only.
 */
public final class FirehoseCursor {
    private static final long UNSET = -1L;

    private final AtomicLong position = new AtomicLong(UNSET);

    /**
     * Moves forward to {@code timeUs}. Older positions are ignored.
     */
    public void advance(long timeUs) {
        if (timeUs < 0) {
            return;
        }
        position.accumulateAndGet(timeUs, Math::max);
    }

    public OptionalLong current() {
        long value = position.get();
        return value == UNSET ? OptionalLong.empty() : OptionalLong.of(value);
    }
}
