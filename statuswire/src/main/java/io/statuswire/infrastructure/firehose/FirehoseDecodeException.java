package io.statuswire.infrastructure.firehose;

/**
 * A firehose frame or record body that cannot be turned into a status change.
 * Carries the frame's event time when it could be read, so the cursor can still move past it.
 */
public class FirehoseDecodeException extends Exception {

    private final long timeUs;

    public FirehoseDecodeException(String message) {
        this(message, -1L, null);
    }

    public FirehoseDecodeException(String message, long timeUs) {
        this(message, timeUs, null);
    }

    public FirehoseDecodeException(String message, long timeUs, Throwable cause) {
        super(message, cause);
        this.timeUs = timeUs;
    }

    public boolean hasTimeUs() {
        return timeUs >= 0;
    }

    public long getTimeUs() {
        return timeUs;
    }
}
