package io.statuswire.infrastructure.firehose;

/**
 * The firehose could not be (re)connected within the reconnection budget.
 */
public class FirehoseConnectException extends RuntimeException {

    private final int attempts;

    public FirehoseConnectException(String endpoint, int attempts, Throwable cause) {
        super(String.format("Firehose %s unreachable after %d attempts", endpoint, attempts), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
