package io.statuswire.application.port.output;

import io.statuswire.domain.model.DeliveryAttempt;

import java.util.List;
import java.util.Optional;

/**
 * Append-only delivery audit trail.
 */
public interface DeliveryAttemptRepository {

    void insert(DeliveryAttempt attempt);

    /**
     * Writes the outcome of a pending attempt.
     *
     * @return false if the stored attempt was no longer PENDING
     */
    boolean complete(DeliveryAttempt attempt);

    Optional<DeliveryAttempt> findById(String id);

    /**
     * Attempts for one subscription, most recent first.
     */
    List<DeliveryAttempt> findBySubscription(String subscriptionId, int limit);
}
