package io.statuswire.domain.model;

/**
 * Delivery attempt lifecycle. PENDING moves once to a terminal state.
 */
public enum DeliveryStatus {
    PENDING,
    DELIVERED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
