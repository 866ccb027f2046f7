package com.flagship.transaction_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a ledger transaction.
 *
 * PENDING is the only initial state. COMPLETED, FAILED and CANCELLED are terminal:
 * once a record reaches one of them it never changes again.
 *
 * <pre>
 *            PENDING
 *               |
 *     +---------+---------+
 *     |         |         |
 * COMPLETED   FAILED   CANCELLED
 * </pre>
 */
public enum TransactionStatus {
    /**
     * Record created, external settlement not yet known.
     */
    PENDING("pending"),

    /**
     * Provider confirmed the money movement. Counts towards the balance.
     */
    COMPLETED("completed"),

    /**
     * Provider rejected the operation or could not be reached.
     */
    FAILED("failed"),

    /**
     * Abandoned by the caller before settlement.
     */
    CANCELLED("cancelled");

    private final String code;

    TransactionStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    /**
     * Checks whether a transition from this status to the target status is allowed.
     * Same-status transitions are rejected as well, so a terminal record can never be
     * "re-completed".
     */
    public boolean canTransitionTo(TransactionStatus target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
