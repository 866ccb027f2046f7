package com.flagship.transaction_ledger.ledger.exception;

import com.flagship.transaction_ledger.ledger.TransactionStatus;

import java.util.UUID;

/**
 * Thrown when a status change is not allowed by the transaction state machine.
 */
public class InvalidTransitionException extends IllegalStateException {

    public InvalidTransitionException(UUID transactionId, TransactionStatus from, TransactionStatus to) {
        super(String.format("Invalid status transition for transaction %s: %s -> %s",
                transactionId, from, to));
    }

    public InvalidTransitionException(String message) {
        super(message);
    }
}
