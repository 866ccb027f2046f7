package com.flagship.transaction_ledger.ledger.exception;

/**
 * Thrown when a record is logged with an id, idempotency key or provider reference
 * that the ledger already holds.
 */
public class DuplicateTransactionException extends IllegalStateException {

    public DuplicateTransactionException(String message) {
        super(message);
    }

    public DuplicateTransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
