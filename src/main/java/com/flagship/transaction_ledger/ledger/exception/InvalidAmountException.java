package com.flagship.transaction_ledger.ledger.exception;

/**
 * Thrown when a monetary amount is missing, not positive, or finer than the
 * currency minor unit.
 */
public class InvalidAmountException extends IllegalArgumentException {

    public InvalidAmountException(String message) {
        super(message);
    }
}
