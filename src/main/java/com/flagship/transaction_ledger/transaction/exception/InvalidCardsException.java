package com.flagship.transaction_ledger.transaction.exception;

/**
 * Thrown when a card transfer names a missing card, or the same card on both sides.
 */
public class InvalidCardsException extends IllegalArgumentException {

    public InvalidCardsException(String message) {
        super(message);
    }
}
