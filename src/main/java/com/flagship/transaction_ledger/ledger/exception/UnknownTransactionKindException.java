package com.flagship.transaction_ledger.ledger.exception;

/**
 * Thrown when a transaction kind has no entry in the fee table, or a kind code
 * cannot be resolved.
 */
public class UnknownTransactionKindException extends IllegalArgumentException {

    public UnknownTransactionKindException(Object kind) {
        super("Unknown transaction kind: " + kind);
    }
}
