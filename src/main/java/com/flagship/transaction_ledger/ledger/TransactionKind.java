package com.flagship.transaction_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.transaction_ledger.ledger.exception.UnknownTransactionKindException;

/**
 * Source of a ledger transaction. Each kind has its own fee schedule in
 * {@link com.flagship.transaction_ledger.fee.FeePolicy}.
 */
public enum TransactionKind {
    CARD_TRANSFER("card_transfer"),
    STRIPE_DEPOSIT("stripe_deposit");

    private final String code;

    TransactionKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Resolves a kind from its wire code (e.g. "card_transfer").
     *
     * @throws UnknownTransactionKindException if no kind has the given code
     */
    public static TransactionKind fromCode(String code) {
        for (TransactionKind kind : values()) {
            if (kind.code.equals(code)) {
                return kind;
            }
        }
        throw new UnknownTransactionKindException(code);
    }
}
