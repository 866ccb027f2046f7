package com.flagship.transaction_ledger.provider;

import java.math.BigDecimal;

/**
 * Moves money from one card to another.
 */
public interface CardTransferProvider {

    /**
     * Executes a card-to-card transfer. Called at most once per ledger transaction.
     *
     * @param fromCardId source card
     * @param toCardId destination card
     * @param amount gross amount, scale 2
     * @param idempotencyKey token derived from the ledger transaction id; a provider
     *        that sees the same key twice must not execute the transfer twice
     * @return accepted or declined
     * @throws ProviderException if the provider could not be reached or answered
     *         unexpectedly
     */
    CardTransferResult createTransfer(String fromCardId, String toCardId, BigDecimal amount,
                                      String idempotencyKey);
}
