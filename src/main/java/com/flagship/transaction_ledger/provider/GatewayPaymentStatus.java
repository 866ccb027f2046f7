package com.flagship.transaction_ledger.provider;

import lombok.Value;

/**
 * State of a deposit as reported by the payment gateway.
 *
 * {@code status} is the gateway's own wording, kept for the record; {@code outcome} is
 * what the ledger acts on.
 */
@Value
public class GatewayPaymentStatus {
    String reference;
    String status;
    Outcome outcome;
    String error;

    public enum Outcome {
        /** Funds captured. */
        SUCCEEDED,
        /** Will not succeed without a new payment attempt. */
        FAILED,
        /** Still waiting on the payer or the gateway. */
        IN_PROGRESS
    }

    public static GatewayPaymentStatus of(String reference, String status, Outcome outcome) {
        return new GatewayPaymentStatus(reference, status, outcome, null);
    }
}
