package com.flagship.transaction_ledger.ledger;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * ISO-4217 currencies the ledger can be configured to book in.
 *
 * Limited to two-decimal currencies, matching the scale of ledger amounts.
 */
public enum CurrencyCode {
    USD,
    EUR,
    GBP,
    INR;

    private static final int MINOR_UNIT_DIGITS = 2;

    /**
     * Lower-case code as payment gateways expect it ("usd").
     */
    public String gatewayCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Converts a ledger amount to minor units, e.g. 12.34 USD to 1234 cents.
     *
     * @throws ArithmeticException if the amount has more precision than the currency
     */
    public long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(MINOR_UNIT_DIGITS).longValueExact();
    }
}
