package com.flagship.transaction_ledger.fee;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Gross amount split into fee and net, all at currency minor-unit scale.
 *
 * Invariant: net == gross - fee.
 */
@Value
public class FeeBreakdown {
    BigDecimal gross;
    BigDecimal fee;
    BigDecimal net;
}
