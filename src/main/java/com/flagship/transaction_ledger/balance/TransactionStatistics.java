package com.flagship.transaction_ledger.balance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class TransactionStatistics {
    String userId;
    int total;
    int completed;
    int failed;
    int pending;
    int cancelled;
    /** Completed as a percentage of all transactions, two decimals. */
    BigDecimal successRate;
    BigDecimal totalGross;
    BigDecimal completedGross;
    BigDecimal averageGross;
}
