package com.flagship.transaction_ledger.balance;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's balance: the sum of net amounts of their completed transactions.
 */
@Value
@Builder
public class UserBalance {
    String userId;
    BigDecimal balance;
    Instant asOf;
    BigDecimal totalDeposits;
    BigDecimal totalTransfers;
    int completedCount;
    int transactionCount;
}
