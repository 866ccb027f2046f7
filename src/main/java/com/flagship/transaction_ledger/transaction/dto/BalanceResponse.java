package com.flagship.transaction_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transaction_ledger.balance.UserBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class BalanceResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("as_of")
    Instant asOf;

    @JsonProperty("total_deposits")
    BigDecimal totalDeposits;

    @JsonProperty("total_transfers")
    BigDecimal totalTransfers;

    @JsonProperty("completed_count")
    int completedCount;

    @JsonProperty("transaction_count")
    int transactionCount;

    public static BalanceResponse from(UserBalance balance) {
        return BalanceResponse.builder()
            .userId(balance.getUserId())
            .balance(balance.getBalance())
            .asOf(balance.getAsOf())
            .totalDeposits(balance.getTotalDeposits())
            .totalTransfers(balance.getTotalTransfers())
            .completedCount(balance.getCompletedCount())
            .transactionCount(balance.getTransactionCount())
            .build();
    }
}
