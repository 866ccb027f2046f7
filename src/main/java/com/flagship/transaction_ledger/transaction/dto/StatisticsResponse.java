package com.flagship.transaction_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transaction_ledger.balance.TransactionStatistics;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class StatisticsResponse {

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("total_transactions")
    int total;

    @JsonProperty("completed")
    int completed;

    @JsonProperty("failed")
    int failed;

    @JsonProperty("pending")
    int pending;

    @JsonProperty("cancelled")
    int cancelled;

    @JsonProperty("success_rate")
    BigDecimal successRate;

    @JsonProperty("total_amount")
    BigDecimal totalGross;

    @JsonProperty("completed_amount")
    BigDecimal completedGross;

    @JsonProperty("average_amount")
    BigDecimal averageGross;

    public static StatisticsResponse from(TransactionStatistics stats) {
        return StatisticsResponse.builder()
            .userId(stats.getUserId())
            .total(stats.getTotal())
            .completed(stats.getCompleted())
            .failed(stats.getFailed())
            .pending(stats.getPending())
            .cancelled(stats.getCancelled())
            .successRate(stats.getSuccessRate())
            .totalGross(stats.getTotalGross())
            .completedGross(stats.getCompletedGross())
            .averageGross(stats.getAverageGross())
            .build();
    }
}
