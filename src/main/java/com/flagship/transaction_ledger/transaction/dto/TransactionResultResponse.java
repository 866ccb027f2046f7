package com.flagship.transaction_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transaction_ledger.ledger.TransactionStatus;
import com.flagship.transaction_ledger.transaction.TransactionResult;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionResultResponse {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("data")
    Map<String, String> data;

    @JsonProperty("error")
    String error;

    @JsonProperty("transaction")
    TransactionResponse transaction;

    public static TransactionResultResponse from(TransactionResult result) {
        return TransactionResultResponse.builder()
            .success(result.isSuccess())
            .transactionId(result.getTransactionId())
            .status(result.getStatus())
            .data(result.getData().isEmpty() ? null : result.getData())
            .error(result.getError())
            .transaction(result.getRecord() != null ? TransactionResponse.from(result.getRecord()) : null)
            .build();
    }
}
