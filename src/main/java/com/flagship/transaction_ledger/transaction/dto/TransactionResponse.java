package com.flagship.transaction_ledger.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.transaction_ledger.ledger.TransactionKind;
import com.flagship.transaction_ledger.ledger.TransactionRecord;
import com.flagship.transaction_ledger.ledger.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("type")
    TransactionKind kind;

    @JsonProperty("amount")
    BigDecimal gross;

    @JsonProperty("fee")
    BigDecimal fee;

    @JsonProperty("net_amount")
    BigDecimal net;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("provider_reference")
    String providerReference;

    @JsonProperty("metadata")
    Map<String, String> metadata;

    public static TransactionResponse from(TransactionRecord record) {
        return TransactionResponse.builder()
            .id(record.getId())
            .userId(record.getUserId())
            .kind(record.getKind())
            .gross(record.getGross())
            .fee(record.getFee())
            .net(record.getNet())
            .status(record.getStatus())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .providerReference(record.getProviderReference())
            .metadata(record.getMetadata())
            .build();
    }
}
