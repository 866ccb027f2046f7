package com.flagship.transaction_ledger.transaction;

import com.flagship.transaction_ledger.ledger.MetadataKeys;
import com.flagship.transaction_ledger.ledger.TransactionRecord;
import com.flagship.transaction_ledger.ledger.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * Outcome of an orchestrator operation.
 *
 * Provider declines and transport errors come back here with {@code success == false};
 * they are never thrown. {@code record} is the ledger state after the operation.
 */
@Value
@Builder
public class TransactionResult {
    boolean success;
    UUID transactionId;
    TransactionStatus status;
    TransactionRecord record;
    @Builder.Default
    Map<String, String> data = Map.of();
    String error;

    static TransactionResult success(TransactionRecord record, Map<String, String> data) {
        return TransactionResult.builder()
                .success(true)
                .transactionId(record.getId())
                .status(record.getStatus())
                .record(record)
                .data(MetadataKeys.withoutNulls(data))
                .build();
    }

    static TransactionResult failure(TransactionRecord record, String error) {
        return TransactionResult.builder()
                .success(false)
                .transactionId(record.getId())
                .status(record.getStatus())
                .record(record)
                .error(error)
                .build();
    }

    /**
     * Result for a request answered from an earlier execution with the same idempotency
     * key: whatever the ledger now holds for that transaction.
     */
    public static TransactionResult replay(TransactionRecord record) {
        return TransactionResult.builder()
                .success(record.getStatus() == TransactionStatus.COMPLETED || record.isPending())
                .transactionId(record.getId())
                .status(record.getStatus())
                .record(record)
                .data(record.getMetadata())
                .error(record.getMetadata().get(MetadataKeys.ERROR))
                .build();
    }
}
