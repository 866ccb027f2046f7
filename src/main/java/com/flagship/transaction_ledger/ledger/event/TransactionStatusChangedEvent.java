package com.flagship.transaction_ledger.ledger.event;

import com.flagship.transaction_ledger.ledger.MetadataKeys;
import com.flagship.transaction_ledger.ledger.TransactionKind;
import com.flagship.transaction_ledger.ledger.TransactionRecord;
import com.flagship.transaction_ledger.ledger.TransactionStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event emitted when a record leaves PENDING for a terminal status.
 *
 * Carries the net amount so that balance projections downstream can apply COMPLETED
 * records without reading the ledger.
 */
@Value
public class TransactionStatusChangedEvent implements TransactionEvent {
    UUID eventId;
    UUID transactionId;
    String userId;
    TransactionKind kind;
    TransactionStatus previousStatus;
    TransactionStatus status;
    BigDecimal net;
    String error;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionStatusChangedEvent fromTransition(TransactionStatus previousStatus,
                                                               TransactionRecord updated) {
        return new TransactionStatusChangedEvent(
            UUID.randomUUID(),
            updated.getId(),
            updated.getUserId(),
            updated.getKind(),
            previousStatus,
            updated.getStatus(),
            updated.getNet(),
            updated.getMetadata().get(MetadataKeys.ERROR),
            updated.getUpdatedAt()
        );
    }
}
