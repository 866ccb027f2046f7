package com.flagship.transaction_ledger.ledger.event;

import com.flagship.transaction_ledger.ledger.TransactionKind;
import com.flagship.transaction_ledger.ledger.TransactionRecord;
import com.flagship.transaction_ledger.ledger.TransactionStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event emitted when a record is appended to the ledger (always in PENDING status).
 */
@Value
public class TransactionCreatedEvent implements TransactionEvent {
    UUID eventId;
    UUID transactionId;
    String userId;
    TransactionKind kind;
    BigDecimal gross;
    BigDecimal fee;
    BigDecimal net;
    TransactionStatus status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TransactionCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static TransactionCreatedEvent fromRecord(TransactionRecord record) {
        return new TransactionCreatedEvent(
            UUID.randomUUID(),
            record.getId(),
            record.getUserId(),
            record.getKind(),
            record.getGross(),
            record.getFee(),
            record.getNet(),
            record.getStatus(),
            record.getCreatedAt()
        );
    }
}
