package com.flagship.transaction_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events emitted by the ledger.
 *
 * Events are facts about records that have already been committed; they are written to
 * the outbox in the same database transaction as the ledger change.
 */
public interface TransactionEvent {

    /**
     * Unique identifier for this event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    UUID getTransactionId();

    Instant getOccurredAt();

    String getEventType();
}
