package com.flagship.transaction_ledger.ledger;

import com.flagship.transaction_ledger.ledger.event.TransactionCreatedEvent;
import com.flagship.transaction_ledger.ledger.event.TransactionStatusChangedEvent;
import com.flagship.transaction_ledger.ledger.exception.DuplicateTransactionException;
import com.flagship.transaction_ledger.ledger.exception.InvalidTransitionException;
import com.flagship.transaction_ledger.ledger.exception.TransactionNotFoundException;
import com.flagship.transaction_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * The durable, append-only store of transaction records.
 *
 * The ledger is the only writer of a record's status and updatedAt. Every mutating
 * method runs in its own database transaction, flushes before returning, and writes the
 * matching outbox event in that same transaction. Status changes hold a row lock on the
 * record for the duration of the transition, which makes updates on one record
 * linearizable: of two racing updates on a pending record, the second one sees the
 * terminal status left by the first and fails.
 *
 * Records are never deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionLedger {

    public static final String AGGREGATE_TYPE = "Transaction";

    /**
     * Unique constraints of the transactions table; see V1__create_transactions.sql.
     */
    static final Set<String> UNIQUE_CONSTRAINTS = Set.of(
            "transactions_pkey",
            "uk_transactions_provider_reference",
            "uk_transactions_idempotency_key");

    private final TransactionRepository repository;
    private final OutboxService outboxService;

    /**
     * Appends a new pending record.
     *
     * @return the record's id
     * @throws DuplicateTransactionException if the id, idempotency key or provider
     *         reference is already in the ledger; nothing is written in that case
     * @throws InvalidTransitionException if the record is not pending
     */
    @Transactional
    public UUID logTransaction(TransactionRecord record, String idempotencyKey) {
        if (!record.isPending()) {
            throw new InvalidTransitionException(String.format(
                "Transaction %s must be logged as %s, was %s",
                record.getId(), TransactionStatus.PENDING, record.getStatus()));
        }
        if (repository.existsById(record.getId())) {
            throw new DuplicateTransactionException("Transaction already exists: " + record.getId());
        }
        if (record.getProviderReference() != null
                && repository.existsByProviderReference(record.getProviderReference())) {
            throw new DuplicateTransactionException(
                "Provider reference already registered: " + record.getProviderReference());
        }

        try {
            repository.saveAndFlush(TransactionEntity.fromDomain(record, idempotencyKey));
        } catch (DataIntegrityViolationException e) {
            if (!isUniqueViolation(e)) {
                throw e;
            }
            throw new DuplicateTransactionException(
                "Transaction " + record.getId() + " conflicts with an existing record", e);
        }

        outboxService.saveEvent(AGGREGATE_TYPE, record.getId(),
                TransactionCreatedEvent.EVENT_TYPE, TransactionCreatedEvent.fromRecord(record));

        log.info("Logged transaction: transactionId={}, userId={}, kind={}, gross={}, fee={}, net={}",
                record.getId(), record.getUserId(), record.getKind(),
                record.getGross(), record.getFee(), record.getNet());

        return record.getId();
    }

    @Transactional
    public UUID logTransaction(TransactionRecord record) {
        return logTransaction(record, null);
    }

    /**
     * Returns a user's records in the order they were logged. An unknown user has no
     * records.
     */
    @Transactional(readOnly = true)
    public List<TransactionRecord> getTransactions(String userId) {
        if (userId == null) {
            return Collections.emptyList();
        }
        return repository.findByUserIdOrderBySequenceNumberAsc(userId)
                .stream()
                .map(TransactionEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public TransactionRecord findById(UUID id) {
        return repository.findById(id)
                .map(TransactionEntity::toDomain)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction not found: " + id));
    }

    @Transactional(readOnly = true)
    public TransactionRecord findByReference(String reference) {
        return repository.findByProviderReference(reference)
                .map(TransactionEntity::toDomain)
                .orElseThrow(() -> new TransactionNotFoundException(
                    "No transaction registered for reference: " + reference));
    }

    @Transactional(readOnly = true)
    public Optional<UUID> findIdByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey)
                .map(TransactionEntity::getId);
    }

    @Transactional
    public TransactionRecord updateTransactionStatus(UUID id, TransactionStatus newStatus) {
        return updateTransactionStatus(id, newStatus, Map.of());
    }

    /**
     * Moves a record to a new status, merging the given entries into its metadata.
     *
     * @throws TransactionNotFoundException if the id is unknown
     * @throws InvalidTransitionException if the state machine forbids the transition
     */
    @Transactional
    public TransactionRecord updateTransactionStatus(UUID id, TransactionStatus newStatus,
                                                     Map<String, String> metadata) {
        TransactionEntity entity = lockForUpdate(id);
        TransactionRecord current = entity.toDomain();
        TransactionRecord updated = current.transitionTo(newStatus).withMetadata(metadata);

        entity.updateFromDomain(updated);
        repository.saveAndFlush(entity);

        outboxService.saveEvent(AGGREGATE_TYPE, id, TransactionStatusChangedEvent.EVENT_TYPE,
                TransactionStatusChangedEvent.fromTransition(current.getStatus(), updated));

        log.info("Transaction status updated: transactionId={}, {} -> {}",
                id, current.getStatus(), updated.getStatus());

        return updated;
    }

    /**
     * Registers a provider reference on a pending record and merges provider data into
     * its metadata. Status and updatedAt are left untouched.
     *
     * @throws TransactionNotFoundException if the id is unknown
     * @throws InvalidTransitionException if the record is no longer pending
     * @throws DuplicateTransactionException if the record already has a reference, or
     *         the reference belongs to another record
     */
    @Transactional
    public TransactionRecord attachReference(UUID id, String reference, Map<String, String> metadata) {
        TransactionEntity entity = lockForUpdate(id);
        TransactionRecord current = entity.toDomain();

        if (!current.isPending()) {
            throw new InvalidTransitionException(String.format(
                "Cannot attach a reference to transaction %s in %s status", id, current.getStatus()));
        }
        if (current.getProviderReference() != null) {
            throw new DuplicateTransactionException(String.format(
                "Transaction %s already has reference %s", id, current.getProviderReference()));
        }
        if (repository.existsByProviderReference(reference)) {
            throw new DuplicateTransactionException("Provider reference already registered: " + reference);
        }

        TransactionRecord updated = current.withProviderReference(reference).withMetadata(metadata);
        entity.updateFromDomain(updated);
        try {
            repository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            if (!isUniqueViolation(e)) {
                throw e;
            }
            throw new DuplicateTransactionException("Provider reference already registered: " + reference, e);
        }

        log.debug("Attached reference {} to transaction {}", reference, id);
        return updated;
    }

    /**
     * True if the violation is one of the table's unique constraints. Check constraints,
     * NOT NULL and column lengths are not duplicates and propagate unchanged.
     */
    static boolean isUniqueViolation(DataIntegrityViolationException e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String constraint = ((ConstraintViolationException) cause).getConstraintName();
                return constraint != null && UNIQUE_CONSTRAINTS.contains(constraint.toLowerCase());
            }
        }
        return false;
    }

    private TransactionEntity lockForUpdate(UUID id) {
        return repository.findByIdForUpdate(id)
                .orElseThrow(() -> new TransactionNotFoundException("Transaction not found: " + id));
    }
}
