package com.flagship.transaction_ledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for ledger transactions.
 */
@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, UUID> {

    /**
     * Loads a transaction with a row lock held until the surrounding transaction ends.
     * Serializes concurrent status updates on the same record.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TransactionEntity t WHERE t.id = :id")
    Optional<TransactionEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * User index: all of a user's transactions in the order they were logged.
     */
    List<TransactionEntity> findByUserIdOrderBySequenceNumberAsc(String userId);

    /**
     * Reference index, used by deposit confirmation.
     */
    Optional<TransactionEntity> findByProviderReference(String providerReference);

    boolean existsByProviderReference(String providerReference);

    Optional<TransactionEntity> findByIdempotencyKey(String idempotencyKey);
}
