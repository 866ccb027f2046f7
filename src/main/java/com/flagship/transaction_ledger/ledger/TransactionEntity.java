package com.flagship.transaction_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * JPA entity backing the ledger's transactions table.
 *
 * No setters: amounts, kind, owner and creation time are write-once. Only status,
 * updatedAt, metadata and the provider reference change, and only through
 * {@link #updateFromDomain(TransactionRecord)}.
 *
 * Implements {@link Persistable} so that saving a new entity with an assigned id is an
 * INSERT rather than a merge; a duplicate id then fails on the primary key instead of
 * silently overwriting the existing row.
 */
@Entity
@Table(
    name = "transactions",
    indexes = {
        @Index(name = "idx_transactions_user_sequence", columnList = "user_id, sequence_number"),
        @Index(name = "idx_transactions_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionEntity implements Persistable<UUID> {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private TransactionKind kind;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal gross;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal fee;

    @Column(nullable = false, updatable = false, precision = 19, scale = 2)
    private BigDecimal net;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TransactionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "provider_reference", unique = true)
    private String providerReference;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", nullable = false, columnDefinition = "jsonb")
    private Map<String, String> metadata = new LinkedHashMap<>();

    /**
     * Insertion order within the ledger, assigned by the database.
     */
    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Transient
    @Getter(AccessLevel.NONE)
    private boolean newEntity;

    /**
     * Creates a new, not yet persisted entity from a domain record.
     *
     * @param record domain record
     * @param idempotencyKey caller-supplied idempotency key, may be null
     */
    static TransactionEntity fromDomain(TransactionRecord record, String idempotencyKey) {
        TransactionEntity entity = new TransactionEntity();
        entity.id = record.getId();
        entity.userId = record.getUserId();
        entity.kind = record.getKind();
        entity.gross = record.getGross();
        entity.fee = record.getFee();
        entity.net = record.getNet();
        entity.status = record.getStatus();
        entity.createdAt = record.getCreatedAt();
        entity.updatedAt = record.getUpdatedAt();
        entity.providerReference = record.getProviderReference();
        entity.idempotencyKey = idempotencyKey;
        entity.metadata = new LinkedHashMap<>(record.getMetadata());
        entity.newEntity = true;
        return entity;
    }

    public TransactionRecord toDomain() {
        return new TransactionRecord(
            id,
            userId,
            kind,
            gross,
            fee,
            net,
            status,
            createdAt,
            updatedAt,
            providerReference,
            metadata
        );
    }

    /**
     * Copies the mutable part of a domain record onto this entity.
     */
    void updateFromDomain(TransactionRecord record) {
        if (!id.equals(record.getId())) {
            throw new IllegalArgumentException(
                "Cannot update transaction " + id + " from record " + record.getId());
        }
        this.status = record.getStatus();
        this.updatedAt = record.getUpdatedAt();
        this.providerReference = record.getProviderReference();
        this.metadata = new LinkedHashMap<>(record.getMetadata());
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }
}
