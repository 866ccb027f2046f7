package com.flagship.transaction_ledger.ledger;

import com.flagship.transaction_ledger.fee.FeeBreakdown;
import com.flagship.transaction_ledger.ledger.exception.InvalidAmountException;
import com.flagship.transaction_ledger.ledger.exception.InvalidTransitionException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A single ledger transaction.
 *
 * Immutable: status changes, metadata merges and reference registration all return a
 * new instance. The amounts are fixed at creation and satisfy net == gross - fee.
 */
@Value
public class TransactionRecord {

    public static final int MAX_USER_ID_LENGTH = 255;
    private static final int MONEY_SCALE = 2;

    UUID id;
    String userId;
    TransactionKind kind;
    BigDecimal gross;
    BigDecimal fee;
    BigDecimal net;
    TransactionStatus status;
    Instant createdAt;
    Instant updatedAt;
    String providerReference;
    Map<String, String> metadata;

    public TransactionRecord(UUID id, String userId, TransactionKind kind,
                             BigDecimal gross, BigDecimal fee, BigDecimal net,
                             TransactionStatus status, Instant createdAt, Instant updatedAt,
                             String providerReference, Map<String, String> metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.userId = Objects.requireNonNull(userId, "userId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.gross = Objects.requireNonNull(gross, "gross");
        this.fee = Objects.requireNonNull(fee, "fee");
        this.net = Objects.requireNonNull(net, "net");
        this.status = Objects.requireNonNull(status, "status");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
        this.providerReference = providerReference;
        this.metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));

        if (userId.isBlank() || userId.length() > MAX_USER_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "User id must be 1 to " + MAX_USER_ID_LENGTH + " characters long");
        }
        requireMoneyScale("Gross amount", gross);
        requireMoneyScale("Fee", fee);
        requireMoneyScale("Net amount", net);
        if (gross.signum() <= 0) {
            throw new InvalidAmountException("Gross amount must be positive, got: " + gross);
        }
        if (fee.signum() < 0) {
            throw new InvalidAmountException("Fee must not be negative, got: " + fee);
        }
        if (gross.subtract(fee).compareTo(net) != 0) {
            throw new InvalidAmountException(String.format(
                    "Net amount %s does not equal gross %s minus fee %s", net, gross, fee));
        }
    }

    /**
     * Creates a new record in PENDING status.
     */
    public static TransactionRecord pending(UUID id, String userId, TransactionKind kind,
                                            FeeBreakdown amounts, Map<String, String> metadata) {
        Instant now = Instant.now();
        return new TransactionRecord(
            id,
            userId,
            kind,
            amounts.getGross(),
            amounts.getFee(),
            amounts.getNet(),
            TransactionStatus.PENDING,
            now,
            now,
            null,
            metadata
        );
    }

    /**
     * Moves the record to the target status and refreshes updatedAt.
     *
     * @throws InvalidTransitionException if the state machine does not allow the transition
     */
    public TransactionRecord transitionTo(TransactionStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, target);
        }
        return new TransactionRecord(
            id, userId, kind, gross, fee, net,
            target,
            createdAt,
            Instant.now(),
            providerReference,
            metadata
        );
    }

    /**
     * Returns a copy with the given entries merged into metadata. Status and
     * timestamps are untouched.
     */
    public TransactionRecord withMetadata(Map<String, String> additions) {
        if (additions == null || additions.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(metadata);
        merged.putAll(additions);
        return new TransactionRecord(
            id, userId, kind, gross, fee, net, status, createdAt, updatedAt,
            providerReference, merged
        );
    }

    /**
     * Returns a copy carrying the given provider reference.
     */
    public TransactionRecord withProviderReference(String reference) {
        return new TransactionRecord(
            id, userId, kind, gross, fee, net, status, createdAt, updatedAt,
            reference, metadata
        );
    }

    private static void requireMoneyScale(String label, BigDecimal amount) {
        if (amount.scale() > MONEY_SCALE) {
            throw new InvalidAmountException(String.format(
                    "%s must have at most %d decimal places, got: %s", label, MONEY_SCALE, amount));
        }
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isPending() {
        return status == TransactionStatus.PENDING;
    }
}
