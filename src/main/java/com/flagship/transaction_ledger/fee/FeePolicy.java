package com.flagship.transaction_ledger.fee;

import com.flagship.transaction_ledger.ledger.TransactionKind;
import com.flagship.transaction_ledger.ledger.exception.InvalidAmountException;
import com.flagship.transaction_ledger.ledger.exception.UnknownTransactionKindException;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fee table for ledger transactions.
 *
 * <ul>
 *   <li>card_transfer: 2% of gross</li>
 *   <li>stripe_deposit: 2.9% of gross + 0.30</li>
 * </ul>
 *
 * Fees are rounded HALF_UP to two decimal places. The lookup is an exhaustive switch
 * over {@link TransactionKind}, so a new kind does not compile until it has a schedule.
 */
@Component
public class FeePolicy {

    public static final int MONEY_SCALE = 2;

    private static final FeeSchedule CARD_TRANSFER_SCHEDULE =
            new FeeSchedule(new BigDecimal("0.02"), BigDecimal.ZERO);
    private static final FeeSchedule STRIPE_DEPOSIT_SCHEDULE =
            new FeeSchedule(new BigDecimal("0.029"), new BigDecimal("0.30"));

    /**
     * Computes the fee for a gross amount.
     *
     * @throws InvalidAmountException if gross is not a positive amount with at most two decimals
     * @throws UnknownTransactionKindException if kind is null
     */
    public BigDecimal fee(TransactionKind kind, BigDecimal gross) {
        FeeSchedule schedule = scheduleFor(kind);
        BigDecimal normalized = normalizeAmount(gross);
        return schedule.apply(normalized);
    }

    /**
     * Splits a gross amount into fee and net. Net is negative when a fixed fee exceeds
     * a small gross amount; it is recorded as such.
     *
     * @throws InvalidAmountException if gross is not a positive amount with at most two decimals
     */
    public FeeBreakdown breakdown(TransactionKind kind, BigDecimal gross) {
        FeeSchedule schedule = scheduleFor(kind);
        BigDecimal normalized = normalizeAmount(gross);
        BigDecimal fee = schedule.apply(normalized);
        return new FeeBreakdown(normalized, fee, normalized.subtract(fee));
    }

    /**
     * Validates an amount and brings it to minor-unit scale.
     *
     * @throws InvalidAmountException if amount is null, not positive, or has more than two decimals
     */
    public static BigDecimal normalizeAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("Amount must be positive, got: " + amount);
        }
        try {
            return amount.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(
                    "Amount must have at most " + MONEY_SCALE + " decimal places, got: " + amount);
        }
    }

    private static FeeSchedule scheduleFor(TransactionKind kind) {
        if (kind == null) {
            throw new UnknownTransactionKindException(null);
        }
        return switch (kind) {
            case CARD_TRANSFER -> CARD_TRANSFER_SCHEDULE;
            case STRIPE_DEPOSIT -> STRIPE_DEPOSIT_SCHEDULE;
        };
    }

    @Value
    private static class FeeSchedule {
        BigDecimal rate;
        BigDecimal fixed;

        BigDecimal apply(BigDecimal gross) {
            return gross.multiply(rate)
                    .add(fixed)
                    .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
        }
    }
}
