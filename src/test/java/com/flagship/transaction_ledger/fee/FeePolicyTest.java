package com.flagship.transaction_ledger.fee;

import com.flagship.transaction_ledger.ledger.TransactionKind;
import com.flagship.transaction_ledger.ledger.exception.InvalidAmountException;
import com.flagship.transaction_ledger.ledger.exception.UnknownTransactionKindException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class FeePolicyTest {

    private final FeePolicy feePolicy = new FeePolicy();

    @Test
    @DisplayName("Card transfer of 100.00 costs 2.00 and nets 98.00")
    void testCardTransferFee() {
        FeeBreakdown breakdown = feePolicy.breakdown(TransactionKind.CARD_TRANSFER, new BigDecimal("100.00"));

        assertEquals(new BigDecimal("100.00"), breakdown.getGross());
        assertEquals(new BigDecimal("2.00"), breakdown.getFee());
        assertEquals(new BigDecimal("98.00"), breakdown.getNet());
    }

    @Test
    @DisplayName("Deposit of 50.00 costs 1.75 and nets 48.25")
    void testStripeDepositFee() {
        FeeBreakdown breakdown = feePolicy.breakdown(TransactionKind.STRIPE_DEPOSIT, new BigDecimal("50.00"));

        assertEquals(new BigDecimal("1.75"), breakdown.getFee());
        assertEquals(new BigDecimal("48.25"), breakdown.getNet());
    }

    @ParameterizedTest(name = "{0} {1} -> fee {2}")
    @CsvSource({
        "CARD_TRANSFER, 0.01, 0.00",
        "CARD_TRANSFER, 0.25, 0.01",
        "CARD_TRANSFER, 33.33, 0.67",
        "CARD_TRANSFER, 1234.56, 24.69",
        "STRIPE_DEPOSIT, 0.31, 0.31",
        "STRIPE_DEPOSIT, 10.00, 0.59",
        "STRIPE_DEPOSIT, 19.99, 0.88",
        "STRIPE_DEPOSIT, 1000.00, 29.30"
    })
    @DisplayName("Fees round half-up to cents and fee + net always equals gross")
    void testFeeRoundingAndConservation(TransactionKind kind, String gross, String expectedFee) {
        FeeBreakdown breakdown = feePolicy.breakdown(kind, new BigDecimal(gross));

        assertEquals(new BigDecimal(expectedFee), breakdown.getFee());
        assertEquals(0, breakdown.getFee().add(breakdown.getNet()).compareTo(new BigDecimal(gross)));
        assertEquals(2, breakdown.getNet().scale());
    }

    @Test
    @DisplayName("Amounts are brought to two decimals")
    void testAmountNormalizedToCents() {
        FeeBreakdown breakdown = feePolicy.breakdown(TransactionKind.CARD_TRANSFER, new BigDecimal("10"));

        assertEquals(new BigDecimal("10.00"), breakdown.getGross());
        assertEquals(new BigDecimal("0.20"), breakdown.getFee());
        assertEquals(new BigDecimal("0.20"), feePolicy.fee(TransactionKind.CARD_TRANSFER, new BigDecimal("10.000")));
    }

    @Test
    @DisplayName("Zero, negative, missing and sub-cent amounts are rejected")
    void testInvalidAmountsRejected() {
        assertThrows(InvalidAmountException.class,
                () -> feePolicy.breakdown(TransactionKind.CARD_TRANSFER, BigDecimal.ZERO));
        assertThrows(InvalidAmountException.class,
                () -> feePolicy.breakdown(TransactionKind.CARD_TRANSFER, new BigDecimal("-5.00")));
        assertThrows(InvalidAmountException.class,
                () -> feePolicy.breakdown(TransactionKind.STRIPE_DEPOSIT, null));
        assertThrows(InvalidAmountException.class,
                () -> feePolicy.breakdown(TransactionKind.STRIPE_DEPOSIT, new BigDecimal("10.005")));
    }

    @Test
    @DisplayName("A deposit below the fixed fee is split with a negative net")
    void testDepositBelowFixedFee() {
        FeeBreakdown breakdown = feePolicy.breakdown(TransactionKind.STRIPE_DEPOSIT, new BigDecimal("0.20"));

        assertEquals(new BigDecimal("0.31"), breakdown.getFee());
        assertEquals(new BigDecimal("-0.11"), breakdown.getNet());
        assertEquals(breakdown.getGross(), breakdown.getFee().add(breakdown.getNet()));
    }

    @Test
    @DisplayName("Unknown kinds have no fee schedule")
    void testUnknownKind() {
        assertThrows(UnknownTransactionKindException.class,
                () -> feePolicy.fee(null, new BigDecimal("10.00")));
        assertThrows(UnknownTransactionKindException.class,
                () -> TransactionKind.fromCode("wire_transfer"));
        assertEquals(TransactionKind.STRIPE_DEPOSIT, TransactionKind.fromCode("stripe_deposit"));
    }
}
