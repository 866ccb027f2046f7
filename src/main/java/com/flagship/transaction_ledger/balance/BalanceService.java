package com.flagship.transaction_ledger.balance;

import com.flagship.transaction_ledger.fee.FeePolicy;
import com.flagship.transaction_ledger.ledger.TransactionKind;
import com.flagship.transaction_ledger.ledger.TransactionLedger;
import com.flagship.transaction_ledger.ledger.TransactionRecord;
import com.flagship.transaction_ledger.ledger.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Derives balances and statistics from a user's ledger history.
 *
 * Read-only: nothing here is stored, every call recomputes from the ledger. Each
 * completed record counts as a credit of its net amount to its owner, transfers
 * included.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TransactionLedger ledger;

    public UserBalance getUserBalance(String userId) {
        List<TransactionRecord> records = ledger.getTransactions(userId);

        BigDecimal deposits = zero();
        BigDecimal transfers = zero();
        Instant asOf = null;
        int completed = 0;

        for (TransactionRecord record : records) {
            if (record.getStatus() != TransactionStatus.COMPLETED) {
                continue;
            }
            completed++;
            if (record.getKind() == TransactionKind.STRIPE_DEPOSIT) {
                deposits = deposits.add(record.getNet());
            } else {
                transfers = transfers.add(record.getNet());
            }
            if (asOf == null || record.getUpdatedAt().isAfter(asOf)) {
                asOf = record.getUpdatedAt();
            }
        }

        UserBalance balance = UserBalance.builder()
                .userId(userId)
                .balance(deposits.add(transfers))
                .asOf(asOf != null ? asOf : Instant.now())
                .totalDeposits(deposits)
                .totalTransfers(transfers)
                .completedCount(completed)
                .transactionCount(records.size())
                .build();

        log.debug("Computed balance: userId={}, balance={}, completed={}/{}",
                userId, balance.getBalance(), completed, records.size());
        return balance;
    }

    public TransactionStatistics getUserStatistics(String userId) {
        List<TransactionRecord> records = ledger.getTransactions(userId);

        int completed = 0;
        int failed = 0;
        int pending = 0;
        int cancelled = 0;
        BigDecimal totalGross = zero();
        BigDecimal completedGross = zero();

        for (TransactionRecord record : records) {
            totalGross = totalGross.add(record.getGross());
            switch (record.getStatus()) {
                case COMPLETED -> {
                    completed++;
                    completedGross = completedGross.add(record.getGross());
                }
                case FAILED -> failed++;
                case PENDING -> pending++;
                case CANCELLED -> cancelled++;
            }
        }

        int total = records.size();
        return TransactionStatistics.builder()
                .userId(userId)
                .total(total)
                .completed(completed)
                .failed(failed)
                .pending(pending)
                .cancelled(cancelled)
                .successRate(total == 0
                        ? zero()
                        : BigDecimal.valueOf(completed).multiply(HUNDRED)
                            .divide(BigDecimal.valueOf(total), FeePolicy.MONEY_SCALE, RoundingMode.HALF_UP))
                .totalGross(totalGross)
                .completedGross(completedGross)
                .averageGross(total == 0
                        ? zero()
                        : totalGross.divide(BigDecimal.valueOf(total), FeePolicy.MONEY_SCALE, RoundingMode.HALF_UP))
                .build();
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(FeePolicy.MONEY_SCALE);
    }
}
