package com.flagship.transaction_ledger.transaction;

import com.flagship.transaction_ledger.balance.BalanceService;
import com.flagship.transaction_ledger.ledger.TransactionStatus;
import com.flagship.transaction_ledger.observability.TransactionMetrics;
import com.flagship.transaction_ledger.transaction.dto.BalanceResponse;
import com.flagship.transaction_ledger.transaction.dto.CardTransferRequest;
import com.flagship.transaction_ledger.transaction.dto.ConfirmPaymentRequest;
import com.flagship.transaction_ledger.transaction.dto.DepositRequest;
import com.flagship.transaction_ledger.transaction.dto.StatisticsResponse;
import com.flagship.transaction_ledger.transaction.dto.TransactionResponse;
import com.flagship.transaction_ledger.transaction.dto.TransactionResultResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * REST endpoints for card transfers, deposits, and the ledger views built on them.
 *
 * The two creation endpoints accept an optional Idempotency-Key header. A repeated key
 * returns the transaction the first request created, in its current state, without
 * calling any provider again.
 *
 * Status codes: 201 when a transfer or deposit was accepted, 422 when the provider
 * declined or could not be reached (the body still carries the ledger record), 202 when
 * a confirmation finds the deposit still in progress.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransactionOrchestrator orchestrator;
    private final BalanceService balanceService;
    private final IdempotencyService idempotencyService;
    private final TransactionMetrics metrics;

    @PostMapping("/card-to-card/{userId}")
    public ResponseEntity<TransactionResultResponse> cardToCard(
            @PathVariable("userId") String userId,
            @Valid @RequestBody CardTransferRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received card transfer request: userId={}, amount={}, idempotencyKey={}",
                userId, request.getAmount(), idempotencyKey);

        return createIdempotently(idempotencyKey, () -> orchestrator.createTransaction(
                request.getFromCardId(), request.getToCardId(), request.getAmount(), userId, idempotencyKey));
    }

    @PostMapping("/deposit/{userId}")
    public ResponseEntity<TransactionResultResponse> deposit(
            @PathVariable("userId") String userId,
            @Valid @RequestBody DepositRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received deposit request: userId={}, amount={}, idempotencyKey={}",
                userId, request.getAmount(), idempotencyKey);

        return createIdempotently(idempotencyKey, () -> orchestrator.depositViaStripe(
                userId, request.getAmount(), request.getSuccessUrl(), request.getCancelUrl(), idempotencyKey));
    }

    @PostMapping("/confirm")
    public ResponseEntity<TransactionResultResponse> confirm(@Valid @RequestBody ConfirmPaymentRequest request) {
        TransactionResult result = orchestrator.confirmStripePayment(request.getReference());

        HttpStatus status;
        if (result.isSuccess()) {
            status = HttpStatus.OK;
        } else if (result.getStatus() == TransactionStatus.PENDING) {
            status = HttpStatus.ACCEPTED;
        } else {
            status = HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return ResponseEntity.status(status).body(TransactionResultResponse.from(result));
    }

    @PostMapping("/transaction/{id}/cancel")
    public ResponseEntity<TransactionResponse> cancel(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(TransactionResponse.from(orchestrator.cancelTransaction(id)));
    }

    @GetMapping("/transaction/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(TransactionResponse.from(orchestrator.getTransaction(id)));
    }

    @GetMapping("/transactions/{userId}")
    public ResponseEntity<List<TransactionResponse>> getUserTransactions(@PathVariable("userId") String userId) {
        List<TransactionResponse> transactions = orchestrator.getUserTransactions(userId)
                .stream()
                .map(TransactionResponse::from)
                .toList();
        return ResponseEntity.ok(transactions);
    }

    @GetMapping("/balance/{userId}")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(BalanceResponse.from(balanceService.getUserBalance(userId)));
    }

    @GetMapping("/stats/{userId}")
    public ResponseEntity<StatisticsResponse> getStatistics(@PathVariable("userId") String userId) {
        return ResponseEntity.ok(StatisticsResponse.from(balanceService.getUserStatistics(userId)));
    }

    private ResponseEntity<TransactionResultResponse> createIdempotently(String idempotencyKey,
                                                                         Supplier<TransactionResult> operation) {
        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();
        if (keyed) {
            Optional<UUID> existing = idempotencyService.checkIdempotencyKey(idempotencyKey);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning transaction {}", existing.get());
                TransactionResult replay = TransactionResult.replay(orchestrator.getTransaction(existing.get()));
                return ResponseEntity.ok(TransactionResultResponse.from(replay));
            }
            metrics.recordIdempotencyMiss();
        }

        TransactionResult result = operation.get();
        if (keyed) {
            idempotencyService.storeIdempotencyKey(idempotencyKey, result.getTransactionId());
        }

        HttpStatus status = result.isSuccess() ? HttpStatus.CREATED : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(TransactionResultResponse.from(result));
    }
}
