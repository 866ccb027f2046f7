package com.flagship.transaction_ledger.transaction;

import com.flagship.transaction_ledger.fee.FeeBreakdown;
import com.flagship.transaction_ledger.fee.FeePolicy;
import com.flagship.transaction_ledger.ledger.CurrencyCode;
import com.flagship.transaction_ledger.ledger.MetadataKeys;
import com.flagship.transaction_ledger.ledger.TransactionKind;
import com.flagship.transaction_ledger.ledger.TransactionLedger;
import com.flagship.transaction_ledger.ledger.TransactionRecord;
import com.flagship.transaction_ledger.ledger.TransactionStatus;
import com.flagship.transaction_ledger.ledger.exception.InvalidTransitionException;
import com.flagship.transaction_ledger.ledger.exception.TransactionNotFoundException;
import com.flagship.transaction_ledger.observability.CorrelationContext;
import com.flagship.transaction_ledger.observability.TransactionMetrics;
import com.flagship.transaction_ledger.provider.CardTransferProvider;
import com.flagship.transaction_ledger.provider.CardTransferResult;
import com.flagship.transaction_ledger.provider.CheckoutSessionHandle;
import com.flagship.transaction_ledger.provider.GatewayPaymentStatus;
import com.flagship.transaction_ledger.provider.PaymentGateway;
import com.flagship.transaction_ledger.provider.PaymentIntentHandle;
import com.flagship.transaction_ledger.provider.ProviderException;
import com.flagship.transaction_ledger.transaction.exception.InvalidCardsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs card transfers and gateway deposits against the ledger.
 *
 * Every flow logs a pending record before any external call, so the ledger holds an
 * audit entry even if the process dies mid-call. The orchestrator itself is not
 * transactional: each ledger call commits on its own and no database lock or
 * transaction is open while a provider is on the wire.
 *
 * Provider declines and transport errors are returned as failed
 * {@link TransactionResult}s. Caller mistakes (bad amount, bad cards, unknown
 * transaction, illegal transition) are thrown.
 */
@Service
@Slf4j
public class TransactionOrchestrator {

    static final String FLOW_PAYMENT_INTENT = "payment_intent";
    static final String FLOW_CHECKOUT_SESSION = "checkout_session";
    static final String CARD_TRANSFER_DECLINED = "Card transfer declined";

    private final FeePolicy feePolicy;
    private final TransactionLedger ledger;
    private final CardTransferProvider cardTransferProvider;
    private final PaymentGateway paymentGateway;
    private final TransactionMetrics metrics;
    private final CurrencyCode currency;

    public TransactionOrchestrator(FeePolicy feePolicy,
                                   TransactionLedger ledger,
                                   CardTransferProvider cardTransferProvider,
                                   PaymentGateway paymentGateway,
                                   TransactionMetrics metrics,
                                   @Value("${ledger.currency:USD}") CurrencyCode currency) {
        this.feePolicy = feePolicy;
        this.ledger = ledger;
        this.cardTransferProvider = cardTransferProvider;
        this.paymentGateway = paymentGateway;
        this.metrics = metrics;
        this.currency = currency;
    }

    public TransactionResult createTransaction(String fromCardId, String toCardId,
                                               BigDecimal amount, String userId) {
        return createTransaction(fromCardId, toCardId, amount, userId, null);
    }

    /**
     * Transfers {@code amount} from one card to another on behalf of {@code userId}.
     *
     * The record always ends COMPLETED or FAILED. The provider is called exactly once,
     * with an idempotency token derived from the transaction id.
     *
     * @throws com.flagship.transaction_ledger.ledger.exception.InvalidAmountException if
     *         the amount is not positive or has more than two decimals
     * @throws InvalidCardsException if a card id is missing or both are the same
     */
    public TransactionResult createTransaction(String fromCardId, String toCardId, BigDecimal amount,
                                               String userId, String idempotencyKey) {
        long start = System.nanoTime();
        requireUser(userId);
        BigDecimal gross = FeePolicy.normalizeAmount(amount);
        if (isBlank(fromCardId) || isBlank(toCardId)) {
            throw new InvalidCardsException("Both source and destination card ids are required");
        }
        if (fromCardId.equals(toCardId)) {
            throw new InvalidCardsException("Source and destination cards must be different");
        }

        FeeBreakdown amounts = feePolicy.breakdown(TransactionKind.CARD_TRANSFER, gross);
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.FROM_CARD_ID, fromCardId);
        metadata.put(MetadataKeys.TO_CARD_ID, toCardId);
        metadata.put(MetadataKeys.AMOUNT, gross.toPlainString());

        TransactionRecord record = TransactionRecord.pending(
                UUID.randomUUID(), userId, TransactionKind.CARD_TRANSFER, amounts, metadata);
        UUID id = ledger.logTransaction(record, idempotencyKey);
        metrics.recordCreated(TransactionKind.CARD_TRANSFER, amounts.getFee());

        CorrelationContext.putTransaction(id, userId);
        try {
            CardTransferResult outcome;
            try {
                outcome = metrics.timeProviderCall("card_transfer", () ->
                        cardTransferProvider.createTransfer(fromCardId, toCardId, gross, providerToken("transfer", id)));
            } catch (RuntimeException e) {
                log.warn("Card transfer provider call failed: {}", e.getMessage());
                outcome = CardTransferResult.failure(describe(e));
            }
            if (outcome == null) {
                log.warn("Card transfer provider returned no result");
                outcome = CardTransferResult.failure(null);
            }

            TransactionResult result;
            if (outcome.isSuccess()) {
                Map<String, String> data = MetadataKeys.withoutNulls(outcome.getData());
                TransactionRecord completed = ledger.updateTransactionStatus(
                        id, TransactionStatus.COMPLETED, data);
                result = TransactionResult.success(completed, data);
            } else {
                String error = isBlank(outcome.getError()) ? CARD_TRANSFER_DECLINED : outcome.getError();
                TransactionRecord failed = ledger.updateTransactionStatus(
                        id, TransactionStatus.FAILED, Map.of(MetadataKeys.ERROR, error));
                result = TransactionResult.failure(failed, error);
            }

            metrics.recordResolved(TransactionKind.CARD_TRANSFER, result.getStatus());
            metrics.recordLatency("card_transfer", Duration.ofNanos(System.nanoTime() - start));
            log.info("Card transfer resolved: status={}, gross={}, fee={}",
                    result.getStatus(), amounts.getGross(), amounts.getFee());
            return result;
        } finally {
            CorrelationContext.clearTransaction();
        }
    }

    public TransactionResult depositViaStripe(String userId, BigDecimal amount,
                                              String successUrl, String cancelUrl) {
        return depositViaStripe(userId, amount, successUrl, cancelUrl, null);
    }

    /**
     * Starts a deposit through the payment gateway. With both redirect URLs a hosted
     * checkout session is created, otherwise a payment intent for the client to confirm.
     *
     * On success the record stays PENDING until {@link #confirmStripePayment} resolves
     * it. If the gateway cannot be reached, or is not configured, the record is marked
     * FAILED and a failed result is returned.
     */
    public TransactionResult depositViaStripe(String userId, BigDecimal amount, String successUrl,
                                              String cancelUrl, String idempotencyKey) {
        long start = System.nanoTime();
        requireUser(userId);
        BigDecimal gross = FeePolicy.normalizeAmount(amount);
        boolean checkout = !isBlank(successUrl) && !isBlank(cancelUrl);

        FeeBreakdown amounts = feePolicy.breakdown(TransactionKind.STRIPE_DEPOSIT, gross);
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.AMOUNT, gross.toPlainString());
        metadata.put(MetadataKeys.FLOW, checkout ? FLOW_CHECKOUT_SESSION : FLOW_PAYMENT_INTENT);

        TransactionRecord record = TransactionRecord.pending(
                UUID.randomUUID(), userId, TransactionKind.STRIPE_DEPOSIT, amounts, metadata);
        UUID id = ledger.logTransaction(record, idempotencyKey);
        metrics.recordCreated(TransactionKind.STRIPE_DEPOSIT, amounts.getFee());

        Map<String, String> gatewayMetadata = Map.of(
                "user_id", userId,
                "transaction_id", id.toString());

        CorrelationContext.putTransaction(id, userId);
        try {
            String reference;
            Map<String, String> data = new LinkedHashMap<>();
            try {
                if (checkout) {
                    CheckoutSessionHandle session = metrics.timeProviderCall("create_checkout_session", () ->
                            paymentGateway.createCheckoutSession(gross, currency, successUrl, cancelUrl,
                                    gatewayMetadata, providerToken("deposit", id)));
                    if (session == null || isBlank(session.getId())) {
                        throw new ProviderException("Gateway returned no checkout session id");
                    }
                    reference = session.getId();
                    data.put(MetadataKeys.SESSION_ID, session.getId());
                    putIfPresent(data, MetadataKeys.CHECKOUT_URL, session.getUrl());
                } else {
                    PaymentIntentHandle intent = metrics.timeProviderCall("create_payment_intent", () ->
                            paymentGateway.createPaymentIntent(gross, currency, gatewayMetadata,
                                    providerToken("deposit", id)));
                    if (intent == null || isBlank(intent.getId())) {
                        throw new ProviderException("Gateway returned no payment intent id");
                    }
                    reference = intent.getId();
                    data.put(MetadataKeys.PAYMENT_INTENT_ID, intent.getId());
                    putIfPresent(data, MetadataKeys.CLIENT_SECRET, intent.getClientSecret());
                }
            } catch (RuntimeException e) {
                log.warn("Deposit gateway call failed: {}", e.getMessage());
                String error = describe(e);
                TransactionRecord failed = ledger.updateTransactionStatus(
                        id, TransactionStatus.FAILED, Map.of(MetadataKeys.ERROR, error));
                metrics.recordResolved(TransactionKind.STRIPE_DEPOSIT, TransactionStatus.FAILED);
                return TransactionResult.failure(failed, error);
            }

            TransactionRecord pending = ledger.attachReference(id, reference, data);
            metrics.recordLatency("deposit", Duration.ofNanos(System.nanoTime() - start));
            log.info("Deposit started: flow={}, reference={}, gross={}, fee={}",
                    metadata.get(MetadataKeys.FLOW), reference, amounts.getGross(), amounts.getFee());
            return TransactionResult.success(pending, data);
        } finally {
            CorrelationContext.clearTransaction();
        }
    }

    /**
     * Asks the gateway how a pending deposit went and records the answer.
     *
     * A deposit the gateway still considers in progress stays PENDING and yields a
     * failed result carrying the gateway's status; so does a gateway that cannot be
     * reached, in which case the record is not touched.
     *
     * @param reference payment intent id or checkout session id
     * @throws TransactionNotFoundException if no pending deposit carries the reference
     */
    public TransactionResult confirmStripePayment(String reference) {
        long start = System.nanoTime();
        TransactionRecord record = ledger.findByReference(reference);
        if (!record.isPending()) {
            throw new TransactionNotFoundException(String.format(
                "No pending transaction for reference %s (status %s)", reference, record.getStatus()));
        }

        CorrelationContext.putTransaction(record.getId(), record.getUserId());
        try {
            boolean checkout = FLOW_CHECKOUT_SESSION.equals(record.getMetadata().get(MetadataKeys.FLOW));
            GatewayPaymentStatus gatewayStatus;
            try {
                gatewayStatus = checkout
                        ? metrics.timeProviderCall("retrieve_checkout_session",
                            () -> paymentGateway.retrieveCheckoutSession(reference))
                        : metrics.timeProviderCall("retrieve_payment_intent",
                            () -> paymentGateway.retrievePaymentIntent(reference));
                if (gatewayStatus == null || gatewayStatus.getOutcome() == null) {
                    throw new ProviderException("Gateway returned no payment status for " + reference);
                }
            } catch (RuntimeException e) {
                log.warn("Could not retrieve deposit status from gateway: {}", e.getMessage());
                return TransactionResult.failure(record, describe(e));
            }

            Map<String, String> gatewayData = Map.of(MetadataKeys.GATEWAY_STATUS, String.valueOf(gatewayStatus.getStatus()));
            TransactionResult result = switch (gatewayStatus.getOutcome()) {
                case SUCCEEDED -> TransactionResult.success(
                        ledger.updateTransactionStatus(record.getId(), TransactionStatus.COMPLETED, gatewayData),
                        gatewayData);
                case FAILED -> {
                    String error = gatewayStatus.getError() != null
                            ? gatewayStatus.getError()
                            : "Payment failed with status: " + gatewayStatus.getStatus();
                    Map<String, String> failure = new LinkedHashMap<>(gatewayData);
                    failure.put(MetadataKeys.ERROR, error);
                    yield TransactionResult.failure(
                            ledger.updateTransactionStatus(record.getId(), TransactionStatus.FAILED, failure),
                            error);
                }
                case IN_PROGRESS -> TransactionResult.failure(
                        record, "Payment not completed, status: " + gatewayStatus.getStatus());
            };

            if (!result.getRecord().isPending()) {
                metrics.recordResolved(TransactionKind.STRIPE_DEPOSIT, result.getStatus());
            }
            metrics.recordLatency("confirm", Duration.ofNanos(System.nanoTime() - start));
            log.info("Deposit confirmation: gatewayStatus={}, status={}",
                    gatewayStatus.getStatus(), result.getStatus());
            return result;
        } finally {
            CorrelationContext.clearTransaction();
        }
    }

    /**
     * Abandons a pending deposit. Only the ledger record is cancelled; a payment intent
     * or checkout session left at the gateway simply expires there.
     *
     * @throws TransactionNotFoundException if the id is unknown
     * @throws InvalidTransitionException for card transfers, and for deposits that are
     *         no longer pending
     */
    public TransactionRecord cancelTransaction(UUID transactionId) {
        TransactionRecord record = ledger.findById(transactionId);
        if (record.getKind() == TransactionKind.CARD_TRANSFER) {
            throw new InvalidTransitionException(
                "Card transfer " + transactionId + " is resolved by the card network and cannot be cancelled");
        }
        TransactionRecord cancelled = ledger.updateTransactionStatus(
                transactionId, TransactionStatus.CANCELLED,
                Map.of(MetadataKeys.CANCEL_REASON, "cancelled by caller"));
        metrics.recordResolved(cancelled.getKind(), cancelled.getStatus());
        return cancelled;
    }

    public List<TransactionRecord> getUserTransactions(String userId) {
        return ledger.getTransactions(userId);
    }

    public TransactionRecord getTransaction(UUID transactionId) {
        return ledger.findById(transactionId);
    }

    /**
     * Token sent with provider calls so a repeated call for the same ledger transaction
     * cannot execute twice.
     */
    static String providerToken(String operation, UUID transactionId) {
        return operation + "-" + transactionId;
    }

    private static void requireUser(String userId) {
        if (isBlank(userId)) {
            throw new IllegalArgumentException("User id is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static void putIfPresent(Map<String, String> data, String key, String value) {
        if (value != null) {
            data.put(key, value);
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
