package com.flagship.transaction_ledger.transaction;

import com.flagship.transaction_ledger.balance.BalanceService;
import com.flagship.transaction_ledger.balance.UserBalance;
import com.flagship.transaction_ledger.fee.FeePolicy;
import com.flagship.transaction_ledger.ledger.MetadataKeys;
import com.flagship.transaction_ledger.ledger.TransactionKind;
import com.flagship.transaction_ledger.ledger.TransactionRecord;
import com.flagship.transaction_ledger.ledger.TransactionStatus;
import com.flagship.transaction_ledger.ledger.exception.InvalidAmountException;
import com.flagship.transaction_ledger.ledger.exception.InvalidTransitionException;
import com.flagship.transaction_ledger.ledger.exception.TransactionNotFoundException;
import com.flagship.transaction_ledger.observability.TransactionMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP contract of the payments API: status codes, JSON shape, idempotent replay and
 * error mapping. The orchestrator and services are mocked.
 */
@WebMvcTest(TransactionController.class)
class TransactionControllerTest {

    private static final String USER = "user-1";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TransactionOrchestrator orchestrator;

    @MockBean
    private BalanceService balanceService;

    @MockBean
    private IdempotencyService idempotencyService;

    @MockBean
    private TransactionMetrics metrics;

    private final FeePolicy feePolicy = new FeePolicy();

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private TransactionRecord transfer(String gross) {
        return TransactionRecord.pending(UUID.randomUUID(), USER, TransactionKind.CARD_TRANSFER,
                feePolicy.breakdown(TransactionKind.CARD_TRANSFER, new BigDecimal(gross)),
                Map.of(MetadataKeys.FROM_CARD_ID, "card-a", MetadataKeys.TO_CARD_ID, "card-b"));
    }

    private TransactionRecord deposit(String gross) {
        return TransactionRecord.pending(UUID.randomUUID(), USER, TransactionKind.STRIPE_DEPOSIT,
                feePolicy.breakdown(TransactionKind.STRIPE_DEPOSIT, new BigDecimal(gross)), Map.of());
    }

    private static final String TRANSFER_BODY = """
            {"from_card_id": "card-a", "to_card_id": "card-b", "amount": 100.00}
            """;

    @Test
    @DisplayName("Completed card transfer returns 201 with fee breakdown")
    void testCardTransferCreated() throws Exception {
        printTestHeader("Card Transfer Created");
        Map<String, String> data = Map.of(MetadataKeys.TRANSFER_ID, "pi_1");
        TransactionRecord completed = transfer("100.00").transitionTo(TransactionStatus.COMPLETED).withMetadata(data);
        when(orchestrator.createTransaction(eq("card-a"), eq("card-b"), any(BigDecimal.class), eq(USER), isNull()))
                .thenReturn(TransactionResult.success(completed, data));

        MvcResult result = mockMvc.perform(post("/api/payments/card-to-card/{userId}", USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TRANSFER_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.transaction_id").value(completed.getId().toString()))
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.data.transfer_id").value("pi_1"))
                .andExpect(jsonPath("$.transaction.type").value("card_transfer"))
                .andExpect(jsonPath("$.transaction.fee").value(2.00))
                .andExpect(jsonPath("$.transaction.net_amount").value(98.00))
                .andReturn();

        printOutput("Response", result.getResponse().getContentAsString());
        verify(idempotencyService, never()).checkIdempotencyKey(anyString());
        printSuccess("Transfer accepted");
    }

    @Test
    @DisplayName("Declined card transfer returns 422 with the error")
    void testCardTransferDeclined() throws Exception {
        TransactionRecord failed = transfer("100.00").transitionTo(TransactionStatus.FAILED)
                .withMetadata(Map.of(MetadataKeys.ERROR, "Your card was declined."));
        when(orchestrator.createTransaction(anyString(), anyString(), any(), anyString(), any()))
                .thenReturn(TransactionResult.failure(failed, "Your card was declined."));

        mockMvc.perform(post("/api/payments/card-to-card/{userId}", USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TRANSFER_BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error").value("Your card was declined."));
    }

    @Test
    @DisplayName("Repeated idempotency key replays the original transaction")
    void testIdempotentReplay() throws Exception {
        printTestHeader("Idempotent Replay");
        TransactionRecord completed = transfer("100.00").transitionTo(TransactionStatus.COMPLETED);
        when(idempotencyService.checkIdempotencyKey("key-1")).thenReturn(Optional.of(completed.getId()));
        when(orchestrator.getTransaction(completed.getId())).thenReturn(completed);

        mockMvc.perform(post("/api/payments/card-to-card/{userId}", USER)
                        .header("Idempotency-Key", "key-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TRANSFER_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.transaction_id").value(completed.getId().toString()))
                .andExpect(jsonPath("$.status").value("completed"));

        verify(orchestrator, never()).createTransaction(any(), any(), any(), any(), any());
        verify(metrics).recordIdempotencyHit();
        printSuccess("No second provider call for a repeated key");
    }

    @Test
    @DisplayName("First use of an idempotency key stores it against the new transaction")
    void testIdempotencyKeyStored() throws Exception {
        TransactionRecord completed = transfer("100.00").transitionTo(TransactionStatus.COMPLETED);
        when(idempotencyService.checkIdempotencyKey("key-2")).thenReturn(Optional.empty());
        when(orchestrator.createTransaction(anyString(), anyString(), any(), anyString(), eq("key-2")))
                .thenReturn(TransactionResult.success(completed, Map.of()));

        mockMvc.perform(post("/api/payments/card-to-card/{userId}", USER)
                        .header("Idempotency-Key", "key-2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(TRANSFER_BODY))
                .andExpect(status().isCreated());

        verify(idempotencyService).storeIdempotencyKey("key-2", completed.getId());
        verify(metrics).recordIdempotencyMiss();
    }

    @Test
    @DisplayName("Request validation failures return 400")
    void testValidation() throws Exception {
        mockMvc.perform(post("/api/payments/card-to-card/{userId}", USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from_card_id\": \"card-a\", \"amount\": 10.00}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"))
                .andExpect(jsonPath("$.details.toCardId").exists());

        mockMvc.perform(post("/api/payments/card-to-card/{userId}", USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from_card_id\": \"card-a\", \"to_card_id\": \"card-b\", \"amount\": -5}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/payments/card-to-card/{userId}", USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isBadRequest());

        verify(orchestrator, never()).createTransaction(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("Domain rejections from the orchestrator map to 400")
    void testInvalidAmountFromOrchestrator() throws Exception {
        when(orchestrator.depositViaStripe(anyString(), any(), any(), any(), any()))
                .thenThrow(new InvalidAmountException("Gross amount must have at most 2 decimal places, got: 10.000"));

        mockMvc.perform(post("/api/payments/deposit/{userId}", USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 10.00}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Transaction"));
    }

    @Test
    @DisplayName("Deposit returns the client secret for a payment intent")
    void testDepositCreated() throws Exception {
        Map<String, String> data = Map.of(
                MetadataKeys.PAYMENT_INTENT_ID, "pi_9",
                MetadataKeys.CLIENT_SECRET, "pi_9_secret");
        TransactionRecord pending = deposit("50.00").withProviderReference("pi_9").withMetadata(data);
        when(orchestrator.depositViaStripe(eq(USER), any(), isNull(), isNull(), isNull()))
                .thenReturn(TransactionResult.success(pending, data));

        mockMvc.perform(post("/api/payments/deposit/{userId}", USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 50.00}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.data.client_secret").value("pi_9_secret"))
                .andExpect(jsonPath("$.transaction.fee").value(1.75))
                .andExpect(jsonPath("$.transaction.provider_reference").value("pi_9"));
    }

    @Test
    @DisplayName("Confirmation maps completed, in-progress and failed to 200, 202 and 422")
    void testConfirmStatusCodes() throws Exception {
        TransactionRecord pending = deposit("50.00").withProviderReference("pi_a");
        when(orchestrator.confirmStripePayment("pi_a"))
                .thenReturn(TransactionResult.success(pending.transitionTo(TransactionStatus.COMPLETED), Map.of()))
                .thenReturn(TransactionResult.failure(pending, "Payment not completed, status: processing"))
                .thenReturn(TransactionResult.failure(pending.transitionTo(TransactionStatus.FAILED), "declined"));

        String body = "{\"payment_intent_id\": \"pi_a\"}";
        mockMvc.perform(post("/api/payments/confirm").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"));
        mockMvc.perform(post("/api/payments/confirm").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("pending"));
        mockMvc.perform(post("/api/payments/confirm").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("declined"));
    }

    @Test
    @DisplayName("Confirmation accepts a checkout session id")
    void testConfirmBySessionId() throws Exception {
        when(orchestrator.confirmStripePayment("cs_1"))
                .thenThrow(new TransactionNotFoundException("No transaction registered for reference: cs_1"));

        mockMvc.perform(post("/api/payments/confirm")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\": \"cs_1\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    @DisplayName("Cancelling a resolved transaction is a conflict")
    void testCancelConflict() throws Exception {
        UUID id = UUID.randomUUID();
        when(orchestrator.cancelTransaction(id)).thenThrow(
                new InvalidTransitionException(id, TransactionStatus.COMPLETED, TransactionStatus.CANCELLED));

        mockMvc.perform(post("/api/payments/transaction/{id}/cancel", id))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Invalid State"));
    }

    @Test
    @DisplayName("Transaction lookups return records and 404 for unknown ids")
    void testGetTransaction() throws Exception {
        TransactionRecord record = transfer("10.00");
        when(orchestrator.getTransaction(record.getId())).thenReturn(record);
        UUID unknown = UUID.randomUUID();
        when(orchestrator.getTransaction(unknown)).thenThrow(new TransactionNotFoundException("Transaction not found"));

        mockMvc.perform(get("/api/payments/transaction/{id}", record.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(record.getId().toString()))
                .andExpect(jsonPath("$.metadata.from_card_id").value("card-a"));
        mockMvc.perform(get("/api/payments/transaction/{id}", unknown))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/payments/transaction/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("User history is returned in ledger order")
    void testUserTransactions() throws Exception {
        TransactionRecord first = transfer("10.00");
        TransactionRecord second = deposit("20.00");
        when(orchestrator.getUserTransactions(USER)).thenReturn(List.of(first, second));

        mockMvc.perform(get("/api/payments/transactions/{userId}", USER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value(first.getId().toString()))
                .andExpect(jsonPath("$[1].type").value("stripe_deposit"));
    }

    @Test
    @DisplayName("Balance endpoint exposes the aggregated balance")
    void testBalance() throws Exception {
        when(balanceService.getUserBalance(USER)).thenReturn(UserBalance.builder()
                .userId(USER)
                .balance(new BigDecimal("146.25"))
                .asOf(Instant.parse("2024-05-01T10:00:00Z"))
                .totalDeposits(new BigDecimal("48.25"))
                .totalTransfers(new BigDecimal("98.00"))
                .completedCount(2)
                .transactionCount(3)
                .build());

        mockMvc.perform(get("/api/payments/balance/{userId}", USER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value(USER))
                .andExpect(jsonPath("$.balance").value(146.25))
                .andExpect(jsonPath("$.completed_count").value(2));
    }
}
