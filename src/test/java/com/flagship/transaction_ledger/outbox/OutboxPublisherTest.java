package com.flagship.transaction_ledger.outbox;

import com.flagship.transaction_ledger.ledger.TransactionLedger;
import com.flagship.transaction_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publisher behaviour against a mocked Kafka producer: keys, ordering, retry
 * bookkeeping and dead-lettering.
 */
@ExtendWith(MockitoExtension.class)
class OutboxPublisherTest {

    private static final String TOPIC = "transactions";

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    @InjectMocks
    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(publisher, "transactionsTopic", TOPIC);
        ReflectionTestUtils.setField(publisher, "batchSize", 100);
        ReflectionTestUtils.setField(publisher, "maxRetries", 3);
        ReflectionTestUtils.setField(publisher, "sendTimeoutMs", 1000L);
        ReflectionTestUtils.setField(publisher, "retention", Duration.ofDays(7));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private OutboxEvent event(UUID aggregateId, String eventType, int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), TransactionLedger.AGGREGATE_TYPE, aggregateId, eventType,
                "{\"eventType\":\"" + eventType + "\"}", Instant.now(), null, retryCount, null, 1L);
    }

    private CompletableFuture<SendResult<String, String>> sent(String key, String value) {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 0L, 0, 0L, 0, 0);
        return CompletableFuture.completedFuture(new SendResult<>(new ProducerRecord<>(TOPIC, key, value), metadata));
    }

    @Test
    @DisplayName("Events are sent keyed by transaction id, in order, then marked published")
    void testPublishesInOrderKeyedByTransaction() {
        printTestHeader("Publisher Sends Keyed Events In Order");
        UUID transactionId = UUID.randomUUID();
        OutboxEvent created = event(transactionId, "TransactionCreated", 0);
        OutboxEvent changed = event(transactionId, "TransactionStatusChanged", 0);
        when(outboxService.findPublishableEvents(100, 3)).thenReturn(List.of(created, changed));
        when(kafkaTemplate.send(eq(TOPIC), eq(transactionId.toString()), anyString()))
                .thenAnswer(inv -> sent(inv.getArgument(1), inv.getArgument(2)));

        publisher.publishPendingEvents();

        InOrder order = inOrder(kafkaTemplate, outboxService);
        order.verify(kafkaTemplate).send(TOPIC, transactionId.toString(), created.getPayload());
        order.verify(outboxService).markPublished(created.getId());
        order.verify(kafkaTemplate).send(TOPIC, transactionId.toString(), changed.getPayload());
        order.verify(outboxService).markPublished(changed.getId());
        verify(outboxMetrics).recordEventPublished("TransactionCreated");
        printSuccess("Both events published with the transaction id as key");
    }

    @Test
    @DisplayName("A failed send records the error and leaves the event unpublished")
    void testFailedSendIsRetried() {
        printTestHeader("Failed Send Bumps Retry Count");
        OutboxEvent event = event(UUID.randomUUID(), "TransactionCreated", 0);
        when(outboxService.findPublishableEvents(100, 3)).thenReturn(List.of(event));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker unavailable")));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(event.getId()), anyString());
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("TransactionCreated");
        verify(outboxMetrics, never()).recordEventDeadLettered(anyString());
        printSuccess("Failure recorded for retry");
    }

    @Test
    @DisplayName("The last allowed failure dead-letters the event")
    void testDeadLetteredAfterMaxRetries() {
        OutboxEvent event = event(UUID.randomUUID(), "TransactionStatusChanged", 2);
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("serializer error"));

        publisher.publishEvent(event);

        verify(outboxService).markFailed(event.getId(), "serializer error");
        verify(outboxMetrics).recordEventDeadLettered("TransactionStatusChanged");
    }

    @Test
    @DisplayName("A failure on one event does not stop the rest of the batch")
    void testBatchContinuesAfterFailure() {
        OutboxEvent failing = event(UUID.randomUUID(), "TransactionCreated", 0);
        OutboxEvent healthy = event(UUID.randomUUID(), "TransactionCreated", 0);
        when(outboxService.findPublishableEvents(100, 3)).thenReturn(List.of(failing, healthy));
        when(kafkaTemplate.send(TOPIC, failing.getAggregateId().toString(), failing.getPayload()))
                .thenThrow(new IllegalStateException("boom"));
        when(kafkaTemplate.send(TOPIC, healthy.getAggregateId().toString(), healthy.getPayload()))
                .thenReturn(sent(healthy.getAggregateId().toString(), healthy.getPayload()));

        publisher.publishPendingEvents();

        verify(outboxService).markFailed(eq(failing.getId()), anyString());
        verify(outboxService).markPublished(healthy.getId());
    }

    @Test
    @DisplayName("Purge removes published events older than the retention window")
    void testPurgeUsesRetention() {
        Instant before = Instant.now().minus(Duration.ofDays(7));

        publisher.purgePublishedEvents();

        verify(outboxService).purgePublishedBefore(argThat(
                cutoff -> !cutoff.isBefore(before) && cutoff.isBefore(Instant.now().minus(Duration.ofDays(6)))));
    }
}
