package com.flagship.transaction_ledger.observability;

import com.flagship.transaction_ledger.ledger.TransactionKind;
import com.flagship.transaction_ledger.ledger.TransactionStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters for the transaction lifecycle.
 *
 * <ul>
 *   <li>{@code transactions.created}, tagged by kind</li>
 *   <li>{@code transactions.resolved}, tagged by kind and resulting status</li>
 *   <li>{@code transactions.fees}, distribution of fees charged</li>
 *   <li>{@code transactions.latency}, end-to-end orchestrator operation time</li>
 *   <li>{@code provider.calls}, timer around card network and gateway calls</li>
 *   <li>{@code idempotency.cache}, hit/miss counter</li>
 * </ul>
 */
@Component
public class TransactionMetrics {

    private final MeterRegistry registry;

    public TransactionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCreated(TransactionKind kind, BigDecimal fee) {
        registry.counter("transactions.created", "kind", kind.code()).increment();
        registry.summary("transactions.fees", "kind", kind.code()).record(fee.doubleValue());
    }

    public void recordResolved(TransactionKind kind, TransactionStatus status) {
        registry.counter("transactions.resolved",
                "kind", kind.code(),
                "status", status.code()
        ).increment();
    }

    public void recordLatency(String operation, Duration duration) {
        registry.timer("transactions.latency", "operation", sanitizeTag(operation)).record(duration);
    }

    /**
     * Times a call out to the card network or payment gateway. The outcome tag is
     * "error" when the call throws.
     */
    public <T> T timeProviderCall(String operation, Supplier<T> call) {
        long start = System.nanoTime();
        String outcome = "error";
        try {
            T result = call.get();
            outcome = "ok";
            return result;
        } finally {
            Timer.builder("provider.calls")
                    .tag("operation", sanitizeTag(operation))
                    .tag("outcome", outcome)
                    .publishPercentiles(0.5, 0.95, 0.99)
                    .register(registry)
                    .record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
