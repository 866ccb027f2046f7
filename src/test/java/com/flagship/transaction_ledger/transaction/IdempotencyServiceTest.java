package com.flagship.transaction_ledger.transaction;

import com.flagship.transaction_ledger.ledger.TransactionLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyServiceTest {

    private static final String KEY = "client-key-1";
    private static final String REDIS_KEY = "idempotency:transaction:" + KEY;

    @Mock
    private TransactionLedger ledger;

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Redis hit answers without touching the database")
    void testRedisHit() {
        printTestHeader("Redis Fast Path");
        UUID id = UUID.randomUUID();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(REDIS_KEY)).thenReturn(id.toString());

        IdempotencyService service = new IdempotencyService(ledger, Optional.of(redisTemplate));

        assertEquals(Optional.of(id), service.checkIdempotencyKey(KEY));
        verifyNoInteractions(ledger);
        printSuccess("Key resolved from Redis");
    }

    @Test
    @DisplayName("Redis miss falls back to the ledger and warms the cache")
    void testRedisMissFallsBackToLedger() {
        printTestHeader("Database Fallback On Cache Miss");
        UUID id = UUID.randomUUID();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(REDIS_KEY)).thenReturn(null);
        when(ledger.findIdByIdempotencyKey(KEY)).thenReturn(Optional.of(id));

        IdempotencyService service = new IdempotencyService(ledger, Optional.of(redisTemplate));

        assertEquals(Optional.of(id), service.checkIdempotencyKey(KEY));
        verify(valueOperations).set(eq(REDIS_KEY), eq(id.toString()), any(Duration.class));
        printSuccess("Key resolved from the ledger and cached");
    }

    @Test
    @DisplayName("Redis outage falls back to the ledger")
    void testRedisDownFallsBackToLedger() {
        printTestHeader("Database Fallback On Redis Outage");
        UUID id = UUID.randomUUID();
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
        when(ledger.findIdByIdempotencyKey(KEY)).thenReturn(Optional.of(id));

        IdempotencyService service = new IdempotencyService(ledger, Optional.of(redisTemplate));

        assertEquals(Optional.of(id), service.checkIdempotencyKey(KEY));
        printSuccess("Redis errors do not fail the lookup");
    }

    @Test
    @DisplayName("Without Redis every lookup goes to the ledger")
    void testNoRedis() {
        when(ledger.findIdByIdempotencyKey(KEY)).thenReturn(Optional.empty());

        IdempotencyService service = new IdempotencyService(ledger, Optional.empty());

        assertTrue(service.checkIdempotencyKey(KEY).isEmpty());
        service.storeIdempotencyKey(KEY, UUID.randomUUID());
        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("Unknown key is not cached")
    void testUnknownKeyNotCached() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(ledger.findIdByIdempotencyKey(KEY)).thenReturn(Optional.empty());

        IdempotencyService service = new IdempotencyService(ledger, Optional.of(redisTemplate));

        assertTrue(service.checkIdempotencyKey(KEY).isEmpty());
        verify(valueOperations, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("Blank keys and missing ids are rejected")
    void testInvalidArguments() {
        IdempotencyService service = new IdempotencyService(ledger, Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> service.checkIdempotencyKey(null));
        assertThrows(IllegalArgumentException.class, () -> service.checkIdempotencyKey("  "));
        assertThrows(IllegalArgumentException.class, () -> service.storeIdempotencyKey(KEY, null));
        verifyNoInteractions(ledger);
    }
}
