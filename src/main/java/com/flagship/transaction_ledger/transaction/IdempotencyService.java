package com.flagship.transaction_ledger.transaction;

import com.flagship.transaction_ledger.ledger.TransactionLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves client idempotency keys to the transaction they created.
 *
 * Redis is a cache in front of the ledger's unique idempotency_key column, which stays
 * the source of truth: a Redis outage only costs a database lookup.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:transaction:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final TransactionLedger ledger;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(TransactionLedger ledger, Optional<StringRedisTemplate> redisTemplate) {
        this.ledger = ledger;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return id of the transaction created with this key, if any
     */
    public Optional<UUID> checkIdempotencyKey(String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = REDIS_KEY_PREFIX + idempotencyKey;

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(redisKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (DataAccessException e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> existing = ledger.findIdByIdempotencyKey(idempotencyKey);
        existing.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(redisKey, id);
        });
        return existing;
    }

    /**
     * Caches the key's transaction id. The ledger row already holds the key, so a failed
     * write here loses nothing.
     */
    public void storeIdempotencyKey(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        if (transactionId == null) {
            throw new IllegalArgumentException("Transaction id cannot be null");
        }
        cache(REDIS_KEY_PREFIX + idempotencyKey, transactionId);
    }

    private void cache(String redisKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, transactionId.toString(), REDIS_TTL);
        } catch (DataAccessException e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", redisKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
