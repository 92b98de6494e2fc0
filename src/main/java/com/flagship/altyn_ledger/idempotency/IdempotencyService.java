package com.flagship.altyn_ledger.idempotency;

import com.flagship.altyn_ledger.observability.LedgerMetrics;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transaction.TransactionLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps client idempotency keys to the ledger transaction they settled.
 *
 * Redis is a cache in front of the unique idempotency_key column on
 * ledger_transactions. The column is the source of truth; when Redis is
 * unreachable lookups fall through to the database. The transfer engine
 * repeats the check under the treasury lock, so a race between two requests
 * with the same key still settles once.
 *
 * Keys are scoped to the calling user before they are stored or looked up.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "altyn:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);
    private static final int MAX_KEY_LENGTH = 128;

    private final TransactionLog transactionLog;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final LedgerMetrics ledgerMetrics;

    public IdempotencyService(TransactionLog transactionLog,
                              Optional<StringRedisTemplate> redisTemplate,
                              LedgerMetrics ledgerMetrics) {
        this.transactionLog = transactionLog;
        this.redisTemplate = redisTemplate;
        this.ledgerMetrics = ledgerMetrics;
    }

    /**
     * Binds a raw client key to the calling user.
     *
     * @throws IllegalArgumentException if the key is blank or too long
     */
    public static String scope(String userId, String idempotencyKey) {
        String key = idempotencyKey == null ? "" : idempotencyKey.trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Idempotency key exceeds " + MAX_KEY_LENGTH + " characters");
        }
        return userId + ":" + key;
    }

    /**
     * @return the transaction already settled under this scoped key, if any
     */
    public Optional<LedgerTransaction> findSettled(String scopedKey) {
        Optional<UUID> cached = readCache(scopedKey);
        Optional<LedgerTransaction> settled = cached.isPresent()
                ? transactionLog.findById(cached.get())
                : transactionLog.findByIdempotencyKey(scopedKey);

        if (settled.isPresent()) {
            ledgerMetrics.recordIdempotencyHit();
            if (cached.isEmpty()) {
                remember(scopedKey, settled.get().getId());
            }
        } else {
            ledgerMetrics.recordIdempotencyMiss();
        }
        return settled;
    }

    /**
     * Caches a settled key. Call only after the settling transaction committed.
     */
    public void remember(String scopedKey, UUID transactionId) {
        redisTemplate.ifPresent(redis -> {
            try {
                redis.opsForValue().set(REDIS_KEY_PREFIX + scopedKey, transactionId.toString(), REDIS_TTL);
            } catch (Exception e) {
                log.warn("Failed to cache idempotency key {}: {}", scopedKey, e.getMessage());
            }
        });
    }

    private Optional<UUID> readCache(String scopedKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + scopedKey);
            return value != null ? Optional.of(UUID.fromString(value)) : Optional.empty();
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, using database: {}", scopedKey, e.getMessage());
            return Optional.empty();
        }
    }
}
