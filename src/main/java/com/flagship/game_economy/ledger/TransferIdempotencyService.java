package com.flagship.game_economy.ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys for client-initiated transfers.
 *
 * Redis is the fast path, currency_transactions.idempotency_key is the source of truth.
 * A Redis hit is only a hint: the caller still loads the transaction from the database,
 * and a key that Redis knows but the database does not is treated as unused.
 */
@Service
@Slf4j
public class TransferIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "economy:transfer-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final JdbcTemplate jdbcTemplate;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public TransferIdempotencyService(JdbcTemplate jdbcTemplate,
                                      Optional<RedisTemplate<String, String>> redisTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the id of the transaction that already used this key, if any
     */
    public Optional<UUID> findTransactionId(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Transfer idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for transfer idempotency key {}, using database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        List<UUID> ids = jdbcTemplate.queryForList(
            "SELECT id FROM currency_transactions WHERE idempotency_key = ?",
            UUID.class,
            idempotencyKey
        );
        if (ids.isEmpty()) {
            return Optional.empty();
        }
        cache(idempotencyKey, ids.get(0));
        return Optional.of(ids.get(0));
    }

    /**
     * Caches the key once the surrounding transaction commits.
     * Outside a transaction the key is cached immediately.
     */
    public void remember(String idempotencyKey, UUID transactionId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            cache(idempotencyKey, transactionId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(idempotencyKey, transactionId);
            }
        });
    }

    private void cache(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                    .set(REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache transfer idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }
}
