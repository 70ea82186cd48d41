package com.flagship.member_ledger.membership;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Idempotency keys of money transfer requests.
 *
 * Lookup order:
 * 1. Redis (fast, may be unavailable)
 * 2. money_transfer_requests table (authoritative)
 *
 * A key maps to the INCREASE_BALANCE finance log entry the first request produced.
 */
@Service
@Slf4j
public class MoneyTransferIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:money-transfer:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final JdbcTemplate jdbcTemplate;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public MoneyTransferIdempotencyService(JdbcTemplate jdbcTemplate,
                                           Optional<RedisTemplate<String, String>> redisTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the finance log entry id recorded for this key, if the key was used before
     */
    public Optional<Long> findFinanceLogId(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(Long.valueOf(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        List<Long> stored = jdbcTemplate.queryForList(
            "SELECT finance_log_id FROM money_transfer_requests WHERE idempotency_key = ?",
            Long.class, idempotencyKey);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        log.debug("Idempotency key found in database: {}", idempotencyKey);
        cache(idempotencyKey, stored.get(0));
        return Optional.of(stored.get(0));
    }

    /**
     * Records a key in the caller's transaction. A concurrent request with the same
     * key fails on the primary key and rolls back its transfer.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void store(String idempotencyKey, Long personaId, Long financeLogId) {
        requireKey(idempotencyKey);
        jdbcTemplate.update(
            "INSERT INTO money_transfer_requests (idempotency_key, persona_id, finance_log_id) VALUES (?, ?, ?)",
            idempotencyKey, personaId, financeLogId);
        // only cache what actually commits
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cache(idempotencyKey, financeLogId);
            }
        });
    }

    private void cache(String idempotencyKey, Long financeLogId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey,
                financeLogId.toString(), REDIS_TTL);
        } catch (Exception e) {
            // database stays authoritative
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
