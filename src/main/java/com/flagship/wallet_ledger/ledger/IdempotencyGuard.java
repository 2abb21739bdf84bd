package com.flagship.wallet_ledger.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.wallet_ledger.observability.LedgerMetrics;
import com.flagship.wallet_ledger.wallet.BalanceCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Exactly-once gate for transfers, keyed by the caller's idempotency key.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to ledger_entries.idempotency_key (always authoritative)
 * 3. Cache database hits back into Redis
 *
 * Redis only ever holds results of committed transfers. Losing it costs
 * latency, never correctness: the unique constraint on the entry's key is what
 * actually rejects a second write.
 */
@Component
@Slf4j
public class IdempotencyGuard {

    static final String REDIS_KEY_PREFIX = "idempotency:ledger:";

    private final LedgerRepository ledgerRepository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final LedgerMetrics ledgerMetrics;
    private final Duration cacheTtl;
    private final boolean cacheEnabled;

    public IdempotencyGuard(LedgerRepository ledgerRepository,
                            Optional<StringRedisTemplate> redisTemplate,
                            ObjectMapper objectMapper,
                            LedgerMetrics ledgerMetrics,
                            @Value("${ledger.idempotency.cache-ttl:7d}") Duration cacheTtl,
                            @Value("${ledger.idempotency.cache-enabled:true}") boolean cacheEnabled) {
        this.ledgerRepository = ledgerRepository;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ledgerMetrics = ledgerMetrics;
        this.cacheTtl = cacheTtl;
        this.cacheEnabled = cacheEnabled;
    }

    /**
     * Returns the committed result for the key, flagged as a replay, or empty
     * if no transfer has committed under it.
     */
    public Optional<TransferResult> checkReplay(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }

        Optional<TransferResult> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            ledgerMetrics.recordIdempotencyHit("redis");
            return Optional.of(cached.get().asReplay());
        }

        Optional<TransferResult> stored = ledgerRepository.findEntryByIdempotencyKey(idempotencyKey)
            .map(IdempotencyGuard::toResult);
        if (stored.isPresent()) {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            ledgerMetrics.recordIdempotencyHit("database");
            writeCache(idempotencyKey, stored.get());
            return Optional.of(stored.get().asReplay());
        }

        ledgerMetrics.recordIdempotencyMiss();
        return Optional.empty();
    }

    /**
     * Caches a committed result. Call only after the unit of work commits.
     */
    public void remember(String idempotencyKey, TransferResult result) {
        writeCache(idempotencyKey, result.toBuilder().replay(false).build());
    }

    /**
     * Rebuilds what the original call returned from its ledger entry.
     */
    static TransferResult toResult(LedgerEntry entry) {
        BigDecimal remainingBalance = null;
        if (entry.getTransactionType() == TransactionType.SPEND) {
            String balanceAfter = entry.getMetadata().get(LedgerEntry.BALANCE_AFTER);
            if (balanceAfter != null) {
                remainingBalance = BalanceCalculator.quantize(new BigDecimal(balanceAfter));
            }
        }
        return TransferResult.builder()
            .transactionId(entry.getTransactionId())
            .type(entry.getTransactionType())
            .amount(BalanceCalculator.quantize(entry.getAmount()))
            .remainingBalance(remainingBalance)
            .replay(false)
            .build();
    }

    private Optional<TransferResult> readCache(String idempotencyKey) {
        if (!cacheEnabled || redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String json = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, TransferResult.class));
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String idempotencyKey, TransferResult result) {
        if (!cacheEnabled || redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(
                REDIS_KEY_PREFIX + idempotencyKey,
                objectMapper.writeValueAsString(result),
                cacheTtl
            );
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}",
                    idempotencyKey, e.getMessage());
        }
    }
}
