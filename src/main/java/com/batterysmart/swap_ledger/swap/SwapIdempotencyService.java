package com.batterysmart.swap_ledger.swap;

import com.batterysmart.swap_ledger.exception.InvalidInputException;
import com.batterysmart.swap_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps swap idempotency keys to the swap they created.
 *
 * Redis is a cache in front of the swaps table: a Redis outage or miss
 * falls through to the database, which stays authoritative. Keys are cached
 * only after the swap's transaction commits, so Redis never points at a
 * rolled-back swap.
 */
@Service
@Slf4j
public class SwapIdempotencyService {

    static final String REDIS_KEY_PREFIX = "swap-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);
    private static final int MAX_KEY_LENGTH = 255;

    private final SwapEventRepository swapRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;
    private final LedgerMetrics metrics;

    public SwapIdempotencyService(SwapEventRepository swapRepository,
                                  Optional<RedisTemplate<String, String>> redisTemplate,
                                  LedgerMetrics metrics) {
        this.swapRepository = swapRepository;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * @return the swap created under this key, if any
     */
    public Optional<UUID> findSwapId(String idempotencyKey) {
        validate(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    metrics.recordIdempotencyHit();
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, using database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        metrics.recordIdempotencyMiss();
        Optional<UUID> stored = findInDatabase(idempotencyKey);
        stored.ifPresent(swapId -> cache(idempotencyKey, swapId));
        return stored;
    }

    /**
     * Authoritative lookup, used once the driver lock is held.
     */
    public Optional<UUID> findInDatabase(String idempotencyKey) {
        return swapRepository.findIdByIdempotencyKey(idempotencyKey);
    }

    /**
     * Caches the key once the current transaction commits; immediately when
     * there is no transaction.
     */
    public void rememberAfterCommit(String idempotencyKey, UUID swapId) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(idempotencyKey, swapId);
                }
            });
        } else {
            cache(idempotencyKey, swapId);
        }
    }

    static void validate(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new InvalidInputException("idempotencyKey", "Idempotency key must not be blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new InvalidInputException("idempotencyKey",
                    "Idempotency key must be at most " + MAX_KEY_LENGTH + " characters");
        }
    }

    private void cache(String idempotencyKey, UUID swapId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, swapId.toString(), REDIS_TTL);
            log.debug("Cached idempotency key {} -> {}", idempotencyKey, swapId);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }
}
