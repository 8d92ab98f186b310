package com.flagship.revenue_ledger.distribution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Fast duplicate check for distributions, keyed on the payment transaction id.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the revenue_distributions table (always authoritative)
 * 3. Cache database hits in Redis for later lookups
 *
 * This is only a fast path: the primary key on revenue_distributions is what
 * actually guarantees at-most-once distribution.
 */
@Service
@Slf4j
public class DistributionIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "ledger:distributed:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final DistributionRepository distributionRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public DistributionIdempotencyService(DistributionRepository distributionRepository,
                                          Optional<StringRedisTemplate> redisTemplate) {
        this.distributionRepository = distributionRepository;
        this.redisTemplate = redisTemplate;
    }

    public boolean isDistributed(String transactionId) {
        String redisKey = REDIS_KEY_PREFIX + transactionId;

        if (redisTemplate.isPresent()) {
            try {
                if (Boolean.TRUE.equals(redisTemplate.get().hasKey(redisKey))) {
                    log.debug("Distribution found in Redis: {}", transactionId);
                    return true;
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for transaction {}, falling back to database: {}",
                        transactionId, e.getMessage());
            }
        }

        if (distributionRepository.exists(transactionId)) {
            log.debug("Distribution found in database: {}", transactionId);
            remember(transactionId);
            return true;
        }
        return false;
    }

    /**
     * Caches a committed distribution in Redis. Best effort; the database stays the source of truth.
     */
    public void remember(String transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + transactionId, "1", REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache distribution {} in Redis: {}", transactionId, e.getMessage());
        }
    }
}
