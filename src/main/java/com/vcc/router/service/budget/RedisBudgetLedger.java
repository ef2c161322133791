package com.vcc.router.service.budget;

import com.vcc.router.config.RouterProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Ledger shared across router instances. Totals are Redis floats updated with INCRBYFLOAT.
 */
@Service
@ConditionalOnProperty(prefix = "router.budget", name = "store", havingValue = "redis")
public class RedisBudgetLedger implements BudgetLedger {
    private static final Logger log = LoggerFactory.getLogger(RedisBudgetLedger.class);

    // Keys outlive their month so late reads still see the final total
    static final Duration KEY_TTL = Duration.ofDays(62);
    private static final int SCALE = 6;

    private final ReactiveStringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisBudgetLedger(ReactiveStringRedisTemplate redisTemplate, RouterProperties properties) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = properties.getBudget().getKeyPrefix() != null
                ? properties.getBudget().getKeyPrefix()
                : "router:budget:";
        log.info("RedisBudgetLedger initialized with keyPrefix={}", keyPrefix);
    }

    @Override
    public Mono<BigDecimal> spent(BudgetKey key) {
        return redisTemplate.opsForValue().get(redisKey(key))
                .map(value -> new BigDecimal(value).setScale(SCALE, RoundingMode.HALF_UP))
                .defaultIfEmpty(BigDecimal.ZERO);
    }

    @Override
    public Mono<BigDecimal> charge(BudgetKey key, BigDecimal amount) {
        String redisKey = redisKey(key);
        return redisTemplate.opsForValue().increment(redisKey, amount.doubleValue())
                .flatMap(total -> redisTemplate.expire(redisKey, KEY_TTL).thenReturn(total))
                .map(total -> BigDecimal.valueOf(total).setScale(SCALE, RoundingMode.HALF_UP))
                .doOnNext(total -> log.debug("Charged {} to {} (total={})", amount, redisKey, total))
                .doOnError(e -> log.warn("Failed to charge budget {}: {}", redisKey, e.getMessage()));
    }

    String redisKey(BudgetKey key) {
        return keyPrefix + key.asString();
    }
}
