package com.vcc.router.service.budget;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local ledger. Each key is updated atomically through {@link ConcurrentHashMap#merge}.
 */
@Service
@ConditionalOnProperty(prefix = "router.budget", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryBudgetLedger implements BudgetLedger {
    private static final Logger log = LoggerFactory.getLogger(InMemoryBudgetLedger.class);

    private final Map<BudgetKey, BigDecimal> totals = new ConcurrentHashMap<>();

    public InMemoryBudgetLedger() {
        log.info("InMemoryBudgetLedger initialized");
    }

    @Override
    public Mono<BigDecimal> spent(BudgetKey key) {
        return Mono.fromSupplier(() -> totals.getOrDefault(key, BigDecimal.ZERO));
    }

    @Override
    public Mono<BigDecimal> charge(BudgetKey key, BigDecimal amount) {
        return Mono.fromSupplier(() -> {
            BigDecimal total = totals.merge(key, amount, BigDecimal::add);
            log.debug("Charged {} to {} (total={})", amount, key.asString(), total);
            return total;
        });
    }
}
