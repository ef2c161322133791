package com.vcc.router.service.budget;

import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/**
 * Month-to-date spend per (tenant, app). Charges must be atomic per key.
 */
public interface BudgetLedger {

    /**
     * Spend recorded so far; zero when nothing was charged.
     */
    Mono<BigDecimal> spent(BudgetKey key);

    /**
     * Add the amount and return the new total.
     */
    Mono<BigDecimal> charge(BudgetKey key, BigDecimal amount);
}
