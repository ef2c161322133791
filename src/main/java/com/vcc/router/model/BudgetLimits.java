package com.vcc.router.model;

import java.math.BigDecimal;

/**
 * Monthly spend limits for one (tenant, app). A null monthly limit means unlimited.
 *
 * @param lowWaterMark         remaining budget below which candidates are downgraded to the cheapest first
 * @param minimalCostThreshold highest unit price still allowed once the budget is exhausted
 */
public record BudgetLimits(
        BigDecimal monthlyLimit,
        BigDecimal lowWaterMark,
        BigDecimal minimalCostThreshold
) {

    public static BudgetLimits unlimited() {
        return new BudgetLimits(null, null, null);
    }

    public boolean hasLimit() {
        return monthlyLimit != null;
    }

    public BigDecimal effectiveLowWaterMark() {
        return lowWaterMark != null ? lowWaterMark : BigDecimal.ZERO;
    }

    public BigDecimal effectiveMinimalCostThreshold() {
        return minimalCostThreshold != null ? minimalCostThreshold : BigDecimal.ZERO;
    }
}
