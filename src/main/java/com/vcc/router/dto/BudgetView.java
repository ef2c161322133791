package com.vcc.router.dto;

import java.math.BigDecimal;

/**
 * Month-to-date spend of one (tenant, app) against its policy limit.
 */
public record BudgetView(
        String tenantId,
        String appId,
        String month,
        BigDecimal spent,
        BigDecimal monthlyLimit,
        BigDecimal remaining,
        BigDecimal lowWaterMark
) {
}
