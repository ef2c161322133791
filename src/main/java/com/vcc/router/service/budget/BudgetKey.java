package com.vcc.router.service.budget;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Spend accumulator identity: one per (tenant, app) and UTC calendar month.
 */
public record BudgetKey(String tenantId, String appId, YearMonth month) {

    public static BudgetKey of(String tenantId, String appId, Instant at) {
        return new BudgetKey(tenantId, appId, YearMonth.from(at.atOffset(ZoneOffset.UTC)));
    }

    public String asString() {
        return tenantId + ":" + appId + ":" + month;
    }
}
