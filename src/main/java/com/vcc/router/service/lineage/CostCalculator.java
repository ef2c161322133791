package com.vcc.router.service.lineage;

import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.TokenUsage;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class CostCalculator {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final int SCALE = 6;

    private CostCalculator() {
    }

    /**
     * Cost of the usage at the model's per-1K-token prices.
     */
    public static BigDecimal cost(ModelDescriptor model, TokenUsage usage) {
        if (model == null || usage == null) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        BigDecimal input = model.inputPricePer1k().multiply(BigDecimal.valueOf(usage.promptTokens()));
        BigDecimal output = model.outputPricePer1k().multiply(BigDecimal.valueOf(usage.completionTokens()));
        return input.add(output).divide(THOUSAND, SCALE, RoundingMode.HALF_UP);
    }
}
