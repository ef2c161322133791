package com.vcc.router.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;

/**
 * Read-only snapshot of a registered model.
 * Prices are per 1,000 tokens.
 */
public record ModelDescriptor(
        String id,
        String provider,
        String name,
        String version,
        BigDecimal inputPricePer1k,
        BigDecimal outputPricePer1k,
        Set<String> capabilities,
        ComplianceTag complianceTag,
        boolean enabled
) {

    public ModelDescriptor {
        inputPricePer1k = inputPricePer1k != null ? inputPricePer1k : BigDecimal.ZERO;
        outputPricePer1k = outputPricePer1k != null ? outputPricePer1k : BigDecimal.ZERO;
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
        complianceTag = complianceTag != null ? complianceTag : ComplianceTag.EXTERNAL;
    }

    /**
     * Blended price used when comparing models against each other or against budget thresholds.
     */
    public BigDecimal unitPrice() {
        return inputPricePer1k.add(outputPricePer1k).divide(BigDecimal.valueOf(2), 6, RoundingMode.HALF_UP);
    }

    public boolean isExternal() {
        return complianceTag == ComplianceTag.EXTERNAL;
    }

    public ModelDescriptor withEnabled(boolean enabled) {
        return new ModelDescriptor(id, provider, name, version, inputPricePer1k, outputPricePer1k,
                capabilities, complianceTag, enabled);
    }
}
