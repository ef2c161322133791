package com.vcc.router.entity;

import com.vcc.router.model.ComplianceTag;
import com.vcc.router.model.ModelDescriptor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.Instant;

@Table("model_descriptor")
public class ModelDescriptorEntity {

    @Id
    @Column("model_id")
    private String modelId;

    @Column("provider")
    private String provider;

    @Column("name")
    private String name;

    @Column("version")
    private String version;

    @Column("input_price_per_1k")
    private BigDecimal inputPricePer1k;

    @Column("output_price_per_1k")
    private BigDecimal outputPricePer1k;

    @Column("capabilities")
    private String capabilities;

    @Column("compliance_tag")
    private String complianceTag;

    @Column("enabled")
    private boolean enabled;

    @Column("updated_at")
    private Instant updatedAt;

    public ModelDescriptorEntity() {
    }

    public String getModelId() {
        return modelId;
    }

    public void setModelId(String modelId) {
        this.modelId = modelId;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public BigDecimal getInputPricePer1k() {
        return inputPricePer1k;
    }

    public void setInputPricePer1k(BigDecimal inputPricePer1k) {
        this.inputPricePer1k = inputPricePer1k;
    }

    public BigDecimal getOutputPricePer1k() {
        return outputPricePer1k;
    }

    public void setOutputPricePer1k(BigDecimal outputPricePer1k) {
        this.outputPricePer1k = outputPricePer1k;
    }

    public String getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(String capabilities) {
        this.capabilities = capabilities;
    }

    public String getComplianceTag() {
        return complianceTag;
    }

    public void setComplianceTag(String complianceTag) {
        this.complianceTag = complianceTag;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public ModelDescriptor toDescriptor() {
        return new ModelDescriptor(
                modelId,
                provider,
                name,
                version,
                inputPricePer1k,
                outputPricePer1k,
                CsvColumns.split(capabilities),
                ComplianceTag.parse(complianceTag),
                enabled
        );
    }
}
