package com.vcc.router.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Persisted lineage record, one row per routed request.
 */
@Table("decision_trace")
public class DecisionTraceEntity {

    @Id
    @Column("id")
    private Long id;

    @Column("audit_id")
    private String auditId;

    @Column("tenant_id")
    private String tenantId;

    @Column("app_id")
    private String appId;

    @Column("team_id")
    private String teamId;

    @Column("policy_version")
    private long policyVersion;

    @Column("rule_id")
    private String ruleId;

    @Column("subscription_scope")
    private String subscriptionScope;

    @Column("recommended_model")
    private String recommendedModel;

    @Column("final_model")
    private String finalModel;

    @Column("fallback_chain")
    private String fallbackChain;

    @Column("attempts_json")
    private String attemptsJson;

    @Column("fell_back")
    private boolean fellBack;

    @Column("downgraded")
    private boolean downgraded;

    @Column("experiment_id")
    private String experimentId;

    @Column("experiment_arm")
    private String experimentArm;

    @Column("firewall_state")
    private String firewallState;

    @Column("violations_json")
    private String violationsJson;

    @Column("sanitizing_model")
    private String sanitizingModel;

    @Column("firewall_degraded")
    private boolean firewallDegraded;

    @Column("prompt_tokens")
    private int promptTokens;

    @Column("completion_tokens")
    private int completionTokens;

    @Column("cost")
    private BigDecimal cost;

    @Column("firewall_cost")
    private BigDecimal firewallCost;

    @Column("stage_timings_json")
    private String stageTimingsJson;

    @Column("status")
    private String status;

    @Column("reason_code")
    private String reasonCode;

    @Column("started_at")
    private Instant startedAt;

    @Column("completed_at")
    private Instant completedAt;

    public DecisionTraceEntity() {
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getAuditId() {
        return auditId;
    }

    public void setAuditId(String auditId) {
        this.auditId = auditId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getAppId() {
        return appId;
    }

    public void setAppId(String appId) {
        this.appId = appId;
    }

    public String getTeamId() {
        return teamId;
    }

    public void setTeamId(String teamId) {
        this.teamId = teamId;
    }

    public long getPolicyVersion() {
        return policyVersion;
    }

    public void setPolicyVersion(long policyVersion) {
        this.policyVersion = policyVersion;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public String getSubscriptionScope() {
        return subscriptionScope;
    }

    public void setSubscriptionScope(String subscriptionScope) {
        this.subscriptionScope = subscriptionScope;
    }

    public String getRecommendedModel() {
        return recommendedModel;
    }

    public void setRecommendedModel(String recommendedModel) {
        this.recommendedModel = recommendedModel;
    }

    public String getFinalModel() {
        return finalModel;
    }

    public void setFinalModel(String finalModel) {
        this.finalModel = finalModel;
    }

    public String getFallbackChain() {
        return fallbackChain;
    }

    public void setFallbackChain(String fallbackChain) {
        this.fallbackChain = fallbackChain;
    }

    public String getAttemptsJson() {
        return attemptsJson;
    }

    public void setAttemptsJson(String attemptsJson) {
        this.attemptsJson = attemptsJson;
    }

    public boolean isFellBack() {
        return fellBack;
    }

    public void setFellBack(boolean fellBack) {
        this.fellBack = fellBack;
    }

    public boolean isDowngraded() {
        return downgraded;
    }

    public void setDowngraded(boolean downgraded) {
        this.downgraded = downgraded;
    }

    public String getExperimentId() {
        return experimentId;
    }

    public void setExperimentId(String experimentId) {
        this.experimentId = experimentId;
    }

    public String getExperimentArm() {
        return experimentArm;
    }

    public void setExperimentArm(String experimentArm) {
        this.experimentArm = experimentArm;
    }

    public String getFirewallState() {
        return firewallState;
    }

    public void setFirewallState(String firewallState) {
        this.firewallState = firewallState;
    }

    public String getViolationsJson() {
        return violationsJson;
    }

    public void setViolationsJson(String violationsJson) {
        this.violationsJson = violationsJson;
    }

    public String getSanitizingModel() {
        return sanitizingModel;
    }

    public void setSanitizingModel(String sanitizingModel) {
        this.sanitizingModel = sanitizingModel;
    }

    public boolean isFirewallDegraded() {
        return firewallDegraded;
    }

    public void setFirewallDegraded(boolean firewallDegraded) {
        this.firewallDegraded = firewallDegraded;
    }

    public int getPromptTokens() {
        return promptTokens;
    }

    public void setPromptTokens(int promptTokens) {
        this.promptTokens = promptTokens;
    }

    public int getCompletionTokens() {
        return completionTokens;
    }

    public void setCompletionTokens(int completionTokens) {
        this.completionTokens = completionTokens;
    }

    public BigDecimal getCost() {
        return cost;
    }

    public void setCost(BigDecimal cost) {
        this.cost = cost;
    }

    public BigDecimal getFirewallCost() {
        return firewallCost;
    }

    public void setFirewallCost(BigDecimal firewallCost) {
        this.firewallCost = firewallCost;
    }

    public String getStageTimingsJson() {
        return stageTimingsJson;
    }

    public void setStageTimingsJson(String stageTimingsJson) {
        this.stageTimingsJson = stageTimingsJson;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public void setReasonCode(String reasonCode) {
        this.reasonCode = reasonCode;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }
}
