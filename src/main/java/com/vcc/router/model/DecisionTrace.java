package com.vcc.router.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lineage record of one request's routing and safety decisions.
 * Appended to as stages complete and frozen once it has been handed to the lineage sink.
 */
public class DecisionTrace {

    private final String auditId;
    private final RequestContext context;
    private final Instant startedAt;
    private final AtomicBoolean persisted = new AtomicBoolean(false);

    private long policyVersion;
    private String ruleId;
    private SubscriptionScope subscriptionScope;
    private String recommendedModel;
    private String finalModel;
    private List<String> fallbackChain = List.of();
    private final List<InvocationAttempt> attempts = new ArrayList<>();
    private boolean fellBack;
    private boolean downgraded;
    private String experimentId;
    private String experimentArm;
    private FirewallState firewallState;
    private List<Violation> violations = List.of();
    private String sanitizingModel;
    private boolean firewallDegraded;
    private TokenUsage usage = TokenUsage.none();
    private BigDecimal cost = BigDecimal.ZERO;
    private BigDecimal firewallCost = BigDecimal.ZERO;
    private final Map<String, Long> stageMicros = new LinkedHashMap<>();
    private TraceStatus status = TraceStatus.IN_PROGRESS;
    private String reasonCode;
    private Instant completedAt;

    public DecisionTrace(String auditId, RequestContext context, Instant startedAt) {
        this.auditId = auditId;
        this.context = context;
        this.startedAt = startedAt;
    }

    public String getAuditId() {
        return auditId;
    }

    public RequestContext getContext() {
        return context;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized void recordStage(String stage, long elapsedNanos) {
        ensureMutable();
        stageMicros.merge(stage, elapsedNanos / 1_000L, Long::sum);
    }

    public synchronized void recordPolicy(long version, String matchedRuleId) {
        ensureMutable();
        this.policyVersion = version;
        this.ruleId = matchedRuleId;
    }

    public synchronized void recordSubscriptionScope(SubscriptionScope scope) {
        ensureMutable();
        this.subscriptionScope = scope;
    }

    public synchronized void recordDowngrade() {
        ensureMutable();
        this.downgraded = true;
    }

    public synchronized void recordExperiment(String id, String arm) {
        ensureMutable();
        this.experimentId = id;
        this.experimentArm = arm;
    }

    public synchronized void recordSelection(String recommended, List<String> chain) {
        ensureMutable();
        this.recommendedModel = recommended;
        this.fallbackChain = List.copyOf(chain);
    }

    public synchronized void recordAttempt(InvocationAttempt attempt) {
        ensureMutable();
        attempts.add(attempt);
    }

    public synchronized void recordServed(String model, boolean fellBack, TokenUsage usage) {
        ensureMutable();
        this.finalModel = model;
        this.fellBack = fellBack;
        this.usage = usage != null ? usage : TokenUsage.none();
    }

    public synchronized void recordFirewall(FirewallOutcome outcome) {
        ensureMutable();
        this.firewallState = outcome.state();
        this.violations = outcome.violations();
        this.sanitizingModel = outcome.sanitizingModel();
        this.firewallDegraded = outcome.degraded();
    }

    public synchronized void recordCost(BigDecimal cost) {
        ensureMutable();
        this.cost = cost;
    }

    /**
     * Adds the cost of a sanitizer or judge call made while screening the output.
     */
    public synchronized void recordFirewallCost(BigDecimal amount) {
        ensureMutable();
        this.firewallCost = firewallCost.add(amount);
    }

    /**
     * Sets the terminal status unless one has already been set.
     */
    public synchronized void complete(TraceStatus terminal, String reason, Instant at) {
        ensureMutable();
        if (status != TraceStatus.IN_PROGRESS) {
            return;
        }
        this.status = terminal;
        this.reasonCode = reason;
        this.completedAt = at;
    }

    /**
     * Marks the trace as handed to the sink. Returns false if it already was.
     */
    public boolean freeze() {
        return persisted.compareAndSet(false, true);
    }

    public boolean isPersisted() {
        return persisted.get();
    }

    private void ensureMutable() {
        if (persisted.get()) {
            throw new IllegalStateException("Decision trace " + auditId + " is already persisted");
        }
    }

    public synchronized long getPolicyVersion() {
        return policyVersion;
    }

    public synchronized String getRuleId() {
        return ruleId;
    }

    public synchronized SubscriptionScope getSubscriptionScope() {
        return subscriptionScope;
    }

    public synchronized String getRecommendedModel() {
        return recommendedModel;
    }

    public synchronized String getFinalModel() {
        return finalModel;
    }

    public synchronized List<String> getFallbackChain() {
        return fallbackChain;
    }

    public synchronized List<InvocationAttempt> getAttempts() {
        return List.copyOf(attempts);
    }

    /**
     * Distinct models attempted, in the order they were first tried.
     */
    public synchronized List<String> getAttemptedModels() {
        return attempts.stream().map(InvocationAttempt::modelId).distinct().toList();
    }

    public synchronized boolean isFellBack() {
        return fellBack;
    }

    public synchronized boolean isDowngraded() {
        return downgraded;
    }

    public synchronized String getExperimentId() {
        return experimentId;
    }

    public synchronized String getExperimentArm() {
        return experimentArm;
    }

    public synchronized FirewallState getFirewallState() {
        return firewallState;
    }

    public synchronized List<Violation> getViolations() {
        return violations;
    }

    public synchronized String getSanitizingModel() {
        return sanitizingModel;
    }

    public synchronized boolean isFirewallDegraded() {
        return firewallDegraded;
    }

    public synchronized TokenUsage getUsage() {
        return usage;
    }

    public synchronized BigDecimal getCost() {
        return cost;
    }

    public synchronized BigDecimal getFirewallCost() {
        return firewallCost;
    }

    public synchronized Map<String, Long> getStageMicros() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(stageMicros));
    }

    public synchronized TraceStatus getStatus() {
        return status;
    }

    public synchronized String getReasonCode() {
        return reasonCode;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }
}
