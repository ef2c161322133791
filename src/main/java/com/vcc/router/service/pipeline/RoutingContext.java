package com.vcc.router.service.pipeline;

import com.vcc.router.model.DecisionTrace;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.RequestContext;
import com.vcc.router.service.subscription.SubscriptionSnapshot;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Everything a request's pipeline stages read: the request, the snapshots captured when it began,
 * and its trace. Snapshots never change for the lifetime of the request.
 */
public class RoutingContext {

    private final RequestContext request;
    private final Policy policy;
    private final SubscriptionSnapshot subscriptions;
    private final BigDecimal monthSpend;
    private final DecisionTrace trace;

    private final Set<String> heldProbes = ConcurrentHashMap.newKeySet();
    private volatile List<ModelDescriptor> complianceEligible = List.of();
    private volatile BigDecimal unitPriceCeiling;

    public RoutingContext(RequestContext request,
                          Policy policy,
                          SubscriptionSnapshot subscriptions,
                          BigDecimal monthSpend,
                          DecisionTrace trace) {
        this.request = request;
        this.policy = policy;
        this.subscriptions = subscriptions;
        this.monthSpend = monthSpend != null ? monthSpend : BigDecimal.ZERO;
        this.trace = trace;
    }

    public RequestContext request() {
        return request;
    }

    public Policy policy() {
        return policy;
    }

    public SubscriptionSnapshot subscriptions() {
        return subscriptions;
    }

    public BigDecimal monthSpend() {
        return monthSpend;
    }

    public DecisionTrace trace() {
        return trace;
    }

    public String auditId() {
        return trace.getAuditId();
    }

    /**
     * Models that survived the compliance filter; the only models any later step may invoke.
     */
    public List<ModelDescriptor> complianceEligible() {
        return complianceEligible;
    }

    public void setComplianceEligible(List<ModelDescriptor> models) {
        this.complianceEligible = List.copyOf(models);
    }

    public boolean isComplianceEligible(String modelId) {
        return complianceEligible.stream().anyMatch(m -> m.id().equals(modelId));
    }

    /**
     * Caps the unit price of every model this request may still invoke, including a minimal completion.
     */
    public void capUnitPrice(BigDecimal ceiling) {
        this.unitPriceCeiling = ceiling;
    }

    public boolean isAffordable(ModelDescriptor model) {
        BigDecimal ceiling = unitPriceCeiling;
        return ceiling == null || model.unitPrice().compareTo(ceiling) <= 0;
    }

    public void holdProbe(String modelId) {
        heldProbes.add(modelId);
    }

    /**
     * Gives up this request's claim on a half-open trial slot. Returns true if it was held.
     */
    public boolean consumeProbe(String modelId) {
        return heldProbes.remove(modelId);
    }

    public boolean holdsProbe(String modelId) {
        return heldProbes.contains(modelId);
    }

    public Set<String> heldProbes() {
        return Set.copyOf(heldProbes);
    }
}
