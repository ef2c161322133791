package com.vcc.router.service.compliance;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.exception.DenyReason;
import com.vcc.router.model.Candidate;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.RequestContext;
import com.vcc.router.model.Sensitivity;
import com.vcc.router.service.pipeline.CandidateFilter;
import com.vcc.router.service.pipeline.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;

/**
 * Removes externally hosted models when the request is too sensitive or carries a blocked tag.
 * Runs unconditionally; nothing downstream may re-admit a model it removed.
 */
@Component
public class ComplianceFilter implements CandidateFilter {
    private static final Logger log = LoggerFactory.getLogger(ComplianceFilter.class);

    private final Sensitivity defaultThreshold;

    public ComplianceFilter(RouterProperties properties) {
        this.defaultThreshold = properties.getCompliance().getSensitivityThreshold();
        log.info("ComplianceFilter initialized: defaultSensitivityThreshold={}", defaultThreshold);
    }

    @Override
    public String name() {
        return "compliance";
    }

    @Override
    public DenyReason denyReason() {
        return DenyReason.COMPLIANCE_BLOCK;
    }

    @Override
    public CandidateSet apply(CandidateSet candidates, RoutingContext context) {
        CandidateSet kept = candidates.filter(c -> permits(c.model(), context.request(), context.policy()));
        context.setComplianceEligible(kept.candidates().stream().map(Candidate::model).toList());
        if (kept.size() < candidates.size()) {
            log.debug("auditId={} compliance removed {} external candidates (sensitivity={})",
                    context.auditId(), candidates.size() - kept.size(), context.request().sensitivity());
        }
        return kept;
    }

    /**
     * Whether the model may process this request under the policy's data-handling rules.
     */
    public boolean permits(ModelDescriptor model, RequestContext request, Policy policy) {
        if (!model.isExternal()) {
            return true;
        }
        if (request.sensitivity().isAbove(threshold(policy))) {
            return false;
        }
        return Collections.disjoint(request.tags(), policy.compliance().blockedTags());
    }

    Sensitivity threshold(Policy policy) {
        Sensitivity configured = policy.compliance().sensitivityThreshold();
        return configured != null ? configured : defaultThreshold;
    }
}
