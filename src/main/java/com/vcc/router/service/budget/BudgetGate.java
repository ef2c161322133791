package com.vcc.router.service.budget;

import com.vcc.router.exception.DenyReason;
import com.vcc.router.model.BudgetLimits;
import com.vcc.router.model.Candidate;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.DirectiveKind;
import com.vcc.router.service.metrics.MetricsSink;
import com.vcc.router.service.pipeline.CandidateFilter;
import com.vcc.router.service.pipeline.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Applies the app's monthly limit against the spend captured when the request began.
 * Exhausted budgets only admit models at or below the minimal cost threshold; budgets under the
 * low-water mark are served cheapest first.
 */
@Component
public class BudgetGate implements CandidateFilter {
    private static final Logger log = LoggerFactory.getLogger(BudgetGate.class);

    static final Comparator<Candidate> CHEAPEST_FIRST = Comparator.comparing(c -> c.model().unitPrice());

    private final MetricsSink metrics;

    public BudgetGate(MetricsSink metrics) {
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return "budget";
    }

    @Override
    public DenyReason denyReason() {
        return DenyReason.BUDGET_EXCEEDED;
    }

    @Override
    public CandidateSet apply(CandidateSet candidates, RoutingContext context) {
        BudgetLimits limits = context.policy().budget();
        if (!limits.hasLimit()) {
            return candidates;
        }
        BigDecimal remaining = limits.monthlyLimit().subtract(context.monthSpend());

        if (remaining.signum() <= 0) {
            context.capUnitPrice(limits.effectiveMinimalCostThreshold());
            CandidateSet affordable = candidates.filter(c -> context.isAffordable(c.model()));
            log.debug("auditId={} budget exhausted (spent={}, limit={}), {} of {} candidates under {}",
                    context.auditId(), context.monthSpend(), limits.monthlyLimit(),
                    affordable.size(), candidates.size(), limits.effectiveMinimalCostThreshold());
            if (!affordable.isEmpty()) {
                markDowngraded(context);
            }
            return affordable;
        }

        if (remaining.compareTo(limits.effectiveLowWaterMark()) < 0) {
            log.debug("auditId={} budget low (remaining={}, lowWaterMark={}), downgrading to cheapest first",
                    context.auditId(), remaining, limits.effectiveLowWaterMark());
            markDowngraded(context);
            return candidates.sorted(CHEAPEST_FIRST).withKind(DirectiveKind.ORDERED);
        }
        return candidates;
    }

    private void markDowngraded(RoutingContext context) {
        context.trace().recordDowngrade();
        metrics.increment("budget_downgrade", context.request().appId());
    }
}
