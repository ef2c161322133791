package com.vcc.router.service.subscription;

import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.RequestContext;
import com.vcc.router.model.Subscription;
import com.vcc.router.model.SubscriptionScope;
import com.vcc.router.service.pipeline.CandidateFilter;
import com.vcc.router.service.pipeline.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Intersects candidates with the allow-list of the first scope, in policy precedence order, that
 * has an enabled subscription for the request. Without any applicable subscription nothing is allowed.
 */
@Component
public class SubscriptionResolver implements CandidateFilter {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionResolver.class);

    @Override
    public String name() {
        return "subscription";
    }

    @Override
    public CandidateSet apply(CandidateSet candidates, RoutingContext context) {
        RequestContext request = context.request();
        for (SubscriptionScope scope : context.policy().subscriptionPrecedence()) {
            List<Subscription> matching = context.subscriptions().enabled(scope, scope.targetOf(request));
            if (matching.isEmpty()) {
                continue;
            }
            Set<String> allowed = new HashSet<>();
            matching.forEach(s -> allowed.addAll(s.models()));
            context.trace().recordSubscriptionScope(scope);
            log.debug("auditId={} subscription scope={} target={} allowed={}",
                    context.auditId(), scope, scope.targetOf(request), allowed);
            return candidates.filter(c -> allowed.contains(c.modelId()));
        }
        log.debug("auditId={} no subscription for tenant={} app={} team={}",
                context.auditId(), request.tenantId(), request.appId(), request.teamId());
        return CandidateSet.empty();
    }
}
