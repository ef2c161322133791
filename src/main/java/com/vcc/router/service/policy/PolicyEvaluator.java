package com.vcc.router.service.policy;

import com.vcc.router.model.Candidate;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.DirectiveKind;
import com.vcc.router.model.FieldCondition;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.PolicyRule;
import com.vcc.router.model.RequestContext;
import com.vcc.router.model.Sensitivity;
import com.vcc.router.model.WeightedModel;
import com.vcc.router.service.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Matches a request against a policy's rules, top to bottom. The first matching rule's directive
 * becomes the candidate set. No match yields an empty set; there is no default route.
 */
@Component
public class PolicyEvaluator {
    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

    private final ModelRegistry registry;

    public PolicyEvaluator(ModelRegistry registry) {
        this.registry = registry;
    }

    public CandidateSet evaluate(RequestContext context, Policy policy) {
        for (PolicyRule rule : policy.rules()) {
            if (matches(rule, context)) {
                log.debug("Rule {} matched app={} version={}", rule.id(), policy.appId(), policy.version());
                return candidatesFor(rule, policy);
            }
        }
        return CandidateSet.empty();
    }

    static boolean matches(PolicyRule rule, RequestContext context) {
        for (FieldCondition condition : rule.when()) {
            if (!holds(condition, context)) {
                return false;
            }
        }
        return true;
    }

    static boolean holds(FieldCondition condition, RequestContext context) {
        if (condition.op() == null) {
            return false;
        }
        Optional<RequestField> field = RequestField.byKey(condition.field());
        if (field.isEmpty()) {
            return false;
        }
        Object actual = field.get().valueOf(context);
        if (actual == null) {
            return false;
        }
        return switch (condition.op()) {
            case EQ -> condition.value() != null && equalsValue(actual, condition.value());
            case IN -> condition.values().stream().anyMatch(v -> equalsValue(actual, v));
            case LT -> compare(actual, condition.value()).map(c -> c < 0).orElse(false);
            case GTE -> compare(actual, condition.value()).map(c -> c >= 0).orElse(false);
        };
    }

    private static boolean equalsValue(Object actual, String expected) {
        if (expected == null) {
            return false;
        }
        if (actual instanceof Collection<?> collection) {
            return collection.contains(expected);
        }
        if (actual instanceof Sensitivity sensitivity) {
            return sensitivity.name().equals(expected.trim().toUpperCase(Locale.ROOT));
        }
        if (actual instanceof Integer number) {
            Double parsed = parseNumber(expected);
            return parsed != null && parsed == number.doubleValue();
        }
        return actual.toString().equals(expected);
    }

    private static Optional<Integer> compare(Object actual, String expected) {
        if (expected == null) {
            return Optional.empty();
        }
        if (actual instanceof Integer number) {
            Double parsed = parseNumber(expected);
            return parsed == null ? Optional.empty() : Optional.of(Double.compare(number.doubleValue(), parsed));
        }
        if (actual instanceof Sensitivity sensitivity) {
            try {
                return Optional.of(sensitivity.compareTo(Sensitivity.parse(expected)));
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static Double parseNumber(String raw) {
        try {
            return Double.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private CandidateSet candidatesFor(PolicyRule rule, Policy policy) {
        DirectiveKind kind = rule.directive().kind();
        List<Candidate> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (WeightedModel entry : rule.directive().models()) {
            double weight = kind == DirectiveKind.WEIGHTED ? entry.effectiveWeight() : 1.0d;
            resolve(entry.model()).filter(m -> seen.add(m.id()))
                    .ifPresent(m -> candidates.add(Candidate.of(m, weight, rule.id())));
        }

        Set<String> visitedRules = new HashSet<>();
        visitedRules.add(rule.id());
        String next = rule.fallbackRule();
        while (next != null && visitedRules.add(next)) {
            Optional<PolicyRule> fallbackRule = policy.rule(next);
            if (fallbackRule.isEmpty()) {
                break;
            }
            for (String modelId : fallbackRule.get().directive().modelIds()) {
                resolve(modelId).filter(m -> seen.add(m.id()))
                        .ifPresent(m -> candidates.add(new Candidate(m, 0.0d, rule.id(), false, true)));
            }
            next = fallbackRule.get().fallbackRule();
        }
        return CandidateSet.of(kind, rule.id(), candidates);
    }

    private Optional<ModelDescriptor> resolve(String modelId) {
        return registry.find(modelId).filter(ModelDescriptor::enabled);
    }
}
