package com.vcc.router.service.policy;

import com.vcc.router.exception.InvalidPolicyException;
import com.vcc.router.model.BudgetLimits;
import com.vcc.router.model.DetectorSpec;
import com.vcc.router.model.DirectiveKind;
import com.vcc.router.model.FieldCondition;
import com.vcc.router.model.FirewallAction;
import com.vcc.router.model.FirewallPolicy;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.PolicyRule;
import com.vcc.router.model.RoutingDirective;
import com.vcc.router.model.Sensitivity;
import com.vcc.router.model.WeightedModel;
import com.vcc.router.service.firewall.DetectorFactory;
import com.vcc.router.service.registry.ModelRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Static checks run before a policy may become active. All violations are collected and reported
 * together.
 */
@Component
public class PolicyValidator {

    static final double WEIGHT_TOLERANCE = 1e-6;

    private final ModelRegistry registry;

    public PolicyValidator(ModelRegistry registry) {
        this.registry = registry;
    }

    public void validate(Policy policy) {
        List<String> violations = new ArrayList<>();
        if (policy.appId() == null || policy.appId().isBlank()) {
            violations.add("appId is required");
        }
        if (policy.version() <= 0) {
            violations.add("version must be positive");
        }
        if (policy.rules().isEmpty()) {
            violations.add("policy has no rules");
        }

        Map<String, PolicyRule> rulesById = new HashMap<>();
        for (PolicyRule rule : policy.rules()) {
            if (rule.id() == null || rule.id().isBlank()) {
                violations.add("rule without id");
                continue;
            }
            if (rulesById.putIfAbsent(rule.id(), rule) != null) {
                violations.add("duplicate rule id '" + rule.id() + "'");
            }
        }

        for (PolicyRule rule : policy.rules()) {
            String label = "rule '" + rule.id() + "'";
            rule.when().forEach(condition -> checkCondition(label, condition, violations));
            checkDirective(label, rule.directive(), violations);
            if (rule.fallbackRule() != null && !rulesById.containsKey(rule.fallbackRule())) {
                violations.add(label + " references unknown fallback rule '" + rule.fallbackRule() + "'");
            }
        }
        checkFallbackCycles(rulesById, violations);
        checkBudget(policy.budget(), violations);
        checkFirewall(policy.firewall(), violations);

        if (!violations.isEmpty()) {
            throw new InvalidPolicyException(policy.appId(), violations);
        }
    }

    private void checkCondition(String label, FieldCondition condition, List<String> violations) {
        Optional<RequestField> field = RequestField.byKey(condition.field());
        if (field.isEmpty()) {
            violations.add(label + " tests unknown field '" + condition.field() + "'");
            return;
        }
        if (condition.op() == null) {
            violations.add(label + " has a condition without operator");
            return;
        }
        switch (condition.op()) {
            case EQ -> {
                if (condition.value() == null) {
                    violations.add(label + " EQ on '" + condition.field() + "' needs a value");
                }
            }
            case IN -> {
                if (condition.values().isEmpty()) {
                    violations.add(label + " IN on '" + condition.field() + "' needs values");
                }
            }
            case LT, GTE -> {
                if (!field.get().isOrdered()) {
                    violations.add(label + " " + condition.op() + " is not supported on '" + condition.field() + "'");
                } else if (!isOrderedOperand(field.get(), condition.value())) {
                    violations.add(label + " " + condition.op() + " on '" + condition.field()
                            + "' has invalid operand '" + condition.value() + "'");
                }
            }
        }
    }

    private static boolean isOrderedOperand(RequestField field, String value) {
        if (value == null) {
            return false;
        }
        if (field == RequestField.SENSITIVITY) {
            try {
                Sensitivity.parse(value);
                return true;
            } catch (IllegalArgumentException e) {
                return false;
            }
        }
        return PolicyEvaluator.parseNumber(value) != null;
    }

    private void checkDirective(String label, RoutingDirective directive, List<String> violations) {
        if (directive == null || directive.kind() == null) {
            violations.add(label + " has no directive");
            return;
        }
        if (directive.models().isEmpty()) {
            violations.add(label + " directive lists no models");
            return;
        }
        Set<String> seen = new HashSet<>();
        for (WeightedModel entry : directive.models()) {
            checkModel(label, entry.model(), violations);
            if (entry.model() != null && !seen.add(entry.model())) {
                violations.add(label + " lists model '" + entry.model() + "' twice");
            }
        }
        if (directive.kind() == DirectiveKind.SINGLE && directive.models().size() != 1) {
            violations.add(label + " SINGLE directive must name exactly one model");
        }
        if (directive.kind() == DirectiveKind.WEIGHTED) {
            double sum = 0.0d;
            for (WeightedModel entry : directive.models()) {
                if (entry.weight() == null || entry.weight() <= 0.0d || entry.weight() > 1.0d) {
                    violations.add(label + " weight of '" + entry.model() + "' must be in (0, 1]");
                } else {
                    sum += entry.weight();
                }
            }
            if (Math.abs(sum - 1.0d) > WEIGHT_TOLERANCE) {
                violations.add(label + " weights sum to " + sum + ", expected 1");
            }
        }
    }

    private void checkModel(String label, String modelId, List<String> violations) {
        Optional<ModelDescriptor> model = registry.find(modelId);
        if (model.isEmpty()) {
            violations.add(label + " references unknown model '" + modelId + "'");
        } else if (!model.get().enabled()) {
            violations.add(label + " references disabled model '" + modelId + "'");
        }
    }

    private static void checkFallbackCycles(Map<String, PolicyRule> rulesById, List<String> violations) {
        for (PolicyRule start : rulesById.values()) {
            Set<String> path = new LinkedHashSet<>();
            PolicyRule current = start;
            while (current != null && current.fallbackRule() != null) {
                if (!path.add(current.id())) {
                    break;
                }
                if (current.fallbackRule().equals(start.id())) {
                    violations.add("cyclic fallback reference: " + String.join(" -> ", path) + " -> " + start.id());
                    break;
                }
                current = rulesById.get(current.fallbackRule());
            }
        }
    }

    private static void checkBudget(BudgetLimits budget, List<String> violations) {
        if (isNegative(budget.monthlyLimit())) {
            violations.add("budget monthlyLimit cannot be negative");
        }
        if (isNegative(budget.lowWaterMark())) {
            violations.add("budget lowWaterMark cannot be negative");
        }
        if (isNegative(budget.minimalCostThreshold())) {
            violations.add("budget minimalCostThreshold cannot be negative");
        }
    }

    private static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    private void checkFirewall(FirewallPolicy firewall, List<String> violations) {
        for (DetectorSpec detector : firewall.detectors()) {
            if (detector.name() == null || detector.name().isBlank()) {
                violations.add("detector without name");
                continue;
            }
            if (detector.effectiveType() == DetectorSpec.Type.BUILTIN) {
                if (!DetectorFactory.BUILTIN_NAMES.contains(detector.name())) {
                    violations.add("unknown builtin detector '" + detector.name() + "'");
                }
            } else if (detector.pattern() == null || detector.pattern().isEmpty()) {
                violations.add("detector '" + detector.name() + "' has no pattern");
            } else {
                try {
                    Pattern.compile(detector.pattern());
                } catch (PatternSyntaxException e) {
                    violations.add("detector '" + detector.name() + "' has an invalid pattern");
                }
            }
        }
        if (firewall.sanitizingModel() != null) {
            checkModel("firewall", firewall.sanitizingModel(), violations);
        } else if (firewall.defaultAction() == FirewallAction.REDRAFT) {
            violations.add("firewall default action REDRAFT requires a sanitizingModel");
        }
        if (firewall.contextual().enabled()) {
            if (firewall.contextual().judgeModel() == null) {
                violations.add("contextual detector requires a judgeModel");
            } else {
                checkModel("contextual detector", firewall.contextual().judgeModel(), violations);
            }
        }
    }
}
