package com.vcc.router.service.firewall;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.model.FirewallAction;
import com.vcc.router.model.FirewallOutcome;
import com.vcc.router.model.FirewallPolicy;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.TokenUsage;
import com.vcc.router.model.Violation;
import com.vcc.router.service.compliance.ComplianceFilter;
import com.vcc.router.service.lineage.CostCalculator;
import com.vcc.router.service.metrics.MetricsSink;
import com.vcc.router.service.pipeline.RoutingContext;
import com.vcc.router.service.registry.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Screens the served output before it reaches the caller. Sanitizer and judge failures never fail
 * the request: a failed redraft is reported as a degraded flag, a failed judge as a deterministic-only
 * result. Sanitizer and judge usage is costed onto the trace.
 */
@Service
public class SensitiveOutputFirewall {
    private static final Logger log = LoggerFactory.getLogger(SensitiveOutputFirewall.class);

    private final DetectorFactory detectorFactory;
    private final SanitizingAdapter sanitizingAdapter;
    private final ContextualDetector contextualDetector;
    private final ModelRegistry registry;
    private final ComplianceFilter complianceFilter;
    private final MetricsSink metrics;
    private final Duration sanitizerTimeout;
    private final Duration contextualTimeout;

    public SensitiveOutputFirewall(DetectorFactory detectorFactory,
                                   SanitizingAdapter sanitizingAdapter,
                                   ContextualDetector contextualDetector,
                                   ModelRegistry registry,
                                   ComplianceFilter complianceFilter,
                                   MetricsSink metrics,
                                   RouterProperties properties) {
        this.detectorFactory = detectorFactory;
        this.sanitizingAdapter = sanitizingAdapter;
        this.contextualDetector = contextualDetector;
        this.registry = registry;
        this.complianceFilter = complianceFilter;
        this.metrics = metrics;
        this.sanitizerTimeout = properties.getTimeouts().getSanitizer();
        this.contextualTimeout = properties.getTimeouts().getContextualDetector();
    }

    public Mono<FirewallOutcome> screen(String output, RoutingContext context) {
        Policy policy = context.policy();
        List<DetectionResult> results = detectorFactory.detectorsFor(policy).stream()
                .map(detector -> detector.scan(output))
                .toList();
        List<Violation> violations = violationsOf(results);

        Mono<List<Violation>> detected = Mono.just(violations);
        if (violations.isEmpty() && results.stream().anyMatch(DetectionResult::inconclusive)) {
            detected = contextual(output, context);
        }
        return detected.flatMap(found -> decide(output, found, context));
    }

    private Mono<List<Violation>> contextual(String output, RoutingContext context) {
        FirewallPolicy firewall = context.policy().firewall();
        if (!firewall.contextual().enabled()) {
            return Mono.just(List.of());
        }
        Optional<ModelDescriptor> judge = eligibleModel(firewall.contextual().judgeModel(), context);
        if (judge.isEmpty()) {
            log.debug("auditId={} contextual detector skipped: judge model {} unavailable or not compliant",
                    context.auditId(), firewall.contextual().judgeModel());
            return Mono.just(List.of());
        }
        return contextualDetector.judge(judge.get(), output)
                .timeout(contextualTimeout)
                .map(judgement -> {
                    recordCost(context, judge.get(), judgement.usage());
                    return violationsOf(List.of(judgement.result()));
                })
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    log.warn("auditId={} contextual detector failed, using deterministic result: {}",
                            context.auditId(), e.toString());
                    metrics.increment("contextual_timeout", context.request().appId(), judge.get().id(),
                            judge.get().provider(), e.getClass().getSimpleName());
                    return Mono.just(List.of());
                });
    }

    private Mono<FirewallOutcome> decide(String output, List<Violation> violations, RoutingContext context) {
        if (violations.isEmpty()) {
            return Mono.just(FirewallOutcome.clean(output));
        }
        String app = context.request().appId();
        FirewallPolicy firewall = context.policy().firewall();
        FirewallAction requested = context.request().options().firewallAction();
        FirewallAction action = requested != null ? requested : firewall.defaultAction();
        log.info("auditId={} firewall violations={} action={}", context.auditId(), violations, action);

        if (action == FirewallAction.FLAG) {
            metrics.increment("firewall_flagged", app);
            return Mono.just(FirewallOutcome.flagged(output, violations, false));
        }

        Optional<ModelDescriptor> sanitizer = eligibleModel(firewall.sanitizingModel(), context);
        if (sanitizer.isEmpty()) {
            log.warn("auditId={} redraft unavailable: sanitizing model {} missing, disabled or not compliant",
                    context.auditId(), firewall.sanitizingModel());
            return Mono.just(degraded(output, violations, app, "sanitizer_unavailable"));
        }
        ModelDescriptor model = sanitizer.get();
        return sanitizingAdapter.sanitize(model, output)
                .timeout(sanitizerTimeout)
                .map(response -> {
                    recordCost(context, model, response.usage());
                    metrics.increment("firewall_redrafted", app, model.id(), model.provider(), null);
                    return FirewallOutcome.redrafted(response.text(), violations, model.id());
                })
                .switchIfEmpty(Mono.fromSupplier(() -> degraded(output, violations, app, "empty_redraft")))
                .onErrorResume(e -> {
                    log.warn("auditId={} sanitizer {} failed, degrading to flag: {}",
                            context.auditId(), model.id(), e.toString());
                    return Mono.just(degraded(output, violations, app, e.getClass().getSimpleName()));
                });
    }

    private static void recordCost(RoutingContext context, ModelDescriptor model, TokenUsage usage) {
        context.trace().recordFirewallCost(CostCalculator.cost(model, usage));
    }

    private FirewallOutcome degraded(String output, List<Violation> violations, String app, String reason) {
        metrics.increment("firewall_degraded", app, null, null, reason);
        return FirewallOutcome.flagged(output, violations, true);
    }

    private Optional<ModelDescriptor> eligibleModel(String modelId, RoutingContext context) {
        return registry.find(modelId)
                .filter(ModelDescriptor::enabled)
                .filter(m -> complianceFilter.permits(m, context.request(), context.policy()));
    }

    static List<Violation> violationsOf(List<DetectionResult> results) {
        List<Violation> violations = new ArrayList<>();
        for (DetectionResult result : results) {
            for (String match : result.matches()) {
                violations.add(new Violation(result.detector(), Masker.mask(match)));
            }
        }
        return violations;
    }
}
