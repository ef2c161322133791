package com.vcc.router.engine;

import com.vcc.router.exception.DenyReason;
import com.vcc.router.exception.ExhaustedFallbackException;
import com.vcc.router.exception.InternalRoutingException;
import com.vcc.router.exception.PolicyDenyException;
import com.vcc.router.exception.RoutingException;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.DecisionTrace;
import com.vcc.router.model.FirewallOutcome;
import com.vcc.router.model.Policy;
import com.vcc.router.model.RequestContext;
import com.vcc.router.model.TraceStatus;
import com.vcc.router.service.budget.BudgetGate;
import com.vcc.router.service.budget.BudgetKey;
import com.vcc.router.service.budget.BudgetLedger;
import com.vcc.router.service.compliance.ComplianceFilter;
import com.vcc.router.service.experiment.ExperimentArm;
import com.vcc.router.service.experiment.ExperimentOverlay;
import com.vcc.router.service.experiment.ExperimentRegistry;
import com.vcc.router.service.firewall.SensitiveOutputFirewall;
import com.vcc.router.service.health.HealthGate;
import com.vcc.router.service.health.HealthTracker;
import com.vcc.router.service.invocation.InvocationOrchestrator;
import com.vcc.router.service.invocation.InvocationResult;
import com.vcc.router.service.lineage.CostCalculator;
import com.vcc.router.service.lineage.LineageRecorder;
import com.vcc.router.service.metrics.MetricsSink;
import com.vcc.router.service.pipeline.CandidateFilter;
import com.vcc.router.service.pipeline.RoutingContext;
import com.vcc.router.service.policy.PolicyEvaluator;
import com.vcc.router.service.policy.PolicyService;
import com.vcc.router.service.selection.CandidateSelector;
import com.vcc.router.service.selection.Selection;
import com.vcc.router.service.subscription.SubscriptionResolver;
import com.vcc.router.service.subscription.SubscriptionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs one request through the decision pipeline: policy evaluation, the narrowing stages,
 * selection, invocation with fallback, output screening, and lineage. Policy and subscription
 * snapshots and the month-to-date spend are captured once when the request starts.
 */
@Service
public class RoutingEngine {
    private static final Logger log = LoggerFactory.getLogger(RoutingEngine.class);

    private final PolicyService policyService;
    private final PolicyEvaluator policyEvaluator;
    private final SubscriptionService subscriptionService;
    private final List<CandidateFilter> stages;
    private final CandidateSelector selector;
    private final InvocationOrchestrator orchestrator;
    private final SensitiveOutputFirewall firewall;
    private final BudgetLedger budgetLedger;
    private final ExperimentRegistry experimentRegistry;
    private final HealthTracker healthTracker;
    private final LineageRecorder lineageRecorder;
    private final MetricsSink metrics;
    private final Clock clock;

    public RoutingEngine(PolicyService policyService,
                         PolicyEvaluator policyEvaluator,
                         SubscriptionService subscriptionService,
                         SubscriptionResolver subscriptionResolver,
                         ComplianceFilter complianceFilter,
                         HealthGate healthGate,
                         BudgetGate budgetGate,
                         ExperimentOverlay experimentOverlay,
                         CandidateSelector selector,
                         InvocationOrchestrator orchestrator,
                         SensitiveOutputFirewall firewall,
                         BudgetLedger budgetLedger,
                         ExperimentRegistry experimentRegistry,
                         HealthTracker healthTracker,
                         LineageRecorder lineageRecorder,
                         MetricsSink metrics,
                         Clock clock) {
        this.policyService = policyService;
        this.policyEvaluator = policyEvaluator;
        this.subscriptionService = subscriptionService;
        // Compliance runs before anything that could re-order or re-weight candidates
        this.stages = List.of(subscriptionResolver, complianceFilter, healthGate, budgetGate, experimentOverlay);
        this.selector = selector;
        this.orchestrator = orchestrator;
        this.firewall = firewall;
        this.budgetLedger = budgetLedger;
        this.experimentRegistry = experimentRegistry;
        this.healthTracker = healthTracker;
        this.lineageRecorder = lineageRecorder;
        this.metrics = metrics;
        this.clock = clock;
        log.info("RoutingEngine initialized with stages={}", stages.stream().map(CandidateFilter::name).toList());
    }

    public Mono<RoutingOutcome> route(RequestContext request, String input) {
        String auditId = UUID.randomUUID().toString();
        DecisionTrace trace = new DecisionTrace(auditId, request, clock.instant());
        AtomicReference<RoutingContext> contextRef = new AtomicReference<>();
        long started = System.nanoTime();

        return Mono.defer(() -> {
                    Policy policy = policyService.active(request.appId())
                            .orElseThrow(() -> new PolicyDenyException(DenyReason.NO_ACTIVE_POLICY, auditId,
                                    "No active policy for app '" + request.appId() + "'"));
                    BudgetKey budgetKey = BudgetKey.of(request.tenantId(), request.appId(), trace.getStartedAt());
                    return monthSpend(policy, budgetKey, auditId)
                            .map(spend -> new RoutingContext(request, policy, subscriptionService.current(), spend, trace))
                            .flatMap(context -> {
                                contextRef.set(context);
                                return decideAndServe(context, input, budgetKey);
                            });
                })
                .doOnSuccess(outcome -> {
                    trace.complete(TraceStatus.SUCCEEDED, null, clock.instant());
                    log.info("auditId={} app={} served by model={} fellBack={} firewall={} cost={}",
                            auditId, request.appId(), outcome.finalModel(), outcome.fellBack(),
                            outcome.firewall().state(), outcome.cost());
                })
                .doOnError(e -> onFailure(e, trace, request, started))
                .onErrorMap(e -> !(e instanceof RoutingException), e -> new InternalRoutingException(auditId, e))
                .doOnCancel(() -> {
                    trace.complete(TraceStatus.CLIENT_CANCELLED, "client_cancelled", clock.instant());
                    metrics.increment("client_cancelled", request.appId());
                    log.info("auditId={} app={} cancelled by client", auditId, request.appId());
                })
                .doFinally(signal -> {
                    releaseProbes(contextRef.get());
                    lineageRecorder.record(trace);
                });
    }

    private Mono<BigDecimal> monthSpend(Policy policy, BudgetKey key, String auditId) {
        if (!policy.budget().hasLimit()) {
            return Mono.just(BigDecimal.ZERO);
        }
        return budgetLedger.spent(key)
                .onErrorResume(e -> {
                    log.warn("auditId={} budget ledger unavailable, assuming no spend for {}: {}",
                            auditId, key.asString(), e.getMessage());
                    return Mono.just(BigDecimal.ZERO);
                });
    }

    private Mono<RoutingOutcome> decideAndServe(RoutingContext context, String input, BudgetKey budgetKey) {
        Selection selection = decide(context);
        long invokeStarted = System.nanoTime();
        return orchestrator.invoke(selection, input, context)
                .doOnEach(signal -> {
                    if (signal.isOnNext() || signal.isOnError()) {
                        context.trace().recordStage("invocation", System.nanoTime() - invokeStarted);
                    }
                })
                .flatMap(result -> screen(result, context)
                        .flatMap(screened -> settle(result, screened, context, budgetKey, selection,
                                Duration.ofNanos(System.nanoTime() - invokeStarted))));
    }

    /**
     * Runs the synchronous part of the pipeline and returns the selection, or throws a deny.
     */
    Selection decide(RoutingContext context) {
        DecisionTrace trace = context.trace();
        Policy policy = context.policy();
        CandidateSet candidates = timed(trace, "policy", () -> policyEvaluator.evaluate(context.request(), policy));
        trace.recordPolicy(policy.version(), candidates.ruleId());
        if (candidates.isEmpty()) {
            throw deny(DenyReason.NO_ELIGIBLE_MODEL, context, "policy");
        }
        for (CandidateFilter stage : stages) {
            CandidateSet input = candidates;
            candidates = timed(trace, stage.name(), () -> stage.apply(input, context));
            log.debug("auditId={} after {}: {}", context.auditId(), stage.name(), candidates);
            if (candidates.isEmpty()) {
                throw deny(stage.denyReason(), context, stage.name());
            }
        }
        CandidateSet finalSet = candidates;
        Selection selection = timed(trace, "selection", () -> selector.select(finalSet, context.auditId()));
        trace.recordSelection(selection.recommended().modelId(), selection.fallbackModelIds());
        return selection;
    }

    private Mono<FirewallOutcome> screen(InvocationResult result, RoutingContext context) {
        long started = System.nanoTime();
        return firewall.screen(result.response().text(), context)
                .doOnNext(outcome -> context.trace().recordStage("firewall", System.nanoTime() - started));
    }

    private Mono<RoutingOutcome> settle(InvocationResult result, FirewallOutcome screened, RoutingContext context,
                                        BudgetKey budgetKey, Selection selection, Duration elapsed) {
        DecisionTrace trace = context.trace();
        BigDecimal cost = CostCalculator.cost(result.model(), result.response().usage());
        trace.recordServed(result.model().id(), result.fellBack(), result.response().usage());
        trace.recordFirewall(screened);
        trace.recordCost(cost);
        recordExperimentOutcome(trace, elapsed, cost, true);

        RoutingOutcome outcome = new RoutingOutcome(
                trace.getAuditId(),
                screened.output(),
                selection.recommended().modelId(),
                result.model().id(),
                result.fellBack(),
                result.degradedCompletion(),
                trace.getRuleId(),
                trace.getPolicyVersion(),
                result.response().usage(),
                cost,
                screened);

        BigDecimal charge = cost.add(trace.getFirewallCost());
        if (charge.signum() <= 0) {
            return Mono.just(outcome);
        }
        return budgetLedger.charge(budgetKey, charge)
                .onErrorResume(e -> {
                    log.warn("auditId={} failed to charge {} to {}: {}", trace.getAuditId(), charge,
                            budgetKey.asString(), e.getMessage());
                    return Mono.just(BigDecimal.ZERO);
                })
                .thenReturn(outcome);
    }

    private void onFailure(Throwable error, DecisionTrace trace, RequestContext request, long started) {
        if (error instanceof PolicyDenyException deny) {
            trace.complete(TraceStatus.DENIED, deny.getReason(), clock.instant());
            metrics.increment("denied", request.appId(), null, null, deny.getReason());
            log.info("auditId={} app={} denied: {}", trace.getAuditId(), request.appId(), deny.getReason());
            return;
        }
        if (error instanceof ExhaustedFallbackException exhausted) {
            trace.complete(TraceStatus.FAILED, exhausted.getReason(), clock.instant());
            recordExperimentOutcome(trace, Duration.ofNanos(System.nanoTime() - started), BigDecimal.ZERO, false);
            log.info("auditId={} app={} failed: {} attempted={}", trace.getAuditId(), request.appId(),
                    exhausted.getReason(), exhausted.getAttemptedChain());
            return;
        }
        trace.complete(TraceStatus.FAILED, InternalRoutingException.REASON, clock.instant());
        log.error("auditId={} app={} routing failed unexpectedly", trace.getAuditId(), request.appId(), error);
    }

    private void recordExperimentOutcome(DecisionTrace trace, Duration elapsed, BigDecimal cost, boolean success) {
        if (trace.getExperimentId() == null) {
            return;
        }
        experimentRegistry.recordOutcome(trace.getExperimentId(), ExperimentArm.fromLabel(trace.getExperimentArm()),
                elapsed, cost, success);
    }

    private static PolicyDenyException deny(DenyReason reason, RoutingContext context, String stage) {
        return new PolicyDenyException(reason, context.auditId(),
                "No eligible model after " + stage + " stage (" + reason.code() + ")");
    }

    private void releaseProbes(RoutingContext context) {
        if (context == null) {
            return;
        }
        for (String modelId : context.heldProbes()) {
            if (context.consumeProbe(modelId)) {
                healthTracker.releaseProbe(modelId);
            }
        }
    }

    private static <T> T timed(DecisionTrace trace, String stage, Supplier<T> work) {
        long started = System.nanoTime();
        try {
            return work.get();
        } finally {
            trace.recordStage(stage, System.nanoTime() - started);
        }
    }
}
