package com.vcc.router.web;

import com.vcc.router.dto.BudgetView;
import com.vcc.router.dto.PublishPolicyResponse;
import com.vcc.router.dto.UpsertSubscriptionRequest;
import com.vcc.router.entity.AdminAuditLogEntity;
import com.vcc.router.model.BudgetLimits;
import com.vcc.router.model.Policy;
import com.vcc.router.model.Subscription;
import com.vcc.router.service.AuditService;
import com.vcc.router.service.budget.BudgetKey;
import com.vcc.router.service.budget.BudgetLedger;
import com.vcc.router.service.experiment.ExperimentRegistry;
import com.vcc.router.service.experiment.ExperimentStatus;
import com.vcc.router.service.health.HealthSnapshot;
import com.vcc.router.service.health.HealthTracker;
import com.vcc.router.service.policy.PolicyService;
import com.vcc.router.service.registry.ModelRegistryService;
import com.vcc.router.service.subscription.SubscriptionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin API controller for policies, subscriptions, and runtime state.
 * Protected by AdminSecurityFilter via the admin key header.
 */
@RestController
@RequestMapping("/admin")
public class AdminController {
    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final PolicyService policyService;
    private final SubscriptionService subscriptionService;
    private final ModelRegistryService modelRegistry;
    private final HealthTracker healthTracker;
    private final ExperimentRegistry experimentRegistry;
    private final BudgetLedger budgetLedger;
    private final AuditService auditService;
    private final Clock clock;

    public AdminController(PolicyService policyService,
                           SubscriptionService subscriptionService,
                           ModelRegistryService modelRegistry,
                           HealthTracker healthTracker,
                           ExperimentRegistry experimentRegistry,
                           BudgetLedger budgetLedger,
                           AuditService auditService,
                           Clock clock) {
        this.policyService = policyService;
        this.subscriptionService = subscriptionService;
        this.modelRegistry = modelRegistry;
        this.healthTracker = healthTracker;
        this.experimentRegistry = experimentRegistry;
        this.budgetLedger = budgetLedger;
        this.auditService = auditService;
        this.clock = clock;
    }

    // ==================== Policy Endpoints ====================

    /**
     * Validate and activate a new policy version.
     * POST /admin/policies
     */
    @PostMapping("/policies")
    public Mono<ResponseEntity<PublishPolicyResponse>> publishPolicy(
            @RequestBody Policy policy,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return policyService.publish(policy, actor)
                .flatMap(published ->
                        auditService.logPolicyPublished(actor, published, clientIp)
                                .thenReturn(published)
                )
                .map(published -> ResponseEntity.status(HttpStatus.CREATED).body(new PublishPolicyResponse(
                        published.appId(), published.version(), published.rules().size(), "active")))
                .doOnSuccess(r -> log.info("Published policy {} v{} by {}",
                        policy.appId(), policy.version(), actor));
    }

    /**
     * Get the active policy of an app, or a specific historical version.
     * GET /admin/policies/{appId}?version=N
     */
    @GetMapping("/policies/{appId}")
    public Mono<ResponseEntity<Policy>> getPolicy(
            @PathVariable String appId,
            @RequestParam(required = false) Long version
    ) {
        return Mono.justOrEmpty(version != null
                        ? policyService.version(appId, version)
                        : policyService.active(appId))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * List the versions known for an app.
     * GET /admin/policies/{appId}/versions
     */
    @GetMapping("/policies/{appId}/versions")
    public Mono<ResponseEntity<List<Long>>> getPolicyVersions(@PathVariable String appId) {
        return Mono.just(ResponseEntity.ok(policyService.versions(appId)));
    }

    // ==================== Subscription Endpoints ====================

    /**
     * Create or replace the subscription of a tenant, app or team.
     * PUT /admin/subscriptions
     */
    @PutMapping("/subscriptions")
    public Mono<ResponseEntity<Subscription>> upsertSubscription(
            @Valid @RequestBody UpsertSubscriptionRequest request,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return subscriptionService.upsert(request.toSubscription())
                .flatMap(saved ->
                        auditService.logSubscriptionUpserted(actor, saved, clientIp)
                                .thenReturn(saved)
                )
                .map(ResponseEntity::ok)
                .doOnSuccess(r -> log.info("Upserted subscription {}:{} by {}",
                        request.scope(), request.targetId(), actor));
    }

    /**
     * List every subscription currently in effect.
     * GET /admin/subscriptions
     */
    @GetMapping("/subscriptions")
    public Mono<ResponseEntity<List<Subscription>>> listSubscriptions() {
        return Mono.just(ResponseEntity.ok(subscriptionService.current().all()));
    }

    // ==================== Runtime State Endpoints ====================

    /**
     * Health and circuit state per model.
     * GET /admin/health
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<List<HealthSnapshot>>> getHealth() {
        return Mono.just(ResponseEntity.ok(healthTracker.snapshots()));
    }

    /**
     * Experiment state and per-arm statistics.
     * GET /admin/experiments
     */
    @GetMapping("/experiments")
    public Mono<ResponseEntity<List<ExperimentStatus>>> getExperiments() {
        return Mono.just(ResponseEntity.ok(experimentRegistry.statuses()));
    }

    /**
     * Month-to-date spend of a (tenant, app).
     * GET /admin/budgets/{tenantId}/{appId}
     */
    @GetMapping("/budgets/{tenantId}/{appId}")
    public Mono<ResponseEntity<BudgetView>> getBudget(
            @PathVariable String tenantId,
            @PathVariable String appId
    ) {
        BudgetKey key = BudgetKey.of(tenantId, appId, clock.instant());
        BudgetLimits limits = policyService.active(appId)
                .map(Policy::budget)
                .orElse(BudgetLimits.unlimited());

        return budgetLedger.spent(key)
                .map(spent -> {
                    BigDecimal remaining = limits.hasLimit() ? limits.monthlyLimit().subtract(spent) : null;
                    return ResponseEntity.ok(new BudgetView(tenantId, appId, key.month().toString(), spent,
                            limits.monthlyLimit(), remaining, limits.lowWaterMark()));
                });
    }

    // ==================== Registry Endpoints ====================

    /**
     * Reload the model registry from configuration and the database.
     * POST /admin/registry/refresh
     */
    @PostMapping("/registry/refresh")
    public Mono<ResponseEntity<Map<String, Object>>> refreshRegistry(ServerWebExchange exchange) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return modelRegistry.refresh()
                .flatMap(count ->
                        auditService.logRegistryRefreshed(actor, count, clientIp)
                                .thenReturn(count)
                )
                .map(count -> {
                    Map<String, Object> result = new HashMap<>();
                    result.put("status", "success");
                    result.put("modelCount", count);
                    result.put("message", "Model registry refreshed successfully");
                    return ResponseEntity.ok(result);
                })
                .doOnSuccess(r -> log.info("Model registry refreshed by {}", actor));
    }

    // ==================== Audit Endpoints ====================

    /**
     * Most recent admin actions, newest first.
     * GET /admin/audit?limit=N
     */
    @GetMapping("/audit")
    public Mono<ResponseEntity<List<AdminAuditLogEntity>>> getAuditLog(
            @RequestParam(defaultValue = "100") int limit
    ) {
        return auditService.getRecentLogs(limit)
                .collectList()
                .map(ResponseEntity::ok);
    }

    /**
     * Admin actions on one target, e.g. /admin/audit/policy/support-assistant.
     * GET /admin/audit/{targetType}/{targetId}
     */
    @GetMapping("/audit/{targetType}/{targetId}")
    public Mono<ResponseEntity<List<AdminAuditLogEntity>>> getAuditLogForTarget(
            @PathVariable String targetType,
            @PathVariable String targetId
    ) {
        return auditService.getLogsForTarget(targetType, targetId)
                .collectList()
                .map(ResponseEntity::ok);
    }

    // ==================== Helper Methods ====================

    private String getAdminActor(ServerWebExchange exchange) {
        Object actor = exchange.getAttribute(AdminSecurityFilter.ADMIN_ACTOR_ATTR);
        return actor != null ? actor.toString() : "unknown";
    }

    /**
     * Get client IP address from exchange.
     */
    private String getClientIp(ServerWebExchange exchange) {
        String forwardedFor = exchange.getRequest().getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }

        String realIp = exchange.getRequest().getHeaders().getFirst("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp;
        }

        InetSocketAddress remoteAddress = exchange.getRequest().getRemoteAddress();
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }
        return "unknown";
    }
}
