package com.vcc.router.support;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.model.BudgetLimits;
import com.vcc.router.model.Candidate;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.ComplianceTag;
import com.vcc.router.model.CompliancePolicy;
import com.vcc.router.model.DecisionTrace;
import com.vcc.router.model.DirectiveKind;
import com.vcc.router.model.FieldCondition;
import com.vcc.router.model.FirewallPolicy;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.PolicyRule;
import com.vcc.router.model.RequestContext;
import com.vcc.router.model.RequestOptions;
import com.vcc.router.model.RoutingDirective;
import com.vcc.router.model.Sensitivity;
import com.vcc.router.model.Subscription;
import com.vcc.router.model.SubscriptionScope;
import com.vcc.router.model.WeightedModel;
import com.vcc.router.service.pipeline.RoutingContext;
import com.vcc.router.service.registry.ModelRegistry;
import com.vcc.router.service.subscription.SubscriptionSnapshot;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Shared builders for models, requests, policies and pipeline contexts.
 */
public final class Fixtures {

    public static final String TENANT = "acme";
    public static final String APP = "support-assistant";

    private Fixtures() {
    }

    public static ModelDescriptor external(String id, String provider, String inputPrice, String outputPrice) {
        return new ModelDescriptor(id, provider, id, "1", new BigDecimal(inputPrice), new BigDecimal(outputPrice),
                Set.of("chat"), ComplianceTag.EXTERNAL, true);
    }

    public static ModelDescriptor internal(String id, String provider, String inputPrice, String outputPrice) {
        return new ModelDescriptor(id, provider, id, "1", new BigDecimal(inputPrice), new BigDecimal(outputPrice),
                Set.of("chat"), ComplianceTag.INTERNAL, true);
    }

    public static ModelRegistry registry(ModelDescriptor... models) {
        Map<String, ModelDescriptor> byId = new LinkedHashMap<>();
        Arrays.stream(models).forEach(m -> byId.put(m.id(), m));
        Map<String, ModelDescriptor> snapshot = Map.copyOf(byId);
        return new ModelRegistry() {
            @Override
            public Optional<ModelDescriptor> find(String modelId) {
                return Optional.ofNullable(snapshot.get(modelId));
            }

            @Override
            public Map<String, ModelDescriptor> snapshot() {
                return snapshot;
            }
        };
    }

    public static RequestContext request() {
        return request(Sensitivity.LOW, Set.of());
    }

    public static RequestContext request(Sensitivity sensitivity, Set<String> tags) {
        return new RequestContext(TENANT, APP, "support", "agent", sensitivity, 200, "en", tags, null,
                RequestOptions.none());
    }

    public static RequestContext requestWithKey(String requestKey) {
        return new RequestContext(TENANT, APP, "support", "agent", Sensitivity.LOW, 200, "en", Set.of(),
                requestKey, RequestOptions.none());
    }

    public static RequestContext request(Function<RequestBuilder, RequestBuilder> customizer) {
        return customizer.apply(new RequestBuilder()).build();
    }

    public static PolicyRule rule(String id, List<FieldCondition> when, RoutingDirective directive,
                                  String fallbackRule) {
        return new PolicyRule(id, when, directive, fallbackRule);
    }

    public static RoutingDirective weighted(Object... modelAndWeight) {
        List<WeightedModel> models = new ArrayList<>();
        for (int i = 0; i < modelAndWeight.length; i += 2) {
            models.add(new WeightedModel((String) modelAndWeight[i], ((Number) modelAndWeight[i + 1]).doubleValue()));
        }
        return new RoutingDirective(DirectiveKind.WEIGHTED, models);
    }

    public static CandidateSet ordered(ModelDescriptor... models) {
        return CandidateSet.of(DirectiveKind.ORDERED, "r", Arrays.stream(models)
                .map(m -> Candidate.of(m, 1.0d, "r"))
                .toList());
    }

    public static Policy policy(long version, PolicyRule... rules) {
        return new Policy(APP, version, List.of(rules), null, null, null, null, null);
    }

    public static Policy policy(long version, List<PolicyRule> rules, BudgetLimits budget, FirewallPolicy firewall,
                                CompliancePolicy compliance, Boolean minimalCompletion) {
        return new Policy(APP, version, rules, budget, firewall, compliance, null, minimalCompletion);
    }

    public static SubscriptionSnapshot subscriptions(Subscription... subscriptions) {
        return SubscriptionSnapshot.of(List.of(subscriptions));
    }

    public static Subscription tenantSubscription(String... models) {
        return new Subscription(SubscriptionScope.TENANT, TENANT, Set.of(models), true);
    }

    public static RoutingContext context(RequestContext request, Policy policy) {
        return context(request, policy, SubscriptionSnapshot.empty(), BigDecimal.ZERO);
    }

    public static RoutingContext context(RequestContext request, Policy policy, SubscriptionSnapshot subscriptions,
                                         BigDecimal monthSpend) {
        DecisionTrace trace = new DecisionTrace("00000000-0000-0000-0000-000000000001", request,
                Instant.parse("2026-03-15T10:00:00Z"));
        return new RoutingContext(request, policy, subscriptions, monthSpend, trace);
    }

    /**
     * Defaults with millisecond backoffs so retrying tests stay fast.
     */
    public static RouterProperties properties() {
        RouterProperties properties = new RouterProperties();
        properties.getRetry().setMaxAttempts(2);
        properties.getRetry().setBaseBackoff(Duration.ofMillis(1));
        properties.getRetry().setMaxBackoff(Duration.ofMillis(5));
        properties.getRetry().setJitter(0.0d);
        properties.getHealth().setFailureThreshold(2);
        properties.getHealth().setCooldown(Duration.ofSeconds(30));
        properties.getTimeouts().setProvider(Duration.ofSeconds(2));
        properties.getTimeouts().setSanitizer(Duration.ofSeconds(2));
        properties.getTimeouts().setContextualDetector(Duration.ofMillis(200));
        properties.getTimeouts().setLineage(Duration.ofMillis(200));
        return properties;
    }

    public static final class RequestBuilder {
        private String tenantId = TENANT;
        private String appId = APP;
        private String teamId = "support";
        private String userRole = "agent";
        private Sensitivity sensitivity = Sensitivity.LOW;
        private int tokenEstimate = 200;
        private String language = "en";
        private Set<String> tags = Set.of();
        private String requestKey;
        private RequestOptions options = RequestOptions.none();

        public RequestBuilder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public RequestBuilder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public RequestBuilder teamId(String teamId) {
            this.teamId = teamId;
            return this;
        }

        public RequestBuilder userRole(String userRole) {
            this.userRole = userRole;
            return this;
        }

        public RequestBuilder sensitivity(Sensitivity sensitivity) {
            this.sensitivity = sensitivity;
            return this;
        }

        public RequestBuilder tokenEstimate(int tokenEstimate) {
            this.tokenEstimate = tokenEstimate;
            return this;
        }

        public RequestBuilder language(String language) {
            this.language = language;
            return this;
        }

        public RequestBuilder tags(String... tags) {
            this.tags = Set.of(tags);
            return this;
        }

        public RequestBuilder requestKey(String requestKey) {
            this.requestKey = requestKey;
            return this;
        }

        public RequestBuilder options(RequestOptions options) {
            this.options = options;
            return this;
        }

        RequestContext build() {
            return new RequestContext(tenantId, appId, teamId, userRole, sensitivity, tokenEstimate, language, tags,
                    requestKey, options);
        }
    }
}
