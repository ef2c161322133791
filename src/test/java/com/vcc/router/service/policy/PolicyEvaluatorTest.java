package com.vcc.router.service.policy;

import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.DirectiveKind;
import com.vcc.router.model.FieldCondition;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.RequestContext;
import com.vcc.router.model.RoutingDirective;
import com.vcc.router.model.Sensitivity;
import com.vcc.router.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.vcc.router.support.Fixtures.external;
import static com.vcc.router.support.Fixtures.internal;
import static com.vcc.router.support.Fixtures.policy;
import static com.vcc.router.support.Fixtures.rule;
import static com.vcc.router.support.Fixtures.weighted;
import static org.assertj.core.api.Assertions.assertThat;

class PolicyEvaluatorTest {

    private static final ModelDescriptor SONNET = external("claude-sonnet", "anthropic", "0.003", "0.015");
    private static final ModelDescriptor GPT = external("gpt-large", "openai", "0.005", "0.015");
    private static final ModelDescriptor LLAMA = internal("llama-local", "onprem", "0.0002", "0.0002");

    private static final ModelDescriptor RETIRED = internal("llama-retired", "onprem", "0.0001", "0.0001")
            .withEnabled(false);

    private final PolicyEvaluator evaluator = new PolicyEvaluator(Fixtures.registry(SONNET, GPT, LLAMA, RETIRED));

    @Nested
    @DisplayName("rule matching")
    class Matching {

        @Test
        @DisplayName("first matching rule wins, top to bottom")
        void firstMatchWins() {
            Policy policy = policy(1,
                    rule("high", List.of(FieldCondition.gte("sensitivity", "HIGH")),
                            RoutingDirective.single("llama-local"), null),
                    rule("any", List.of(), RoutingDirective.single("claude-sonnet"), null));

            CandidateSet high = evaluator.evaluate(Fixtures.request(Sensitivity.CRITICAL, Set.of()), policy);
            CandidateSet low = evaluator.evaluate(Fixtures.request(), policy);

            assertThat(high.ruleId()).isEqualTo("high");
            assertThat(high.modelIds()).containsExactly("llama-local");
            assertThat(low.ruleId()).isEqualTo("any");
            assertThat(low.modelIds()).containsExactly("claude-sonnet");
        }

        @Test
        @DisplayName("no matching rule yields an empty set")
        void noMatch() {
            Policy policy = policy(1, rule("fr-only", List.of(FieldCondition.eq("language", "fr")),
                    RoutingDirective.single("claude-sonnet"), null));

            assertThat(evaluator.evaluate(Fixtures.request(), policy).isEmpty()).isTrue();
        }

        @Test
        @DisplayName("every condition of a rule must hold")
        void conjunction() {
            Policy policy = policy(1, rule("both", List.of(
                            FieldCondition.eq("userRole", "agent"),
                            FieldCondition.lt("tokenEstimate", "100")),
                    RoutingDirective.single("claude-sonnet"), null));

            assertThat(evaluator.evaluate(Fixtures.request(b -> b.tokenEstimate(50)), policy).isEmpty()).isFalse();
            assertThat(evaluator.evaluate(Fixtures.request(b -> b.tokenEstimate(150)), policy).isEmpty()).isTrue();
        }

        @Test
        @DisplayName("IN matches scalar fields and tag membership")
        void inOperator() {
            RequestContext tagged = Fixtures.request(b -> b.tags("billing", "vip"));

            assertThat(PolicyEvaluator.holds(FieldCondition.in("tags", List.of("vip")), tagged)).isTrue();
            assertThat(PolicyEvaluator.holds(FieldCondition.in("language", List.of("de", "en")), tagged)).isTrue();
            assertThat(PolicyEvaluator.holds(FieldCondition.in("language", List.of("de")), tagged)).isFalse();
        }

        @Test
        @DisplayName("conditions on absent fields never hold")
        void absentField() {
            RequestContext noTeam = Fixtures.request(b -> b.teamId(null));

            assertThat(PolicyEvaluator.holds(FieldCondition.eq("teamId", "support"), noTeam)).isFalse();
            assertThat(PolicyEvaluator.holds(FieldCondition.eq("unknownField", "x"), noTeam)).isFalse();
        }

        @Test
        @DisplayName("numeric comparisons reject non-numeric operands")
        void numericOperands() {
            RequestContext request = Fixtures.request(b -> b.tokenEstimate(500));

            assertThat(PolicyEvaluator.holds(FieldCondition.gte("tokenEstimate", "500"), request)).isTrue();
            assertThat(PolicyEvaluator.holds(FieldCondition.lt("tokenEstimate", "500"), request)).isFalse();
            assertThat(PolicyEvaluator.holds(FieldCondition.lt("tokenEstimate", "lots"), request)).isFalse();
        }
    }

    @Nested
    @DisplayName("candidate construction")
    class Candidates {

        @Test
        @DisplayName("weighted directive keeps its weights and kind")
        void weightedDirective() {
            Policy policy = policy(1, rule("split", List.of(), weighted("claude-sonnet", 0.7, "gpt-large", 0.3), null));

            CandidateSet set = evaluator.evaluate(Fixtures.request(), policy);

            assertThat(set.kind()).isEqualTo(DirectiveKind.WEIGHTED);
            assertThat(set.candidates()).extracting(c -> c.weight()).containsExactly(0.7, 0.3);
        }

        @Test
        @DisplayName("fallback rule models follow the primaries and are flagged fallback-only")
        void fallbackChain() {
            Policy policy = policy(1,
                    rule("primary", List.of(), RoutingDirective.ordered("claude-sonnet"), "secondary"),
                    rule("secondary", List.of(FieldCondition.eq("language", "xx")),
                            RoutingDirective.ordered("gpt-large", "claude-sonnet"), "tertiary"),
                    rule("tertiary", List.of(FieldCondition.eq("language", "xx")),
                            RoutingDirective.ordered("llama-local"), null));

            CandidateSet set = evaluator.evaluate(Fixtures.request(), policy);

            assertThat(set.modelIds()).containsExactly("claude-sonnet", "gpt-large", "llama-local");
            assertThat(set.primaries()).extracting(c -> c.modelId()).containsExactly("claude-sonnet");
            assertThat(set.fallbacks()).extracting(c -> c.modelId()).containsExactly("gpt-large", "llama-local");
        }

        @Test
        @DisplayName("disabled and unknown models are dropped")
        void disabledModelsDropped() {
            Policy policy = policy(1, rule("r", List.of(),
                    RoutingDirective.ordered("llama-retired", "ghost", "llama-local"), null));

            assertThat(evaluator.evaluate(Fixtures.request(), policy).modelIds()).containsExactly("llama-local");
        }
    }
}
