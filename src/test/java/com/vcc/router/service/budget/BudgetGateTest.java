package com.vcc.router.service.budget;

import com.vcc.router.exception.DenyReason;
import com.vcc.router.model.BudgetLimits;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.DirectiveKind;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.RoutingDirective;
import com.vcc.router.service.pipeline.RoutingContext;
import com.vcc.router.service.subscription.SubscriptionSnapshot;
import com.vcc.router.support.Fixtures;
import com.vcc.router.support.RecordingMetricsSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.vcc.router.support.Fixtures.external;
import static com.vcc.router.support.Fixtures.internal;
import static com.vcc.router.support.Fixtures.rule;
import static com.vcc.router.support.Fixtures.weighted;
import static org.assertj.core.api.Assertions.assertThat;

class BudgetGateTest {

    private static final ModelDescriptor SONNET = external("claude-sonnet", "anthropic", "0.003", "0.015");
    private static final ModelDescriptor LLAMA = internal("llama-local", "onprem", "0.0002", "0.0002");
    private static final ModelDescriptor SMALL = internal("llama-local-small", "onprem", "0.00005", "0.00005");

    private final RecordingMetricsSink metrics = new RecordingMetricsSink();
    private final BudgetGate gate = new BudgetGate(metrics);

    private static Policy policyWith(BudgetLimits limits) {
        return Fixtures.policy(1, List.of(rule("r", List.of(), RoutingDirective.ordered("claude-sonnet"), null)),
                limits, null, null, null);
    }

    private static BudgetLimits limits(String monthly, String lowWater, String minimalCost) {
        return new BudgetLimits(new BigDecimal(monthly), new BigDecimal(lowWater), new BigDecimal(minimalCost));
    }

    private static RoutingContext context(Policy policy, String spent) {
        return Fixtures.context(Fixtures.request(), policy, SubscriptionSnapshot.empty(), new BigDecimal(spent));
    }

    @Test
    @DisplayName("no limit passes candidates through untouched")
    void unlimited() {
        CandidateSet input = Fixtures.ordered(SONNET, LLAMA);
        RoutingContext context = context(policyWith(BudgetLimits.unlimited()), "99999");

        assertThat(gate.apply(input, context)).isSameAs(input);
        assertThat(context.trace().isDowngraded()).isFalse();
    }

    @Test
    @DisplayName("healthy budget passes candidates through untouched")
    void healthyBudget() {
        CandidateSet input = Fixtures.ordered(SONNET, LLAMA);
        RoutingContext context = context(policyWith(limits("100", "10", "0.001")), "50");

        assertThat(gate.apply(input, context)).isSameAs(input);
        assertThat(metrics.count("budget_downgrade")).isZero();
    }

    @Nested
    @DisplayName("below the low-water mark")
    class LowWater {

        @Test
        @DisplayName("reorders cheapest first as an ordered list")
        void cheapestFirst() {
            CandidateSet input = CandidateSet.of(DirectiveKind.WEIGHTED, "r",
                    Fixtures.ordered(SONNET, LLAMA, SMALL).candidates());
            RoutingContext context = context(policyWith(limits("100", "10", "0.001")), "95");

            CandidateSet result = gate.apply(input, context);

            assertThat(result.kind()).isEqualTo(DirectiveKind.ORDERED);
            assertThat(result.modelIds()).containsExactly("llama-local-small", "llama-local", "claude-sonnet");
            assertThat(context.trace().isDowngraded()).isTrue();
            assertThat(metrics.count("budget_downgrade")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("exhausted budget")
    class Exhausted {

        @Test
        @DisplayName("keeps only models under the minimal cost threshold")
        void minimalCostOnly() {
            RoutingContext context = context(policyWith(limits("100", "10", "0.0002")), "100");

            CandidateSet result = gate.apply(Fixtures.ordered(SONNET, LLAMA, SMALL), context);

            assertThat(result.modelIds()).containsExactly("llama-local", "llama-local-small");
            assertThat(context.trace().isDowngraded()).isTrue();
        }

        @Test
        @DisplayName("caps the unit price for the rest of the request")
        void capsUnitPrice() {
            RoutingContext context = context(policyWith(limits("100", "10", "0.0002")), "150");

            gate.apply(Fixtures.ordered(LLAMA), context);

            assertThat(context.isAffordable(LLAMA)).isTrue();
            assertThat(context.isAffordable(SONNET)).isFalse();
        }

        @Test
        @DisplayName("a healthy budget sets no price cap")
        void noCapWhenHealthy() {
            RoutingContext context = context(policyWith(limits("100", "10", "0.0002")), "20");

            gate.apply(Fixtures.ordered(SONNET), context);

            assertThat(context.isAffordable(SONNET)).isTrue();
        }

        @Test
        @DisplayName("leaves nothing when no model is cheap enough")
        void nothingAffordable() {
            RoutingContext context = context(policyWith(limits("100", "10", "0.0001")), "120");

            CandidateSet result = gate.apply(Fixtures.ordered(SONNET, LLAMA), context);

            assertThat(result.isEmpty()).isTrue();
            assertThat(gate.denyReason()).isEqualTo(DenyReason.BUDGET_EXCEEDED);
            assertThat(context.trace().isDowngraded()).isFalse();
        }

        @Test
        @DisplayName("missing threshold means nothing but free models survive")
        void defaultThreshold() {
            Policy policy = policyWith(new BudgetLimits(new BigDecimal("10"), null, null));

            assertThat(gate.apply(Fixtures.ordered(SONNET, LLAMA), context(policy, "10")).isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("keeps weights when nothing is downgraded")
    void weightsPreserved() {
        Policy policy = Fixtures.policy(1, List.of(rule("r", List.of(),
                weighted("claude-sonnet", 0.5, "llama-local", 0.5), null)), limits("100", "10", "0"), null, null, null);
        CandidateSet input = CandidateSet.of(DirectiveKind.WEIGHTED, "r",
                Fixtures.ordered(SONNET, LLAMA).map(c -> c.withWeight(0.5)).candidates());

        CandidateSet result = gate.apply(input, context(policy, "1"));

        assertThat(result.kind()).isEqualTo(DirectiveKind.WEIGHTED);
        assertThat(result.candidates()).extracting(c -> c.weight()).containsExactly(0.5, 0.5);
    }
}
