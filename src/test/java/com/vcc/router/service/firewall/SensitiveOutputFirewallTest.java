package com.vcc.router.service.firewall;

import com.vcc.router.config.RouterProperties;
import com.vcc.router.model.ContextualDetectorConfig;
import com.vcc.router.model.FirewallAction;
import com.vcc.router.model.FirewallOutcome;
import com.vcc.router.model.FirewallPolicy;
import com.vcc.router.model.FirewallState;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.ProviderResponse;
import com.vcc.router.model.RequestContext;
import com.vcc.router.model.RequestOptions;
import com.vcc.router.model.Sensitivity;
import com.vcc.router.model.TokenUsage;
import com.vcc.router.model.Violation;
import com.vcc.router.service.compliance.ComplianceFilter;
import com.vcc.router.service.pipeline.RoutingContext;
import com.vcc.router.support.Fixtures;
import com.vcc.router.support.RecordingMetricsSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static com.vcc.router.support.Fixtures.external;
import static com.vcc.router.support.Fixtures.internal;
import static org.assertj.core.api.Assertions.assertThat;

class SensitiveOutputFirewallTest {

    private static final ModelDescriptor LLAMA = internal("llama-local", "onprem", "0.0002", "0.0002");
    private static final ModelDescriptor SONNET = external("claude-sonnet", "anthropic", "0.003", "0.015");
    private static final String CARD_OUTPUT = "Your card 4111 1111 1111 1111 is on file.";

    private RecordingMetricsSink metrics;
    private RouterProperties properties;
    private AtomicInteger sanitizerCalls;
    private AtomicInteger judgeCalls;
    private SanitizingAdapter sanitizer;
    private ContextualDetector judge;

    @BeforeEach
    void setUp() {
        metrics = new RecordingMetricsSink();
        properties = Fixtures.properties();
        properties.getTimeouts().setSanitizer(Duration.ofMillis(100));
        properties.getTimeouts().setContextualDetector(Duration.ofMillis(50));
        sanitizerCalls = new AtomicInteger();
        judgeCalls = new AtomicInteger();
        sanitizer = (model, output) -> {
            sanitizerCalls.incrementAndGet();
            return Mono.just(new ProviderResponse("Your card [REDACTED] is on file.", TokenUsage.none(), null));
        };
        judge = (model, output) -> {
            judgeCalls.incrementAndGet();
            return Mono.just(new ContextualDetector.Judgement(DetectionResult.none(ContextualDetector.NAME), null));
        };
    }

    private SensitiveOutputFirewall firewall() {
        return new SensitiveOutputFirewall(new DetectorFactory(), sanitizer, judge,
                Fixtures.registry(LLAMA, SONNET), new ComplianceFilter(properties), metrics, properties);
    }

    private static RoutingContext context(FirewallPolicy firewallPolicy) {
        return context(Fixtures.request(), firewallPolicy);
    }

    private static RoutingContext context(RequestContext request, FirewallPolicy firewallPolicy) {
        Policy policy = Fixtures.policy(1L, List.of(), null, firewallPolicy, null, null);
        return Fixtures.context(request, policy);
    }

    private static FirewallPolicy policy(FirewallAction action, String sanitizingModel) {
        return new FirewallPolicy(action, null, null, sanitizingModel);
    }

    @Test
    @DisplayName("clean output passes through untouched")
    void clean() {
        StepVerifier.create(firewall().screen("Your order has shipped.", context(policy(FirewallAction.REDRAFT, "llama-local"))))
                .assertNext(outcome -> {
                    assertThat(outcome.state()).isEqualTo(FirewallState.CLEAN);
                    assertThat(outcome.output()).isEqualTo("Your order has shipped.");
                    assertThat(outcome.violations()).isEmpty();
                })
                .verifyComplete();

        assertThat(sanitizerCalls).hasValue(0);
    }

    @Test
    @DisplayName("flag keeps the output and reports masked violations")
    void flag() {
        StepVerifier.create(firewall().screen(CARD_OUTPUT, context(policy(FirewallAction.FLAG, "llama-local"))))
                .assertNext(outcome -> {
                    assertThat(outcome.state()).isEqualTo(FirewallState.FLAGGED);
                    assertThat(outcome.output()).isEqualTo(CARD_OUTPUT);
                    assertThat(outcome.degraded()).isFalse();
                    assertThat(outcome.violations())
                            .containsExactly(new Violation("credit_card", "***************1111"));
                })
                .verifyComplete();

        assertThat(sanitizerCalls).hasValue(0);
        assertThat(metrics.count("firewall_flagged")).isEqualTo(1);
    }

    @Test
    @DisplayName("violation samples never carry the raw span")
    void masked() {
        FirewallOutcome outcome = firewall()
                .screen("mail jane.doe@example.org", context(policy(FirewallAction.FLAG, null)))
                .block();

        assertThat(outcome).isNotNull();
        assertThat(outcome.violations()).extracting(Violation::sample)
                .noneMatch(sample -> sample.contains("jane.doe"));
    }

    @Nested
    @DisplayName("redraft")
    class Redraft {

        @Test
        @DisplayName("sanitizer output replaces the original")
        void redrafted() {
            StepVerifier.create(firewall().screen(CARD_OUTPUT, context(policy(FirewallAction.REDRAFT, "llama-local"))))
                    .assertNext(outcome -> {
                        assertThat(outcome.state()).isEqualTo(FirewallState.REDRAFTED);
                        assertThat(outcome.output()).isEqualTo("Your card [REDACTED] is on file.");
                        assertThat(outcome.sanitizingModel()).isEqualTo("llama-local");
                        assertThat(outcome.violations()).extracting(Violation::detector).containsExactly("credit_card");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("sanitizer usage is costed onto the trace")
        void sanitizerCost() {
            sanitizer = (model, output) -> Mono.just(
                    new ProviderResponse("Your card [REDACTED] is on file.", new TokenUsage(1000, 500), null));
            RoutingContext context = context(policy(FirewallAction.REDRAFT, "llama-local"));

            firewall().screen(CARD_OUTPUT, context).block();

            assertThat(context.trace().getFirewallCost()).isEqualByComparingTo(new BigDecimal("0.0003"));
            assertThat(context.trace().getCost()).isEqualByComparingTo(BigDecimal.ZERO);
        }

        @Test
        @DisplayName("caller option overrides the policy action")
        void requestOverride() {
            RequestContext request = Fixtures.request(b -> b.options(
                    new RequestOptions(null, null, FirewallAction.FLAG)));

            StepVerifier.create(firewall().screen(CARD_OUTPUT,
                            context(request, policy(FirewallAction.REDRAFT, "llama-local"))))
                    .assertNext(outcome -> assertThat(outcome.state()).isEqualTo(FirewallState.FLAGGED))
                    .verifyComplete();

            assertThat(sanitizerCalls).hasValue(0);
        }

        @Test
        @DisplayName("sanitizer failure degrades to flag")
        void sanitizerFailure() {
            sanitizer = (model, output) -> Mono.error(new IllegalStateException("sanitizer down"));

            StepVerifier.create(firewall().screen(CARD_OUTPUT, context(policy(FirewallAction.REDRAFT, "llama-local"))))
                    .assertNext(outcome -> {
                        assertThat(outcome.state()).isEqualTo(FirewallState.FLAGGED);
                        assertThat(outcome.output()).isEqualTo(CARD_OUTPUT);
                        assertThat(outcome.degraded()).isTrue();
                    })
                    .verifyComplete();

            assertThat(metrics.count("firewall_degraded")).isEqualTo(1);
        }

        @Test
        @DisplayName("slow sanitizer degrades to flag")
        void sanitizerTimeout() {
            sanitizer = (model, output) -> Mono.never();

            StepVerifier.create(firewall().screen(CARD_OUTPUT, context(policy(FirewallAction.REDRAFT, "llama-local"))))
                    .assertNext(outcome -> assertThat(outcome.degraded()).isTrue())
                    .verifyComplete();
        }

        @Test
        @DisplayName("external sanitizer is not used for a request above the compliance threshold")
        void sanitizerMustBeCompliant() {
            RequestContext request = Fixtures.request(Sensitivity.HIGH, Set.of());

            StepVerifier.create(firewall().screen(CARD_OUTPUT,
                            context(request, policy(FirewallAction.REDRAFT, "claude-sonnet"))))
                    .assertNext(outcome -> {
                        assertThat(outcome.state()).isEqualTo(FirewallState.FLAGGED);
                        assertThat(outcome.degraded()).isTrue();
                    })
                    .verifyComplete();

            assertThat(sanitizerCalls).hasValue(0);
        }

        @Test
        @DisplayName("unknown sanitizing model degrades to flag")
        void unknownSanitizer() {
            StepVerifier.create(firewall().screen(CARD_OUTPUT, context(policy(FirewallAction.REDRAFT, "missing"))))
                    .assertNext(outcome -> assertThat(outcome.degraded()).isTrue())
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("contextual detector")
    class Contextual {

        private static final String AMBIGUOUS = "Reference number 4111 1111 1111 1112 was logged.";

        private FirewallPolicy contextualPolicy(boolean enabled) {
            return new FirewallPolicy(FirewallAction.FLAG, null,
                    new ContextualDetectorConfig(enabled, "llama-local"), "llama-local");
        }

        @Test
        @DisplayName("consulted only when deterministic detectors are inconclusive")
        void onlyWhenInconclusive() {
            firewall().screen(CARD_OUTPUT, context(contextualPolicy(true))).block();
            assertThat(judgeCalls).hasValue(0);

            firewall().screen(AMBIGUOUS, context(contextualPolicy(true))).block();
            assertThat(judgeCalls).hasValue(1);
        }

        @Test
        @DisplayName("judge verdict becomes a violation")
        void judgeFires() {
            judge = (model, output) -> Mono.just(new ContextualDetector.Judgement(
                    ModelJudgedDetector.parseVerdict("SENSITIVE: 4111 1111 1111 1112"), new TokenUsage(400, 20)));

            RoutingContext context = context(contextualPolicy(true));

            StepVerifier.create(firewall().screen(AMBIGUOUS, context))
                    .assertNext(outcome -> {
                        assertThat(outcome.state()).isEqualTo(FirewallState.FLAGGED);
                        assertThat(outcome.violations()).extracting(Violation::detector).containsExactly("contextual");
                    })
                    .verifyComplete();

            assertThat(context.trace().getFirewallCost()).isEqualByComparingTo(new BigDecimal("0.000084"));
        }

        @Test
        @DisplayName("slow judge falls back to the deterministic result")
        void judgeTimeout() {
            judge = (model, output) -> Mono.never();

            StepVerifier.create(firewall().screen(AMBIGUOUS, context(contextualPolicy(true))))
                    .assertNext(outcome -> assertThat(outcome.state()).isEqualTo(FirewallState.CLEAN))
                    .verifyComplete();

            assertThat(metrics.count("contextual_timeout")).isEqualTo(1);
        }

        @Test
        @DisplayName("disabled detector is never consulted")
        void disabled() {
            StepVerifier.create(firewall().screen(AMBIGUOUS, context(contextualPolicy(false))))
                    .assertNext(outcome -> assertThat(outcome.state()).isEqualTo(FirewallState.CLEAN))
                    .verifyComplete();

            assertThat(judgeCalls).hasValue(0);
        }
    }
}
