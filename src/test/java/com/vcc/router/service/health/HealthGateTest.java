package com.vcc.router.service.health;

import com.vcc.router.model.Candidate;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.model.Policy;
import com.vcc.router.model.ProviderErrorClass;
import com.vcc.router.model.RoutingDirective;
import com.vcc.router.service.pipeline.RoutingContext;
import com.vcc.router.support.Fixtures;
import com.vcc.router.support.MutableClock;
import com.vcc.router.support.RecordingMetricsSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.vcc.router.support.Fixtures.external;
import static com.vcc.router.support.Fixtures.internal;
import static com.vcc.router.support.Fixtures.rule;
import static org.assertj.core.api.Assertions.assertThat;

class HealthGateTest {

    private static final ModelDescriptor SONNET = external("claude-sonnet", "anthropic", "0.003", "0.015");
    private static final ModelDescriptor LLAMA = internal("llama-local", "onprem", "0.0002", "0.0002");

    private final Policy policy = Fixtures.policy(1,
            rule("r", List.of(), RoutingDirective.ordered("claude-sonnet", "llama-local"), null));

    private MutableClock clock;
    private RecordingMetricsSink metrics;
    private HealthTracker tracker;
    private HealthGate gate;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-15T10:00:00Z");
        metrics = new RecordingMetricsSink();
        tracker = new HealthTracker(Fixtures.properties(), clock, metrics);
        gate = new HealthGate(tracker, metrics);
    }

    private void open(ModelDescriptor model) {
        for (int i = 0; i < 3; i++) {
            tracker.recordFailure(model, Duration.ofMillis(10), ProviderErrorClass.SERVER_ERROR, false);
        }
    }

    private RoutingContext newContext() {
        return Fixtures.context(Fixtures.request(), policy);
    }

    @Test
    @DisplayName("keeps closed candidates in order")
    void closedKept() {
        CandidateSet result = gate.apply(Fixtures.ordered(SONNET, LLAMA), newContext());

        assertThat(result.modelIds()).containsExactly("claude-sonnet", "llama-local");
        assertThat(result.candidates()).noneMatch(Candidate::probe);
    }

    @Test
    @DisplayName("drops candidates whose circuit is open")
    void openDropped() {
        open(SONNET);

        assertThat(gate.apply(Fixtures.ordered(SONNET, LLAMA), newContext()).modelIds())
                .containsExactly("llama-local");
    }

    @Test
    @DisplayName("half-open model goes to one request as a probe and is bypassed by the rest")
    void halfOpenProbe() {
        open(SONNET);
        clock.advance(Duration.ofSeconds(30));
        RoutingContext first = newContext();
        RoutingContext second = newContext();

        CandidateSet firstSet = gate.apply(Fixtures.ordered(SONNET, LLAMA), first);
        CandidateSet secondSet = gate.apply(Fixtures.ordered(SONNET, LLAMA), second);

        assertThat(firstSet.candidates().get(0).probe()).isTrue();
        assertThat(first.holdsProbe("claude-sonnet")).isTrue();
        assertThat(secondSet.modelIds()).containsExactly("llama-local");
        assertThat(metrics.has("probe_bypassed", "claude-sonnet")).isTrue();
    }

    @Test
    @DisplayName("re-applying the gate keeps a probe the request already holds")
    void heldProbeKept() {
        open(SONNET);
        clock.advance(Duration.ofSeconds(30));
        RoutingContext context = newContext();

        gate.apply(Fixtures.ordered(SONNET), context);
        CandidateSet again = gate.apply(Fixtures.ordered(SONNET), context);

        assertThat(again.modelIds()).containsExactly("claude-sonnet");
    }
}
