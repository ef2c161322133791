package com.vcc.router.service.selection;

import com.vcc.router.model.Candidate;
import com.vcc.router.model.CandidateSet;
import com.vcc.router.model.DirectiveKind;
import com.vcc.router.model.ModelDescriptor;
import com.vcc.router.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.vcc.router.support.Fixtures.external;
import static com.vcc.router.support.Fixtures.internal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateSelectorTest {

    private static final ModelDescriptor SONNET = external("claude-sonnet", "anthropic", "0.003", "0.015");
    private static final ModelDescriptor GPT = external("gpt-large", "openai", "0.005", "0.015");
    private static final ModelDescriptor LLAMA = internal("llama-local", "onprem", "0.0002", "0.0002");
    private static final ToDoubleFunction<String> HEALTHY = id -> 1.0d;

    private static CandidateSet weighted(double sonnet, double gpt) {
        return CandidateSet.of(DirectiveKind.WEIGHTED, "r", List.of(
                Candidate.of(SONNET, sonnet, "r"),
                Candidate.of(GPT, gpt, "r"),
                new Candidate(LLAMA, 0.0, "r", false, true)));
    }

    @Test
    @DisplayName("ordered sets recommend the head and keep the rest as fallbacks")
    void orderedHead() {
        Selection selection = CandidateSelector.select(Fixtures.ordered(LLAMA, SONNET, GPT), 7L, HEALTHY);

        assertThat(selection.recommended().modelId()).isEqualTo("llama-local");
        assertThat(selection.fallbackModelIds()).containsExactly("claude-sonnet", "gpt-large");
        assertThat(selection.plan()).extracting(Candidate::modelId)
                .containsExactly("llama-local", "claude-sonnet", "gpt-large");
    }

    @Test
    @DisplayName("same seed always produces the same selection")
    void deterministicForSeed() {
        String auditId = UUID.randomUUID().toString();
        long seed = CandidateSelector.seedOf(auditId);

        List<String> recommendations = IntStream.range(0, 20)
                .mapToObj(i -> CandidateSelector.select(weighted(0.5, 0.5), seed, HEALTHY).recommended().modelId())
                .distinct()
                .toList();

        assertThat(recommendations).hasSize(1);
    }

    @Test
    @DisplayName("weighted draw follows the configured weights")
    void weightedDistribution() {
        Map<String, Long> counts = IntStream.range(0, 10_000)
                .mapToObj(i -> CandidateSelector.select(weighted(0.8, 0.2), i * 7919L, HEALTHY)
                        .recommended().modelId())
                .collect(Collectors.groupingBy(id -> id, Collectors.counting()));

        assertThat(counts.get("claude-sonnet") / 10_000.0d).isBetween(0.77d, 0.83d);
        assertThat(counts.get("gpt-large") / 10_000.0d).isBetween(0.17d, 0.23d);
        assertThat(counts).doesNotContainKey("llama-local");
    }

    @Test
    @DisplayName("unpicked primaries come first in the fallback chain, then the fallback-only models")
    void fallbackChainOrder() {
        Selection selection = CandidateSelector.select(weighted(0.6, 0.4), 11L, HEALTHY);

        assertThat(selection.fallbackModelIds()).hasSize(2).last().isEqualTo("llama-local");
        assertThat(selection.plan()).extracting(Candidate::modelId)
                .containsExactlyInAnyOrder("claude-sonnet", "gpt-large", "llama-local");
    }

    @Test
    @DisplayName("equal weights are ordered by health score, then model id")
    void tieBreak() {
        List<Candidate> tied = List.of(Candidate.of(SONNET, 0.5, "r"), Candidate.of(GPT, 0.5, "r"));
        ToDoubleFunction<String> gptHealthier = id -> id.equals("gpt-large") ? 0.9d : 0.4d;

        assertThat(tied.stream().sorted(CandidateSelector.weightedOrder(gptHealthier)).map(Candidate::modelId))
                .containsExactly("gpt-large", "claude-sonnet");
        assertThat(tied.stream().sorted(CandidateSelector.weightedOrder(HEALTHY)).map(Candidate::modelId))
                .containsExactly("claude-sonnet", "gpt-large");
    }

    @Test
    @DisplayName("set with only fallback models promotes them")
    void onlyFallbacks() {
        CandidateSet set = CandidateSet.of(DirectiveKind.ORDERED, "r", List.of(
                new Candidate(LLAMA, 0.0, "r", false, true),
                new Candidate(GPT, 0.0, "r", false, true)));

        Selection selection = CandidateSelector.select(set, 1L, HEALTHY);

        assertThat(selection.recommended().modelId()).isEqualTo("llama-local");
        assertThat(selection.fallbackModelIds()).containsExactly("gpt-large");
    }

    @Test
    @DisplayName("empty set cannot be selected from")
    void emptySet() {
        assertThatThrownBy(() -> CandidateSelector.select(CandidateSet.empty(), 1L, HEALTHY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("non-UUID audit ids still yield a stable seed")
    void seedOfNonUuid() {
        assertThat(CandidateSelector.seedOf("trace-1")).isEqualTo(CandidateSelector.seedOf("trace-1"));
    }
}
