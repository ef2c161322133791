package com.vcc.router.service.experiment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class StableHasherTest {

    @Test
    @DisplayName("same experiment and key always land in the same bucket")
    void deterministic() {
        int first = StableHasher.bucket("exp-1", "user-42");

        assertThat(IntStream.range(0, 100).map(i -> StableHasher.bucket("exp-1", "user-42")))
                .allMatch(b -> b == first);
        assertThat(first).isBetween(0, StableHasher.BUCKETS - 1);
    }

    @Test
    @DisplayName("traffic share is honoured across many keys")
    void trafficShare() {
        long enrolled = IntStream.range(0, 20_000)
                .filter(i -> StableHasher.inTraffic("exp-1", "user-" + i, 10.0d))
                .count();

        assertThat(enrolled / 20_000.0d).isBetween(0.08d, 0.12d);
    }

    @Test
    @DisplayName("zero and full traffic are exact")
    void bounds() {
        assertThat(IntStream.range(0, 1_000).noneMatch(i -> StableHasher.inTraffic("exp-1", "k" + i, 0.0d))).isTrue();
        assertThat(IntStream.range(0, 1_000).allMatch(i -> StableHasher.inTraffic("exp-1", "k" + i, 100.0d))).isTrue();
    }

    @Test
    @DisplayName("experiments bucket the same keys independently")
    void independentExperiments() {
        long differing = IntStream.range(0, 1_000)
                .filter(i -> StableHasher.bucket("exp-a", "k" + i) != StableHasher.bucket("exp-b", "k" + i))
                .count();

        assertThat(differing).isGreaterThan(900);
    }
}
