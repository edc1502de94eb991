package io.github.vevoly.rewards.core.idempotency;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BloomFilterIdempotencyStrategyTest {

    @Test
    void contains_isTrueForEveryAddedKey() {
        BloomFilterIdempotencyStrategy strategy = new BloomFilterIdempotencyStrategy(1_000, 0.0001);
        for (int i = 0; i < 500; i++) {
            strategy.add("claim-" + i);
        }

        for (int i = 0; i < 500; i++) {
            assertThat(strategy.contains("claim-" + i)).isTrue();
        }
        assertThat(strategy.contains("never-seen")).isFalse();
        assertThat(strategy.getName()).isEqualTo("BLOOM");
    }
}
