package io.github.vevoly.rewards.core.idempotency;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LruIdempotencyStrategyTest {

    @Test
    void add_beyondCapacity_evictsLeastRecentlyUsed() {
        LruIdempotencyStrategy strategy = new LruIdempotencyStrategy(2);
        strategy.add("tx-1");
        strategy.add("tx-2");

        // touch tx-1 so tx-2 becomes eldest
        assertThat(strategy.contains("tx-1")).isTrue();
        strategy.add("tx-3");

        assertThat(strategy.contains("tx-1")).isTrue();
        assertThat(strategy.contains("tx-2")).isFalse();
        assertThat(strategy.contains("tx-3")).isTrue();
    }

    @Test
    void clear_forgetsEverything() {
        LruIdempotencyStrategy strategy = new LruIdempotencyStrategy(10);
        strategy.add("tx-1");

        strategy.clear();

        assertThat(strategy.contains("tx-1")).isFalse();
        assertThat(strategy.getName()).isEqualTo("LRU");
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new LruIdempotencyStrategy(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
