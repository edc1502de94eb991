package io.github.vevoly.rewards.api.utils;

import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AmountMathTest {

    @Test
    void mulDiv_floorsTheQuotient() throws Exception {
        assertThat(AmountMath.mulDiv(1000, 1, 3)).isEqualTo(333);
        assertThat(AmountMath.mulDiv(1000, 2, 3)).isEqualTo(666);
        assertThat(AmountMath.mulDiv(0, 5, 7)).isZero();
    }

    @Test
    void mulDiv_survivesIntermediateOverflow() throws Exception {
        assertThat(AmountMath.mulDiv(Long.MAX_VALUE, 5, 10)).isEqualTo(4611686018427387903L);
        assertThat(AmountMath.mulDiv(Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void mulDiv_resultBeyondLong_isOverflow() {
        assertThatThrownBy(() -> AmountMath.mulDiv(Long.MAX_VALUE, 2, 1))
                .isInstanceOfSatisfying(RewardsLedgerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RewardsErrorCode.AMOUNT_OVERFLOW));
    }

    @Test
    void mulDiv_rejectsZeroDenominatorAndNegatives() {
        assertThatThrownBy(() -> AmountMath.mulDiv(1, 1, 0))
                .isInstanceOfSatisfying(RewardsLedgerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RewardsErrorCode.INVALID_ARGUMENT));
        assertThatThrownBy(() -> AmountMath.mulDiv(-1, 1, 1))
                .isInstanceOfSatisfying(RewardsLedgerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RewardsErrorCode.INVALID_ARGUMENT));
    }

    @Test
    void addSubtractMultiply_reportOverflow() throws Exception {
        assertThat(AmountMath.add(2, 3)).isEqualTo(5);
        assertThat(AmountMath.subtract(5, 3)).isEqualTo(2);
        assertThat(AmountMath.multiply(4, 3)).isEqualTo(12);
        assertThatThrownBy(() -> AmountMath.add(Long.MAX_VALUE, 1)).isInstanceOf(RewardsLedgerException.class);
        assertThatThrownBy(() -> AmountMath.subtract(Long.MIN_VALUE, 1)).isInstanceOf(RewardsLedgerException.class);
        assertThatThrownBy(() -> AmountMath.multiply(Long.MAX_VALUE, 2)).isInstanceOf(RewardsLedgerException.class);
    }
}
