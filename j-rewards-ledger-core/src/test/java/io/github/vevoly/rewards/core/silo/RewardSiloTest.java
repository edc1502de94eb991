package io.github.vevoly.rewards.core.silo;

import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.exception.UnauthorizedException;
import io.github.vevoly.rewards.api.exception.ZeroAmountException;
import io.github.vevoly.rewards.core.RewardsDistributor;
import io.github.vevoly.rewards.core.support.RewardsFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.github.vevoly.rewards.core.support.TestAddresses.ADMIN;
import static io.github.vevoly.rewards.core.support.TestAddresses.ALICE;
import static io.github.vevoly.rewards.core.support.TestAddresses.HARVESTER;
import static io.github.vevoly.rewards.core.support.TestAddresses.PRODUCER;
import static io.github.vevoly.rewards.core.support.TestAddresses.REWARD_A;
import static io.github.vevoly.rewards.core.support.TestAddresses.VAULT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RewardSiloTest {

    RewardsDistributor distributor;

    @BeforeEach
    void setup() throws RewardsLedgerException {
        distributor = new RewardsFixture().distributor;
    }

    @Test
    void rewardAccrue_accumulatesPerPair() throws Exception {
        assertThat(distributor.rewardAccrue(HARVESTER, PRODUCER, REWARD_A, 40)).isEqualTo(40);
        assertThat(distributor.rewardAccrue(HARVESTER, PRODUCER, REWARD_A, 2)).isEqualTo(42);

        assertThat(distributor.getSiloBalance(PRODUCER, REWARD_A)).isEqualTo(42);
    }

    @Test
    void rewardAccrue_onlyHarvesterMayDeposit() {
        assertThatThrownBy(() -> distributor.rewardAccrue(ALICE, PRODUCER, REWARD_A, 1))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> distributor.rewardAccrue(ADMIN, PRODUCER, REWARD_A, 1))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(distributor.getSiloBalance(PRODUCER, REWARD_A)).isZero();
    }

    @Test
    void rewardAccrue_rejectsZeroAndNegativeAmounts() {
        assertThatThrownBy(() -> distributor.rewardAccrue(HARVESTER, PRODUCER, REWARD_A, 0))
                .isInstanceOf(ZeroAmountException.class);
        assertThatThrownBy(() -> distributor.rewardAccrue(HARVESTER, PRODUCER, REWARD_A, -5))
                .isInstanceOfSatisfying(RewardsLedgerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RewardsErrorCode.INVALID_ARGUMENT));
    }

    @Test
    void rewardAccrue_rejectsNullPair() {
        assertThatThrownBy(() -> distributor.rewardAccrue(HARVESTER, null, REWARD_A, 1))
                .isInstanceOfSatisfying(RewardsLedgerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RewardsErrorCode.NULL_IDENTITY));
    }

    @Test
    void rewardAccrue_overflow_keepsPreviousBalance() throws Exception {
        distributor.rewardAccrue(HARVESTER, PRODUCER, REWARD_A, Long.MAX_VALUE);

        assertThatThrownBy(() -> distributor.rewardAccrue(HARVESTER, PRODUCER, REWARD_A, 1))
                .isInstanceOfSatisfying(RewardsLedgerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RewardsErrorCode.AMOUNT_OVERFLOW));
        assertThat(distributor.getSiloBalance(PRODUCER, REWARD_A)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void setHarvester_movesDepositCapability() throws Exception {
        distributor.setHarvester(ADMIN, VAULT);

        assertThat(distributor.getHarvester()).isEqualTo(VAULT);
        assertThat(distributor.rewardAccrue(VAULT, PRODUCER, REWARD_A, 5)).isEqualTo(5);
        assertThatThrownBy(() -> distributor.rewardAccrue(HARVESTER, PRODUCER, REWARD_A, 5))
                .isInstanceOf(UnauthorizedException.class);
    }
}
