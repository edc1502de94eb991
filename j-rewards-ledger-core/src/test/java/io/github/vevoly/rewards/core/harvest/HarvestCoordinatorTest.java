package io.github.vevoly.rewards.core.harvest;

import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.HarvestReport;
import io.github.vevoly.rewards.api.model.RewardMovement;
import io.github.vevoly.rewards.api.spi.HarvestSource;
import io.github.vevoly.rewards.core.RewardsDistributor;
import io.github.vevoly.rewards.core.support.InMemoryBalanceLedger;
import io.github.vevoly.rewards.core.support.MutableClock;
import io.github.vevoly.rewards.core.support.RecordingTransfer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static io.github.vevoly.rewards.core.support.TestAddresses.ADMIN;
import static io.github.vevoly.rewards.core.support.TestAddresses.ALICE;
import static io.github.vevoly.rewards.core.support.TestAddresses.HARVESTER;
import static io.github.vevoly.rewards.core.support.TestAddresses.PRODUCER;
import static io.github.vevoly.rewards.core.support.TestAddresses.PRODUCER_2;
import static io.github.vevoly.rewards.core.support.TestAddresses.REWARD_A;
import static io.github.vevoly.rewards.core.support.TestAddresses.REWARD_B;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HarvestCoordinatorTest {

    @Mock
    HarvestSource harvestSource;

    MutableClock clock = new MutableClock(0);
    InMemoryBalanceLedger ledger = new InMemoryBalanceLedger();
    RewardsDistributor distributor;

    @BeforeEach
    void setup() throws RewardsLedgerException {
        distributor = RewardsDistributor.builder()
                .administrator(ADMIN)
                .harvester(HARVESTER)
                .balanceLedger(ledger)
                .harvestSource(harvestSource)
                .rewardTransfer(new RecordingTransfer())
                .contractInspector(address -> false)
                .clock(clock)
                .build();
        ledger.attach(distributor);
    }

    @Test
    void harvest_creditsSilos_andReportsDeposits() throws Exception {
        distributor.addRewardToken(ADMIN, PRODUCER, REWARD_A);
        distributor.addRewardToken(ADMIN, PRODUCER, REWARD_B);
        distributor.addRewardToken(ADMIN, PRODUCER_2, REWARD_A);
        when(harvestSource.collect(PRODUCER, REWARD_A)).thenReturn(70L);
        when(harvestSource.collect(PRODUCER, REWARD_B)).thenReturn(0L);
        when(harvestSource.collect(PRODUCER_2, REWARD_A)).thenReturn(5L);
        clock.set(30);

        HarvestReport report = distributor.harvest();

        assertThat(report.getTimestamp()).isEqualTo(30);
        assertThat(report.getDeposits()).containsExactly(
                new RewardMovement(PRODUCER, REWARD_A, HARVESTER, 70),
                new RewardMovement(PRODUCER_2, REWARD_A, HARVESTER, 5));
        assertThat(report.totalFor(PRODUCER, REWARD_A)).isEqualTo(70);
        assertThat(distributor.getSiloBalance(PRODUCER, REWARD_A)).isEqualTo(70);
        assertThat(distributor.getSiloBalance(PRODUCER, REWARD_B)).isZero();
        assertThat(distributor.getSiloBalance(PRODUCER_2, REWARD_A)).isEqualTo(5);
    }

    @Test
    void harvest_syncsGlobalPointsBeforeDepositing() throws Exception {
        distributor.addRewardToken(ADMIN, PRODUCER, REWARD_A);
        ledger.mint(PRODUCER, ALICE, 10);
        when(harvestSource.collect(PRODUCER, REWARD_A)).thenReturn(100L);
        clock.set(50);

        distributor.harvest();

        assertThat(distributor.getGlobalState(PRODUCER).getPoints()).isEqualTo(500);
        assertThat(distributor.getGlobalState(PRODUCER).getLastUpdate()).isEqualTo(50L);
    }

    @Test
    void harvest_withNothingRegistered_isEmpty() throws Exception {
        HarvestReport report = distributor.harvest();

        assertThat(report.isEmpty()).isTrue();
    }

    @Test
    void harvest_collectFailure_rollsBackEarlierDeposits() throws Exception {
        distributor.addRewardToken(ADMIN, PRODUCER, REWARD_A);
        distributor.addRewardToken(ADMIN, PRODUCER, REWARD_B);
        when(harvestSource.collect(PRODUCER, REWARD_A)).thenReturn(70L);
        when(harvestSource.collect(PRODUCER, REWARD_B)).thenThrow(new IllegalStateException("source offline"));

        assertThatThrownBy(() -> distributor.harvest())
                .isInstanceOfSatisfying(RewardsLedgerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RewardsErrorCode.DELIVERY_FAILED));
        assertThat(distributor.getSiloBalance(PRODUCER, REWARD_A)).isZero();
    }

    @Test
    void pendingHarvest_readsSourceWithoutCollecting() throws Exception {
        when(harvestSource.claimable(PRODUCER, REWARD_A)).thenReturn(12L);

        assertThat(distributor.pendingHarvest(PRODUCER, REWARD_A)).isEqualTo(12);
        verify(harvestSource, never()).collect(PRODUCER, REWARD_A);
    }
}
