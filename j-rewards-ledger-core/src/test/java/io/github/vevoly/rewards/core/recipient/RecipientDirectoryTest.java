package io.github.vevoly.rewards.core.recipient;

import io.github.vevoly.rewards.api.exception.NotContractException;
import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.exception.UnauthorizedException;
import io.github.vevoly.rewards.core.RewardsDistributor;
import io.github.vevoly.rewards.core.support.RewardsFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.github.vevoly.rewards.core.support.TestAddresses.ADMIN;
import static io.github.vevoly.rewards.core.support.TestAddresses.ALICE;
import static io.github.vevoly.rewards.core.support.TestAddresses.BOB;
import static io.github.vevoly.rewards.core.support.TestAddresses.CAROL;
import static io.github.vevoly.rewards.core.support.TestAddresses.PRODUCER;
import static io.github.vevoly.rewards.core.support.TestAddresses.REWARD_A;
import static io.github.vevoly.rewards.core.support.TestAddresses.REWARD_B;
import static io.github.vevoly.rewards.core.support.TestAddresses.VAULT;
import static io.github.vevoly.rewards.core.support.TestAddresses.WRAPPER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecipientDirectoryTest {

    RewardsFixture fx;
    RewardsDistributor distributor;

    @BeforeEach
    void setup() throws RewardsLedgerException {
        fx = new RewardsFixture();
        distributor = fx.distributor;
        fx.contracts.add(WRAPPER);
    }

    @Test
    void resolveRecipient_defaultsToTheAccount() {
        assertThat(distributor.resolveRecipient(ALICE, PRODUCER, REWARD_A)).isEqualTo(ALICE);
        assertThat(distributor.getPersonalRecipient(ALICE, PRODUCER, REWARD_A)).isEmpty();
    }

    @Test
    void setRewardRecipient_isScopedToTheRewardPair() throws Exception {
        distributor.setRewardRecipient(ALICE, PRODUCER, REWARD_A, CAROL);

        assertThat(distributor.resolveRecipient(ALICE, PRODUCER, REWARD_A)).isEqualTo(CAROL);
        assertThat(distributor.resolveRecipient(ALICE, PRODUCER, REWARD_B)).isEqualTo(ALICE);
        assertThat(distributor.resolveRecipient(BOB, PRODUCER, REWARD_A)).isEqualTo(BOB);
        assertThat(distributor.getPersonalRecipient(ALICE, PRODUCER, REWARD_A)).contains(CAROL);
    }

    @Test
    void unsetRewardRecipient_revertsToTheAccount() throws Exception {
        distributor.setRewardRecipient(ALICE, PRODUCER, REWARD_A, CAROL);

        distributor.unsetRewardRecipient(ALICE, PRODUCER, REWARD_A);
        distributor.unsetRewardRecipient(ALICE, PRODUCER, REWARD_A);

        assertThat(distributor.resolveRecipient(ALICE, PRODUCER, REWARD_A)).isEqualTo(ALICE);
    }

    @Test
    void setRewardRecipient_rejectsNullRecipient() {
        assertThatThrownBy(() -> distributor.setRewardRecipient(ALICE, PRODUCER, REWARD_A, null))
                .isInstanceOfSatisfying(RewardsLedgerException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(RewardsErrorCode.NULL_IDENTITY));
    }

    @Test
    void privilegedRecipient_takesPrecedenceOverPersonal() throws Exception {
        distributor.setRewardRecipient(WRAPPER, PRODUCER, REWARD_A, CAROL);
        distributor.setRewardRecipientPrivileged(ADMIN, WRAPPER, PRODUCER, REWARD_A, VAULT);

        assertThat(distributor.resolveRecipient(WRAPPER, PRODUCER, REWARD_A)).isEqualTo(VAULT);
        assertThat(distributor.getPrivilegedRecipient(WRAPPER, PRODUCER, REWARD_A)).contains(VAULT);

        distributor.unsetRewardRecipientPrivileged(ADMIN, WRAPPER, PRODUCER, REWARD_A);

        assertThat(distributor.resolveRecipient(WRAPPER, PRODUCER, REWARD_A)).isEqualTo(CAROL);
    }

    @Test
    void setRewardRecipientPrivileged_requiresAdministrator() {
        assertThatThrownBy(() -> distributor.setRewardRecipientPrivileged(ALICE, WRAPPER, PRODUCER, REWARD_A, VAULT))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(distributor.getPrivilegedRecipient(WRAPPER, PRODUCER, REWARD_A)).isEmpty();
    }

    @Test
    void setRewardRecipientPrivileged_requiresDeployedCode() {
        assertThatThrownBy(() -> distributor.setRewardRecipientPrivileged(ADMIN, BOB, PRODUCER, REWARD_A, VAULT))
                .isInstanceOf(NotContractException.class);
        assertThatThrownBy(() -> distributor.unsetRewardRecipientPrivileged(ADMIN, BOB, PRODUCER, REWARD_A))
                .isInstanceOf(NotContractException.class);
    }

    @Test
    void claim_throughWrapper_paysPrivilegedRecipient() throws Exception {
        distributor.addRewardToken(ADMIN, PRODUCER, REWARD_A);
        distributor.setRewardRecipientPrivileged(ADMIN, WRAPPER, PRODUCER, REWARD_A, VAULT);
        fx.ledger.mint(PRODUCER, WRAPPER, 10);
        fx.deposit(PRODUCER, REWARD_A, 99);
        fx.clock.set(5);

        distributor.claim(PRODUCER, WRAPPER);

        assertThat(fx.transfer.totalTo(VAULT, REWARD_A)).isEqualTo(99);
        assertThat(fx.transfer.totalTo(WRAPPER, REWARD_A)).isZero();
    }
}
