package io.github.vevoly.rewards.core.silo;

import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.api.utils.AmountMath;
import io.github.vevoly.rewards.core.state.RewardPairKey;
import io.github.vevoly.rewards.core.state.RewardsState;
import io.github.vevoly.rewards.core.state.StateJournal;

/**
 * 奖励仓：记录每个 (生产代币, 奖励代币) 已收获、未领取的数量。
 * <br><span style="color: gray;">Reward silo: harvested but unclaimed amount per (producer, reward) pair.</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class RewardSilo {

    private final RewardsState state;
    private final StateJournal journal;

    public RewardSilo(RewardsState state, StateJournal journal) {
        this.state = state;
        this.journal = journal;
    }

    public long balance(Address producerToken, Address rewardToken) {
        return state.getSilos().getOrDefault(new RewardPairKey(producerToken, rewardToken), 0L);
    }

    public long credit(Address producerToken, Address rewardToken, long amount) throws RewardsLedgerException {
        long next = AmountMath.add(balance(producerToken, rewardToken), amount);
        journal.put(state.getSilos(), new RewardPairKey(producerToken, rewardToken), next);
        return next;
    }

    public long debit(Address producerToken, Address rewardToken, long amount) throws RewardsLedgerException {
        long current = balance(producerToken, rewardToken);
        if (amount > current) {
            throw new RewardsLedgerException(RewardsErrorCode.INVALID_ARGUMENT,
                    "Debit " + amount + " exceeds silo balance " + current + " for " + producerToken + "/" + rewardToken);
        }
        long next = current - amount;
        journal.put(state.getSilos(), new RewardPairKey(producerToken, rewardToken), next);
        return next;
    }
}
