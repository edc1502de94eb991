package io.github.vevoly.rewards.core.registry;

import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.core.state.RewardsState;
import io.github.vevoly.rewards.core.state.StateJournal;

import java.util.ArrayList;
import java.util.List;

import static io.github.vevoly.rewards.core.LedgerChecks.requireIdentity;

/**
 * <h3>奖励代币注册表 (Reward Token Registry)</h3>
 *
 * <p>
 * 每个生产代币对应一个有序的奖励代币列表，领取时按此顺序发放。
 * 删除采用"与末尾交换后弹出"，因此会改变剩余元素的顺序。
 * 同一奖励代币不允许重复注册，否则领取时会对同一奖励仓重复结算。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Reward Token Registry.</b><br>
 * An ordered list of reward tokens per producer token, walked in order on claim.
 * Removal swaps the target with the last entry and pops, so the order of the remaining entries changes.
 * Duplicate registrations are rejected since a claim would settle the same silo twice.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class RewardTokenRegistry {

    private final RewardsState state;
    private final StateJournal journal;

    public RewardTokenRegistry(RewardsState state, StateJournal journal) {
        this.state = state;
        this.journal = journal;
    }

    public void add(Address producerToken, Address rewardToken) throws RewardsLedgerException {
        requireIdentity(producerToken, "producerToken");
        requireIdentity(rewardToken, "rewardToken");
        List<Address> current = tokens(producerToken);
        if (current.contains(rewardToken)) {
            throw new RewardsLedgerException(RewardsErrorCode.INVALID_ARGUMENT,
                    "Reward token " + rewardToken + " is already registered for " + producerToken);
        }
        List<Address> next = new ArrayList<>(current);
        next.add(rewardToken);
        journal.put(state.getRewardTokens(), producerToken, next);
    }

    /**
     * 按下标删除，返回被删除的奖励代币 (Removes by index and returns the removed reward token).
     */
    public Address removeAt(Address producerToken, int index) throws RewardsLedgerException {
        List<Address> current = tokens(producerToken);
        if (index < 0 || index >= current.size()) {
            throw new RewardsLedgerException(RewardsErrorCode.INVALID_ARGUMENT,
                    "Index " + index + " out of range for " + producerToken + " (size " + current.size() + ")");
        }
        List<Address> next = new ArrayList<>(current);
        Address removed = next.get(index);
        Address last = next.remove(next.size() - 1);
        if (index < next.size()) {
            next.set(index, last);
        }
        if (next.isEmpty()) {
            journal.remove(state.getRewardTokens(), producerToken);
        } else {
            journal.put(state.getRewardTokens(), producerToken, next);
        }
        return removed;
    }

    public int remove(Address producerToken, Address rewardToken) throws RewardsLedgerException {
        int index = tokens(producerToken).indexOf(rewardToken);
        if (index < 0) {
            throw new RewardsLedgerException(RewardsErrorCode.INVALID_ARGUMENT,
                    "Reward token " + rewardToken + " is not registered for " + producerToken);
        }
        removeAt(producerToken, index);
        return index;
    }

    public List<Address> tokens(Address producerToken) {
        List<Address> list = state.getRewardTokens().get(producerToken);
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * 拥有奖励代币的生产代币，按首次注册顺序 (Producers with registered reward tokens, in registration order).
     */
    public List<Address> producers() {
        return List.copyOf(state.getRewardTokens().keySet());
    }
}
