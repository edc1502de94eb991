package io.github.vevoly.rewards.api.model;

import lombok.Value;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * <h3>领取结果 (Claim Result)</h3>
 *
 * <p>记录一次领取消耗的积分以及每个奖励代币的实际发放。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * Points consumed by one claim and the payout delivered for every registered reward token.
 * A claim against a producer with zero global points yields {@link #isNoop()} {@code true} and no payouts.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class ClaimResult implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    Address producerToken;

    Address holder;

    /**
     * 本次消耗的用户积分 (User points consumed).
     */
    long userPoints;

    /**
     * 领取前的全局积分 (Global points before the claim).
     */
    long globalPoints;

    List<RewardMovement> payouts;

    public static ClaimResult noop(Address producerToken, Address holder, long userPoints) {
        return new ClaimResult(producerToken, holder, userPoints, 0L, List.of());
    }

    public boolean isNoop() {
        return globalPoints == 0L;
    }

    /**
     * 某个奖励代币的发放总额 (Total paid in one reward token).
     */
    public long paidIn(Address rewardToken) {
        long total = 0L;
        for (RewardMovement payout : payouts) {
            if (payout.getRewardToken().equals(rewardToken)) {
                total += payout.getAmount();
            }
        }
        return total;
    }
}
