package io.github.vevoly.rewards.api.model;

import lombok.Value;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * 收获报告：列出每个产出非零数量的 (生产代币, 奖励代币) 组合。
 * <br>
 * <span style="color: gray;">Harvest report. One entry per (producer, reward) pair that yielded a non-zero amount,
 * in registry order.</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class HarvestReport implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    long timestamp;

    List<RewardMovement> deposits;

    public boolean isEmpty() {
        return deposits.isEmpty();
    }

    public long totalFor(Address producerToken, Address rewardToken) {
        long total = 0L;
        for (RewardMovement deposit : deposits) {
            if (deposit.getProducerToken().equals(producerToken) && deposit.getRewardToken().equals(rewardToken)) {
                total += deposit.getAmount();
            }
        }
        return total;
    }
}
