package io.github.vevoly.rewards.api.model;

import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

/**
 * 一笔奖励资金流动：领取时为 (奖励代币 → 接收人)，收获时为 (收获方 → 奖励仓)。
 * <br>
 * <span style="color: gray;">One reward movement. For a claim the counterparty is the resolved recipient,
 * for a harvest or deposit it is the harvester.</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class RewardMovement implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    Address producerToken;

    Address rewardToken;

    Address counterparty;

    long amount;
}
