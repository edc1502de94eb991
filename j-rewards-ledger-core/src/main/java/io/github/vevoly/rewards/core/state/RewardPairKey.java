package io.github.vevoly.rewards.core.state;

import io.github.vevoly.rewards.api.model.Address;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

/**
 * 奖励组合键，(生产代币, 奖励代币)。
 * <br><span style="color: gray;">Reward pair key: (producer token, reward token).</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class RewardPairKey implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    Address producerToken;

    Address rewardToken;
}
