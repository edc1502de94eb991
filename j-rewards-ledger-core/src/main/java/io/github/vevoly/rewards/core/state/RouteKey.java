package io.github.vevoly.rewards.core.state;

import io.github.vevoly.rewards.api.model.Address;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

/**
 * 接收人路由键，(账户, 生产代币, 奖励代币)。账户是个人映射中的持有人，或特权映射中的包装合约。
 * <br><span style="color: gray;">Recipient route key. The account is the holder for personal routes and the wrapper for privileged ones.</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class RouteKey implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    Address account;

    Address producerToken;

    Address rewardToken;
}
