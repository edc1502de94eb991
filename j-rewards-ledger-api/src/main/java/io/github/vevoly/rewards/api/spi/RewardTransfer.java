package io.github.vevoly.rewards.api.spi;

import io.github.vevoly.rewards.api.model.RewardMovement;

import java.util.List;

/**
 * 奖励交付通道 (Reward Transfer).
 *
 * <p>
 * 领取时由引擎调用，将一笔领取的全部发放作为一个整体交付给解析出的接收人。调用时所有账本状态已经落定；
 * 抛出任何异常都会使整笔领取回滚，因此实现必须保证<b>全部成功或全部不生效</b>：
 * 抛出异常前不得有任何一笔已经到账。
 * </p>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * Called once per claim with every payout of that claim, after every state change is final.
 * Throwing rolls the whole claim back, so the batch must be all-or-nothing: when this method throws,
 * none of the payouts may have been delivered. Implementations may call back into the engine;
 * such calls observe the finalized state.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface RewardTransfer {

    /**
     * 原子地交付一笔领取的全部发放 (Deliver every payout of one claim atomically).
     *
     * @param payouts 非空，每项的 counterparty 为接收人，amount 大于 0
     *                <br><span style="color: gray;">non-empty; counterparty is the recipient, amount is positive</span>
     */
    void transferAll(List<RewardMovement> payouts);
}
