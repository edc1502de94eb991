package io.github.vevoly.rewards.api.spi;

import io.github.vevoly.rewards.api.model.Address;

/**
 * <h3>收获来源 (Harvest Source)</h3>
 *
 * <p>
 * 外部协作方：计算并交付归属于某个 (生产代币, 奖励代币) 组合的奖励数量。
 * 其内部如何计算 (例如质押头寸产生了多少收益) 对引擎是不透明的。
 * </p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Harvest Source (external collaborator).</b><br>
 * Computes and delivers the reward amount attributable to a (producer, reward) pair.
 * How it computes that amount is opaque to the engine.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface HarvestSource {

    /**
     * 查询当前可收获但尚未收获的数量，无副作用。
     * <br><span style="color: gray;">Currently claimable, not yet harvested amount. No side effects.</span>
     */
    long claimable(Address producerToken, Address rewardToken);

    /**
     * 交付自上次收获以来的数量，并将自身计数清零。
     * <br><span style="color: gray;">Deliver the amount accrued since the last harvest and reset the source's own counter to zero.</span>
     *
     * @return 交付数量，不得为负 (Delivered amount, never negative)
     */
    long collect(Address producerToken, Address rewardToken);
}
