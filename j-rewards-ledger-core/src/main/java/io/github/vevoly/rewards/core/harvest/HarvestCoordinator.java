package io.github.vevoly.rewards.core.harvest;

import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.api.model.HarvestReport;
import io.github.vevoly.rewards.api.model.RewardMovement;
import io.github.vevoly.rewards.api.spi.HarvestSource;
import io.github.vevoly.rewards.core.accrual.AccrualLedger;
import io.github.vevoly.rewards.core.access.AccessPolicy;
import io.github.vevoly.rewards.core.registry.RewardTokenRegistry;
import io.github.vevoly.rewards.core.silo.RewardSilo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

import static io.github.vevoly.rewards.core.LedgerChecks.queryCollaborator;

/**
 * <h3>收获协调器 (Harvest Coordinator)</h3>
 *
 * <p>
 * 按注册顺序遍历所有 (生产代币, 奖励代币)：先同步全局积分，再从收获源取出自上次收获以来归属该组合的数量，
 * 存入奖励仓。先同步全局积分，保证这批奖励按收获前累计的积分分配。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Harvest Coordinator.</b><br>
 * Walks every registered (producer, reward) pair in registry order: syncs global points, collects the amount
 * attributable to the pair since the last harvest and deposits it into the silo. The global sync comes first so
 * the batch is split by the points accrued up to the harvest.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class HarvestCoordinator {

    private final AccrualLedger accrualLedger;
    private final RewardTokenRegistry registry;
    private final RewardSilo silo;
    private final AccessPolicy accessPolicy;
    private final HarvestSource harvestSource;

    public HarvestCoordinator(AccrualLedger accrualLedger, RewardTokenRegistry registry, RewardSilo silo,
                              AccessPolicy accessPolicy, HarvestSource harvestSource) {
        this.accrualLedger = accrualLedger;
        this.registry = registry;
        this.silo = silo;
        this.accessPolicy = accessPolicy;
        this.harvestSource = harvestSource;
    }

    public HarvestReport harvest(long now) throws RewardsLedgerException {
        List<RewardMovement> deposits = new ArrayList<>();
        Address harvester = accessPolicy.harvester();
        for (Address producerToken : registry.producers()) {
            for (Address rewardToken : registry.tokens(producerToken)) {
                accrualLedger.globalAccrue(producerToken, now);
                long amount = queryCollaborator("collect(" + producerToken + ", " + rewardToken + ")",
                        () -> harvestSource.collect(producerToken, rewardToken));
                if (amount == 0L) {
                    continue;
                }
                silo.credit(producerToken, rewardToken, amount);
                deposits.add(new RewardMovement(producerToken, rewardToken, harvester, amount));
                log.debug("Harvested {} of {} for {}", amount, rewardToken, producerToken);
            }
        }
        return new HarvestReport(now, List.copyOf(deposits));
    }

    /**
     * 收获源中可收获的数量，只读 (Amount the source would yield right now; read-only).
     */
    public long claimable(Address producerToken, Address rewardToken) throws RewardsLedgerException {
        return queryCollaborator("claimable(" + producerToken + ", " + rewardToken + ")",
                () -> harvestSource.claimable(producerToken, rewardToken));
    }
}
