package io.github.vevoly.rewards.core.claim;

import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.AccrualState;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.api.model.ClaimResult;
import io.github.vevoly.rewards.api.model.RewardMovement;
import io.github.vevoly.rewards.api.spi.RewardTransfer;
import io.github.vevoly.rewards.api.utils.AmountMath;
import io.github.vevoly.rewards.core.accrual.AccrualLedger;
import io.github.vevoly.rewards.core.recipient.RecipientDirectory;
import io.github.vevoly.rewards.core.registry.RewardTokenRegistry;
import io.github.vevoly.rewards.core.silo.RewardSilo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

import static io.github.vevoly.rewards.core.LedgerChecks.requireIdentity;

/**
 * <h3>领取引擎 (Claim Engine)</h3>
 *
 * <p>
 * 持有人按 {@code userPoints / globalPoints} 的比例领取每个奖励仓。执行顺序固定为：
 * </p>
 * <ol>
 *     <li><b>检查 (Checks):</b> 同步用户与全局积分。</li>
 *     <li><b>生效 (Effects):</b> 扣减奖励仓，清零用户积分，扣减全局积分，解析接收人。</li>
 *     <li><b>交互 (Interactions):</b> 通过 {@link RewardTransfer#transferAll} 一次性原子交付全部发放。</li>
 * </ol>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Claim Engine.</b><br>
 * A holder takes {@code floor(silo × userPoints / globalPoints)} of every silo of the producer.
 * All state is final before the first delivery, so a reentrant claim from inside a delivery sees zero points.
 * Zero amounts are never delivered. Payouts go out in one all-or-nothing batch, so a failed delivery
 * rolls back a claim of which nothing was paid.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class ClaimEngine {

    private final AccrualLedger accrualLedger;
    private final RewardTokenRegistry registry;
    private final RewardSilo silo;
    private final RecipientDirectory recipients;
    private final RewardTransfer rewardTransfer;

    public ClaimEngine(AccrualLedger accrualLedger, RewardTokenRegistry registry, RewardSilo silo,
                       RecipientDirectory recipients, RewardTransfer rewardTransfer) {
        this.accrualLedger = accrualLedger;
        this.registry = registry;
        this.silo = silo;
        this.recipients = recipients;
        this.rewardTransfer = rewardTransfer;
    }

    public ClaimResult claim(Address producerToken, Address holder, long now) throws RewardsLedgerException {
        requireIdentity(producerToken, "producerToken");
        requireIdentity(holder, "holder");

        // 1. Checks
        AccrualState user = accrualLedger.userAccrue(producerToken, holder, now);
        AccrualState global = accrualLedger.globalAccrue(producerToken, now);
        long userPoints = user.getPoints();
        long globalPoints = global.getPoints();
        if (globalPoints == 0L) {
            return ClaimResult.noop(producerToken, holder, userPoints);
        }
        if (userPoints > globalPoints) {
            throw new RewardsLedgerException(RewardsErrorCode.INVALID_ARGUMENT,
                    "User points " + userPoints + " exceed global points " + globalPoints + " for " + producerToken
                            + "; balance ledger sync hooks are missing");
        }

        // 2. Effects
        List<RewardMovement> payouts = new ArrayList<>();
        for (Address rewardToken : registry.tokens(producerToken)) {
            long amount = AmountMath.mulDiv(silo.balance(producerToken, rewardToken), userPoints, globalPoints);
            if (amount == 0L) {
                continue;
            }
            silo.debit(producerToken, rewardToken, amount);
            payouts.add(new RewardMovement(producerToken, rewardToken,
                    recipients.resolve(holder, producerToken, rewardToken), amount));
        }
        accrualLedger.resetUserPoints(producerToken, holder);
        accrualLedger.deductGlobalPoints(producerToken, userPoints);

        // 3. Interactions
        if (!payouts.isEmpty()) {
            deliver(payouts);
        }
        log.debug("Claim settled: producer={}, holder={}, userPoints={}, globalPoints={}, payouts={}",
                producerToken, holder, userPoints, globalPoints, payouts.size());
        return new ClaimResult(producerToken, holder, userPoints, globalPoints, List.copyOf(payouts));
    }

    /**
     * 预估当前领取能得到的数量，不修改状态 (Preview of what a claim would pay right now; no mutation).
     */
    public long preview(Address producerToken, Address holder, Address rewardToken, long now) throws RewardsLedgerException {
        requireIdentity(producerToken, "producerToken");
        requireIdentity(holder, "holder");
        requireIdentity(rewardToken, "rewardToken");
        long globalPoints = accrualLedger.previewGlobal(producerToken, now).getPoints();
        if (globalPoints == 0L || !registry.tokens(producerToken).contains(rewardToken)) {
            return 0L;
        }
        long userPoints = Math.min(accrualLedger.previewUser(producerToken, holder, now).getPoints(), globalPoints);
        return AmountMath.mulDiv(silo.balance(producerToken, rewardToken), userPoints, globalPoints);
    }

    private void deliver(List<RewardMovement> payouts) throws RewardsLedgerException {
        try {
            rewardTransfer.transferAll(List.copyOf(payouts));
        } catch (RuntimeException e) {
            throw new RewardsLedgerException(RewardsErrorCode.DELIVERY_FAILED,
                    "Delivery of " + payouts.size() + " payout(s) failed: " + e.getMessage(), e);
        }
    }
}
