package io.github.vevoly.rewards.core.accrual;

import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.AccrualState;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.api.spi.BalanceLedger;
import io.github.vevoly.rewards.api.utils.AmountMath;
import io.github.vevoly.rewards.core.state.PositionKey;
import io.github.vevoly.rewards.core.state.RewardsState;
import io.github.vevoly.rewards.core.state.StateJournal;
import lombok.extern.slf4j.Slf4j;

import static io.github.vevoly.rewards.core.LedgerChecks.queryCollaborator;
import static io.github.vevoly.rewards.core.LedgerChecks.requireIdentity;

/**
 * <h3>积分累计账本 (Accrual Ledger)</h3>
 *
 * <p>
 * 维护全局与用户两级的"余额 × 时间"积分。每次同步时，先按上次观察到的数量累加
 * {@code lastAmount × (now - lastUpdate)}，再记录当前数量与时间。
 * 余额账本必须在每次余额或供应量变化时调用同步，否则积分会按旧数量继续累计。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Accrual Ledger.</b><br>
 * Maintains the balance-over-time integral at global and user level. A sync first adds
 * {@code lastAmount × (now - lastUpdate)} and then records the currently observed amount and time.
 * The balance ledger must sync on every balance or supply change, otherwise points keep accruing at the stale amount.
 * </span>
 *
 * <h3>时钟回拨 (Clock going backwards)：</h3>
 * <p>
 * 经过时间按 0 处理，{@code lastUpdate} 取 {@code max(last, now)}，积分永不减少。
 * <br><span style="color: gray;">Elapsed time is clamped to zero and lastUpdate never moves back, so points never decrease.</span>
 * </p>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class AccrualLedger {

    private final RewardsState state;
    private final StateJournal journal;
    private final BalanceLedger balanceLedger;

    public AccrualLedger(RewardsState state, StateJournal journal, BalanceLedger balanceLedger) {
        this.state = state;
        this.journal = journal;
        this.balanceLedger = balanceLedger;
    }

    public AccrualState globalAccrue(Address producerToken, long now) throws RewardsLedgerException {
        requireIdentity(producerToken, "producerToken");
        AccrualState next = previewGlobal(producerToken, now);
        journal.put(state.getGlobalStates(), producerToken, next);
        return next;
    }

    public AccrualState userAccrue(Address producerToken, Address holder, long now) throws RewardsLedgerException {
        requireIdentity(producerToken, "producerToken");
        requireIdentity(holder, "holder");
        AccrualState next = previewUser(producerToken, holder, now);
        journal.put(state.getUserStates(), new PositionKey(producerToken, holder), next);
        return next;
    }

    /**
     * 计算同步后的全局状态，但不写入 (Global state a sync would produce, without storing it).
     */
    public AccrualState previewGlobal(Address producerToken, long now) throws RewardsLedgerException {
        long supply = queryCollaborator("totalSupply(" + producerToken + ")",
                () -> balanceLedger.totalSupply(producerToken));
        return integrate(globalState(producerToken), now, supply);
    }

    public AccrualState previewUser(Address producerToken, Address holder, long now) throws RewardsLedgerException {
        long balance = queryCollaborator("balanceOf(" + producerToken + ", " + holder + ")",
                () -> balanceLedger.balanceOf(producerToken, holder));
        return integrate(userState(producerToken, holder), now, balance);
    }

    public AccrualState globalState(Address producerToken) {
        return state.getGlobalStates().getOrDefault(producerToken, AccrualState.uninitialized());
    }

    public AccrualState userState(Address producerToken, Address holder) {
        return state.getUserStates().getOrDefault(new PositionKey(producerToken, holder), AccrualState.uninitialized());
    }

    /**
     * 领取后扣减积分 (Point deduction after a claim).
     */
    public void resetUserPoints(Address producerToken, Address holder) {
        PositionKey key = new PositionKey(producerToken, holder);
        journal.put(state.getUserStates(), key, userState(producerToken, holder).withPoints(0L));
    }

    public void deductGlobalPoints(Address producerToken, long points) throws RewardsLedgerException {
        AccrualState current = globalState(producerToken);
        journal.put(state.getGlobalStates(), producerToken,
                current.withPoints(AmountMath.subtract(current.getPoints(), points)));
    }

    static AccrualState integrate(AccrualState current, long now, long observed) throws RewardsLedgerException {
        if (!current.isInitialized()) {
            return AccrualState.of(now, observed, current.getPoints());
        }
        long last = current.getLastUpdate();
        if (now < last) {
            log.warn("Clock went backwards: lastUpdate={}, now={}. Elapsed time clamped to zero.", last, now);
        }
        long elapsed = Math.max(0L, now - last);
        long points = AmountMath.add(current.getPoints(), AmountMath.multiply(current.getLastAmount(), elapsed));
        return AccrualState.of(Math.max(last, now), observed, points);
    }
}
