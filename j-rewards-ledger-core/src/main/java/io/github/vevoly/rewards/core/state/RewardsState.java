package io.github.vevoly.rewards.core.state;

import io.github.vevoly.rewards.api.model.AccrualState;
import io.github.vevoly.rewards.api.model.Address;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <h3>奖励账本内存状态 (Rewards Ledger State)</h3>
 *
 * <p>
 * 这个类相当于 <b>"内存数据库"</b>。引擎启动时从快照加载；运行时所有操作都直接修改它，
 * 并且每次修改都先记入 {@link StateJournal}，以便失败时整笔回滚。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Rewards Ledger State.</b><br>
 * The in-memory database. Loaded from the snapshot on startup and mutated in place at runtime,
 * every mutation recorded in the {@link StateJournal} first so a failed operation can be undone as a whole.
 * </span>
 *
 * <h3>约定 (Conventions)：</h3>
 * <ul>
 *     <li>Map 中的值一律视为不可变，修改即替换。<br>
 *     <span style="color: gray;">Map values are treated as immutable; a change replaces the value.</span></li>
 *     <li>奖励仓条目清零后保留，不删除。<br>
 *     <span style="color: gray;">Silo entries persist at zero.</span></li>
 * </ul>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
public class RewardsState implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * 管理员 (Administrator capability holder).
     */
    private Address administrator;

    /**
     * 收获方，唯一允许直接存入奖励仓的身份 (Harvester capability holder).
     */
    private Address harvester;

    /**
     * 全局累计状态，按生产代币 (Global accrual state per producer token).
     */
    private Map<Address, AccrualState> globalStates = new LinkedHashMap<>();

    /**
     * 用户累计状态 (User accrual state per producer token and holder).
     */
    private Map<PositionKey, AccrualState> userStates = new HashMap<>();

    /**
     * 奖励代币注册表，值为有序列表 (Reward token registry, ordered per producer token).
     */
    private Map<Address, List<Address>> rewardTokens = new LinkedHashMap<>();

    /**
     * 奖励仓：已收获未领取的数量 (Harvested but unclaimed amounts).
     */
    private Map<RewardPairKey, Long> silos = new HashMap<>();

    private Map<RouteKey, Address> personalRecipients = new HashMap<>();

    private Map<RouteKey, Address> privilegedRecipients = new HashMap<>();

    public RewardsState(Address administrator, Address harvester) {
        this.administrator = administrator;
        this.harvester = harvester;
    }
}
