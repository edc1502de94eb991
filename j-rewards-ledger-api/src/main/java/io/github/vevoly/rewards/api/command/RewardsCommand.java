package io.github.vevoly.rewards.api.command;

import io.github.vevoly.rewards.api.model.Address;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.util.concurrent.CompletableFuture;

/**
 * <h3>奖励账本命令 (Rewards Ledger Command)</h3>
 *
 * <p>
 * 一个命令对象承载一次对外操作的全部参数，由 {@link CommandType} 决定哪些字段有效。
 * 建议通过静态工厂方法创建，避免漏填字段。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Rewards Ledger Command.</b><br>
 * Carries every argument of one operation; {@link CommandType} decides which fields apply.
 * Prefer the static factories, which fill exactly the fields each operation reads.
 * </span>
 *
 * <h3>字段含义 (Field Usage):</h3>
 * <ul>
 *     <li><b>caller:</b> 发起方身份，管理员操作与存入操作据此鉴权。<br>
 *     <span style="color: gray;">Identity the capability checks run against.</span></li>
 *     <li><b>account:</b> 持有人 / 包装合约 / 新的收获方 / 新的管理员。<br>
 *     <span style="color: gray;">Holder, wrapper, new harvester or new administrator.</span></li>
 * </ul>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
public class RewardsCommand implements LedgerCommand {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * 业务唯一ID (Transaction ID)，可为空。
     * <br><span style="color: gray;">Optional id for idempotency deduplication.</span>
     */
    private String txId;

    private CommandType type;

    private Address caller;

    private Address producerToken;

    private Address rewardToken;

    private Address account;

    private Address recipient;

    private int index;

    private long amount;

    /**
     * 异步结果通知句柄，仅用于内存中的线程通信，不参与序列化。
     * <br><span style="color: gray;">In-memory result handle; transient, never serialized.</span>
     */
    private transient CompletableFuture<Object> future;

    private RewardsCommand(CommandType type, Address caller) {
        this.type = type;
        this.caller = caller;
    }

    @Override
    public String getUniqueId() {
        return txId;
    }

    /**
     * 附加幂等 ID (Attach idempotency id).
     */
    public RewardsCommand withTxId(String txId) {
        this.txId = txId;
        return this;
    }

    public static RewardsCommand globalAccrue(Address producerToken) {
        RewardsCommand cmd = new RewardsCommand(CommandType.GLOBAL_ACCRUE, null);
        cmd.producerToken = producerToken;
        return cmd;
    }

    public static RewardsCommand userAccrue(Address producerToken, Address holder) {
        RewardsCommand cmd = new RewardsCommand(CommandType.USER_ACCRUE, null);
        cmd.producerToken = producerToken;
        cmd.account = holder;
        return cmd;
    }

    public static RewardsCommand addRewardToken(Address caller, Address producerToken, Address rewardToken) {
        RewardsCommand cmd = new RewardsCommand(CommandType.ADD_REWARD_TOKEN, caller);
        cmd.producerToken = producerToken;
        cmd.rewardToken = rewardToken;
        return cmd;
    }

    public static RewardsCommand removeRewardToken(Address caller, Address producerToken, int index) {
        RewardsCommand cmd = new RewardsCommand(CommandType.REMOVE_REWARD_TOKEN, caller);
        cmd.producerToken = producerToken;
        cmd.index = index;
        return cmd;
    }

    public static RewardsCommand removeRewardToken(Address caller, Address producerToken, Address rewardToken) {
        RewardsCommand cmd = new RewardsCommand(CommandType.REMOVE_REWARD_TOKEN_BY_ADDRESS, caller);
        cmd.producerToken = producerToken;
        cmd.rewardToken = rewardToken;
        return cmd;
    }

    public static RewardsCommand rewardAccrue(Address caller, Address producerToken, Address rewardToken, long amount) {
        RewardsCommand cmd = new RewardsCommand(CommandType.REWARD_ACCRUE, caller);
        cmd.producerToken = producerToken;
        cmd.rewardToken = rewardToken;
        cmd.amount = amount;
        return cmd;
    }

    public static RewardsCommand harvest() {
        return new RewardsCommand(CommandType.HARVEST, null);
    }

    public static RewardsCommand claim(Address producerToken, Address holder) {
        RewardsCommand cmd = new RewardsCommand(CommandType.CLAIM, holder);
        cmd.producerToken = producerToken;
        cmd.account = holder;
        return cmd;
    }

    public static RewardsCommand setRewardRecipient(Address caller, Address producerToken, Address rewardToken, Address recipient) {
        RewardsCommand cmd = new RewardsCommand(CommandType.SET_REWARD_RECIPIENT, caller);
        cmd.producerToken = producerToken;
        cmd.rewardToken = rewardToken;
        cmd.recipient = recipient;
        return cmd;
    }

    public static RewardsCommand unsetRewardRecipient(Address caller, Address producerToken, Address rewardToken) {
        RewardsCommand cmd = new RewardsCommand(CommandType.UNSET_REWARD_RECIPIENT, caller);
        cmd.producerToken = producerToken;
        cmd.rewardToken = rewardToken;
        return cmd;
    }

    public static RewardsCommand setRewardRecipientPrivileged(Address caller, Address wrapper, Address producerToken,
                                                              Address rewardToken, Address recipient) {
        RewardsCommand cmd = new RewardsCommand(CommandType.SET_REWARD_RECIPIENT_PRIVILEGED, caller);
        cmd.account = wrapper;
        cmd.producerToken = producerToken;
        cmd.rewardToken = rewardToken;
        cmd.recipient = recipient;
        return cmd;
    }

    public static RewardsCommand unsetRewardRecipientPrivileged(Address caller, Address wrapper, Address producerToken,
                                                                Address rewardToken) {
        RewardsCommand cmd = new RewardsCommand(CommandType.UNSET_REWARD_RECIPIENT_PRIVILEGED, caller);
        cmd.account = wrapper;
        cmd.producerToken = producerToken;
        cmd.rewardToken = rewardToken;
        return cmd;
    }

    public static RewardsCommand setHarvester(Address caller, Address harvester) {
        RewardsCommand cmd = new RewardsCommand(CommandType.SET_HARVESTER, caller);
        cmd.account = harvester;
        return cmd;
    }

    public static RewardsCommand transferAdministration(Address caller, Address newAdministrator) {
        RewardsCommand cmd = new RewardsCommand(CommandType.TRANSFER_ADMINISTRATION, caller);
        cmd.account = newAdministrator;
        return cmd;
    }
}
