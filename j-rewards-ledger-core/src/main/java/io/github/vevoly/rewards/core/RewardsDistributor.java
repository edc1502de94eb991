package io.github.vevoly.rewards.core;

import io.github.vevoly.rewards.api.exception.InitializationException;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.exception.ZeroAmountException;
import io.github.vevoly.rewards.api.model.AccrualState;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.api.model.ClaimResult;
import io.github.vevoly.rewards.api.model.HarvestReport;
import io.github.vevoly.rewards.api.spi.BalanceLedger;
import io.github.vevoly.rewards.api.spi.ContractInspector;
import io.github.vevoly.rewards.api.spi.HarvestSource;
import io.github.vevoly.rewards.api.spi.RewardTransfer;
import io.github.vevoly.rewards.core.access.AccessPolicy;
import io.github.vevoly.rewards.core.accrual.AccrualLedger;
import io.github.vevoly.rewards.core.claim.ClaimEngine;
import io.github.vevoly.rewards.core.harvest.HarvestCoordinator;
import io.github.vevoly.rewards.core.recipient.RecipientDirectory;
import io.github.vevoly.rewards.core.registry.RewardTokenRegistry;
import io.github.vevoly.rewards.core.silo.RewardSilo;
import io.github.vevoly.rewards.core.state.RewardsState;
import io.github.vevoly.rewards.core.state.StateJournal;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static io.github.vevoly.rewards.core.LedgerChecks.requireIdentity;
import static io.github.vevoly.rewards.core.LedgerChecks.requireNonNegative;

/**
 * <h3>奖励分配器 (Rewards Distributor)</h3>
 *
 * <p>
 * 同步 API，聚合积分累计、注册表、奖励仓、接收人与领取。每个公开操作都是原子的：
 * 所有修改先记入撤销日志，任何失败 (包括外部发放失败) 都会把状态回滚到操作开始前，
 * 然后把具体异常抛给调用方。发放过程中的重入调用拥有自己的保存点。
 * </p>
 *
 * <p style="color: red">
 * <b>⚠️ 非线程安全：</b> 多线程场景请使用 {@link RewardsLedgerEngine}，它在单一线程上串行驱动本类。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Rewards Distributor.</b><br>
 * Synchronous API over accrual, registry, silo, recipients and claims. Every public operation is atomic:
 * mutations go to the undo journal first and any failure, a failing external delivery included, rolls the
 * state back to the operation start before the specific exception reaches the caller.
 * Reentrant calls made during a delivery get their own savepoint.<br>
 * <b>⚠️ Not thread-safe.</b> Use {@link RewardsLedgerEngine} for concurrent callers.
 * </span>
 *
 * <h3>时间 (Time)：</h3>
 * <p>
 * 最外层操作开始时读取一次时钟 (秒)，嵌套调用沿用同一时刻。
 * <br><span style="color: gray;">The clock is read once, in epoch seconds, when the outermost operation starts; nested calls share that instant.</span>
 * </p>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class RewardsDistributor {

    private final RewardsState state;
    private final StateJournal journal = new StateJournal();
    private final Clock clock;

    private final AccrualLedger accrualLedger;
    private final RewardTokenRegistry registry;
    private final RewardSilo silo;
    private final RecipientDirectory recipients;
    private final AccessPolicy accessPolicy;
    private final HarvestCoordinator harvestCoordinator;
    private final ClaimEngine claimEngine;

    private int depth;
    private long operationTime;

    private RewardsDistributor(Builder builder) {
        this.state = builder.state;
        this.clock = builder.clock;
        this.accrualLedger = new AccrualLedger(state, journal, builder.balanceLedger);
        this.registry = new RewardTokenRegistry(state, journal);
        this.silo = new RewardSilo(state, journal);
        this.recipients = new RecipientDirectory(state, journal, builder.contractInspector);
        this.accessPolicy = new AccessPolicy(state, journal);
        this.harvestCoordinator = new HarvestCoordinator(accrualLedger, registry, silo, accessPolicy, builder.harvestSource);
        this.claimEngine = new ClaimEngine(accrualLedger, registry, silo, recipients, builder.rewardTransfer);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ==================== Accrual ====================

    public AccrualState globalAccrue(Address producerToken) throws RewardsLedgerException {
        return inTransaction("globalAccrue", now -> accrualLedger.globalAccrue(producerToken, now));
    }

    public AccrualState userAccrue(Address producerToken, Address holder) throws RewardsLedgerException {
        return inTransaction("userAccrue", now -> accrualLedger.userAccrue(producerToken, holder, now));
    }

    // ==================== Registry ====================

    public void addRewardToken(Address caller, Address producerToken, Address rewardToken) throws RewardsLedgerException {
        inTransaction("addRewardToken", now -> {
            accessPolicy.requireAdministrator(caller);
            registry.add(producerToken, rewardToken);
            log.info("Reward token registered: producer={}, reward={}", producerToken, rewardToken);
            return null;
        });
    }

    /**
     * 按下标删除。会把末尾元素换到该位置，调用前请重新读取注册表。
     * <br><span style="color: gray;">Removes by index; the last entry moves into the slot, so re-read the registry before indexing again.</span>
     *
     * @return 被删除的奖励代币 (The removed reward token)
     */
    public Address removeRewardToken(Address caller, Address producerToken, int index) throws RewardsLedgerException {
        return inTransaction("removeRewardToken", now -> {
            accessPolicy.requireAdministrator(caller);
            requireIdentity(producerToken, "producerToken");
            Address removed = registry.removeAt(producerToken, index);
            log.info("Reward token removed: producer={}, reward={}, index={}", producerToken, removed, index);
            return removed;
        });
    }

    /**
     * 按身份删除 (Removes by identity).
     *
     * @return 删除前所在的下标 (Index the token occupied before removal)
     */
    public int removeRewardToken(Address caller, Address producerToken, Address rewardToken) throws RewardsLedgerException {
        return inTransaction("removeRewardToken", now -> {
            accessPolicy.requireAdministrator(caller);
            requireIdentity(producerToken, "producerToken");
            requireIdentity(rewardToken, "rewardToken");
            int index = registry.remove(producerToken, rewardToken);
            log.info("Reward token removed: producer={}, reward={}, index={}", producerToken, rewardToken, index);
            return index;
        });
    }

    // ==================== Silo & Harvest ====================

    /**
     * 收获方向奖励仓存入 (Harvester deposit into a silo).
     *
     * @return 存入后的奖励仓余额 (Silo balance after the deposit)
     */
    public long rewardAccrue(Address caller, Address producerToken, Address rewardToken, long amount)
            throws RewardsLedgerException {
        return inTransaction("rewardAccrue", now -> {
            accessPolicy.requireHarvester(caller);
            requireIdentity(producerToken, "producerToken");
            requireIdentity(rewardToken, "rewardToken");
            requireNonNegative(amount, "amount");
            if (amount == 0L) {
                throw new ZeroAmountException("Deposit amount must be positive");
            }
            return silo.credit(producerToken, rewardToken, amount);
        });
    }

    public HarvestReport harvest() throws RewardsLedgerException {
        HarvestReport report = inTransaction("harvest", harvestCoordinator::harvest);
        log.info("Harvest completed: {} deposit(s)", report.getDeposits().size());
        return report;
    }

    // ==================== Claim ====================

    public ClaimResult claim(Address producerToken, Address holder) throws RewardsLedgerException {
        return inTransaction("claim", now -> claimEngine.claim(producerToken, holder, now));
    }

    // ==================== Recipients ====================

    public void setRewardRecipient(Address caller, Address producerToken, Address rewardToken, Address recipient)
            throws RewardsLedgerException {
        inTransaction("setRewardRecipient", now -> {
            recipients.setPersonal(caller, producerToken, rewardToken, recipient);
            return null;
        });
    }

    public void unsetRewardRecipient(Address caller, Address producerToken, Address rewardToken) throws RewardsLedgerException {
        inTransaction("unsetRewardRecipient", now -> {
            recipients.unsetPersonal(caller, producerToken, rewardToken);
            return null;
        });
    }

    public void setRewardRecipientPrivileged(Address caller, Address wrapper, Address producerToken, Address rewardToken,
                                             Address recipient) throws RewardsLedgerException {
        inTransaction("setRewardRecipientPrivileged", now -> {
            accessPolicy.requireAdministrator(caller);
            recipients.setPrivileged(wrapper, producerToken, rewardToken, recipient);
            log.info("Privileged recipient set: wrapper={}, producer={}, reward={}, recipient={}",
                    wrapper, producerToken, rewardToken, recipient);
            return null;
        });
    }

    public void unsetRewardRecipientPrivileged(Address caller, Address wrapper, Address producerToken, Address rewardToken)
            throws RewardsLedgerException {
        inTransaction("unsetRewardRecipientPrivileged", now -> {
            accessPolicy.requireAdministrator(caller);
            recipients.unsetPrivileged(wrapper, producerToken, rewardToken);
            log.info("Privileged recipient unset: wrapper={}, producer={}, reward={}", wrapper, producerToken, rewardToken);
            return null;
        });
    }

    // ==================== Administration ====================

    public void setHarvester(Address caller, Address harvester) throws RewardsLedgerException {
        inTransaction("setHarvester", now -> {
            accessPolicy.setHarvester(caller, harvester);
            return null;
        });
    }

    public void transferAdministration(Address caller, Address newAdministrator) throws RewardsLedgerException {
        inTransaction("transferAdministration", now -> {
            accessPolicy.transferAdministration(caller, newAdministrator);
            return null;
        });
    }

    // ==================== Read surface ====================

    public AccrualState getGlobalState(Address producerToken) {
        return accrualLedger.globalState(producerToken);
    }

    public AccrualState getUserState(Address producerToken, Address holder) {
        return accrualLedger.userState(producerToken, holder);
    }

    public List<Address> getRewardTokens(Address producerToken) {
        return registry.tokens(producerToken);
    }

    public List<Address> getProducers() {
        return registry.producers();
    }

    public long getSiloBalance(Address producerToken, Address rewardToken) {
        return silo.balance(producerToken, rewardToken);
    }

    public Address resolveRecipient(Address account, Address producerToken, Address rewardToken) {
        return recipients.resolve(account, producerToken, rewardToken);
    }

    public Optional<Address> getPersonalRecipient(Address holder, Address producerToken, Address rewardToken) {
        return recipients.personal(holder, producerToken, rewardToken);
    }

    public Optional<Address> getPrivilegedRecipient(Address wrapper, Address producerToken, Address rewardToken) {
        return recipients.privileged(wrapper, producerToken, rewardToken);
    }

    public Address getAdministrator() {
        return accessPolicy.administrator();
    }

    public Address getHarvester() {
        return accessPolicy.harvester();
    }

    /**
     * 若此刻同步，持有人将拥有的积分 (Points the holder would have if synced now).
     */
    public long pendingPoints(Address producerToken, Address holder) throws RewardsLedgerException {
        requireIdentity(producerToken, "producerToken");
        requireIdentity(holder, "holder");
        return accrualLedger.previewUser(producerToken, holder, currentTime()).getPoints();
    }

    public long pendingReward(Address producerToken, Address holder, Address rewardToken) throws RewardsLedgerException {
        return claimEngine.preview(producerToken, holder, rewardToken, currentTime());
    }

    /**
     * 收获源中尚未收获的数量 (Amount still waiting at the harvest source).
     */
    public long pendingHarvest(Address producerToken, Address rewardToken) throws RewardsLedgerException {
        requireIdentity(producerToken, "producerToken");
        requireIdentity(rewardToken, "rewardToken");
        return harvestCoordinator.claimable(producerToken, rewardToken);
    }

    public RewardsState getState() {
        return state;
    }

    // ==================== Transactions ====================

    private <T> T inTransaction(String operation, Operation<T> body) throws RewardsLedgerException {
        int savepoint = journal.savepoint();
        if (depth == 0) {
            operationTime = clock.instant().getEpochSecond();
        }
        depth++;
        try {
            T result = body.run(operationTime);
            journal.release(savepoint);
            return result;
        } catch (RewardsLedgerException e) {
            journal.rollbackTo(savepoint);
            log.warn("{} rejected [{}]: {}", operation, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            journal.rollbackTo(savepoint);
            log.error("{} failed unexpectedly, state rolled back", operation, e);
            throw e;
        } finally {
            depth--;
        }
    }

    private long currentTime() {
        return depth > 0 ? operationTime : clock.instant().getEpochSecond();
    }

    @FunctionalInterface
    private interface Operation<T> {
        T run(long now) throws RewardsLedgerException;
    }

    /**
     * 构建器。未传入状态时按管理员与收获方新建空状态。
     * <br><span style="color: gray;">Builder. Without an explicit state a fresh one is created from the administrator and harvester.</span>
     */
    public static class Builder {
        private RewardsState state;
        private Address administrator;
        private Address harvester;
        private BalanceLedger balanceLedger;
        private HarvestSource harvestSource;
        private RewardTransfer rewardTransfer;
        private ContractInspector contractInspector;
        private Clock clock = Clock.systemUTC();

        public Builder state(RewardsState state) { this.state = state; return this; }
        public Builder administrator(Address administrator) { this.administrator = administrator; return this; }
        public Builder harvester(Address harvester) { this.harvester = harvester; return this; }
        public Builder balanceLedger(BalanceLedger balanceLedger) { this.balanceLedger = balanceLedger; return this; }
        public Builder harvestSource(HarvestSource harvestSource) { this.harvestSource = harvestSource; return this; }
        public Builder rewardTransfer(RewardTransfer rewardTransfer) { this.rewardTransfer = rewardTransfer; return this; }
        public Builder contractInspector(ContractInspector contractInspector) { this.contractInspector = contractInspector; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }

        public RewardsDistributor build() throws InitializationException {
            if (balanceLedger == null || harvestSource == null || rewardTransfer == null || contractInspector == null) {
                throw new InitializationException(
                        "BalanceLedger, HarvestSource, RewardTransfer and ContractInspector are all required");
            }
            if (clock == null) {
                throw new InitializationException("Clock is required");
            }
            if (state == null) {
                if (Address.isNull(administrator)) {
                    throw new InitializationException("An administrator is required when no state is supplied");
                }
                state = new RewardsState(administrator, Address.isNull(harvester) ? null : harvester);
            }
            return new RewardsDistributor(this);
        }
    }
}
