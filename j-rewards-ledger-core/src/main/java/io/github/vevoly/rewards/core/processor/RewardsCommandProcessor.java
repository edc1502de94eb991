package io.github.vevoly.rewards.core.processor;

import io.github.vevoly.rewards.api.BusinessProcessor;
import io.github.vevoly.rewards.api.command.RewardsCommand;
import io.github.vevoly.rewards.api.exception.InitializationException;
import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.ClaimResult;
import io.github.vevoly.rewards.api.model.HarvestReport;
import io.github.vevoly.rewards.api.model.RewardMovement;
import io.github.vevoly.rewards.api.model.RewardReceipt;
import io.github.vevoly.rewards.api.spi.BalanceLedger;
import io.github.vevoly.rewards.api.spi.ContractInspector;
import io.github.vevoly.rewards.api.spi.HarvestSource;
import io.github.vevoly.rewards.api.spi.RewardTransfer;
import io.github.vevoly.rewards.core.RewardsDistributor;
import io.github.vevoly.rewards.core.state.RewardsState;
import lombok.extern.slf4j.Slf4j;

/**
 * <h3>奖励命令处理器 (Rewards Command Processor)</h3>
 *
 * <p>
 * 把 {@link RewardsCommand} 翻译成对 {@link RewardsDistributor} 的调用，并生成审计回执。
 * 分配器绑定在引擎当前持有的状态上；状态对象被替换 (例如加载快照) 时自动重新绑定。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Rewards Command Processor.</b><br>
 * Translates a {@link RewardsCommand} into a {@link RewardsDistributor} call and produces the audit receipt.
 * The distributor is bound to the state the engine currently holds and is rebound when that state object is replaced.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class RewardsCommandProcessor implements BusinessProcessor<RewardsState, RewardsCommand, RewardReceipt> {

    private final BalanceLedger balanceLedger;
    private final HarvestSource harvestSource;
    private final RewardTransfer rewardTransfer;
    private final ContractInspector contractInspector;
    private final PinnedClock clock = new PinnedClock();

    private RewardsState boundState;
    private RewardsDistributor distributor;

    public RewardsCommandProcessor(BalanceLedger balanceLedger, HarvestSource harvestSource,
                                   RewardTransfer rewardTransfer, ContractInspector contractInspector) {
        this.balanceLedger = balanceLedger;
        this.harvestSource = harvestSource;
        this.rewardTransfer = rewardTransfer;
        this.contractInspector = contractInspector;
    }

    @Override
    public Outcome<RewardReceipt> process(RewardsState state, RewardsCommand command, long timestamp)
            throws RewardsLedgerException {
        if (command.getType() == null) {
            throw new RewardsLedgerException(RewardsErrorCode.INVALID_ARGUMENT, "Command type is required");
        }
        RewardsDistributor d = view(state, timestamp);
        RewardReceipt receipt = new RewardReceipt(command.getTxId(), command.getType(), timestamp,
                command.getCaller(), command.getProducerToken(), command.getAccount());
        Object result = dispatch(d, command, receipt);
        return new Outcome<>(result, receipt);
    }

    /**
     * 返回绑定到给定状态、时钟固定在给定时刻的分配器，供只读查询使用。
     * <br><span style="color: gray;">Distributor bound to the given state with the clock pinned at the given instant; used for reads.</span>
     */
    public RewardsDistributor view(RewardsState state, long timestamp) throws InitializationException {
        clock.pin(timestamp);
        if (distributor == null || boundState != state) {
            distributor = RewardsDistributor.builder()
                    .state(state)
                    .balanceLedger(balanceLedger)
                    .harvestSource(harvestSource)
                    .rewardTransfer(rewardTransfer)
                    .contractInspector(contractInspector)
                    .clock(clock)
                    .build();
            boundState = state;
            log.debug("Distributor bound to a new state instance");
        }
        return distributor;
    }

    private Object dispatch(RewardsDistributor d, RewardsCommand c, RewardReceipt receipt) throws RewardsLedgerException {
        switch (c.getType()) {
            case GLOBAL_ACCRUE:
                return d.globalAccrue(c.getProducerToken());
            case USER_ACCRUE:
                return d.userAccrue(c.getProducerToken(), c.getAccount());
            case ADD_REWARD_TOKEN:
                d.addRewardToken(c.getCaller(), c.getProducerToken(), c.getRewardToken());
                return null;
            case REMOVE_REWARD_TOKEN:
                return d.removeRewardToken(c.getCaller(), c.getProducerToken(), c.getIndex());
            case REMOVE_REWARD_TOKEN_BY_ADDRESS:
                return d.removeRewardToken(c.getCaller(), c.getProducerToken(), c.getRewardToken());
            case REWARD_ACCRUE: {
                long balance = d.rewardAccrue(c.getCaller(), c.getProducerToken(), c.getRewardToken(), c.getAmount());
                receipt.getMovements().add(new RewardMovement(c.getProducerToken(), c.getRewardToken(), c.getCaller(), c.getAmount()));
                return balance;
            }
            case HARVEST: {
                HarvestReport report = d.harvest();
                receipt.getMovements().addAll(report.getDeposits());
                return report;
            }
            case CLAIM: {
                ClaimResult result = d.claim(c.getProducerToken(), c.getAccount());
                receipt.getMovements().addAll(result.getPayouts());
                return result;
            }
            case SET_REWARD_RECIPIENT:
                d.setRewardRecipient(c.getCaller(), c.getProducerToken(), c.getRewardToken(), c.getRecipient());
                return null;
            case UNSET_REWARD_RECIPIENT:
                d.unsetRewardRecipient(c.getCaller(), c.getProducerToken(), c.getRewardToken());
                return null;
            case SET_REWARD_RECIPIENT_PRIVILEGED:
                d.setRewardRecipientPrivileged(c.getCaller(), c.getAccount(), c.getProducerToken(), c.getRewardToken(), c.getRecipient());
                return null;
            case UNSET_REWARD_RECIPIENT_PRIVILEGED:
                d.unsetRewardRecipientPrivileged(c.getCaller(), c.getAccount(), c.getProducerToken(), c.getRewardToken());
                return null;
            case SET_HARVESTER:
                d.setHarvester(c.getCaller(), c.getAccount());
                return null;
            case TRANSFER_ADMINISTRATION:
                d.transferAdministration(c.getCaller(), c.getAccount());
                return null;
            default:
                throw new RewardsLedgerException(RewardsErrorCode.INVALID_ARGUMENT, "Unsupported command type: " + c.getType());
        }
    }
}
