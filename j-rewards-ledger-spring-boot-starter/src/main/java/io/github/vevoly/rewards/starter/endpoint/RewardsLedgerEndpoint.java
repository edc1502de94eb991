package io.github.vevoly.rewards.starter.endpoint;

import io.github.vevoly.rewards.api.constants.JRewardsLedgerConstant;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.core.ReadQuery;
import io.github.vevoly.rewards.core.RewardsDistributor;
import io.github.vevoly.rewards.core.RewardsLedgerEngine;
import io.github.vevoly.rewards.core.tools.RewardsLedgerAdminUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * <h3>j-rewards-ledger 管理端点</h3>
 * <p>
 * 暴露运维只读接口：引擎概览、持仓积分、回执日志分页与快照内容。
 * 默认关闭，需通过 {@code j-rewards-ledger.admin.enabled=true} 显式开启。
 * 状态读取都经过引擎线程，与命令严格串行。
 * </p>
 *
 * <ul>
 *     <li>GET /actuator/j-rewards-ledger</li>
 *     <li>GET /actuator/j-rewards-ledger/journal?cursor=&amp;pageSize=&amp;backward=&amp;txId=&amp;account=</li>
 *     <li>GET /actuator/j-rewards-ledger/snapshot</li>
 *     <li>GET /actuator/j-rewards-ledger/{producer}/{holder}</li>
 * </ul>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
@Endpoint(id = JRewardsLedgerConstant.J_REWARDS_LEDGER_ID)
public class RewardsLedgerEndpoint {

    private static final long QUERY_TIMEOUT_SECONDS = 5;
    private static final int DEFAULT_PAGE_SIZE = 20;

    private final RewardsLedgerEngine engine;

    public RewardsLedgerEndpoint(RewardsLedgerEngine engine) {
        this.engine = engine;
    }

    @ReadOperation
    public Map<String, Object> overview() {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("engine", engine.getEngineName());
        view.put("running", engine.isRunning());
        view.put("commandCount", engine.getCommandCount());
        view.put("idempotency", engine.getIdempotencyName());
        if (!engine.isRunning()) {
            return view;
        }
        try {
            view.putAll(read(d -> {
                Map<String, Object> state = new LinkedHashMap<>();
                state.put("administrator", d.getAdministrator());
                state.put("harvester", d.getHarvester());
                Map<String, List<Address>> producers = new LinkedHashMap<>();
                for (Address producer : d.getProducers()) {
                    producers.put(producer.getValue(), d.getRewardTokens(producer));
                }
                state.put("rewardTokens", producers);
                return state;
            }));
        } catch (Exception e) {
            view.put("error", e.getMessage());
        }
        return view;
    }

    /**
     * 回执日志分页或快照内容 (Receipt journal page or snapshot dump).
     *
     * @param section journal | snapshot
     */
    @ReadOperation
    public Object section(@Selector String section,
                          @Nullable String cursor,
                          @Nullable Integer pageSize,
                          @Nullable Boolean backward,
                          @Nullable String txId,
                          @Nullable String account) {
        try {
            switch (section) {
                case JRewardsLedgerConstant.JOURNAL_DIR:
                    if (engine.getJournalDir() == null) {
                        return error("Receipt journal is disabled");
                    }
                    return RewardsLedgerAdminUtils.dumpJournalPage(engine.getJournalDir(), cursor,
                            pageSize == null ? DEFAULT_PAGE_SIZE : pageSize,
                            backward == null || backward, txId, account);
                case JRewardsLedgerConstant.SNAPSHOT_DIR:
                    return RewardsLedgerAdminUtils.dumpSnapshot(engine.getSnapshotFile());
                default:
                    return error("Unknown section: " + section);
            }
        } catch (Exception e) {
            log.warn("管理端点读取失败 / Admin endpoint read failed: section={}", section, e);
            return error(e.getMessage());
        }
    }

    /**
     * 某持有人在某生产代币下的积分与待领取奖励 (Points and pending rewards of one holder).
     */
    @ReadOperation
    public Map<String, Object> position(@Selector String producer, @Selector String holder) {
        try {
            Address producerToken = Address.of(producer);
            Address account = Address.of(holder);
            return read(d -> {
                Map<String, Object> view = new LinkedHashMap<>();
                view.put("userState", d.getUserState(producerToken, account));
                view.put("globalState", d.getGlobalState(producerToken));
                view.put("pendingPoints", d.pendingPoints(producerToken, account));
                Map<String, Object> rewards = new LinkedHashMap<>();
                for (Address rewardToken : d.getRewardTokens(producerToken)) {
                    Map<String, Object> reward = new LinkedHashMap<>();
                    reward.put("silo", d.getSiloBalance(producerToken, rewardToken));
                    reward.put("pending", d.pendingReward(producerToken, account, rewardToken));
                    reward.put("recipient", d.resolveRecipient(account, producerToken, rewardToken));
                    rewards.put(rewardToken.getValue(), reward);
                }
                view.put("rewards", rewards);
                return view;
            });
        } catch (Exception e) {
            return error(e.getMessage());
        }
    }

    private <T> T read(ReadQuery<T> query) throws InterruptedException, ExecutionException, TimeoutException {
        return engine.query(query).get(QUERY_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }
}
