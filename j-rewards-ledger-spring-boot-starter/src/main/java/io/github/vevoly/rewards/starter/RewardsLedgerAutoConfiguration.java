package io.github.vevoly.rewards.starter;

import io.github.vevoly.rewards.api.BatchWriter;
import io.github.vevoly.rewards.api.IdempotencyStrategy;
import io.github.vevoly.rewards.api.constants.IdempotencyType;
import io.github.vevoly.rewards.api.constants.JRewardsLedgerConstant;
import io.github.vevoly.rewards.api.exception.InitializationException;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.api.model.RewardReceipt;
import io.github.vevoly.rewards.api.spi.BalanceLedger;
import io.github.vevoly.rewards.api.spi.ContractInspector;
import io.github.vevoly.rewards.api.spi.HarvestSource;
import io.github.vevoly.rewards.api.spi.RewardTransfer;
import io.github.vevoly.rewards.core.RewardsLedgerEngine;
import io.github.vevoly.rewards.core.idempotency.BloomFilterIdempotencyStrategy;
import io.github.vevoly.rewards.core.idempotency.LruIdempotencyStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * <h3>核心自动装配类 (Core Auto-Configuration)</h3>
 *
 * <p>
 * 利用 Spring Boot 的自动配置机制，将配置文件、核心引擎与用户提供的外部协作方组装在一起。
 * 只有当用户提供了四个协作方 Bean（BalanceLedger, HarvestSource, RewardTransfer, ContractInspector）
 * 并配置了存储路径与管理员时，引擎才会启动。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Core Auto-Configuration.</b><br>
 * Assembles configuration, the core engine and the user's collaborator beans.<br>
 * The engine starts only when all four collaborator beans exist and both base-dir and administrator are configured.
 * A {@link BatchWriter}, a {@link MeterRegistry} and a {@link Clock} bean are picked up when present.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RewardsLedgerProperties.class)
public class RewardsLedgerAutoConfiguration {

    /**
     * 初始化幂等去重策略 (Initialize Idempotency Strategy).
     * <ul>
     *     <li><b>LRU:</b> 适合小规模精准去重。/ Exact deduplication over a bounded window</li>
     *     <li><b>BLOOM (Default):</b> 适合海量数据去重。/ Suitable for massive data deduplication</li>
     * </ul>
     */
    @Bean
    @ConditionalOnMissingBean(IdempotencyStrategy.class)
    public IdempotencyStrategy defaultIdempotencyStrategy(RewardsLedgerProperties props) {
        if (props.getIdempotency() == IdempotencyType.LRU) {
            return new LruIdempotencyStrategy();
        }
        return new BloomFilterIdempotencyStrategy();
    }

    /**
     * <h3>核心引擎 Bean (Core Rewards Engine Bean)</h3>
     *
     * <ul>
     *     <li><b>initMethod = "start":</b> Spring 容器启动时自动恢复快照并启动线程。</li>
     *     <li><b>destroyMethod = "shutdown":</b> Spring 容器销毁时自动执行优雅停机 (强制快照 + 排空队列)。</li>
     * </ul>
     *
     * <hr>
     *
     * <span style="color: gray; font-size: 0.9em;">
     * <b>initMethod = "start":</b> snapshot recovery and thread startup on container boot.<br>
     * <b>destroyMethod = "shutdown":</b> graceful shutdown (forced snapshot + drained queue) on container destroy.
     * </span>
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(RewardsLedgerEngine.class)
    @ConditionalOnBean({BalanceLedger.class, HarvestSource.class, RewardTransfer.class, ContractInspector.class})
    @ConditionalOnProperty(prefix = JRewardsLedgerConstant.J_REWARDS_LEDGER_ID, name = {"base-dir", "administrator"})
    public RewardsLedgerEngine rewardsLedgerEngine(
            RewardsLedgerProperties props,
            BalanceLedger balanceLedger,
            HarvestSource harvestSource,
            RewardTransfer rewardTransfer,
            ContractInspector contractInspector,
            IdempotencyStrategy idempotencyStrategy,
            ObjectProvider<BatchWriter<RewardReceipt>> batchWriterProvider,
            ObjectProvider<MeterRegistry> registryProvider,
            ObjectProvider<Clock> clockProvider
    ) throws InitializationException {
        Address administrator;
        Address harvester;
        try {
            administrator = Address.of(props.getAdministrator());
            harvester = props.getHarvester() == null || props.getHarvester().isBlank() ? null : Address.of(props.getHarvester());
        } catch (IllegalArgumentException e) {
            throw new InitializationException("Invalid j-rewards-ledger address property: " + e.getMessage(), e);
        }
        BatchWriter<RewardReceipt> batchWriter = batchWriterProvider.getIfAvailable();
        if (batchWriter == null) {
            log.info("未发现 BatchWriter Bean，回执只写入本地日志。/ No BatchWriter bean, receipts go to the local journal only.");
        }
        return RewardsLedgerEngine.builder()
                .baseDir(props.getBaseDir())
                .name(props.getEngineName())
                .queueSize(props.getQueueSize())
                .batchSize(props.getBatchSize())
                .ringBufferSize(props.getRingBufferSize())
                .snapshotInterval(props.getSnapshotInterval())
                .enableTimeSnapshot(props.isEnableTimeSnapshot())
                .snapshotTimeInterval(props.getSnapshotTimeInterval())
                .journalEnabled(props.isJournalEnabled())
                .metricsPrefix(props.getMetricsPrefix())
                .administrator(administrator)
                .harvester(harvester)
                .balanceLedger(balanceLedger)
                .harvestSource(harvestSource)
                .rewardTransfer(rewardTransfer)
                .contractInspector(contractInspector)
                .batchWriter(batchWriter)
                .idempotency(idempotencyStrategy)
                .meterRegistry(registryProvider.getIfAvailable())
                .clock(clockProvider.getIfAvailable(Clock::systemUTC))
                .build();
    }
}
