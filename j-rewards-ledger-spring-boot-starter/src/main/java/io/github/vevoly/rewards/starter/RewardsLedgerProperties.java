package io.github.vevoly.rewards.starter;

import io.github.vevoly.rewards.api.constants.IdempotencyType;
import io.github.vevoly.rewards.api.constants.JRewardsLedgerConstant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * <h3>核心引擎配置属性 (Engine Configuration Properties)</h3>
 *
 * <p>
 * 对应 {@code application.yml} 中的配置项。前缀为 <b>j-rewards-ledger</b>。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Engine Configuration Properties.</b><br>
 * Maps to configuration items in {@code application.yml}. Prefix: <b>j-rewards-ledger</b>.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = JRewardsLedgerConstant.J_REWARDS_LEDGER_ID)
public class RewardsLedgerProperties {

    /**
     * 数据存储根目录 (Base Directory).
     * <p><b>必填项。</b> 回执日志和快照文件将存储在此目录下。</p>
     * <span style="color: gray;">Mandatory. Root directory for the receipt journal and snapshots. e.g., /data/rewards-data</span>
     */
    private String baseDir;

    /**
     * 引擎名称 (Engine Name).
     * <p>用于目录隔离。当部署多个引擎实例时，需确保名称唯一。</p>
     * <span style="color: gray;">Used for directory isolation. Default: "JRewardsLedgerEngine".</span>
     */
    private String engineName = JRewardsLedgerConstant.DEFAULT_ENGINE_NAME;

    /**
     * 初始管理员地址 (Initial Administrator).
     * <p><b>必填项。</b> 仅在没有快照时使用；恢复快照后以快照中的管理员为准。</p>
     * <span style="color: gray;">Mandatory. Used only when no snapshot exists; a restored snapshot keeps its own administrator.</span>
     */
    private String administrator;

    /**
     * 初始收获方地址，可为空 (Initial Harvester, optional).
     */
    private String harvester;

    /**
     * 数据库批量写入大小 (DB Batch Size).
     * <span style="color: gray;">Receipts accumulated before one {@code BatchWriter} call. Default: 1000.</span>
     */
    private int batchSize = JRewardsLedgerConstant.DEFAULT_BATCH_SIZE;

    /**
     * 异步落库队列大小 (Async Queue Size).
     * <p>队列满时会阻塞核心业务（背压机制）。</p>
     * <span style="color: gray;">Blocks the engine thread when full (Backpressure). Default: 65536.</span>
     */
    private int queueSize = JRewardsLedgerConstant.DEFAULT_QUEUE_SIZE;

    /**
     * RingBuffer 大小，必须是 2 的幂 (Ring buffer size, a power of 2).
     */
    private int ringBufferSize = JRewardsLedgerConstant.DEFAULT_RING_BUFFER_SIZE;

    /**
     * 自动快照间隔 (Snapshot Interval).
     * <p>提交多少条命令后触发一次自动快照保存。</p>
     * <span style="color: gray;">Triggers an automatic snapshot after this many committed commands. Default: 50,000.</span>
     */
    private int snapshotInterval = JRewardsLedgerConstant.DEFAULT_SNAPSHOT_INTERVAL;

    private boolean enableTimeSnapshot = JRewardsLedgerConstant.DEFAULT_ENABLE_TIME_SNAPSHOT;

    /**
     * 自动快照时间间隔 (Time-based Auto Snapshot Interval).
     * <p>默认 10分钟。支持格式: 10m, 1h, 30s</p>
     * <span style="color: gray;">Default: 10m. Supports formats: 10m, 1h, 30s</span>
     */
    private Duration snapshotTimeInterval = JRewardsLedgerConstant.DEFAULT_SNAPSHOT_TIME_INTERVAL;

    /**
     * 幂等去重策略类型 (Idempotency Strategy Type).
     * <p>默认为布隆过滤器 (BLOOM)。</p>
     * <span style="color: gray;">Deduplication strategy. Default: BLOOM.</span>
     */
    private IdempotencyType idempotency = IdempotencyType.BLOOM;

    /**
     * 监控指标的前缀 (Metrics Prefix).
     * <span style="color: gray;">Default: "j-rewards-ledger.".</span>
     */
    private String metricsPrefix = JRewardsLedgerConstant.DEFAULT_METRICS_PREFIX;

    /**
     * 是否写回执日志 (Write the Chronicle receipt journal).
     */
    private boolean journalEnabled = JRewardsLedgerConstant.DEFAULT_JOURNAL_ENABLED;

    private Admin admin = new Admin();

    /**
     * 运维端点配置 (Admin endpoint settings).
     */
    @Data
    public static class Admin {
        /**
         * 是否开启 Actuator 管理端点，默认关闭。
         * <br><span style="color: gray;">Exposes the actuator admin endpoint. Off by default.</span>
         */
        private boolean enabled = JRewardsLedgerConstant.DEFAULT_ADMIN_ENABLED;
    }
}
