package io.github.vevoly.rewards.core.metrics;

import io.github.vevoly.rewards.api.constants.JRewardsLedgerConstant;

/**
 * <h3>监控指标管理器 (Metric Manager)</h3>
 *
 * <p>根据可配置的前缀生成引擎暴露给 Micrometer (Prometheus/Grafana) 的监控指标名称。</p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Metric Manager.</b><br>
 * Builds the metric names exposed to Micrometer (Prometheus/Grafana) from a configurable prefix.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class RewardsMetricManager {

    /**
     * RingBuffer 剩余容量 (反映 Disruptor 负载).
     * <br><span style="color: gray;">RingBuffer remaining capacity (Reflects Disruptor load).</span>
     */
    public final String ringRemaining;

    /**
     * 回执异步落库队列积压数.
     * <br><span style="color: gray;">Receipt queue size (Reflects downstream pressure).</span>
     */
    public final String receiptQueueSize;

    public final String receiptBatchTime;

    /**
     * 命令处理耗时 (Command process time).
     */
    public final String processTime;

    /**
     * 命令计数，按类型与结果打标签 (Command counter tagged by type and outcome).
     */
    public final String commands;

    /**
     * 失败计数，按错误码打标签 (Failure counter tagged by error code).
     */
    public final String failures;

    public final String claimedAmount;

    public final String harvestedAmount;

    // 标签名称 / Label names
    public static final String TAG_ENGINE = "engine";
    public static final String TAG_TYPE = "type";
    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_CODE = "code";

    public RewardsMetricManager(String prefix) {
        if (prefix == null || prefix.trim().isEmpty()) {
            prefix = JRewardsLedgerConstant.DEFAULT_METRICS_PREFIX;
        }
        if (!prefix.endsWith(".")) {
            prefix += ".";
        }
        this.ringRemaining = prefix + "ring.remaining";
        this.receiptQueueSize = prefix + "receipt.queue.size";
        this.receiptBatchTime = prefix + "receipt.batch.time";
        this.processTime = prefix + "process.time";
        this.commands = prefix + "commands";
        this.failures = prefix + "failures";
        this.claimedAmount = prefix + "claimed.amount";
        this.harvestedAmount = prefix + "harvested.amount";
    }
}
