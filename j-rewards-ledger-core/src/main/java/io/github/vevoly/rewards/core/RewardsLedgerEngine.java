package io.github.vevoly.rewards.core;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.github.vevoly.rewards.api.BatchWriter;
import io.github.vevoly.rewards.api.BusinessProcessor;
import io.github.vevoly.rewards.api.IdempotencyStrategy;
import io.github.vevoly.rewards.api.command.RewardsCommand;
import io.github.vevoly.rewards.api.constants.JRewardsLedgerConstant;
import io.github.vevoly.rewards.api.exception.DuplicateCommandException;
import io.github.vevoly.rewards.api.exception.InitializationException;
import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.Address;
import io.github.vevoly.rewards.api.model.RewardMovement;
import io.github.vevoly.rewards.api.model.RewardReceipt;
import io.github.vevoly.rewards.api.spi.BalanceLedger;
import io.github.vevoly.rewards.api.spi.ContractInspector;
import io.github.vevoly.rewards.api.spi.HarvestSource;
import io.github.vevoly.rewards.api.spi.RewardTransfer;
import io.github.vevoly.rewards.core.idempotency.BloomFilterIdempotencyStrategy;
import io.github.vevoly.rewards.core.journal.ReceiptJournal;
import io.github.vevoly.rewards.core.metrics.RewardsMetricManager;
import io.github.vevoly.rewards.core.processor.RewardsCommandProcessor;
import io.github.vevoly.rewards.core.snapshot.SnapshotContainer;
import io.github.vevoly.rewards.core.snapshot.SnapshotManager;
import io.github.vevoly.rewards.core.state.RewardsState;
import io.github.vevoly.rewards.core.sync.AsyncWriter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * <h3>奖励账本引擎 (Rewards Ledger Engine)</h3>
 *
 * <p>
 * 多线程入口。所有命令与查询都发布到 LMAX Disruptor 的 RingBuffer，由<b>唯一的消费者线程</b>串行执行，
 * 因此业务代码无需任何锁。每个命令的结果或异常通过其 {@link CompletableFuture} 返回。
 * </p>
 *
 * <h3>架构视图 (Architecture):</h3>
 * <pre>
 * submit() -> RingBuffer -> [Disruptor thread] -> RewardsCommandProcessor -> RewardsDistributor -> RewardsState
 *                                             |-> ReceiptJournal (Chronicle Queue, audit)
 *                                             |-> AsyncWriter -> BatchWriter (user persistence)
 *                                             |-> SnapshotManager (Kryo, count/time triggers)
 * </pre>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Rewards Ledger Engine.</b><br>
 * Multi-threaded entry point. Commands and queries are published to an LMAX Disruptor ring buffer and executed one
 * at a time by a <b>single consumer thread</b>, so the accounting code needs no locks. Each command's result or
 * failure is delivered through its {@link CompletableFuture}.
 * </span>
 *
 * <h3>恢复 (Recovery):</h3>
 * <p>
 * 启动时只加载最近的快照。回执日志用于审计，不重放。
 * <br><span style="color: gray;">Startup loads the latest snapshot only; the receipt journal is an audit trail and is not replayed.</span>
 * </p>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class RewardsLedgerEngine {

    // --- 核心组件 (Core Components) ---
    private final BusinessProcessor<RewardsState, RewardsCommand, RewardReceipt> processor;
    private final RewardsCommandProcessor commandProcessor;
    private final SnapshotManager snapshotManager;
    private final ReceiptJournal receiptJournal;
    private final AsyncWriter<RewardReceipt> asyncWriter;
    private final Clock clock;
    private Disruptor<EventWrapper> disruptor;

    // --- 运行时状态 (Runtime State) ---
    private RewardsState state;
    private IdempotencyStrategy idempotencyStrategy;
    private volatile boolean running = false;
    @Getter
    private volatile long commandCount = 0;
    private long lastJournalIndex = -1L;

    // --- 配置 (Configuration) ---
    @Getter
    private final String engineName;
    @Getter
    private final String dataDir;
    private final int ringBufferSize;
    private final int snapshotInterval;
    private final boolean enableTimeSnapshot;
    private final long snapshotTimeIntervalMs;

    // --- 快照运行时状态 (Snapshot Runtime State) ---
    private long lastSnapshotCount = 0;
    private long lastSnapshotTime = System.currentTimeMillis();

    // --- 监控 (Metrics) ---
    private final MeterRegistry registry;
    private final RewardsMetricManager metrics;
    private final Tags tags;
    private final Timer processTimer;

    // --- 心跳 (Heartbeat) ---
    private ScheduledExecutorService heartbeatScheduler;
    private static final Object HEARTBEAT_EVENT = new Object();

    // 内部事件包装器 / Internal event wrapper
    private static class EventWrapper {
        Object payload;
    }

    // 查询与其 future 的组合 / A query together with its future
    private static final class PendingQuery<T> {
        final ReadQuery<T> query;
        final CompletableFuture<T> future = new CompletableFuture<>();

        PendingQuery(ReadQuery<T> query) {
            this.query = query;
        }
    }

    private RewardsLedgerEngine(Builder builder) {
        this.engineName = builder.engineName;
        this.dataDir = builder.baseDir + File.separator + builder.engineName;
        this.ringBufferSize = builder.ringBufferSize;
        this.snapshotInterval = builder.snapshotInterval;
        this.enableTimeSnapshot = builder.enableTimeSnapshot;
        this.snapshotTimeIntervalMs = builder.snapshotTimeInterval.toMillis();
        this.clock = builder.clock;
        this.state = new RewardsState(builder.administrator, builder.harvester);
        this.commandProcessor = new RewardsCommandProcessor(builder.balanceLedger, builder.harvestSource,
                builder.rewardTransfer, builder.contractInspector);
        this.processor = commandProcessor;

        // 1. 持久化组件 / Persistence components
        this.snapshotManager = new SnapshotManager(dataDir);
        this.receiptJournal = builder.journalEnabled ? new ReceiptJournal(dataDir) : null;
        // 2. 去重策略 (默认 Guava BloomFilter) / Idempotency strategy (Guava BloomFilter by default)
        this.idempotencyStrategy = builder.idempotencyStrategy != null
                ? builder.idempotencyStrategy
                : new BloomFilterIdempotencyStrategy();
        // 3. Metrics
        this.registry = builder.meterRegistry != null ? builder.meterRegistry : new SimpleMeterRegistry();
        this.metrics = new RewardsMetricManager(builder.metricsPrefix);
        this.tags = Tags.of(RewardsMetricManager.TAG_ENGINE, engineName);
        this.processTimer = registry.timer(metrics.processTime, tags);
        // 4. 异步写入器 (未配置 BatchWriter 时不启用) / Async writer (only with a BatchWriter)
        this.asyncWriter = builder.batchWriter != null
                ? new AsyncWriter<>(engineName, builder.queueSize, builder.batchSize, builder.batchWriter, registry, metrics, tags)
                : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 启动引擎 (Start Engine).
     * <ol>
     *     <li>加载快照 (Load snapshot).</li>
     *     <li>启动异步落库线程 (Start AsyncWriter).</li>
     *     <li>启动 Disruptor 与心跳 (Start Disruptor and heartbeat).</li>
     * </ol>
     *
     * @throws InitializationException 快照损坏时拒绝启动 (Refuses to start on a corrupted snapshot)
     */
    public synchronized void start() throws InitializationException {
        if (running) {
            return;
        }
        log.info(">>> 引擎 [{}] 正在启动... / Engine starting, dataDir={}", engineName, dataDir);

        // 1. 恢复 / Recover
        recover();

        // 2. 异步落库线程 / AsyncWriter
        if (asyncWriter != null) {
            asyncWriter.start();
        }

        // 3. Disruptor
        this.disruptor = new Disruptor<>(
                EventWrapper::new,
                ringBufferSize,
                r -> {
                    Thread t = new Thread(r);
                    t.setName(engineName + "-Disruptor");
                    return t;
                },
                ProducerType.MULTI,
                new BlockingWaitStrategy()
        );
        registry.gauge(metrics.ringRemaining, tags, disruptor, d -> d.getRingBuffer().remainingCapacity());
        this.disruptor.handleEventsWith(new CoreEventHandler());
        this.disruptor.start();
        this.running = true;

        // 4. 心跳，驱动空闲时的时间快照 / Heartbeat drives time snapshots while idle
        this.heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, engineName + "-Heartbeat");
            t.setDaemon(true);
            return t;
        });
        this.heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeat, 10, 10, TimeUnit.SECONDS);
        log.info("<<< 引擎 [{}] 启动成功！Disruptor 线程已就绪。/ Engine started.", engineName);
    }

    private void recover() throws InitializationException {
        SnapshotContainer snapshot;
        try {
            snapshot = snapshotManager.load();
        } catch (RewardsLedgerException e) {
            throw new InitializationException("引擎 [" + engineName + "] 快照加载失败 / Snapshot load failed", e);
        }
        if (snapshot != null) {
            this.state = snapshot.getState();
            this.idempotencyStrategy = snapshot.getIdempotencyStrategy();
            this.commandCount = snapshot.getCommandCount();
            this.lastSnapshotCount = commandCount;
            log.info("引擎 [{}] 已加载快照 / Snapshot loaded. commands={}, journalIndex={}, administrator={}",
                    engineName, commandCount, snapshot.getLastJournalIndex(), state.getAdministrator());
        } else {
            log.info("引擎 [{}] 以初始状态启动 / Starting from the initial state. administrator={}, harvester={}",
                    engineName, state.getAdministrator(), state.getHarvester());
        }
        if (receiptJournal != null) {
            this.lastJournalIndex = receiptJournal.lastIndex();
        }
    }

    /**
     * <h3>提交命令 (Submit Command)</h3>
     *
     * <p>
     * 发布到 RingBuffer 并立即返回。命令没有 future 时会自动创建一个。
     * 引擎未运行时返回一个以 {@link RewardsErrorCode#ENGINE_NOT_RUNNING} 失败的 future。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * Publishes to the ring buffer and returns at once. A future is attached when the command has none.
     * When the engine is not running the returned future fails with ENGINE_NOT_RUNNING.
     * </span>
     *
     * @param command 业务命令 (Command)
     * @return 结果 future (Result future)
     */
    public CompletableFuture<Object> submit(RewardsCommand command) {
        if (command.getFuture() == null) {
            command.setFuture(new CompletableFuture<>());
        }
        CompletableFuture<Object> future = command.getFuture();
        if (!running) {
            future.completeExceptionally(new RewardsLedgerException(RewardsErrorCode.ENGINE_NOT_RUNNING,
                    "Engine [" + engineName + "] is not running"));
            return future;
        }
        publish(command);
        return future;
    }

    /**
     * 提交命令并按期望类型返回结果 (Submit and cast the result to the expected type).
     */
    public <T> CompletableFuture<T> submit(RewardsCommand command, Class<T> resultType) {
        return submit(command).thenApply(resultType::cast);
    }

    /**
     * 在引擎线程上执行只读查询，与命令严格串行 (Runs a read-only query on the engine thread, ordered with commands).
     */
    public <T> CompletableFuture<T> query(ReadQuery<T> query) {
        PendingQuery<T> pending = new PendingQuery<>(query);
        if (!running) {
            pending.future.completeExceptionally(new RewardsLedgerException(RewardsErrorCode.ENGINE_NOT_RUNNING,
                    "Engine [" + engineName + "] is not running"));
            return pending.future;
        }
        publish(pending);
        return pending.future;
    }

    private void publish(Object payload) {
        RingBuffer<EventWrapper> ringBuffer = disruptor.getRingBuffer();
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).payload = payload;
        } finally {
            ringBuffer.publish(sequence);
        }
    }

    private void sendHeartbeat() {
        if (running) {
            publish(HEARTBEAT_EVENT);
        }
    }

    /**
     * 内部 Disruptor 处理器 (Internal Disruptor Handler).
     */
    private class CoreEventHandler implements EventHandler<EventWrapper> {
        @Override
        public void onEvent(EventWrapper event, long sequence, boolean endOfBatch) {
            Object payload = event.payload;
            event.payload = null;
            try {
                if (payload instanceof RewardsCommand) {
                    processCommand((RewardsCommand) payload);
                } else if (payload instanceof PendingQuery) {
                    runQuery((PendingQuery<?>) payload);
                }
                if (endOfBatch || payload == HEARTBEAT_EVENT) {
                    checkAndSnapshot();
                }
            } catch (Throwable t) {
                // 不能让 Disruptor 线程退出 / Never let the Disruptor thread die
                log.error("引擎 [{}] 处理事件时发生严重错误 / Fatal error while handling event: {}", engineName, payload, t);
            }
        }
    }

    /**
     * <h3>命令处理流程 (Command Workflow)</h3>
     * <ol>
     *     <li>按 txId 去重 (Idempotency check).</li>
     *     <li>执行业务；失败时状态已由分配器回滚 (Execute; on failure the distributor already rolled back).</li>
     *     <li>记录 txId、写回执日志、提交异步落库 (Record txId, journal the receipt, hand it to the writer).</li>
     *     <li>完成 future (Complete the future).</li>
     * </ol>
     */
    private void processCommand(RewardsCommand command) {
        String txId = command.getUniqueId();
        CompletableFuture<Object> future = command.getFuture();
        String type = String.valueOf(command.getType());

        if (txId != null && idempotencyStrategy.contains(txId)) {
            log.debug("Command already processed: {}", txId);
            countCommand(type, "duplicate");
            complete(future, null, new DuplicateCommandException("Duplicate command: " + txId));
            return;
        }

        long timestamp = clock.instant().getEpochSecond();
        long start = System.nanoTime();
        BusinessProcessor.Outcome<RewardReceipt> outcome;
        try {
            outcome = processor.process(state, command, timestamp);
        } catch (RewardsLedgerException e) {
            countCommand(type, "rejected");
            registry.counter(metrics.failures, tags.and(RewardsMetricManager.TAG_CODE, e.getErrorCode().name())).increment();
            complete(future, null, e);
            return;
        } catch (RuntimeException e) {
            log.error("引擎 [{}] 业务逻辑执行异常 / Unexpected processing failure: {}", engineName, command, e);
            countCommand(type, "error");
            complete(future, null, e);
            return;
        } finally {
            processTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }

        if (txId != null) {
            idempotencyStrategy.add(txId);
        }
        commandCount++;
        countCommand(type, "ok");
        recordAmounts(command, outcome.getReceipt());
        journal(outcome.getReceipt());
        if (asyncWriter != null) {
            asyncWriter.submit(outcome.getReceipt());
        }
        complete(future, outcome.getResult(), null);
    }

    private <T> void runQuery(PendingQuery<T> pending) {
        try {
            RewardsDistributor view = commandProcessor.view(state, clock.instant().getEpochSecond());
            pending.future.complete(pending.query.read(view));
        } catch (RewardsLedgerException | RuntimeException e) {
            pending.future.completeExceptionally(e);
        }
    }

    private void journal(RewardReceipt receipt) {
        if (receiptJournal == null) {
            return;
        }
        try {
            lastJournalIndex = receiptJournal.append(receipt);
        } catch (RewardsLedgerException e) {
            // 命令已提交，回执缺失只影响审计 / The command is committed; only the audit trail has a gap
            registry.counter(metrics.failures, tags.and(RewardsMetricManager.TAG_CODE, e.getErrorCode().name())).increment();
            log.error("引擎 [{}] 回执写入失败 / Receipt journal write failed: {}", engineName, receipt, e);
        }
    }

    private void recordAmounts(RewardsCommand command, RewardReceipt receipt) {
        switch (command.getType()) {
            case CLAIM:
                registry.counter(metrics.claimedAmount, tags).increment(total(receipt));
                break;
            case HARVEST:
            case REWARD_ACCRUE:
                registry.counter(metrics.harvestedAmount, tags).increment(total(receipt));
                break;
            default:
                break;
        }
    }

    private static double total(RewardReceipt receipt) {
        double total = 0;
        for (RewardMovement movement : receipt.getMovements()) {
            total += movement.getAmount();
        }
        return total;
    }

    private void countCommand(String type, String outcome) {
        registry.counter(metrics.commands, tags.and(RewardsMetricManager.TAG_TYPE, type, RewardsMetricManager.TAG_OUTCOME, outcome))
                .increment();
    }

    private static void complete(CompletableFuture<Object> future, Object result, Throwable error) {
        if (future == null || future.isDone()) {
            return;
        }
        if (error != null) {
            future.completeExceptionally(error);
        } else {
            future.complete(result);
        }
    }

    /**
     * 检查并执行快照 (Check and execute snapshot).
     */
    private void checkAndSnapshot() {
        String reason = null;
        if (commandCount - lastSnapshotCount >= snapshotInterval) {
            reason = "CountTrigger";
        } else if (enableTimeSnapshot && commandCount != lastSnapshotCount
                && System.currentTimeMillis() - lastSnapshotTime >= snapshotTimeIntervalMs) {
            reason = "TimeTrigger";
        }
        if (reason != null) {
            doSnapshot(reason);
        }
    }

    private void doSnapshot(String reason) {
        String logContext = String.format("[%s][%s]", engineName, reason);
        try {
            snapshotManager.save(new SnapshotContainer(commandCount, lastJournalIndex, System.currentTimeMillis(),
                    state, idempotencyStrategy), logContext);
            this.lastSnapshotCount = commandCount;
            this.lastSnapshotTime = System.currentTimeMillis();
        } catch (RewardsLedgerException e) {
            registry.counter(metrics.failures, tags.and(RewardsMetricManager.TAG_CODE, e.getErrorCode().name())).increment();
            log.error("{} 快照保存失败 / Snapshot save failed", logContext, e);
        }
    }

    /**
     * <h3>优雅停机 (Graceful Shutdown)</h3>
     * <ol>
     *     <li>停止心跳 (Stop heartbeat).</li>
     *     <li>停止 Disruptor，处理完积压 (Stop Disruptor after draining the ring).</li>
     *     <li>强制快照 (Force a final snapshot).</li>
     *     <li>停止异步写入器，等待队列排空 (Stop AsyncWriter after draining).</li>
     *     <li>关闭回执日志 (Close the receipt journal).</li>
     * </ol>
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        log.info(">>> 引擎 [{}] 正在停止... / Engine stopping", engineName);
        running = false;
        if (heartbeatScheduler != null) {
            heartbeatScheduler.shutdownNow();
        }
        if (disruptor != null) {
            disruptor.shutdown();
        }
        doSnapshot("Shutdown");
        if (asyncWriter != null) {
            asyncWriter.shutdown();
        }
        if (receiptJournal != null) {
            receiptJournal.close();
        }
        log.info("<<< 引擎 [{}] 已安全停止。/ Engine stopped.", engineName);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * 回执日志目录，未启用日志时为 null (Receipt journal directory, null when disabled).
     */
    public String getJournalDir() {
        return receiptJournal == null ? null : receiptJournal.getDirectory();
    }

    public String getSnapshotFile() {
        return dataDir + File.separator + JRewardsLedgerConstant.SNAPSHOT_DIR + File.separator + SnapshotManager.SNAPSHOT_FILE_NAME;
    }

    public String getIdempotencyName() {
        return idempotencyStrategy.getName();
    }

    /**
     * 引擎构建器 (Engine Builder).
     */
    public static class Builder {
        private String baseDir = JRewardsLedgerConstant.DEFAULT_BASE_DIR;
        private String engineName = JRewardsLedgerConstant.DEFAULT_ENGINE_NAME;
        private int batchSize = JRewardsLedgerConstant.DEFAULT_BATCH_SIZE;
        private int queueSize = JRewardsLedgerConstant.DEFAULT_QUEUE_SIZE;
        private int ringBufferSize = JRewardsLedgerConstant.DEFAULT_RING_BUFFER_SIZE;
        private int snapshotInterval = JRewardsLedgerConstant.DEFAULT_SNAPSHOT_INTERVAL;
        private boolean enableTimeSnapshot = JRewardsLedgerConstant.DEFAULT_ENABLE_TIME_SNAPSHOT;
        private Duration snapshotTimeInterval = JRewardsLedgerConstant.DEFAULT_SNAPSHOT_TIME_INTERVAL;
        private boolean journalEnabled = JRewardsLedgerConstant.DEFAULT_JOURNAL_ENABLED;
        private String metricsPrefix = JRewardsLedgerConstant.DEFAULT_METRICS_PREFIX;
        private Address administrator;
        private Address harvester;
        private BalanceLedger balanceLedger;
        private HarvestSource harvestSource;
        private RewardTransfer rewardTransfer;
        private ContractInspector contractInspector;
        private BatchWriter<RewardReceipt> batchWriter;
        private IdempotencyStrategy idempotencyStrategy;
        private MeterRegistry meterRegistry;
        private Clock clock = Clock.systemUTC();

        public Builder baseDir(String baseDir) { this.baseDir = baseDir; return this; }
        public Builder name(String engineName) { this.engineName = engineName; return this; }
        public Builder batchSize(int batchSize) { this.batchSize = batchSize; return this; }
        public Builder queueSize(int queueSize) { this.queueSize = queueSize; return this; }
        public Builder ringBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; return this; }
        public Builder snapshotInterval(int snapshotInterval) { this.snapshotInterval = snapshotInterval; return this; }
        public Builder enableTimeSnapshot(boolean enable) { this.enableTimeSnapshot = enable; return this; }
        public Builder snapshotTimeInterval(Duration interval) { this.snapshotTimeInterval = interval; return this; }
        public Builder journalEnabled(boolean journalEnabled) { this.journalEnabled = journalEnabled; return this; }
        public Builder metricsPrefix(String metricsPrefix) { this.metricsPrefix = metricsPrefix; return this; }
        public Builder administrator(Address administrator) { this.administrator = administrator; return this; }
        public Builder harvester(Address harvester) { this.harvester = harvester; return this; }
        public Builder balanceLedger(BalanceLedger balanceLedger) { this.balanceLedger = balanceLedger; return this; }
        public Builder harvestSource(HarvestSource harvestSource) { this.harvestSource = harvestSource; return this; }
        public Builder rewardTransfer(RewardTransfer rewardTransfer) { this.rewardTransfer = rewardTransfer; return this; }
        public Builder contractInspector(ContractInspector contractInspector) { this.contractInspector = contractInspector; return this; }
        public Builder batchWriter(BatchWriter<RewardReceipt> batchWriter) { this.batchWriter = batchWriter; return this; }
        public Builder idempotency(IdempotencyStrategy idempotencyStrategy) { this.idempotencyStrategy = idempotencyStrategy; return this; }
        public Builder meterRegistry(MeterRegistry meterRegistry) { this.meterRegistry = meterRegistry; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }

        public RewardsLedgerEngine build() throws InitializationException {
            if (balanceLedger == null || harvestSource == null || rewardTransfer == null || contractInspector == null) {
                throw new InitializationException(
                        "BalanceLedger, HarvestSource, RewardTransfer and ContractInspector are all required");
            }
            if (Address.isNull(administrator)) {
                throw new InitializationException("An administrator address is required");
            }
            if (Address.isNull(harvester)) {
                harvester = null;
            }
            if (Integer.bitCount(ringBufferSize) != 1) {
                throw new InitializationException("Ring buffer size must be a power of 2: " + ringBufferSize);
            }
            if (batchSize <= 0 || queueSize <= 0 || snapshotInterval <= 0) {
                throw new InitializationException("batchSize, queueSize and snapshotInterval must be > 0");
            }
            if (clock == null || snapshotTimeInterval == null || baseDir == null || engineName == null) {
                throw new InitializationException("clock, snapshotTimeInterval, baseDir and engineName are required");
            }
            return new RewardsLedgerEngine(this);
        }
    }
}
