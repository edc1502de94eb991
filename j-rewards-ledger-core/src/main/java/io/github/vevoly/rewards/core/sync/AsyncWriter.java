package io.github.vevoly.rewards.core.sync;

import io.github.vevoly.rewards.api.BatchWriter;
import io.github.vevoly.rewards.core.metrics.RewardsMetricManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * <h3>异步批量写入器 (Async Batch Writer)</h3>
 *
 * <p>
 * 把 Disruptor 线程提交的回执攒批后交给用户的 {@link BatchWriter} (例如写数据库或消息队列)。
 * 队列满时 {@link #submit} 阻塞 Disruptor 线程，形成背压；批量写失败时每秒重试一次，不丢数据。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Async Batch Writer.</b><br>
 * Batches the receipts submitted by the Disruptor thread and hands them to the user's {@link BatchWriter}
 * (a database, a message queue). A full queue blocks the Disruptor thread in {@link #submit} as backpressure;
 * a failed batch is retried every second.
 * </span>
 *
 * <h3>为什么使用 BlockingQueue 而不是 Disruptor？(Why a BlockingQueue?)</h3>
 * <p>
 * 下游瓶颈在 IO，锁竞争的开销可以忽略；{@code drainTo} 天然适合"有多少拿多少，最多 N 个"；{@code put} 天然阻塞。
 * <br><span style="color: gray;">The downstream is IO-bound, so lock contention is negligible. {@code drainTo} gives
 * "whatever is there, at most N" for free, and {@code put} blocks by itself.</span>
 * </p>
 *
 * @param <E> 回执类型 (Receipt type)
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class AsyncWriter<E extends Serializable> extends Thread {

    private final BlockingQueue<E> queue;
    private final BatchWriter<E> batchWriter;
    private final int batchSize;
    private volatile boolean running = false;

    private final MeterRegistry registry;
    private final RewardsMetricManager metrics;
    private final Tags tags;
    private Timer batchTimer;

    /**
     * @param bufferSize  队列大小 (Queue capacity)
     * @param batchSize   单批最大条数 (Max entities per batch)
     * @param batchWriter 用户落库实现 (User persistence)
     */
    public AsyncWriter(String engineName, int bufferSize, int batchSize, BatchWriter<E> batchWriter,
                       MeterRegistry registry, RewardsMetricManager metrics, Tags tags) {
        this.queue = new LinkedBlockingQueue<>(bufferSize);
        this.batchSize = batchSize;
        this.batchWriter = batchWriter;
        this.registry = registry;
        this.metrics = metrics;
        this.tags = tags;
        this.setName(engineName + "-AsyncWriter");
    }

    /**
     * 提交 (阻塞模式，实现背压).
     * <br><span style="color: gray;">Submit (blocking, implements backpressure).</span>
     */
    public void submit(E entity) {
        try {
            queue.put(entity);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("AsyncWriter submit interrupted, entity dropped: {}", entity, e);
        }
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        registry.gauge(metrics.receiptQueueSize, tags, queue, BlockingQueue::size);
        this.batchTimer = registry.timer(metrics.receiptBatchTime, tags);
        this.running = true;
        super.start();
        log.info("AsyncWriter 启动成功 / AsyncWriter started");
    }

    /**
     * 停止并等待队列排空 (Stops and waits for the queue to drain).
     */
    public void shutdown() {
        this.running = false;
        this.interrupt();
        try {
            this.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待 AsyncWriter 停止时被中断 / Interrupted while waiting for AsyncWriter", e);
        }
    }

    public boolean isQueueEmpty() {
        return queue.isEmpty();
    }

    public int pending() {
        return queue.size();
    }

    @Override
    public void run() {
        List<E> batch = new ArrayList<>(batchSize);
        while (running || !queue.isEmpty()) {
            try {
                E first = queue.poll(1, TimeUnit.SECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, batchSize - 1);
                persistWithRetry(batch);
                batch.clear();
            } catch (InterruptedException e) {
                // running 标志控制退出 / the running flag decides when to stop
                log.debug("AsyncWriter woken up, running={}", running);
            } catch (RuntimeException e) {
                log.error("AsyncWriter 发生未知异常 / AsyncWriter unknown exception", e);
                batch.clear();
            }
        }
        log.info("AsyncWriter 已停止，剩余待处理: {} / AsyncWriter stopped, remaining: {}", queue.size(), queue.size());
    }

    private void persistWithRetry(List<E> entities) {
        while (true) {
            try {
                batchTimer.record(() -> batchWriter.persist(entities));
                return;
            } catch (RuntimeException e) {
                log.error("批量落库失败，条数: {}，1秒后重试... / Batch persist failed, count: {}, retry in 1s...",
                        entities.size(), entities.size(), e);
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ex) {
                    if (!running) {
                        log.error("停机期间放弃 {} 条回执 / Gave up {} receipt(s) during shutdown", entities.size(), entities.size());
                        return;
                    }
                }
            }
        }
    }
}
