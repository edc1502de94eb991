package io.github.vevoly.rewards.core.journal;

import io.github.vevoly.rewards.api.constants.JRewardsLedgerConstant;
import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.RewardReceipt;
import net.openhft.chronicle.queue.ExcerptAppender;
import net.openhft.chronicle.queue.ExcerptTailer;
import net.openhft.chronicle.queue.impl.single.SingleChronicleQueue;
import net.openhft.chronicle.queue.impl.single.SingleChronicleQueueBuilder;

import java.io.Closeable;
import java.io.File;

/**
 * <h3>回执日志 (Receipt Journal)</h3>
 *
 * <p>
 * 基于 <b>OpenHFT Chronicle Queue</b> 的审计日志。每条已提交的命令追加一条 {@link RewardReceipt}。
 * 回执只用于审计与排查，不参与恢复：命令的结果依赖外部协作方 (余额账本、收获源)，重放无法得到相同结果，
 * 因此恢复只加载快照。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Receipt Journal.</b><br>
 * Audit trail on <b>OpenHFT Chronicle Queue</b>: one {@link RewardReceipt} per committed command.
 * Receipts are never replayed. Command outcomes depend on external collaborators, so recovery loads the snapshot only.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class ReceiptJournal implements Closeable {

    private final SingleChronicleQueue queue;

    // 每个线程一个 appender / One appender per thread
    private final ThreadLocal<ExcerptAppender> threadLocalAppender;

    /**
     * @param dataDir 引擎数据目录，日志写在其下的 journal 子目录 (Engine data dir; the journal goes to its journal subdir)
     */
    public ReceiptJournal(String dataDir) {
        File journalDir = new File(dataDir, JRewardsLedgerConstant.JOURNAL_DIR);
        this.queue = SingleChronicleQueueBuilder.binary(journalDir).build();
        this.threadLocalAppender = ThreadLocal.withInitial(queue::acquireAppender);
    }

    /**
     * 追加回执 (Append a receipt).
     *
     * @return 写入后的索引 (Index of the appended excerpt)
     * @throws RewardsLedgerException {@link RewardsErrorCode#JOURNAL_WRITE_FAILED}
     */
    public long append(RewardReceipt receipt) throws RewardsLedgerException {
        try {
            ExcerptAppender appender = threadLocalAppender.get();
            appender.writeDocument(w -> w.write(JRewardsLedgerConstant.JOURNAL_KEY_FIELD_NAME).object(RewardReceipt.class, receipt));
            return appender.lastIndexAppended();
        } catch (RuntimeException e) {
            throw new RewardsLedgerException(RewardsErrorCode.JOURNAL_WRITE_FAILED,
                    "Failed to journal receipt " + receipt.getTxId(), e);
        }
    }

    public ExcerptTailer createTailer() {
        return queue.createTailer();
    }

    /**
     * 最后一条回执的索引，空日志返回 -1 (Index of the last receipt, -1 when empty).
     */
    public long lastIndex() {
        long index = queue.lastIndex();
        return index < 0 ? -1L : index;
    }

    public String getDirectory() {
        return queue.file().getAbsolutePath();
    }

    @Override
    public void close() {
        if (!queue.isClosed()) {
            queue.close();
        }
    }
}
