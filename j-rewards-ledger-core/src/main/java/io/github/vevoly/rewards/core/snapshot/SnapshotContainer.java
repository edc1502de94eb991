package io.github.vevoly.rewards.core.snapshot;

import io.github.vevoly.rewards.api.IdempotencyStrategy;
import io.github.vevoly.rewards.core.state.RewardsState;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;

/**
 * <h3>快照数据包装器 (Snapshot Data Wrapper)</h3>
 *
 * <p>恢复所需的全部信息：已处理命令数、回执日志进度、奖励状态、去重策略状态。</p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Snapshot Data Wrapper.</b><br>
 * Everything recovery needs: commands processed, receipt journal position, rewards state and idempotency state.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotContainer implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * 快照时已提交的命令数 (Commands committed when the snapshot was taken).
     */
    private long commandCount;

    /**
     * 快照时回执日志的最后索引，未启用日志时为 -1.
     * <br><span style="color: gray;">Last receipt journal index at snapshot time, -1 when the journal is disabled.</span>
     */
    private long lastJournalIndex;

    /**
     * 快照写入时间，毫秒 (Snapshot wall time, millis).
     */
    private long createdAt;

    private RewardsState state;

    private IdempotencyStrategy idempotencyStrategy;
}
