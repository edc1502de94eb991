package io.github.vevoly.rewards.api.command;

import java.io.Serializable;
import java.util.concurrent.CompletableFuture;

/**
 * <h3>核心命令接口 (Core Command Interface)</h3>
 *
 * <p>
 * 所有发送给引擎的命令都必须实现此接口。它定义了引擎处理请求所需的两个要素：
 * <b>去重 (Idempotency)</b> 和 <b>结果通知 (Result Notification)</b>。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Core Command Interface.</b><br>
 * Every command submitted to the engine implements this interface, which carries
 * the two elements the engine needs: <b>Idempotency</b> and <b>Result Notification</b>.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface LedgerCommand extends Serializable {

    /**
     * 获取用于幂等去重的唯一 ID.
     * <p>
     * 返回 {@code null} 表示该命令不参与去重 (例如定时触发的收获)。
     * </p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Get Unique ID for Idempotency.</b><br>
     * {@code null} opts the command out of deduplication (e.g. a scheduled harvest).
     * </span>
     *
     * @return 业务唯一 ID (Business Unique ID, e.g., txId)
     */
    String getUniqueId();

    /**
     * 获取用于通知结果的 Future.
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * The engine completes this future with the operation result, or exceptionally with the failure.
     * </span>
     *
     * @return 异步结果句柄 (Async Result Handle)
     */
    default CompletableFuture<Object> getFuture() {
        return null; // 默认不关心结果 (Fire & Forget)
    }

    /**
     * 设置 Future (业务层构建命令时调用).
     *
     * @param future 异步结果句柄 (Async Result Handle)
     */
    default void setFuture(CompletableFuture<Object> future) {}
}
