package io.github.vevoly.rewards.api;

import java.io.Serializable;
import java.util.List;

/**
 * <h3>批量写入接口 (Batch Persistence Interface)</h3>
 *
 * <p>
 * 定义如何将引擎产生的回执同步到持久化存储（如 MySQL）。
 * 框架会将多条回执聚合为一个列表，调用此接口进行批量写入。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Batch Persistence Interface.</b><br>
 * Defines how receipts produced by the engine reach persistent storage.
 * The framework aggregates receipts into a list and calls this interface once per batch.
 * </span>
 *
 * @param <E> 实体对象类型 (Entity Type)
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface BatchWriter<E extends Serializable> {

    /**
     * 执行批量落库.
     * <p>
     * <b>注意：</b> 此方法在独立的异步线程中被调用。抛出异常时框架会持续重试，直到成功为止（At-least-once）。
     * </p>
     *
     * <span style="color: gray; font-size: 0.9em;">
     * Called on a separate thread. On exception the framework retries until it succeeds (at-least-once).
     * </span>
     *
     * @param entities 回执列表 (List of receipts)
     */
    void persist(List<E> entities);
}
