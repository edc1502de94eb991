package io.github.vevoly.rewards.api;

import java.io.Serializable;

/**
 * <h3>幂等性去重策略接口 (Idempotency Strategy Interface)</h3>
 *
 * <p>
 * 定义如何判断一个请求（TxId）是否已经处理过。
 * 框架内置了 LRU (精准但占内存) 和 BloomFilter (省内存但有误判) 两种实现。
 * 策略状态随快照一起保存。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Idempotency Strategy Interface.</b><br>
 * Decides whether a transaction id has already been processed. Built-in LRU and BloomFilter implementations.
 * The strategy state is saved with every snapshot.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface IdempotencyStrategy extends Serializable {

    /**
     * 检查 Key 是否已存在.
     *
     * @param key 唯一业务键 (Unique Business Key, e.g. txId)
     * @return true=已存在(重复/Duplicate), false=不存在(New)
     */
    boolean contains(String key);

    /**
     * 记录 Key.
     *
     * @param key 唯一业务键
     */
    void add(String key);

    /**
     * 清理/重置策略状态 (可选).
     */
    default void clear() {}

    /**
     * 获取策略名 (Get Strategy Name).
     */
    String getName();
}
