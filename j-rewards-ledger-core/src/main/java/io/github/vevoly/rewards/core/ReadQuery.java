package io.github.vevoly.rewards.core;

import io.github.vevoly.rewards.api.exception.RewardsLedgerException;

/**
 * 在引擎线程上执行的只读查询 (Read-only query executed on the engine thread).
 *
 * @param <T> 结果类型 (Result type)
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface ReadQuery<T> {

    T read(RewardsDistributor distributor) throws RewardsLedgerException;
}
