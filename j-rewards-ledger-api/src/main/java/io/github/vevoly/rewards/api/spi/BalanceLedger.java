package io.github.vevoly.rewards.api.spi;

import io.github.vevoly.rewards.api.model.Address;

/**
 * <h3>余额账本 (Balance Ledger)</h3>
 *
 * <p>
 * 外部协作方：报告生产代币的总供应量与各持有人余额。账本在每次铸造、销毁、转账生效的同一时刻，
 * 必须调用引擎的 {@code globalAccrue} (铸造/销毁) 与 {@code userAccrue} (每个余额变化的持有人)，
 * 且调用时新的余额已经可见。
 * </p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Balance Ledger (external collaborator).</b><br>
 * Reports total supply and per-holder balance of a producer token. In the same instant a mint, burn or transfer
 * takes effect, the ledger calls {@code globalAccrue} (mint/burn) and {@code userAccrue} (every holder whose
 * balance changed) with the new balances already visible.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface BalanceLedger {

    long totalSupply(Address producerToken);

    long balanceOf(Address producerToken, Address holder);
}
