package io.github.vevoly.rewards.api;

import io.github.vevoly.rewards.api.exception.RewardsLedgerException;

import java.io.Serializable;

/**
 * <h3>业务逻辑处理器接口 (Business Logic Processor)</h3>
 *
 * <p>
 * 这是核心引擎的“大脑”。实现此接口来定义如何根据命令修改内存状态。
 * 处理器在单一消费者线程上执行，一次只处理一个命令。
 * </p>
 *
 * <p style="color: red">
 * <b>⚠️ 约束：</b><br>
 * 1. 禁止使用任何锁（synchronized, Lock）或 Thread.sleep。<br>
 * 2. 失败时必须保证状态回到命令执行前的样子，然后抛出异常。<br>
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Business Logic Processor Interface.</b><br>
 * Defines how memory state is mutated by a command. Runs on the single consumer thread, one command at a time.<br>
 * <b>⚠️ Constraints:</b> No locks, no sleep. On failure the state must be back to what it was before the command.
 * </span>
 *
 * @param <S> 状态对象类型 (State)
 * @param <C> 命令对象类型 (Command)
 * @param <R> 回执类型 (Receipt) - 用于审计日志与异步落库
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface BusinessProcessor<S extends Serializable, C extends Serializable, R> {

    /**
     * 执行业务逻辑.
     *
     * @param state     当前内存状态 (Current Memory State)
     * @param command   接收到的命令 (Received Command)
     * @param timestamp 处理时刻，秒 (Processing time, epoch seconds)
     * @return 处理结果与回执 (Result and receipt)
     * @throws RewardsLedgerException 校验或执行失败 (Validation or execution failure)
     */
    Outcome<R> process(S state, C command, long timestamp) throws RewardsLedgerException;

    /**
     * 处理结果：返回给调用方的值 + 需要审计/落库的回执。
     * <br><span style="color: gray;">Value returned to the caller plus the receipt to journal and persist.</span>
     */
    final class Outcome<R> {

        private final Object result;
        private final R receipt;

        public Outcome(Object result, R receipt) {
            this.result = result;
            this.receipt = receipt;
        }

        public Object getResult() {
            return result;
        }

        public R getReceipt() {
            return receipt;
        }
    }
}
