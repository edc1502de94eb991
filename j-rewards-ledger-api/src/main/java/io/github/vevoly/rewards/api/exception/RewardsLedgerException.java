package io.github.vevoly.rewards.api.exception;

/**
 * <h3>j-rewards-ledger 异常基类 (Base Ledger Exception)</h3>
 *
 * <p>所有由本框架抛出的、可预期的异常都应继承此类。调用方可通过 {@link #getErrorCode()} 区分失败原因。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Base exception for the rewards ledger.</b><br>
 * Every predictable failure raised by the framework extends this class.
 * Callers distinguish failure kinds through {@link #getErrorCode()}.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class RewardsLedgerException extends Exception {

    private final RewardsErrorCode errorCode;

    public RewardsLedgerException(RewardsErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public RewardsLedgerException(RewardsErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RewardsLedgerException(RewardsErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public RewardsErrorCode getErrorCode() {
        return errorCode;
    }
}
