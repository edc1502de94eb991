package io.github.vevoly.rewards.api.exception;

/**
 * <h3>非合约地址异常</h3>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * Thrown when a privileged wrapper identity has no deployed code.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class NotContractException extends RewardsLedgerException {

    public NotContractException(String message) {
        super(RewardsErrorCode.NOT_CONTRACT, message);
    }

    public NotContractException(String message, Throwable cause) {
        super(RewardsErrorCode.NOT_CONTRACT, message, cause);
    }
}
