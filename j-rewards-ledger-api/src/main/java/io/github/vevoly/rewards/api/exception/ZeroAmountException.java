package io.github.vevoly.rewards.api.exception;

/**
 * <h3>零金额异常</h3>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * Thrown when a reward deposit of zero units is attempted.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class ZeroAmountException extends RewardsLedgerException {

    public ZeroAmountException(String message) {
        super(RewardsErrorCode.ZERO_AMOUNT, message);
    }

    public ZeroAmountException(String message, Throwable cause) {
        super(RewardsErrorCode.ZERO_AMOUNT, message, cause);
    }
}
