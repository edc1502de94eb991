package io.github.vevoly.rewards.api.exception;

/**
 * <h3>初始化异常</h3>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * Thrown when builder validation fails or a required engine component cannot be created.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class InitializationException extends RewardsLedgerException {

    public InitializationException(String message) {
        super(RewardsErrorCode.INITIALIZATION_FAILED, message);
    }

    public InitializationException(String message, Throwable cause) {
        super(RewardsErrorCode.INITIALIZATION_FAILED, message, cause);
    }
}
