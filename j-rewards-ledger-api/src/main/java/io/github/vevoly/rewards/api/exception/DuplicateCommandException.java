package io.github.vevoly.rewards.api.exception;

/**
 * <h3>重复命令异常</h3>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * Thrown when the idempotency strategy has already seen the command's transaction id.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class DuplicateCommandException extends RewardsLedgerException {

    public DuplicateCommandException(String message) {
        super(RewardsErrorCode.DUPLICATE_COMMAND, message);
    }

    public DuplicateCommandException(String message, Throwable cause) {
        super(RewardsErrorCode.DUPLICATE_COMMAND, message, cause);
    }
}
