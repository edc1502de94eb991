package io.github.vevoly.rewards.api.exception;

/**
 * <h3>权限不足异常</h3>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * Thrown when the caller is neither the administrator nor the collaborator the operation requires.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class UnauthorizedException extends RewardsLedgerException {

    public UnauthorizedException(String message) {
        super(RewardsErrorCode.UNAUTHORIZED, message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(RewardsErrorCode.UNAUTHORIZED, message, cause);
    }
}
