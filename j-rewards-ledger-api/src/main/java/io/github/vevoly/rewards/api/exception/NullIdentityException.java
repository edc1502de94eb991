package io.github.vevoly.rewards.api.exception;

/**
 * <h3>空身份异常</h3>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * Thrown when a required producer, reward, holder or recipient identity is the null address.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class NullIdentityException extends RewardsLedgerException {

    public NullIdentityException(String message) {
        super(RewardsErrorCode.NULL_IDENTITY, message);
    }

    public NullIdentityException(String message, Throwable cause) {
        super(RewardsErrorCode.NULL_IDENTITY, message, cause);
    }
}
