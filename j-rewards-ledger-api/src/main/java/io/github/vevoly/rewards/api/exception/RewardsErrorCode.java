package io.github.vevoly.rewards.api.exception;

/**
 * <h3>奖励账本错误码 (Rewards Ledger Error Codes)</h3>
 *
 * <p>定义了引擎内部与业务校验可能抛出的所有标准异常代码。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Rewards Ledger Error Codes.</b><br>
 * Defines all standard exception codes raised by the engine and by operation validation.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum RewardsErrorCode {

    // --- 1xxx: 初始化与配置错误 (Initialization & Configuration) ---
    INITIALIZATION_FAILED(1001, "Engine initialization failed"),

    // --- 2xxx: 运行时错误 (Runtime) ---
    DUPLICATE_COMMAND(2001, "Duplicate command detected"),
    ENGINE_NOT_RUNNING(2002, "Engine is not running"),

    // --- 3xxx: 持久化错误 (Persistence) ---
    SNAPSHOT_SAVE_FAILED(3002, "Failed to save snapshot"),
    SNAPSHOT_LOAD_FAILED(3003, "Failed to load snapshot"),
    JOURNAL_WRITE_FAILED(3004, "Failed to append receipt to journal"),

    // --- 4xxx: API 调用错误 (API Usage) ---
    INVALID_ARGUMENT(4001, "Invalid argument provided"),
    NULL_IDENTITY(4002, "Required identity is the null address"),
    ZERO_AMOUNT(4003, "Amount must not be zero"),
    AMOUNT_OVERFLOW(4004, "Amount arithmetic overflowed"),

    // --- 5xxx: 权限错误 (Capability) ---
    UNAUTHORIZED(5001, "Caller lacks the required capability"),
    NOT_CONTRACT(5002, "Wrapper identity has no deployed code"),

    // --- 6xxx: 外部协作方错误 (Collaborator) ---
    DELIVERY_FAILED(6001, "External collaborator failed, operation rolled back"),
    ;

    private final int code;
    private final String defaultMessage;

    RewardsErrorCode(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
