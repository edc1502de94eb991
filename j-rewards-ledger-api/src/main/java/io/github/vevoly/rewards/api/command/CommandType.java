package io.github.vevoly.rewards.api.command;

/**
 * 命令类型 (Command Type).
 *
 * <p>每个枚举值对应一项对外操作。{@link #isAdministrative()} 标记只允许管理员调用的操作。</p>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum CommandType {

    GLOBAL_ACCRUE(false),
    USER_ACCRUE(false),
    ADD_REWARD_TOKEN(true),
    REMOVE_REWARD_TOKEN(true),
    REMOVE_REWARD_TOKEN_BY_ADDRESS(true),
    REWARD_ACCRUE(false),
    HARVEST(false),
    CLAIM(false),
    SET_REWARD_RECIPIENT(false),
    UNSET_REWARD_RECIPIENT(false),
    SET_REWARD_RECIPIENT_PRIVILEGED(true),
    UNSET_REWARD_RECIPIENT_PRIVILEGED(true),
    SET_HARVESTER(true),
    TRANSFER_ADMINISTRATION(true);

    private final boolean administrative;

    CommandType(boolean administrative) {
        this.administrative = administrative;
    }

    public boolean isAdministrative() {
        return administrative;
    }
}
