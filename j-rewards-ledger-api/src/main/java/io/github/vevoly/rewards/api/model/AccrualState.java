package io.github.vevoly.rewards.api.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;

import java.io.Serial;
import java.io.Serializable;
import java.util.OptionalLong;

/**
 * <h3>积分累计状态 (Accrual State)</h3>
 *
 * <p>
 * 全局状态 (每个生产代币) 与用户状态 (每个生产代币 × 持有人) 共用此结构：
 * </p>
 * <ul>
 *     <li><b>lastUpdate:</b> 上次同步的秒级时间戳；{@code null} 表示尚未初始化，与时间戳 0 区分开。</li>
 *     <li><b>lastAmount:</b> 上次同步时的总供应量 (全局) 或余额 (用户)。</li>
 *     <li><b>points:</b> 余额对时间的积分 (单位：数量 × 秒)。</li>
 * </ul>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Accrual State.</b><br>
 * Shared by the global state (per producer) and the user state (per producer and holder).
 * {@code lastUpdate} is {@code null} until the first sync, which keeps "never initialized" apart from timestamp zero.
 * {@code lastAmount} is the supply (global) or balance (user) observed at {@code lastUpdate}.
 * {@code points} is the balance-over-time integral in unit-seconds.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
@With
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccrualState implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final AccrualState UNINITIALIZED = new AccrualState(null, 0L, 0L);

    Long lastUpdate;

    long lastAmount;

    long points;

    public static AccrualState uninitialized() {
        return UNINITIALIZED;
    }

    public static AccrualState of(long lastUpdate, long lastAmount, long points) {
        return new AccrualState(lastUpdate, lastAmount, points);
    }

    public boolean isInitialized() {
        return lastUpdate != null;
    }

    /**
     * 上次同步时间，未初始化时为空 (Last sync time, empty while uninitialized).
     */
    public OptionalLong lastUpdateTime() {
        return lastUpdate == null ? OptionalLong.empty() : OptionalLong.of(lastUpdate);
    }
}
