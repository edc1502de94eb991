package io.github.vevoly.rewards.api.utils;

import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;

import java.math.BigInteger;

/**
 * <h3>数量运算工具类 (Amount Arithmetic Utility)</h3>
 *
 * <p>
 * 核心链路统一使用 {@code long} 整数单位。累加与乘法使用精确运算，溢出时抛出
 * {@link RewardsErrorCode#AMOUNT_OVERFLOW}，绝不静默回绕。
 * 按比例分配使用全宽度乘除 ({@link #mulDiv})，中间乘积不会溢出。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Amount Arithmetic Utility.</b><br>
 * The core path works in {@code long} integer units. Accumulation and multiplication are exact and raise
 * {@link RewardsErrorCode#AMOUNT_OVERFLOW} instead of wrapping. Proportional shares use a full-width
 * multiply-divide ({@link #mulDiv}) so the intermediate product never overflows.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public final class AmountMath {

    private AmountMath() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static long add(long a, long b) throws RewardsLedgerException {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw overflow(a + " + " + b, e);
        }
    }

    public static long subtract(long a, long b) throws RewardsLedgerException {
        try {
            return Math.subtractExact(a, b);
        } catch (ArithmeticException e) {
            throw overflow(a + " - " + b, e);
        }
    }

    public static long multiply(long a, long b) throws RewardsLedgerException {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw overflow(a + " * " + b, e);
        }
    }

    /**
     * 计算 {@code floor(a * b / denominator)}，要求参数非负。
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * Computes {@code floor(a * b / denominator)} for non-negative operands.
     * The result is at most {@code a} whenever {@code b <= denominator}, so it always fits for proportional shares.
     * </span>
     *
     * <h3>示例 (Examples)：</h3>
     * <ul>
     *     <li><code>mulDiv(1000, 1, 3)</code> -> <code>333</code></li>
     *     <li><code>mulDiv(Long.MAX_VALUE, 5, 10)</code> -> <code>4611686018427387903</code></li>
     * </ul>
     */
    public static long mulDiv(long a, long b, long denominator) throws RewardsLedgerException {
        if (a < 0 || b < 0 || denominator <= 0) {
            throw new RewardsLedgerException(RewardsErrorCode.INVALID_ARGUMENT,
                    "mulDiv requires non-negative operands and a positive denominator: " + a + ", " + b + ", " + denominator);
        }
        if (a == 0 || b == 0) {
            return 0L;
        }
        long high = Math.multiplyHigh(a, b);
        if (high == 0 && a * b >= 0) {
            return (a * b) / denominator;
        }
        BigInteger result = BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(denominator));
        if (result.bitLength() > 63) {
            throw overflow("mulDiv(" + a + ", " + b + ", " + denominator + ")", null);
        }
        return result.longValue();
    }

    private static RewardsLedgerException overflow(String expression, Throwable cause) {
        return new RewardsLedgerException(RewardsErrorCode.AMOUNT_OVERFLOW, "Amount overflow: " + expression, cause);
    }
}
