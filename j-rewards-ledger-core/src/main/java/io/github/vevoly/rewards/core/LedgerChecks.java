package io.github.vevoly.rewards.core;

import io.github.vevoly.rewards.api.exception.NullIdentityException;
import io.github.vevoly.rewards.api.exception.RewardsErrorCode;
import io.github.vevoly.rewards.api.exception.RewardsLedgerException;
import io.github.vevoly.rewards.api.model.Address;

import java.util.function.LongSupplier;

/**
 * 核心链路的公共校验与外部调用封装。
 * <br><span style="color: gray;">Shared argument checks and collaborator call wrapping for the core path.</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public final class LedgerChecks {

    private LedgerChecks() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static Address requireIdentity(Address address, String name) throws NullIdentityException {
        if (Address.isNull(address)) {
            throw new NullIdentityException(name + " must not be the null identity");
        }
        return address;
    }

    public static long requireNonNegative(long amount, String name) throws RewardsLedgerException {
        if (amount < 0) {
            throw new RewardsLedgerException(RewardsErrorCode.INVALID_ARGUMENT, name + " must not be negative: " + amount);
        }
        return amount;
    }

    /**
     * 调用外部协作方读取数量；协作方抛出的运行时异常统一转换为 {@link RewardsErrorCode#DELIVERY_FAILED}。
     * <br><span style="color: gray;">Reads an amount from a collaborator; its runtime failures become DELIVERY_FAILED.</span>
     */
    public static long queryCollaborator(String description, LongSupplier call) throws RewardsLedgerException {
        long value;
        try {
            value = call.getAsLong();
        } catch (RuntimeException e) {
            throw new RewardsLedgerException(RewardsErrorCode.DELIVERY_FAILED, description + " failed: " + e.getMessage(), e);
        }
        return requireNonNegative(value, description);
    }
}
