package io.github.vevoly.rewards.api.spi;

import io.github.vevoly.rewards.api.model.Address;

/**
 * 判断身份是否为已部署代码的合约 (Tells whether an identity has deployed code).
 *
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface ContractInspector {

    boolean isContract(Address address);
}
