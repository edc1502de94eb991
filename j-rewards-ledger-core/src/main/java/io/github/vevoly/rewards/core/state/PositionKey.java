package io.github.vevoly.rewards.core.state;

import io.github.vevoly.rewards.api.model.Address;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

/**
 * 持仓键，(生产代币, 持有人)。
 * <br><span style="color: gray;">Position key: (producer token, holder).</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class PositionKey implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    Address producerToken;

    Address holder;
}
