package io.flashvault.core.protocol;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Signed change for the two currencies of a pool, in pool order.
 * Both components are int128.
 */
public record BalanceDelta(BigInteger amount0, BigInteger amount1) {

    public BalanceDelta {
        Objects.requireNonNull(amount0, "amount0");
        Objects.requireNonNull(amount1, "amount1");
        Amounts.toInt128(amount0);
        Amounts.toInt128(amount1);
    }

    public static BalanceDelta of(long amount0, long amount1) {
        return new BalanceDelta(BigInteger.valueOf(amount0), BigInteger.valueOf(amount1));
    }

    public BalanceDelta negate() {
        return new BalanceDelta(amount0.negate(), amount1.negate());
    }
}
