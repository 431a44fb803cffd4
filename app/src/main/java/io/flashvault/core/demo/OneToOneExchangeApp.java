package io.flashvault.core.demo;

import io.flashvault.core.protocol.Address;
import io.flashvault.core.protocol.BalanceDelta;
import io.flashvault.core.protocol.PoolKey;
import io.flashvault.core.vault.Vault;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Minimal exchange app: swaps the two currencies of a pool at a fixed 1:1 rate out of the
 * liquidity it holds in the vault. Must be registered with the vault and called inside a
 * session; the trader settles the resulting deltas.
 */
public final class OneToOneExchangeApp {
    private final Vault vault;
    private final Address address;

    public OneToOneExchangeApp(Vault vault, Address address) {
        this.vault = Objects.requireNonNull(vault, "vault");
        this.address = Objects.requireNonNull(address, "address");
    }

    public Address address() {
        return address;
    }

    /** The provider owes both amounts to the vault; the app's reserve grows by them. */
    public BalanceDelta addLiquidity(Address provider, PoolKey key, BigInteger amount0, BigInteger amount1) {
        if (amount0.signum() < 0 || amount1.signum() < 0) {
            throw new IllegalArgumentException("Liquidity amounts must be >= 0");
        }
        BalanceDelta delta = new BalanceDelta(amount0.negate(), amount1.negate());
        vault.accountAppBalanceDelta(address, key, delta, provider);
        return delta;
    }

    /**
     * Trader pays {@code amountIn} of one currency and is owed the same amount of the other.
     * Fails with ARITHMETIC_UNDERFLOW when the pool lacks liquidity for the output side.
     */
    public BalanceDelta swap(Address trader, PoolKey key, boolean zeroForOne, BigInteger amountIn) {
        if (amountIn.signum() <= 0) {
            throw new IllegalArgumentException("amountIn must be > 0");
        }
        BalanceDelta delta = zeroForOne
                ? new BalanceDelta(amountIn.negate(), amountIn)
                : new BalanceDelta(amountIn, amountIn.negate());
        vault.accountAppBalanceDelta(address, key, delta, trader);
        return delta;
    }
}
