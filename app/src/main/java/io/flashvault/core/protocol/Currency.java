package io.flashvault.core.protocol;

import java.math.BigInteger;

/**
 * An asset the vault can custody: either the chain's native asset or a fungible token.
 * The vault only ever moves value out through {@link #transfer}; inflows are observed
 * through {@link #balanceOfSelf()}.
 */
public interface Currency {

    /** Stable identifier; ledgers are keyed by it. */
    String id();

    boolean isNative();

    /** Move {@code amount} of this currency out of the vault to {@code to}. */
    void transfer(Address to, BigInteger amount);

    /** The vault's current on-hand balance of this currency. */
    BigInteger balanceOfSelf();
}
